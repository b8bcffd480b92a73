package com.gameflip.sdk;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalised outcome of a successful call.
 *
 * <p>
 * A page with a {@code null} payload is the terminal "no more data" result. Otherwise the payload is the data the
 * server returned and {@code nextCursor} is the continuation to pass to the following call, or {@code null} when this
 * was the last page.
 * </p>
 */
public record Page(JsonNode payload, String nextCursor) {

    private static final Page EMPTY = new Page(null, null);

    public static Page empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return payload == null;
    }

    public boolean hasNext() {
        return nextCursor != null;
    }
}
