package com.gameflip.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-owned filter parameters plus the traversal cursor of a list endpoint.
 *
 * <p>
 * Every successful list call writes the next cursor back into the query it was given, so repeating the call with the
 * same instance walks forward one page at a time. When the server signals the last page the query becomes
 * {@linkplain #isExhausted() exhausted} and the next call returns without touching the network. Callers can stop a
 * traversal up front the same way with {@link #markExhausted()}.
 * </p>
 *
 * <p>Instances are not thread-safe; share one query per traversal.</p>
 */
public final class ListQuery {

    private final Map<String, String> filters = new LinkedHashMap<>();
    private String cursor;
    private boolean exhausted;

    public static ListQuery create() {
        return new ListQuery();
    }

    public static ListQuery of(Map<String, ?> filters) {
        ListQuery query = new ListQuery();
        if (filters != null) {
            filters.forEach(query::with);
        }
        return query;
    }

    /**
     * A query whose traversal is already over; list calls made with it return no data.
     */
    public static ListQuery exhausted() {
        return new ListQuery().markExhausted();
    }

    /**
     * Sets a filter; a {@code null} value removes it.
     */
    public ListQuery with(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            filters.remove(name);
        } else {
            filters.put(name, String.valueOf(value));
        }
        return this;
    }

    public Map<String, String> filters() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    /**
     * @return continuation returned by the previous call, or {@code null} before the first call and after the last.
     */
    public String cursor() {
        return cursor;
    }

    public boolean hasCursor() {
        return cursor != null;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * Resumes a traversal from a continuation obtained earlier, for example from {@link Page#nextCursor()}.
     */
    public ListQuery resume(String cursor) {
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.exhausted = false;
        return this;
    }

    public ListQuery markExhausted() {
        this.cursor = null;
        this.exhausted = true;
        return this;
    }

    /**
     * Records the continuation handed back by the server; {@code null} ends the traversal.
     */
    void advance(String nextCursor) {
        if (nextCursor == null) {
            markExhausted();
        } else {
            resume(nextCursor);
        }
    }

    @Override
    public String toString() {
        return "ListQuery{filters=" + filters + ", cursor=" + cursor + ", exhausted=" + exhausted + "}";
    }
}
