package com.gameflip.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.gameflip.sdk.internal.ApiErrorDecoder;
import com.gameflip.sdk.internal.Json;
import com.gameflip.sdk.transport.RawResponse;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Classifies a raw response into a {@link Page} or a {@link GfApiException}.
 *
 * <ul>
 *   <li>A body that is absent or not a JSON object is read as {@code {}}.</li>
 *   <li>On success with neither continuation nor data the result is {@link Page#empty()}.</li>
 *   <li>On success otherwise the result carries the family's payload and next cursor.</li>
 *   <li>On failure a {@link GfApiException} is thrown, preferring the body's structured error over the HTTP status.</li>
 * </ul>
 */
public final class ResultNormalizer {

    private static final Logger LOGGER = Logger.getLogger(ResultNormalizer.class.getName());

    private ResultNormalizer() {
    }

    public static Page normalize(RawResponse response, ResponseShape shape) throws GfApiException {
        Objects.requireNonNull(response, "response");
        Objects.requireNonNull(shape, "shape");

        JsonNode data = response.data();
        JsonNode body = data != null && data.isObject() ? data : Json.emptyObject();

        if (shape.isSuccess(body)) {
            LOGGER.finest(() -> "[gfapi-sdk] SUCCESS: " + Json.pretty(body));
            if (shape.isExhausted(body)) {
                return Page.empty();
            }
            return new Page(shape.payload(body), shape.nextCursor(body));
        }

        GfApiException error = ApiErrorDecoder.decode(body, response);
        LOGGER.finest(() -> "[gfapi-sdk] FAIL: statusCode=" + error.getStatusCode()
            + " statusMessage=" + error.getStatusMessage());
        throw error;
    }
}
