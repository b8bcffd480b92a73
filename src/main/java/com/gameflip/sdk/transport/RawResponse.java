package com.gameflip.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unclassified HTTP response as delivered by an {@link HttpTransport}.
 *
 * @param data          parsed JSON body, or {@code null} when the body was empty or not JSON
 * @param statusCode    HTTP status code
 * @param statusMessage HTTP reason phrase (nullable)
 */
public record RawResponse(JsonNode data, int statusCode, String statusMessage) {
}
