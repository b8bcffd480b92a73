package com.gameflip.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.gameflip.sdk.GfApiException;
import com.gameflip.sdk.transport.RawResponse;

/**
 * Builds {@link GfApiException} from a failed response. The {@code error.code} and {@code error.message} fields of
 * the body win over the HTTP status line, each on its own.
 */
public final class ApiErrorDecoder {

    private ApiErrorDecoder() {
    }

    public static GfApiException decode(JsonNode body, RawResponse response) {
        JsonNode error = body == null ? null : body.get("error");
        Integer structuredCode = null;
        String structuredMessage = null;
        if (error != null && error.isObject()) {
            structuredCode = numericCode(error.get("code"));
            structuredMessage = error.hasNonNull("message") ? error.get("message").asText() : null;
        }

        int statusCode = structuredCode != null ? structuredCode : response.statusCode();
        String statusMessage = structuredMessage != null ? structuredMessage : response.statusMessage();
        return new GfApiException(statusCode, statusMessage);
    }

    private static Integer numericCode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt() && node.isIntegralNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
