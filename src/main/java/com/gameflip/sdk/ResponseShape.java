package com.gameflip.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.gameflip.sdk.internal.QueryStrings;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response conventions of the API families the client talks to. Each family decides what success looks like, where
 * the payload and the continuation live, and how a continuation is fed into the next request.
 */
public enum ResponseShape {

    /**
     * Gameflip API: {@code {"status": "SUCCESS", "data": ..., "next_page": "<absolute url>"}}. The continuation is
     * the URL of the next page and replaces the request target.
     */
    GAMEFLIP {
        @Override
        boolean isSuccess(JsonNode body) {
            return "SUCCESS".equals(body.path("status").asText(null));
        }

        @Override
        boolean isExhausted(JsonNode body) {
            return isAbsent(body.get("next_page")) && isEmptyOrAbsent(body.get("data"));
        }

        @Override
        JsonNode payload(JsonNode body) {
            JsonNode data = body.get("data");
            return data == null ? NullNode.getInstance() : data;
        }

        @Override
        String nextCursor(JsonNode body) {
            return textOrNull(body.get("next_page"));
        }

        @Override
        String requestUrl(String url, Map<String, String> filters, String cursor) {
            return cursor != null ? cursor : url + QueryStrings.of(filters);
        }

        @Override
        boolean authenticated() {
            return true;
        }
    },

    /**
     * Steam community inventory: {@code {"success": 1, "assets": [...], "more_items": 1, "last_assetid": "..."}}.
     * The whole body is the payload; the continuation is sent back as the {@code start_assetid} parameter.
     */
    STEAM {
        @Override
        boolean isSuccess(JsonNode body) {
            return body.path("success").asBoolean(false);
        }

        @Override
        boolean isExhausted(JsonNode body) {
            return isAbsent(body.get("more_items")) && isEmptyOrAbsent(body.get("assets"));
        }

        @Override
        JsonNode payload(JsonNode body) {
            return body;
        }

        @Override
        String nextCursor(JsonNode body) {
            return textOrNull(body.get("last_assetid"));
        }

        @Override
        String requestUrl(String url, Map<String, String> filters, String cursor) {
            if (cursor == null) {
                return url + QueryStrings.of(filters);
            }
            Map<String, String> params = new LinkedHashMap<>(filters);
            params.put(START_ASSET_ID, cursor);
            return url + QueryStrings.of(params);
        }

        @Override
        boolean authenticated() {
            return false;
        }
    };

    static final String START_ASSET_ID = "start_assetid";

    abstract boolean isSuccess(JsonNode body);

    /**
     * True when the server reports neither a continuation nor any data.
     */
    abstract boolean isExhausted(JsonNode body);

    abstract JsonNode payload(JsonNode body);

    abstract String nextCursor(JsonNode body);

    /**
     * Target of a list request: the continuation when this family uses URLs as cursors, otherwise {@code url} with
     * the filters (and cursor parameter) appended.
     */
    abstract String requestUrl(String url, Map<String, String> filters, String cursor);

    /**
     * Whether requests to this family carry the TOTP {@code Authorization} header.
     */
    abstract boolean authenticated();

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static boolean isEmptyOrAbsent(JsonNode node) {
        return isAbsent(node) || (node.isArray() && node.isEmpty());
    }

    private static String textOrNull(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String text = node.asText();
        return text.isEmpty() ? null : text;
    }
}
