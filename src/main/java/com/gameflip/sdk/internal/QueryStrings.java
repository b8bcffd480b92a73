package com.gameflip.sdk.internal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Formats query strings for request URLs.
 */
public final class QueryStrings {

    private QueryStrings() {
    }

    /**
     * @return {@code ?k=v&...} with both sides form-encoded, or an empty string when there is nothing to send.
     *         Entries with a null value are skipped.
     */
    public static String of(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            query.append(query.length() == 0 ? '?' : '&')
                .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return query.toString();
    }
}
