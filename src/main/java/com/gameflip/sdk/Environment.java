package com.gameflip.sdk;

import java.util.Locale;

/**
 * Gameflip deployments an API key can target. The key's prefix before the first {@code -} names the environment;
 * a key without a prefix belongs to production.
 */
public enum Environment {
    PRODUCTION("https://production-gameflip.fingershock.com/api/v1"),
    TEST("https://test-gameflip.fingershock.com/api/v1"),
    DEVELOPMENT("http://localhost:3000/api/v1");

    private final String baseUrl;

    Environment(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String baseUrl() {
        return baseUrl;
    }

    /**
     * Resolves the environment of an API key such as {@code test-0123456789abcde}.
     *
     * @throws IllegalArgumentException when the key carries a prefix that names no known environment.
     */
    public static Environment fromApiKey(String apiKey) {
        int dash = apiKey.indexOf('-');
        if (dash < 0) {
            return PRODUCTION;
        }
        String prefix = apiKey.substring(0, dash).toUpperCase(Locale.ROOT);
        for (Environment candidate : values()) {
            if (candidate.name().equals(prefix)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("API key prefix '" + apiKey.substring(0, dash) + "' names no environment");
    }
}
