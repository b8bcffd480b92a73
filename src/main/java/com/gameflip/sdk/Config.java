package com.gameflip.sdk;

import com.gameflip.sdk.auth.TotpSecret;
import com.gameflip.sdk.ratelimit.IntervalRateLimiter;
import com.gameflip.sdk.transport.HttpTransport;
import com.gameflip.sdk.transport.JdkHttpTransport;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link GfClient} instances.
 */
public final class Config {

    public static final String DEFAULT_STEAM_INVENTORY_URL = "https://steamcommunity.com/inventory";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RATE_LIMIT_INTERVAL = IntervalRateLimiter.DEFAULT_INTERVAL;

    private final String apiKey;
    private final TotpSecret totpSecret;
    private final Environment environment;
    private final String baseUrl;
    private final String steamInventoryUrl;
    private final HttpClient httpClient;
    private final HttpTransport transport;
    private final Duration httpTimeout;
    private final Duration rateLimitInterval;
    private final Clock clock;

    private Config(Builder builder) {
        this.apiKey = builder.apiKey;
        this.totpSecret = builder.totpSecret;
        this.environment = builder.environment;
        this.baseUrl = builder.baseUrl;
        this.steamInventoryUrl = builder.steamInventoryUrl;
        this.httpClient = builder.httpClient;
        this.transport = builder.transport;
        this.httpTimeout = builder.httpTimeout;
        this.rateLimitInterval = builder.rateLimitInterval;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String key = Optional.ofNullable(apiKey).map(String::trim).orElse("");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("ApiKey is required");
        }
        if (totpSecret == null) {
            throw new IllegalArgumentException("TotpSecret is required");
        }

        Environment resolvedEnvironment = Environment.fromApiKey(key);
        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(resolvedEnvironment.baseUrl()));
        String resolvedSteamUrl = sanitizeUrl(Optional.ofNullable(steamInventoryUrl).orElse(DEFAULT_STEAM_INVENTORY_URL));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        Duration resolvedInterval = Optional.ofNullable(rateLimitInterval).orElse(DEFAULT_RATE_LIMIT_INTERVAL);
        if (resolvedInterval.isNegative()) {
            throw new IllegalArgumentException("RateLimitInterval cannot be negative");
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        HttpTransport resolvedTransport = transport;
        if (resolvedTransport == null) {
            resolvedTransport = new JdkHttpTransport(resolvedClient, resolvedTimeout);
        }

        return new Builder()
            .apiKey(key)
            .totpSecret(totpSecret)
            .environment(resolvedEnvironment)
            .baseUrl(resolvedBaseUrl)
            .steamInventoryUrl(resolvedSteamUrl)
            .httpClient(resolvedClient)
            .transport(resolvedTransport)
            .httpTimeout(resolvedTimeout)
            .rateLimitInterval(resolvedInterval)
            .clock(Optional.ofNullable(clock).orElse(Clock.systemUTC()))
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getApiKey() {
        return apiKey;
    }

    public TotpSecret getTotpSecret() {
        return totpSecret;
    }

    /**
     * @return environment named by the API key prefix; informational when {@link #getBaseUrl()} was overridden.
     */
    public Environment getEnvironment() {
        return environment;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getSteamInventoryUrl() {
        return steamInventoryUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public HttpTransport getTransport() {
        return transport;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Duration getRateLimitInterval() {
        return rateLimitInterval;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private String apiKey;
        private TotpSecret totpSecret;
        private Environment environment;
        private String baseUrl;
        private String steamInventoryUrl;
        private HttpClient httpClient;
        private HttpTransport transport;
        private Duration httpTimeout;
        private Duration rateLimitInterval;
        private Clock clock;

        private Builder() {
        }

        /**
         * API key, e.g. {@code test-0123456789abcde}. The prefix selects the environment.
         */
        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder totpSecret(TotpSecret totpSecret) {
            this.totpSecret = totpSecret;
            return this;
        }

        public Builder totpSecret(String secret) {
            this.totpSecret = TotpSecret.of(secret);
            return this;
        }

        private Builder environment(Environment environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Overrides the base URL derived from the API key.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder steamInventoryUrl(String steamInventoryUrl) {
            this.steamInventoryUrl = steamInventoryUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Replaces the JDK transport; {@link #httpClient(HttpClient)} and {@link #httpTimeout(Duration)} then only
         * apply if the supplied transport uses them.
         */
        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        /**
         * Minimum spacing between request starts of one client. {@link Duration#ZERO} disables spacing.
         */
        public Builder rateLimitInterval(Duration rateLimitInterval) {
            this.rateLimitInterval = rateLimitInterval;
            return this;
        }

        /**
         * Wall clock used to derive TOTP codes.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
