package com.gameflip.sdk.auth;

import java.time.Duration;
import java.util.Objects;

/**
 * Shared-secret configuration for time-based one-time passcodes. Defaults match the values issued with Gameflip API
 * keys: Base32 secret, HMAC-SHA1, 6 digits, 30 second period.
 */
public final class TotpSecret {

    public static final Encoding DEFAULT_ENCODING = Encoding.BASE32;
    public static final Algorithm DEFAULT_ALGORITHM = Algorithm.SHA1;
    public static final int DEFAULT_DIGITS = 6;
    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(30);

    /**
     * How the secret string maps to key bytes.
     */
    public enum Encoding {
        ASCII,
        HEX,
        BASE32,
        BASE64
    }

    /**
     * HMAC digest used to derive the code.
     */
    public enum Algorithm {
        SHA1,
        SHA256,
        SHA512
    }

    private final String secret;
    private final Encoding encoding;
    private final Algorithm algorithm;
    private final int digits;
    private final Duration period;

    private TotpSecret(Builder builder) {
        this.secret = builder.secret;
        this.encoding = builder.encoding == null ? DEFAULT_ENCODING : builder.encoding;
        this.algorithm = builder.algorithm == null ? DEFAULT_ALGORITHM : builder.algorithm;
        this.digits = builder.digits == null ? DEFAULT_DIGITS : builder.digits;
        this.period = builder.period == null ? DEFAULT_PERIOD : builder.period;
    }

    /**
     * Secret with every other setting at its default.
     */
    public static TotpSecret of(String secret) {
        return builder().secret(secret).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSecret() {
        return secret;
    }

    public Encoding getEncoding() {
        return encoding;
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public int getDigits() {
        return digits;
    }

    public Duration getPeriod() {
        return period;
    }

    @Override
    public String toString() {
        // the secret itself never reaches logs
        return "TotpSecret{encoding=" + encoding + ", algorithm=" + algorithm + ", digits=" + digits
            + ", period=" + period + "}";
    }

    public static final class Builder {
        private String secret;
        private Encoding encoding;
        private Algorithm algorithm;
        private Integer digits;
        private Duration period;

        private Builder() {
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder encoding(Encoding encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder algorithm(Algorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder digits(int digits) {
            this.digits = digits;
            return this;
        }

        public Builder period(Duration period) {
            this.period = period;
            return this;
        }

        /**
         * Validates the shape of the configuration. Whether the secret decodes under its encoding is only known when
         * a code is generated.
         *
         * @throws IllegalArgumentException when the secret is missing, digits fall outside 1..10 or the period is not a
         *                                  whole number of seconds, at least one.
         */
        public TotpSecret build() {
            if (secret == null || secret.isBlank()) {
                throw new IllegalArgumentException("TOTP secret is required");
            }
            if (digits != null && (digits < 1 || digits > 10)) {
                throw new IllegalArgumentException("TOTP digits must be between 1 and 10, got " + digits);
            }
            if (period != null && period.getSeconds() < 1) {
                throw new IllegalArgumentException("TOTP period must be at least one second");
            }
            if (period != null && period.getNano() != 0) {
                throw new IllegalArgumentException("TOTP period must be a whole number of seconds, got " + period);
            }
            return new TotpSecret(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TotpSecret)) {
            return false;
        }
        TotpSecret that = (TotpSecret) o;
        return digits == that.digits
            && secret.equals(that.secret)
            && encoding == that.encoding
            && algorithm == that.algorithm
            && period.equals(that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(secret, encoding, algorithm, digits, period);
    }
}
