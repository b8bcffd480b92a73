package com.gameflip.sdk.auth;

import com.gameflip.sdk.GfConfigurationException;

import java.time.Clock;
import java.util.Objects;

/**
 * Authenticator signing each request with a fresh TOTP code: {@code GFAPI <apiKey>:<code>}.
 *
 * <p>
 * Holds no state between calls. Two calls in the same period bucket produce the same header; calls straddling a
 * bucket boundary may differ by one code.
 * </p>
 */
public final class TotpAuthenticator implements Authenticator {

    public static final String SCHEME = "GFAPI";

    private final String apiKey;
    private final TotpSecret secret;
    private final Clock clock;

    public TotpAuthenticator(String apiKey, TotpSecret secret, Clock clock) {
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.secret = Objects.requireNonNull(secret, "secret");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String authorizationHeader() throws GfConfigurationException {
        return SCHEME + " " + apiKey + ":" + TotpGenerator.code(secret, clock.instant());
    }
}
