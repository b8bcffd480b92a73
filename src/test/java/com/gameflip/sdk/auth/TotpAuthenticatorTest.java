package com.gameflip.sdk.auth;

import com.gameflip.sdk.GfConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TotpAuthenticatorTest {

    private static final String SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    @Test
    void formatsSchemeKeyAndCode() throws Exception {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(59), ZoneOffset.UTC);
        TotpAuthenticator authenticator = new TotpAuthenticator("test-0123456789abcde", TotpSecret.of(SECRET), clock);

        assertEquals("GFAPI test-0123456789abcde:287082", authenticator.authorizationHeader());
    }

    @Test
    void isDeterministicForFixedInstant() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:05Z"), ZoneOffset.UTC);
        TotpAuthenticator authenticator = new TotpAuthenticator("key", TotpSecret.of(SECRET), clock);

        String first = authenticator.authorizationHeader();
        assertEquals(first, authenticator.authorizationHeader());
        assertTrue(first.matches("GFAPI key:\\d{6}"));
    }

    @Test
    void malformedSecretFailsWhenHeaderIsGenerated() {
        TotpAuthenticator authenticator = new TotpAuthenticator("key", TotpSecret.of("1nv@lid"), Clock.systemUTC());

        GfConfigurationException ex = assertThrows(GfConfigurationException.class, authenticator::authorizationHeader);
        assertTrue(ex.getMessage().contains("base32"));
    }
}
