package com.gameflip.sdk.auth;

import com.gameflip.sdk.GfConfigurationException;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base32;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;

/**
 * RFC 6238 time-based one-time passcodes.
 */
public final class TotpGenerator {

    private static final long[] POWERS_OF_TEN = {
        1L, 10L, 100L, 1_000L, 10_000L, 100_000L, 1_000_000L, 10_000_000L, 100_000_000L, 1_000_000_000L,
        10_000_000_000L
    };

    private TotpGenerator() {
    }

    /**
     * Computes the passcode for the period bucket containing {@code instant}.
     *
     * @return zero-padded code of {@link TotpSecret#getDigits()} characters.
     * @throws GfConfigurationException when the secret cannot be decoded or used as an HMAC key.
     */
    public static String code(TotpSecret secret, Instant instant) throws GfConfigurationException {
        return code(decodeKey(secret), secret.getAlgorithm(), secret.getDigits(), counter(secret, instant));
    }

    /**
     * @return index of the period bucket containing {@code instant}.
     */
    public static long counter(TotpSecret secret, Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), secret.getPeriod().getSeconds());
    }

    static String code(byte[] key, TotpSecret.Algorithm algorithm, int digits, long counter)
        throws GfConfigurationException {
        byte[] hash;
        try {
            hash = new HmacUtils(hmacAlgorithm(algorithm), key)
                .hmac(ByteBuffer.allocate(Long.BYTES).putLong(counter).array());
        } catch (IllegalArgumentException ex) {
            throw new GfConfigurationException("TOTP secret cannot be used as an HMAC key: " + ex.getMessage(), ex);
        }

        int offset = hash[hash.length - 1] & 0x0f;
        long binary = ((hash[offset] & 0x7fL) << 24)
            | ((hash[offset + 1] & 0xffL) << 16)
            | ((hash[offset + 2] & 0xffL) << 8)
            | (hash[offset + 3] & 0xffL);

        StringBuilder code = new StringBuilder(Long.toString(binary % POWERS_OF_TEN[digits]));
        while (code.length() < digits) {
            code.insert(0, '0');
        }
        return code.toString();
    }

    static byte[] decodeKey(TotpSecret secret) throws GfConfigurationException {
        String raw = secret.getSecret();
        byte[] key;
        switch (secret.getEncoding()) {
            case ASCII:
                if (!StandardCharsets.US_ASCII.newEncoder().canEncode(raw)) {
                    throw new GfConfigurationException("TOTP secret contains non-ASCII characters");
                }
                key = raw.getBytes(StandardCharsets.US_ASCII);
                break;
            case HEX:
                try {
                    key = Hex.decodeHex(raw.trim());
                } catch (DecoderException ex) {
                    throw new GfConfigurationException("TOTP secret is not valid hex", ex);
                }
                break;
            case BASE32:
                String normalized = raw.replace(" ", "").toUpperCase(Locale.ROOT);
                Base32 base32 = new Base32();
                // padding is only valid as a trailing run
                if (!base32.isInAlphabet(normalized) || normalized.replaceAll("=+$", "").indexOf('=') >= 0) {
                    throw new GfConfigurationException("TOTP secret is not valid base32");
                }
                key = base32.decode(normalized);
                break;
            case BASE64:
                try {
                    key = Base64.getDecoder().decode(raw.trim());
                } catch (IllegalArgumentException ex) {
                    throw new GfConfigurationException("TOTP secret is not valid base64", ex);
                }
                break;
            default:
                throw new GfConfigurationException("unsupported TOTP encoding " + secret.getEncoding());
        }
        if (key.length == 0) {
            throw new GfConfigurationException("TOTP secret decodes to an empty key");
        }
        return key;
    }

    private static HmacAlgorithms hmacAlgorithm(TotpSecret.Algorithm algorithm) {
        switch (algorithm) {
            case SHA256:
                return HmacAlgorithms.HMAC_SHA_256;
            case SHA512:
                return HmacAlgorithms.HMAC_SHA_512;
            case SHA1:
            default:
                return HmacAlgorithms.HMAC_SHA_1;
        }
    }
}
