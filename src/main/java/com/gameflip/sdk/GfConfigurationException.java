package com.gameflip.sdk;

/**
 * Raised when the client credentials cannot be used, for example a TOTP secret that is not valid for its declared
 * encoding. Never retried: the client cannot recover until it is rebuilt with a corrected {@link Config}.
 */
public final class GfConfigurationException extends GfException {

    private static final long serialVersionUID = 1L;

    public GfConfigurationException(String message) {
        super(message);
    }

    public GfConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
