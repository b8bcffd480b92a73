package com.gameflip.sdk;

/**
 * Base exception thrown by the Gameflip Java SDK.
 */
public class GfException extends Exception {

    private static final long serialVersionUID = 1L;

    public GfException(String message) {
        super(message);
    }

    public GfException(String message, Throwable cause) {
        super(message, cause);
    }
}
