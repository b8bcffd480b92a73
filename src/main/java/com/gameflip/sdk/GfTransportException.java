package com.gameflip.sdk;

/**
 * Failure below the HTTP layer: DNS resolution, refused connections, timeouts or an interrupted exchange.
 * When present, the cause carries the original {@link java.io.IOException} or {@link InterruptedException}.
 */
public final class GfTransportException extends GfException {

    private static final long serialVersionUID = 1L;

    public GfTransportException(String message) {
        super(message);
    }

    public GfTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
