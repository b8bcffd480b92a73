package com.gameflip.sdk;

/**
 * Exception representing a failure reported by the server. The status code and message come from the structured
 * {@code error} object of the response when present, otherwise from the HTTP status line.
 */
public final class GfApiException extends GfException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String statusMessage;

    public GfApiException(int statusCode, String statusMessage) {
        super(statusMessage == null || statusMessage.isBlank() ? defaultMessage(statusCode) : statusMessage);
        this.statusCode = statusCode;
        this.statusMessage = statusMessage;
    }

    /**
     * @return application error code when the server supplied one, otherwise the HTTP status code.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return application error message when the server supplied one, otherwise the HTTP reason phrase (nullable).
     */
    public String getStatusMessage() {
        return statusMessage;
    }

    private static String defaultMessage(int status) {
        return "Gameflip request failed with status " + status;
    }
}
