package com.gameflip.sdk.transport;

/**
 * Verbs used by the Gameflip API, with the content type their bodies are sent under.
 */
public enum HttpMethod {
    GET(null),
    POST("application/json"),
    PUT("application/json"),
    PATCH("application/json-patch+json");

    private final String contentType;

    HttpMethod(String contentType) {
        this.contentType = contentType;
    }

    /**
     * @return content type sent with this verb, or {@code null} when requests carry no body.
     */
    public String contentType() {
        return contentType;
    }
}
