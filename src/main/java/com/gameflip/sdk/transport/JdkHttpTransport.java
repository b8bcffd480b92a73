package com.gameflip.sdk.transport;

import com.gameflip.sdk.GfTransportException;
import com.gameflip.sdk.internal.Json;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 */
public final class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public JdkHttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    @Override
    public RawResponse send(HttpMethod method, String url, Map<String, String> headers, Object body)
        throws GfTransportException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(buildRequest(method, url, headers, body), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GfTransportException(method + " " + url + " interrupted", ex);
        } catch (IOException ex) {
            throw new GfTransportException(method + " " + url + ": " + ex.getMessage(), ex);
        }

        return new RawResponse(
            Json.readOrNull(response.body()),
            response.statusCode(),
            ReasonPhrases.of(response.statusCode())
        );
    }

    private HttpRequest buildRequest(HttpMethod method, String url, Map<String, String> headers, Object body)
        throws GfTransportException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder().uri(URI.create(url));
        } catch (IllegalArgumentException ex) {
            throw new GfTransportException("invalid request url " + url, ex);
        }

        if (body == null) {
            builder.method(method.name(), HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] json;
            try {
                json = Json.mapper().writeValueAsBytes(body);
            } catch (IOException ex) {
                throw new GfTransportException("encode request body: " + ex.getMessage(), ex);
            }
            builder.method(method.name(), HttpRequest.BodyPublishers.ofByteArray(json));
        }

        if (method.contentType() != null) {
            builder.header("Content-Type", method.contentType());
        }
        builder.header("Accept", "application/json");
        if (headers != null) {
            headers.forEach(builder::header);
        }

        return builder.timeout(requestTimeout).build();
    }
}
