package com.gameflip.sdk.transport;

import com.gameflip.sdk.GfTransportException;

import java.util.Map;

/**
 * Performs one HTTP exchange. Implementations must return every response the server produced, whatever its status,
 * and report only failures below HTTP as {@link GfTransportException}.
 */
public interface HttpTransport {

    /**
     * @param method  HTTP verb; {@link HttpMethod#contentType()} decides the {@code Content-Type} header
     * @param url     absolute request URL
     * @param headers additional headers (for example {@code Authorization})
     * @param body    object serialised as JSON, or {@code null} for no body
     */
    RawResponse send(HttpMethod method, String url, Map<String, String> headers, Object body)
        throws GfTransportException;
}
