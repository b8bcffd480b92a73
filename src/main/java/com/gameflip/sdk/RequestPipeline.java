package com.gameflip.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.gameflip.sdk.auth.Authenticator;
import com.gameflip.sdk.internal.Json;
import com.gameflip.sdk.ratelimit.RateLimiter;
import com.gameflip.sdk.transport.HttpMethod;
import com.gameflip.sdk.transport.HttpTransport;
import com.gameflip.sdk.transport.RawResponse;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runs one request through the client: rate limiter, authorization header, transport, normalisation.
 *
 * <p>
 * The header is computed after the rate limiter admits the request so a caller that queued behind others still sends
 * a current code. Errors from any stage reach the caller unchanged; nothing is retried.
 * </p>
 */
final class RequestPipeline {

    private static final Logger LOGGER = Logger.getLogger(RequestPipeline.class.getName());

    private final Authenticator authenticator;
    private final RateLimiter rateLimiter;
    private final HttpTransport transport;

    RequestPipeline(Authenticator authenticator, RateLimiter rateLimiter, HttpTransport transport) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    Page send(HttpMethod method, String url, Object body, ResponseShape shape) throws GfException {
        rateLimiter.acquire();
        if (Thread.currentThread().isInterrupted()) {
            // interrupted while queued: give up before anything reaches the server, flag stays set
            throw new GfTransportException(method + " " + url + " interrupted before sending");
        }
        LOGGER.fine(() -> body == null
            ? "[gfapi-sdk] " + method + " " + url
            : "[gfapi-sdk] " + method + " " + url + " data=" + Json.pretty(body));

        Map<String, String> headers = shape.authenticated()
            ? Map.of("Authorization", authenticator.authorizationHeader())
            : Map.of();
        RawResponse response = transport.send(method, url, headers, body);
        return ResultNormalizer.normalize(response, shape);
    }

    /**
     * Fetches one page without side effects.
     *
     * @param cursor continuation from a previous {@link Page#nextCursor()}, or {@code null} for the first page
     */
    Page fetchPage(String url, Map<String, String> filters, String cursor, ResponseShape shape) throws GfException {
        return send(HttpMethod.GET, shape.requestUrl(url, filters, cursor), null, shape);
    }

    /**
     * Fetches the next page of {@code query} and writes the following cursor back into it.
     *
     * @return the page payload, or empty once the traversal is over. An exhausted query returns empty without a
     *         request.
     */
    Optional<JsonNode> list(String url, ListQuery query, ResponseShape shape) throws GfException {
        Objects.requireNonNull(query, "query");
        if (query.isExhausted()) {
            LOGGER.fine(() -> "[gfapi-sdk] cursor exhausted, skipping GET " + url);
            return Optional.empty();
        }

        Page page = fetchPage(url, query.filters(), query.cursor(), shape);
        if (page.isEmpty()) {
            return Optional.empty();
        }
        query.advance(page.nextCursor());
        return Optional.of(page.payload());
    }

    static Optional<JsonNode> value(Page page) {
        return page.isEmpty() ? Optional.empty() : Optional.of(page.payload());
    }
}
