package com.gameflip.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.gameflip.sdk.auth.TotpAuthenticator;
import com.gameflip.sdk.internal.QueryStrings;
import com.gameflip.sdk.ratelimit.IntervalRateLimiter;
import com.gameflip.sdk.transport.HttpMethod;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for the Gameflip marketplace API. Create one instance per API key and reuse it: every request
 * made through an instance shares its rate limiter, so concurrent callers are admitted one at a time, in arrival
 * order, at most once per {@link Config#getRateLimitInterval()}.
 * </p>
 *
 * <h2>Results</h2>
 * <ul>
 *   <li>Successful calls return the response {@code data} as a {@link JsonNode}.</li>
 *   <li>{@link Optional#empty()} means the server succeeded but had nothing (more) to return.</li>
 *   <li>Failures never return: {@link GfApiException} for errors reported by the server, {@link GfTransportException}
 *       for network failures, {@link GfConfigurationException} for an unusable TOTP secret. Nothing is retried.</li>
 * </ul>
 *
 * <h2>Lists</h2>
 * <p>
 * List methods take a {@link ListQuery} and advance its cursor in place. Call them repeatedly with the same query
 * until they return empty:
 * </p>
 * <pre>{@code
 * ListQuery query = ListQuery.create().with("status", EscrowStatus.RECEIVED.value());
 * Optional<JsonNode> page;
 * while ((page = client.escrowsMine(query)).isPresent()) {
 *     page.get().forEach(escrow -> ...);
 * }
 * }</pre>
 * <p>
 * {@link #fetchPage(String, Map, String)} is the side-effect free alternative returning the cursor with the data.
 * </p>
 */
public final class GfClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(GfClient.class.getName());

    private final Config config;
    private final String baseUrl;
    private final RequestPipeline pipeline;

    /**
     * @param config caller-supplied configuration; only the API key and TOTP secret are mandatory.
     */
    public GfClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.baseUrl = this.config.getBaseUrl();
        this.pipeline = new RequestPipeline(
            new TotpAuthenticator(this.config.getApiKey(), this.config.getTotpSecret(), this.config.getClock()),
            new IntervalRateLimiter(this.config.getRateLimitInterval()),
            this.config.getTransport()
        );
        LOGGER.info(() -> "[gfapi-sdk] client ready for " + this.config.getEnvironment() + " at " + baseUrl);
    }

    public Config config() {
        return config;
    }

    /**
     * @return profile of the account owning the API key.
     */
    public Optional<JsonNode> profile() throws GfException {
        return get("account/me/profile");
    }

    /**
     * Gets a single listing. Owners can view any listing they own; anyone else only publicly viewable listings.
     */
    public Optional<JsonNode> listing(String id) throws GfException {
        return get("listing/" + requireId(id));
    }

    /**
     * Searches listings, advancing {@code query} to the next page.
     *
     * @return array of listings, or empty when none are left.
     */
    public Optional<JsonNode> listingSearch(ListQuery query) throws GfException {
        return getList("listing", query);
    }

    /**
     * Applies JSON Patch operations to a listing, e.g.
     * {@code [{"op": "replace", "path": "/status", "value": "onsale"}]}.
     */
    public Optional<JsonNode> listingPatch(String id, Object operations) throws GfException {
        Objects.requireNonNull(operations, "operations");
        return patch("listing/" + requireId(id), operations);
    }

    /**
     * Lists your escrows (subset of fields). Useful filters: {@code status} ({@code received}, {@code delivered},
     * {@code returned}) and {@code limit} (default 20, max 100).
     */
    public Optional<JsonNode> escrowsMine(ListQuery query) throws GfException {
        return getList("steam/escrow/mine", query);
    }

    /**
     * Escrow of a listing you own, if it exists.
     */
    public Optional<JsonNode> escrow(String listingId) throws GfException {
        return get("steam/escrow/" + requireId(listingId));
    }

    /**
     * Checks whether the account has a Steam trade ban or hold.
     *
     * @throws GfApiException with status 422 when a ban or hold is in place.
     */
    public Optional<JsonNode> checkTradeBan() throws GfException {
        return get("steam/escrow/hold");
    }

    /**
     * Lists your bulk objects (subset of fields), filtered by {@code status} and {@code limit}.
     */
    public Optional<JsonNode> bulksMine(ListQuery query) throws GfException {
        return getList("steam/bulk/mine", query);
    }

    public Optional<JsonNode> bulk(String id) throws GfException {
        return get("steam/bulk/" + requireId(id));
    }

    /**
     * Creates a bulk object in {@code start} state; its {@code id} is what later calls need.
     */
    public Optional<JsonNode> bulkCreate() throws GfException {
        return post("steam/bulk", null);
    }

    /**
     * Creates a trade offer for {@code items} on a bulk object, or refreshes it when {@code items} is {@code null}.
     * Each item carries {@code id} (asset id), {@code appid}, {@code price} in cents and {@code market_hash_name}.
     */
    public Optional<JsonNode> bulkUpdate(String id, Object items) throws GfException {
        return put("steam/bulk/" + requireId(id), items);
    }

    /**
     * Reads a public Steam inventory page. Not part of the Gameflip API and sent without credentials.
     * Optional filters: {@code l} (language) and {@code count}. The cursor is the last asset id of the page.
     *
     * @return the whole inventory response, or empty when no items remain.
     */
    public Optional<JsonNode> steamInventory(String profileId, String appId, ListQuery query) throws GfException {
        Objects.requireNonNull(query, "query");
        String url = config.getSteamInventoryUrl() + "/" + requireId(profileId) + "/" + requireId(appId) + "/"
            + SteamApp.contextIdFor(appId);
        return pipeline.list(url, query, ResponseShape.STEAM);
    }

    public Optional<JsonNode> steamInventory(String profileId, SteamApp app, ListQuery query) throws GfException {
        Objects.requireNonNull(app, "app");
        return steamInventory(profileId, app.appId(), query);
    }

    public Optional<JsonNode> get(String path) throws GfException {
        return get(path, null);
    }

    public Optional<JsonNode> get(String path, Map<String, String> params) throws GfException {
        return RequestPipeline.value(
            pipeline.send(HttpMethod.GET, url(path) + QueryStrings.of(params), null, ResponseShape.GAMEFLIP));
    }

    /**
     * Fetches the next page of a list endpoint and advances {@code query}. Once the last page has been returned the
     * query is exhausted and further calls return empty without a request.
     */
    public Optional<JsonNode> getList(String path, ListQuery query) throws GfException {
        return pipeline.list(url(path), query, ResponseShape.GAMEFLIP);
    }

    /**
     * Fetches one page of a list endpoint without mutating anything.
     *
     * @param cursor {@link Page#nextCursor()} of the previous page, or {@code null} for the first page
     */
    public Page fetchPage(String path, Map<String, String> filters, String cursor) throws GfException {
        return pipeline.fetchPage(url(path), filters == null ? Map.of() : filters, cursor, ResponseShape.GAMEFLIP);
    }

    public Optional<JsonNode> post(String path, Object body) throws GfException {
        return RequestPipeline.value(pipeline.send(HttpMethod.POST, url(path), body, ResponseShape.GAMEFLIP));
    }

    public Optional<JsonNode> put(String path, Object body) throws GfException {
        return RequestPipeline.value(pipeline.send(HttpMethod.PUT, url(path), body, ResponseShape.GAMEFLIP));
    }

    public Optional<JsonNode> patch(String path, Object body) throws GfException {
        return RequestPipeline.value(pipeline.send(HttpMethod.PATCH, url(path), body, ResponseShape.GAMEFLIP));
    }

    /**
     * No-op: the underlying {@link java.net.http.HttpClient} does not require explicit shutdown.
     */
    @Override
    public void close() {
        // transport is managed externally; nothing to close.
    }

    private String url(String path) {
        Objects.requireNonNull(path, "path");
        return baseUrl + "/" + (path.startsWith("/") ? path.substring(1) : path);
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        return id;
    }
}
