package com.gameflip.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.gameflip.sdk.internal.Json;
import com.gameflip.sdk.transport.RawResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultNormalizerTest {

    @Test
    void successReturnsDataAndNoCursorOnLastPage() throws Exception {
        Page page = ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\",\"data\":[1,2,3],\"next_page\":null}", 200), ResponseShape.GAMEFLIP);

        assertFalse(page.isEmpty());
        assertEquals(Json.mapper().readTree("[1,2,3]"), page.payload());
        assertNull(page.nextCursor());
        assertFalse(page.hasNext());
    }

    @Test
    void successCarriesNextPageCursor() throws Exception {
        Page page = ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\",\"data\":[{\"id\":\"a\"}],\"next_page\":\"https://x/listing?page=2\"}", 200),
            ResponseShape.GAMEFLIP);

        assertEquals("a", page.payload().get(0).path("id").asText());
        assertEquals("https://x/listing?page=2", page.nextCursor());
    }

    @Test
    void successWithoutDataOrContinuationIsEmpty() throws Exception {
        assertTrue(ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\",\"data\":[],\"next_page\":null}", 200), ResponseShape.GAMEFLIP).isEmpty());
        assertTrue(ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\"}", 200), ResponseShape.GAMEFLIP).isEmpty());
        assertTrue(ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\",\"data\":null}", 200), ResponseShape.GAMEFLIP).isEmpty());
    }

    @Test
    void singleObjectPayloadIsNotEmpty() throws Exception {
        Page page = ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\",\"data\":{\"owner\":\"me\"}}", 200), ResponseShape.GAMEFLIP);

        assertEquals("me", page.payload().path("owner").asText());
        assertNull(page.nextCursor());
    }

    @Test
    void emptyPayloadWithContinuationKeepsTraversing() throws Exception {
        Page page = ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\",\"data\":[],\"next_page\":\"https://x/next\"}", 200),
            ResponseShape.GAMEFLIP);

        assertFalse(page.isEmpty());
        assertTrue(page.payload().isArray());
        assertEquals("https://x/next", page.nextCursor());
    }

    @Test
    void structuredErrorWinsOverHttpStatus() {
        GfApiException ex = assertThrows(GfApiException.class, () -> ResultNormalizer.normalize(
            response("{\"status\":\"FAIL\",\"error\":{\"code\":422,\"message\":\"trade hold\"}}", 400),
            ResponseShape.GAMEFLIP));

        assertEquals(422, ex.getStatusCode());
        assertEquals("trade hold", ex.getStatusMessage());
        assertEquals("trade hold", ex.getMessage());
    }

    @Test
    void eachErrorFieldFallsBackIndependently() {
        GfApiException missingMessage = assertThrows(GfApiException.class, () -> ResultNormalizer.normalize(
            response("{\"status\":\"FAIL\",\"error\":{\"code\":409}}", 400), ResponseShape.GAMEFLIP));
        assertEquals(409, missingMessage.getStatusCode());
        assertEquals("Bad Request", missingMessage.getStatusMessage());

        GfApiException textualCode = assertThrows(GfApiException.class, () -> ResultNormalizer.normalize(
            response("{\"status\":\"FAIL\",\"error\":{\"code\":\"LISTING_LOCKED\",\"message\":\"locked\"}}", 403),
            ResponseShape.GAMEFLIP));
        assertEquals(403, textualCode.getStatusCode());
        assertEquals("locked", textualCode.getStatusMessage());
    }

    @Test
    void nonJsonBodyFailsWithHttpStatus() {
        GfApiException ex = assertThrows(GfApiException.class, () -> ResultNormalizer.normalize(
            new RawResponse(null, 502, "Bad Gateway"), ResponseShape.GAMEFLIP));

        assertEquals(502, ex.getStatusCode());
        assertEquals("Bad Gateway", ex.getStatusMessage());
    }

    @Test
    void steamSuccessReturnsWholeBodyWithLastAssetCursor() throws Exception {
        JsonNode body = Json.mapper().readTree(
            "{\"success\":true,\"assets\":[{\"assetid\":\"98\"},{\"assetid\":\"99\"}],\"more_items\":1,\"last_assetid\":\"99\"}");
        Page page = ResultNormalizer.normalize(new RawResponse(body, 200, "OK"), ResponseShape.STEAM);

        assertEquals(body, page.payload());
        assertEquals("99", page.nextCursor());
    }

    @Test
    void steamNumericSuccessFlagAndExhaustion() throws Exception {
        Page page = ResultNormalizer.normalize(
            response("{\"success\":1,\"assets\":[{\"assetid\":\"1\"}]}", 200), ResponseShape.STEAM);
        assertFalse(page.isEmpty());
        assertNull(page.nextCursor());

        assertTrue(ResultNormalizer.normalize(
            response("{\"success\":1,\"total_inventory_count\":0}", 200), ResponseShape.STEAM).isEmpty());
        assertTrue(ResultNormalizer.normalize(
            response("{\"success\":1,\"assets\":null}", 200), ResponseShape.STEAM).isEmpty());
    }

    @Test
    void steamFailureUsesHttpStatus() {
        GfApiException ex = assertThrows(GfApiException.class, () -> ResultNormalizer.normalize(
            new RawResponse(Json.emptyObject().put("success", false), 503, "Service Unavailable"),
            ResponseShape.STEAM));

        assertEquals(503, ex.getStatusCode());
        assertEquals("Service Unavailable", ex.getStatusMessage());
    }

    @Test
    void gameflipBodyIsNotSuccessForSteamAndViceVersa() {
        assertThrows(GfApiException.class, () -> ResultNormalizer.normalize(
            response("{\"status\":\"SUCCESS\",\"data\":[1]}", 200), ResponseShape.STEAM));
        assertThrows(GfApiException.class, () -> ResultNormalizer.normalize(
            response("{\"success\":true,\"assets\":[1]}", 200), ResponseShape.GAMEFLIP));
    }

    private static RawResponse response(String json, int status) throws Exception {
        String reason = status == 200 ? "OK" : status == 400 ? "Bad Request" : status == 403 ? "Forbidden" : null;
        return new RawResponse(Json.mapper().readTree(json), status, reason);
    }
}
