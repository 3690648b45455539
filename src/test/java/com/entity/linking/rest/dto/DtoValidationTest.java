package com.entity.linking.rest.dto;

import com.entity.linking.core.model.AutoLinkResult;
import com.entity.linking.core.model.EntityLink;
import com.entity.linking.core.model.EntityType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DtoValidationTest {

    private final ObjectMapper mapper = new ObjectMapper();

    // ========== CreateLinkRequest Tests ==========

    @Test
    @DisplayName("Should create valid CreateLinkRequest without label")
    void testValidCreateLinkRequest() {
        CreateLinkRequest req = new CreateLinkRequest("todo", "id", "url", "https://x", null);
        assertNull(req.label());
    }

    @Test
    @DisplayName("Should reject CreateLinkRequest with missing fields")
    void testCreateLinkRequestMissingFields() {
        assertThrows(IllegalArgumentException.class, () -> new CreateLinkRequest(null, "id", "url", "x", null));
        assertThrows(IllegalArgumentException.class, () -> new CreateLinkRequest("todo", " ", "url", "x", null));
        assertThrows(IllegalArgumentException.class, () -> new CreateLinkRequest("todo", "id", "", "x", null));
        assertThrows(IllegalArgumentException.class, () -> new CreateLinkRequest("todo", "id", "url", null, null));
    }

    @Test
    @DisplayName("Should read CreateLinkRequest from snake_case JSON")
    void testCreateLinkRequestJson() throws Exception {
        CreateLinkRequest req = mapper.readValue(
                "{\"source_type\":\"project\",\"source_id\":\"p1\",\"target_type\":\"url\","
                        + "\"target_ref\":\"https://example.com\",\"label\":\"docs\"}",
                CreateLinkRequest.class);
        assertEquals("project", req.sourceType());
        assertEquals("https://example.com", req.targetRef());
        assertEquals("docs", req.label());
    }

    // ========== AutoLinkRequest Tests ==========

    @Test
    @DisplayName("Should reject AutoLinkRequest without thread id")
    void testAutoLinkRequestNoThread() {
        assertThrows(IllegalArgumentException.class, () -> new AutoLinkRequest(null, "+1", null, "x", null));
    }

    @Test
    @DisplayName("Should reject AutoLinkRequest threshold outside [0, 1]")
    void testAutoLinkRequestThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new AutoLinkRequest("t", null, null, "x", 1.5));
        assertThrows(IllegalArgumentException.class, () -> new AutoLinkRequest("t", null, null, "x", -0.1));
        assertEquals(0.0, new AutoLinkRequest("t", null, null, "x", 0.0).similarityThreshold());
    }

    // ========== Response Tests ==========

    @Test
    @DisplayName("AutoLinkResponse serializes with snake_case names")
    void testAutoLinkResponseJson() {
        AutoLinkResponse response = AutoLinkResponse.from(AutoLinkResult.of(List.of("c"), List.of(), List.of("t")));
        JsonNode json = mapper.valueToTree(response);
        assertEquals(2, json.get("links_created").asInt());
        assertEquals("t", json.get("matches").get("todos").get(0).asText());
    }

    @Test
    @DisplayName("LinkResponse keeps wire names and ISO timestamps")
    void testLinkResponse() {
        EntityLink link = new EntityLink(EntityType.CONTACT, "c1", EntityType.THREAD, "t1",
                "inbound-message-sender", Instant.parse("2026-03-01T10:15:30Z"), true);
        LinkResponse response = LinkResponse.from(link);
        assertEquals("contact", response.sourceType());
        assertEquals("thread", response.targetType());
        assertEquals("2026-03-01T10:15:30Z", response.createdAt());
        assertTrue(response.autoLinked());
    }

    @Test
    @DisplayName("Bad gateway error names the backend")
    void testBadGateway() {
        ErrorResponse error = ErrorResponse.badGateway("search: unavailable", "/api/links", "search");
        assertEquals(502, error.status());
        assertEquals("search", error.details().get("backend"));
    }
}
