package com.scanops.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    static record ScanParams(String target, int ports) {}

    @Test
    void testReadObjectEmbeddedInProse() {
        String raw = "Tool finished: {\"stdout\":\"22/tcp open\", \"exit_code\":0} (took 3s)";
        JsonNode node = service.readObject("nmap", raw);
        assertNotNull(node);
        assertEquals("22/tcp open", node.get("stdout").asText());
        assertEquals(0, node.get("exit_code").asInt());
    }

    @Test
    void testReadObjectDirect() {
        JsonNode node = service.readObject("nmap", "{\"stderr\":\"\"}");
        assertNotNull(node);
        assertTrue(node.has("stderr"));
    }

    @Test
    void testReadObjectEmptyOrInvalid() {
        assertNull(service.readObject("nmap", ""));
        assertNull(service.readObject("nmap", "{invalid-json}"));
        assertNull(service.readObject("nmap", "plain text output"));
    }

    @Test
    void testToMap() {
        Map<String, Object> map = service.toMap(new ScanParams("10.0.0.1", 1000));
        assertEquals("10.0.0.1", map.get("target"));
        assertEquals(1000, map.get("ports"));
    }

    @Test
    void testTruncateFlattensNewlines() {
        assertEquals("line one line two", service.truncate("line one\nline two", 100));
        assertEquals("abc...", service.truncate("abcdef", 3));
        assertEquals("", service.truncate(null, 3));
    }

    @Test
    void testToJson() {
        String json = service.toJson(List.of(new SubInvocation("nmap_scan", "{}", "ok", "", 0, 15)));
        assertTrue(json.contains("\"name\" : \"nmap_scan\""));
        assertTrue(json.contains("\"durationMs\" : 15"));
    }
}
