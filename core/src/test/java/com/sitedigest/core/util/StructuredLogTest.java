package com.sitedigest.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void line_is_single_json_object_with_typed_values() throws Exception {
        String line = slog.line(Level.INFO, "crawl-done", null,
                "engine", "sequential", "pages", 4, "requests", 9L, "ok", true, "categories", List.of("home", "pricing"));

        assertThat(line).doesNotContain("\n");
        JsonNode n = MAPPER.readTree(line);
        assertThat(n.get("event").asText()).isEqualTo("crawl-done");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("pages").isInt()).isTrue();
        assertThat(n.get("requests").asLong()).isEqualTo(9L);
        assertThat(n.get("ok").asBoolean()).isTrue();
        assertThat(n.get("categories").isArray()).isTrue();
        assertThat(n.get("categories").get(1).asText()).isEqualTo("pricing");
    }

    @Test
    void error_and_odd_kvs_are_recorded() throws Exception {
        String line = slog.line(Level.SEVERE, "request-failed", new IllegalStateException("boom"), "url");

        JsonNode n = MAPPER.readTree(line);
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom");
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
    }
}
