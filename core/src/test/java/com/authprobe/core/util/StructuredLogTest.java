package com.authprobe.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.logging.Level;

import static org.assertj.core.api.Assertions.*;

class StructuredLogTest {

    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void event_line_is_valid_json_with_typed_values() throws Exception {
        String line = slog.buildJson(Level.INFO, "run-done", null,
                "tested", 42L, "workers", 5, "elapsedMs", Duration.ofSeconds(3),
                "stopped", false, "reasons", List.of("status 302 != 422", "url \"x\""), "note", null);

        JsonNode n = new ObjectMapper().readTree(line);
        assertThat(n.get("event").asText()).isEqualTo("run-done");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("tested").isNumber()).isTrue();
        assertThat(n.get("elapsedMs").asLong()).isEqualTo(3000);
        assertThat(n.get("stopped").asBoolean()).isFalse();
        assertThat(n.get("reasons").get(1).asText()).isEqualTo("url \"x\"");
        assertThat(n.get("note").isNull()).isTrue();
        assertThat(line).doesNotContain("\n");
    }

    @Test
    void password_keys_are_masked() throws Exception {
        String line = slog.buildJson(Level.WARNING, "verdict", null, "user", "admin", "Password", "hunter2");
        assertThat(line).doesNotContain("hunter2");
        assertThat(new ObjectMapper().readTree(line).get("Password").asText()).isEqualTo(StructuredLog.MASK);
    }

    @Test
    void odd_kv_count_and_throwable_are_reported() throws Exception {
        String line = slog.buildJson(Level.SEVERE, "worker-fault", new IllegalStateException("boom"), "user");
        JsonNode n = new ObjectMapper().readTree(line);
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom");
    }
}
