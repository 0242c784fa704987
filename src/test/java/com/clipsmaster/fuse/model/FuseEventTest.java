package com.clipsmaster.fuse.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FuseEventTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void jsonUsesSnakeCaseFieldsAndRoundTrips() throws Exception {
        Map<String, Object> system = new LinkedHashMap<>();
        system.put("percent", 91.5);
        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("system", system);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("level", "CRITICAL");
        details.put("actions", List.of("force_gc"));

        FuseEvent event = new FuseEvent("e-1", "fuse_triggered", 1_700_000_000_123L,
                memory, details, List.of("e-0"));

        String json = mapper.writeValueAsString(event);
        assertThat(json).contains("\"event_id\"", "\"event_type\"", "\"memory_usage\"", "\"related_ids\"");

        FuseEvent back = mapper.readValue(json, FuseEvent.class);
        assertThat(back).isEqualTo(event);
        assertThat(back.isType(EventType.FUSE_TRIGGERED)).isTrue();
    }

    @Test
    void queryMatchesNumbersAcrossBoxedTypes() {
        FuseEvent event = new FuseEvent("e-2", "validation_result", 1L, null,
                Map.of("action", "force_gc", "expected", 150), null);

        assertThat(EventQuery.ofType(EventType.VALIDATION_RESULT).withDetail("expected", 150.0).matches(event)).isTrue();
        assertThat(EventQuery.any().withDetail("action", "clear_cache").matches(event)).isFalse();
        assertThat(EventQuery.ofType("fuse_triggered").matches(event)).isFalse();
    }
}
