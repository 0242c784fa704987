package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.core.EventStorage;
import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.EventType;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 各事件存储实现共同遵守的行为。
 */
abstract class AbstractEventStorageTest {

    protected static final long T0 = 1_700_000_000_000L;

    @TempDir
    Path dir;

    protected EventStorage storage;

    protected abstract EventStorage open(Path dir);

    @BeforeEach
    void openStorage() {
        storage = open(dir);
    }

    @AfterEach
    void closeStorage() {
        storage.close();
    }

    protected static FuseEvent event(String id, EventType type, long ts, Map<String, Object> details,
                                     String... related) {
        Map<String, Object> system = new LinkedHashMap<>();
        system.put("percent", 81.25);
        system.put("total_mb", 16384.0);
        return new FuseEvent(id, type.value(), ts, Map.of("system", system), details, List.of(related));
    }

    @Test
    void storedEventReadsBackEqual() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("level", "CRITICAL");
        details.put("pressure", 96.5);
        details.put("success_count", 2);
        details.put("actions", List.of("force_gc", "clear_cache"));
        FuseEvent original = event("e1", EventType.FUSE_TRIGGERED, T0, details);

        assertThat(storage.store(original)).isEqualTo("e1");

        assertThat(storage.get("e1")).isEqualTo(original);
        assertThat(storage.get("nope")).isNull();
        assertThat(storage.size()).isEqualTo(1);
    }

    @Test
    void longAndFloatDetailsReadBackEqual() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("released_bytes", 5L);
        details.put("total_bytes", 8_000_000_000L);
        details.put("ratio", 0.5f);
        details.put("nested", Map.of("count", 3L));
        FuseEvent original = event("n1", EventType.RESOURCE_RELEASED, T0, details);

        storage.store(original);

        FuseEvent loaded = storage.get("n1");
        assertThat(loaded).isEqualTo(original);
        assertThat(loaded.getNumberDetail("released_bytes")).isEqualTo(5.0);
        assertThat(loaded.getNumberDetail("total_bytes")).isEqualTo(8.0e9);
    }

    @Test
    void queryFiltersByTypeAndReturnsNewestFirst() {
        storage.store(event("a", EventType.FUSE_TRIGGERED, T0, Map.of()));
        storage.store(event("b", EventType.RESOURCE_RELEASED, T0 + 10, Map.of()));
        storage.store(event("c", EventType.FUSE_TRIGGERED, T0 + 20, Map.of()));

        assertThat(storage.query(EventQuery.ofType(EventType.FUSE_TRIGGERED), null, 0))
                .extracting(FuseEvent::getEventId).containsExactly("c", "a");
        assertThat(storage.query(EventQuery.any(), null, 0))
                .extracting(FuseEvent::getEventId).containsExactly("c", "b", "a");
    }

    @Test
    void equalTimestampsKeepLatestWriteFirst() {
        storage.store(event("first", EventType.CUSTOM_EVENT, T0, Map.of()));
        storage.store(event("second", EventType.CUSTOM_EVENT, T0, Map.of()));

        assertThat(storage.query(EventQuery.any(), null, 0))
                .extracting(FuseEvent::getEventId).containsExactly("second", "first");
    }

    @Test
    void queryHonoursTimeRangeAndLimit() {
        for (int i = 0; i < 5; i++) {
            storage.store(event("e" + i, EventType.MEMORY_SNAPSHOT, T0 + i * 1000L, Map.of()));
        }

        assertThat(storage.query(EventQuery.any(), new TimeRange(T0 + 1000, T0 + 3000), 0))
                .extracting(FuseEvent::getEventId).containsExactly("e3", "e2", "e1");
        assertThat(storage.query(EventQuery.any(), TimeRange.since(T0 + 1000), 2))
                .extracting(FuseEvent::getEventId).containsExactly("e4", "e3");
    }

    @Test
    void queryMatchesDetailFields() {
        storage.store(event("x", EventType.VALIDATION_RESULT, T0, Map.of("action", "force_gc", "expected", 150)));
        storage.store(event("y", EventType.VALIDATION_RESULT, T0 + 1, Map.of("action", "clear_cache", "expected", 100)));

        assertThat(storage.query(EventQuery.ofType(EventType.VALIDATION_RESULT).withDetail("action", "force_gc"), null, 0))
                .extracting(FuseEvent::getEventId).containsExactly("x");
        assertThat(storage.query(EventQuery.any().withDetail("expected", 100.0), null, 0))
                .extracting(FuseEvent::getEventId).containsExactly("y");
    }

    @Test
    void referencingEventsAreFound() {
        storage.store(event("trigger", EventType.FUSE_TRIGGERED, T0, Map.of()));
        storage.store(event("done", EventType.FUSE_COMPLETED, T0 + 5, Map.of(), "trigger"));
        storage.store(event("other", EventType.CUSTOM_EVENT, T0 + 6, Map.of()));

        assertThat(storage.findReferencing("trigger")).extracting(FuseEvent::getEventId).containsExactly("done");
        assertThat(storage.findReferencing("other")).isEmpty();
    }
}
