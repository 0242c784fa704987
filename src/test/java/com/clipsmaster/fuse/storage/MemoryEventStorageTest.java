package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.core.EventStorage;
import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.EventType;
import com.clipsmaster.fuse.model.FuseEvent;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryEventStorageTest extends AbstractEventStorageTest {

    @Override
    protected EventStorage open(Path dir) {
        return new MemoryEventStorage();
    }

    @Test
    void oldestEventsAreEvictedBeyondCapacity() {
        MemoryEventStorage small = new MemoryEventStorage(3);
        for (int i = 0; i < 5; i++) {
            small.store(event("e" + i, i % 2 == 0 ? EventType.CUSTOM_EVENT : EventType.MEMORY_SNAPSHOT,
                    T0 + i, Map.of()));
        }

        assertThat(small.size()).isEqualTo(3);
        assertThat(small.get("e0")).isNull();
        assertThat(small.query(EventQuery.ofType(EventType.CUSTOM_EVENT), null, 0))
                .extracting(FuseEvent::getEventId).containsExactly("e4", "e2");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new MemoryEventStorage(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
