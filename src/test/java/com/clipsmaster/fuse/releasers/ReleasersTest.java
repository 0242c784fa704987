package com.clipsmaster.fuse.releasers;

import com.clipsmaster.fuse.model.ReleaseResult;
import com.clipsmaster.fuse.model.ResourceHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ReleasersTest {

    @TempDir
    Path dir;

    private static ResourceHandle handle(String id, Object resource, Map<String, Object> metadata) {
        return new ResourceHandle(id, resource, metadata, null, 0L);
    }

    @Test
    void genericReleaserClearsContainersAndClosesCloseables() throws Exception {
        Map<String, Object> cache = new HashMap<>(Map.of("k", "v"));
        ResourceHandle mapHandle = handle("audio_cache:a", cache, Map.of());

        assertThat(new GenericReleaser().release(mapHandle)).isEqualTo(ReleaseResult.RELEASED);
        assertThat(cache).isEmpty();
        assertThat(mapHandle.getResource()).isNull();

        AtomicInteger closed = new AtomicInteger();
        AutoCloseable closeable = closed::incrementAndGet;
        new GenericReleaser().release(handle("temp_buffers:b", closeable, Map.of()));
        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void genericReleaserToleratesImmutableContainers() throws Exception {
        ResourceHandle immutable = handle("audio_cache:c", List.of(1, 2, 3), Map.of());

        assertThat(new GenericReleaser().release(immutable)).isEqualTo(ReleaseResult.RELEASED);
        assertThat(immutable.getResource()).isNull();
    }

    @Test
    void modelWeightsReleaserClosesModelAndTokenizer() throws Exception {
        AtomicInteger closed = new AtomicInteger();
        Map<String, Object> weights = new HashMap<>();
        weights.put("model", (AutoCloseable) closed::incrementAndGet);
        weights.put("tokenizer", (AutoCloseable) closed::incrementAndGet);
        weights.put("vocab", "unchanged");

        new ModelWeightsReleaser().release(handle("model_weights_cache:zh", weights, Map.of()));

        assertThat(closed.get()).isEqualTo(2);
        assertThat(weights).isEmpty();
    }

    @Test
    void renderCacheIsPersistedBeforeRelease() throws Exception {
        Path target = dir.resolve("spill").resolve("frame.bin");
        byte[] frame = {1, 2, 3, 4};
        ResourceHandle cache = handle("render_cache:f1", frame,
                Map.of("persist_to_disk", true, "persist_path", target.toString()));

        assertThat(new RenderCacheReleaser().release(cache)).isEqualTo(ReleaseResult.RELEASED);

        assertThat(Files.readAllBytes(target)).containsExactly(1, 2, 3, 4);
        assertThat(cache.getResource()).isNull();
    }

    @Test
    void renderCacheWithoutPersistenceIsJustReleased() throws Exception {
        List<String> frames = new ArrayList<>(List.of("a"));
        assertThat(new RenderCacheReleaser().release(handle("render_cache:f2", frames, Map.of())))
                .isEqualTo(ReleaseResult.RELEASED);
        assertThat(frames).isEmpty();
    }

    @Test
    void subtitleIndexTrimsIncrementallyToDefaultKeep() throws Exception {
        List<Integer> segments = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            segments.add(i);
        }
        Map<String, Object> index = new HashMap<>();
        index.put("segments", segments);
        ResourceHandle handle = handle("subtitle_index:ep2", index, Map.of("incremental_release", true));

        assertThat(new SubtitleIndexReleaser().release(handle)).isEqualTo(ReleaseResult.PARTIAL);

        assertThat(segments).hasSize(SubtitleIndexReleaser.DEFAULT_KEEP_SEGMENTS).startsWith(15).endsWith(24);
        assertThat(handle.getResource()).isSameAs(index);
    }

    @Test
    void smallSubtitleIndexIsReleasedWhole() throws Exception {
        List<Integer> segments = new ArrayList<>(List.of(1, 2, 3));
        ResourceHandle handle = handle("subtitle_index:ep3", segments, Map.of("incremental_release", true));

        assertThat(new SubtitleIndexReleaser().release(handle)).isEqualTo(ReleaseResult.RELEASED);
        assertThat(segments).isEmpty();
    }
}
