package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.FuseConfig;
import com.clipsmaster.fuse.diagnosis.DiagnosisResult;
import com.clipsmaster.fuse.model.*;
import com.clipsmaster.fuse.storage.MemoryEventStorage;
import com.clipsmaster.fuse.support.FakeMemoryProbe;
import com.clipsmaster.fuse.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultFuseContextTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private FakeMemoryProbe probe;
    private DefaultFuseContext fuse;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.setProperty("fuse.level.WARNING.actions", "release_resources");
        props.setProperty("fuse.level.CRITICAL.actions", "clear_cache");
        props.setProperty("validator.settle_ms", "0");
        props.setProperty("recovery.directory", dir.resolve("recovery").toString());
        props.setProperty("detection.sample_interval_seconds", "1");
        props.setProperty("detection.check_interval_seconds", "1");

        clock = new MutableClock();
        probe = new FakeMemoryProbe(50.0);
        fuse = DefaultFuseContext.create(FuseConfig.fromProperties(props), probe, new MemoryEventStorage(), clock);
    }

    @AfterEach
    void tearDown() {
        fuse.shutdown();
    }

    @Test
    void forcedTriggerRunsConfiguredActions() {
        List<String> scratch = new ArrayList<>(List.of("a", "b"));
        fuse.registerResource("temp_buffers:scratch", scratch, Map.of("size_mb", 32), null);
        fuse.registerResource("render_cache:frame_1", new ArrayList<>(List.of("frame")), Map.of("size_mb", 64), null);

        assertThat(fuse.forceTrigger(FuseLevel.WARNING, false)).isTrue();

        assertThat(fuse.getCurrentLevel()).isEqualTo(FuseLevel.WARNING);
        assertThat(scratch).isEmpty();
        assertThat(fuse.getRegistry().contains("temp_buffers:scratch")).isFalse();
        assertThat(fuse.getRegistry().contains("render_cache:frame_1")).isTrue();
        assertThat(fuse.getActionHistory()).extracting(ActionRecord::getAction).containsExactly("release_resources");
        assertThat(fuse.getActionHistory().get(0).isSuccess()).isTrue();

        List<FuseEvent> triggered = fuse.queryEvents(EventQuery.ofType(EventType.FUSE_TRIGGERED), TimeRange.all(), 10);
        assertThat(triggered).hasSize(1);
        assertThat(triggered.get(0).getDetails()).containsEntry("level", "WARNING");
        assertThat(fuse.queryEvents(EventQuery.ofType(EventType.RESOURCE_RELEASED), TimeRange.all(), 10)).hasSize(1);

        // 稳定期内再次强制触发被忽略
        assertThat(fuse.forceTrigger(FuseLevel.WARNING, false)).isFalse();
    }

    @Test
    void testModeOnlyRecords() {
        fuse.registerResource("temp_buffers:scratch", new ArrayList<>(), Map.of(), null);

        assertThat(fuse.forceTrigger(FuseLevel.CRITICAL, true)).isTrue();

        assertThat(fuse.getCurrentLevel()).isEqualTo(FuseLevel.NORMAL);
        assertThat(fuse.getRegistry().contains("temp_buffers:scratch")).isTrue();
        assertThat(fuse.getActionHistory()).extracting(ActionRecord::getAction).containsExactly("force_trigger_test");
        assertThat(fuse.forceTrigger(FuseLevel.NORMAL, false)).isFalse();
    }

    @Test
    void resourcesCanBeReleasedDirectly() {
        List<String> weights = new ArrayList<>(List.of("w"));
        fuse.registerResource("model_shards:zh_1", weights, Map.of("size_mb", 512), null);

        assertThat(fuse.releaseResource("model_shards:zh_1")).isTrue();
        assertThat(weights).isEmpty();
        assertThat(fuse.releaseResource("model_shards:zh_1")).isFalse();
        assertThat(fuse.releaseResource("never_registered")).isFalse();
    }

    @Test
    void recordedEventsAreQueryable() {
        String first = fuse.recordEvent("export_started", Map.of("project", "demo"), null);
        clock.advanceSeconds(1);
        String second = fuse.recordEvent("export_finished", Map.of("project", "demo"), first);

        assertThat(first).isNotEmpty();
        List<FuseEvent> found = fuse.queryEvents(EventQuery.any().withDetail("project", "demo"), TimeRange.all(), 10);
        assertThat(found).extracting(FuseEvent::getEventId).containsExactly(second, first);
        assertThat(found.get(0).getRelatedIds()).contains(first);
    }

    @Test
    void diagnosisIsAudited() {
        DiagnosisResult result = fuse.diagnose(List.of(30.0, 35.0, 42.0, 55.0, 70.0, 82.0, 95.0), null);

        assertThat(result.getMatchedCase()).isEqualTo("OOM_001");
        List<FuseEvent> events = fuse.queryEvents(EventQuery.ofType(EventType.CUSTOM_EVENT), TimeRange.all(), 10);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).getDetails())
                .containsEntry("matched_case", "OOM_001")
                .containsEntry("pattern", "rapid_increase");
    }

    @Test
    void casesRoundTripThroughContext() {
        Path file = dir.resolve("cases.json");
        assertThat(fuse.exportCases(file)).isTrue();
        assertThat(fuse.importCases(file)).isEqualTo(10);
        assertThat(fuse.importCases(dir.resolve("missing.json"))).isEqualTo(-1);
    }

    @Test
    void startAndShutdownManageBackgroundLoops() {
        fuse.start();
        assertThat(fuse.isRunning()).isTrue();
        assertThat(fuse.getMonitor().isRunning()).isTrue();
        assertThat(fuse.queryEvents(EventQuery.ofType(EventType.SYSTEM_STATE_CHANGE), TimeRange.all(), 10))
                .extracting(e -> e.getDetails().get("state"))
                .contains("started");

        fuse.start();
        fuse.shutdown();

        assertThat(fuse.isRunning()).isFalse();
        assertThat(fuse.getMonitor().isRunning()).isFalse();
    }
}
