package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.model.*;
import com.clipsmaster.fuse.storage.MemoryEventStorage;
import com.clipsmaster.fuse.support.FakeMemoryProbe;
import com.clipsmaster.fuse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecoveryCoordinatorTest {

    @TempDir
    Path stateDir;

    private MutableClock clock;
    private FakeMemoryProbe probe;
    private FuseAudit audit;
    private DefaultResourceRegistry registry;
    private RecoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        probe = new FakeMemoryProbe(50);
        audit = new FuseAudit(new MemoryEventStorage(), probe, clock);
        registry = new DefaultResourceRegistry(ResourceReaper.withDefaults(clock), audit, clock);
        coordinator = new RecoveryCoordinator(registry, probe, audit, clock, stateDir);
        coordinator.setRecoveryIntervalMs(10);
    }

    @Test
    void snapshotCapturesTypeMetadataAndDependencies() {
        registry.register("model_zh_base", new Object(), Map.of(), null);
        registry.register("processed_clip1", new ArrayList<>(), Map.of("depends_on", List.of("model_zh_base")), null);

        List<ResourceSnapshot> snapshots = coordinator.snapshot();

        assertThat(snapshots).extracting(ResourceSnapshot::getResourceId)
                .containsExactly("model_zh_base", "processed_clip1");
        ResourceSnapshot model = snapshots.get(0);
        assertThat(model.getResourceType()).isEqualTo("model");
        assertThat(model.getMetadata()).containsEntry("language", "zh");
        assertThat(snapshots.get(1).getDependencyIds()).containsExactly("clip1", "model_zh_base");
        assertThat(coordinator.hasPendingState()).isTrue();
    }

    @Test
    void rollbackRestoresInReverseRegistrationOrder() {
        registry.register("render_cache:a", new ArrayList<>(), Map.of("size_mb", 4), null);
        registry.register("render_cache:b", new ArrayList<>(), Map.of(), null);
        registry.register("render_cache:c", new ArrayList<>(), Map.of(), null);
        coordinator.snapshot();
        registry.releaseAll(h -> true);
        assertThat(registry.listHandles()).isEmpty();

        List<String> order = new ArrayList<>();
        coordinator.registerRestorer("render_cache", snapshot -> {
            order.add(snapshot.getResourceId());
            return new ArrayList<>();
        });

        RollbackReport report = coordinator.rollback();

        assertThat(order).containsExactly("render_cache:c", "render_cache:b", "render_cache:a");
        assertThat(report.getRestoredIds()).containsExactly("render_cache:c", "render_cache:b", "render_cache:a");
        assertThat(report.isSuccess()).isTrue();
        assertThat(registry.contains("render_cache:a")).isTrue();
        assertThat(registry.listHandles().get(2).getMetadata()).containsEntry("size_mb", 4);
        assertThat(coordinator.hasPendingState()).isFalse();
    }

    @Test
    void missingRestorerIsReportedAsFailureAndKeptForRetry() {
        registry.register("render_cache:a", new ArrayList<>(), Map.of(), null);
        registry.register("audio_cache:b", new ArrayList<>(), Map.of(), null);
        coordinator.snapshot();
        coordinator.registerRestorer("render_cache", snapshot -> new ArrayList<>());

        RollbackReport report = coordinator.rollback();

        assertThat(report.getFailedIds()).containsExactly("audio_cache:b");
        assertThat(report.getRestoredIds()).containsExactly("render_cache:a");
        assertThat(report.getSuccessRate()).isEqualTo(0.5);
        assertThat(report.isSuccess()).isFalse();
        assertThat(coordinator.getSnapshots()).extracting(ResourceSnapshot::getResourceId)
                .containsExactly("audio_cache:b");
    }

    @Test
    void restorerReturningNothingCountsAsFailure() {
        registry.register("render_cache:a", new ArrayList<>(), Map.of(), null);
        coordinator.snapshot();
        coordinator.registerRestorer("render_cache", snapshot -> null);

        assertThat(coordinator.rollback().getFailedIds()).containsExactly("render_cache:a");
    }

    @Test
    void rollbackWithoutSnapshotDoesNotStart() {
        RollbackReport report = coordinator.rollback();

        assertThat(report.isStarted()).isFalse();
        assertThat(report.isSuccess()).isFalse();
        assertThat(coordinator.getRecoveryStats()).containsEntry("total_rollbacks", 0);
    }

    @Test
    void rollbackIsAuditedAsLinkedEvents() {
        registry.register("render_cache:a", new ArrayList<>(), Map.of(), null);
        coordinator.snapshot();
        coordinator.registerRestorer("render_cache", snapshot -> new ArrayList<>());

        coordinator.rollback();

        FuseEvent started = audit.query(EventQuery.ofType(EventType.RECOVERY_STARTED)).get(0);
        FuseEvent completed = audit.query(EventQuery.ofType(EventType.RECOVERY_COMPLETED)).get(0);
        assertThat(completed.getRelatedIds()).containsExactly(started.getEventId());
        assertThat(completed.getDetails()).containsEntry("restored", 1).containsEntry("success", true);
        assertThat(coordinator.getRecoveryStats())
                .containsEntry("total_rollbacks", 1)
                .containsEntry("successful_rollbacks", 1)
                .containsEntry("total_restored", 1);
    }

    @Test
    void snapshotSurvivesRestartThroughLatestFile() {
        registry.register("render_cache:a", new ArrayList<>(), Map.of("size_mb", 8), null);
        registry.register("subtitle_index:ep1", new ArrayList<>(), Map.of(), null);
        List<ResourceSnapshot> taken = coordinator.snapshot();

        assertThat(Files.exists(stateDir.resolve("state_latest.json"))).isTrue();

        RecoveryCoordinator restarted = new RecoveryCoordinator(registry, probe, audit, clock, stateDir);
        assertThat(restarted.loadLatest()).isEqualTo(2);
        assertThat(restarted.getSnapshots()).containsExactlyElementsOf(taken);
    }

    @Test
    void inMemoryCoordinatorLoadsNothing() {
        RecoveryCoordinator volatileCoordinator = new RecoveryCoordinator(registry, probe, audit, clock, null);
        registry.register("render_cache:a", new ArrayList<>(), Map.of(), null);
        volatileCoordinator.snapshot();

        assertThat(volatileCoordinator.loadLatest()).isZero();
        assertThat(volatileCoordinator.hasPendingState()).isTrue();
    }

    @Test
    void settersClampToSaneRanges() {
        coordinator.setRecoveryIntervalMs(1);
        coordinator.setMemoryThreshold(99);
        assertThat(coordinator.getRecoveryIntervalMs()).isEqualTo(10);
        assertThat(coordinator.getMemoryThreshold()).isEqualTo(95.0);
    }
}
