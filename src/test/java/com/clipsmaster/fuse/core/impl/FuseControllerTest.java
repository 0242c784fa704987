package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.model.*;
import com.clipsmaster.fuse.storage.MemoryEventStorage;
import com.clipsmaster.fuse.support.FakeMemoryProbe;
import com.clipsmaster.fuse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FuseControllerTest {

    private MutableClock clock;
    private FakeMemoryProbe probe;
    private FuseAudit audit;
    private DefaultResourceRegistry registry;
    private OriginalSettings originalSettings;
    private DefaultActionManager actionManager;
    private final Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        probe = new FakeMemoryProbe(50);
        audit = new FuseAudit(new MemoryEventStorage(), probe, clock);
        registry = new DefaultResourceRegistry(ResourceReaper.withDefaults(clock), audit, clock);
        originalSettings = new OriginalSettings();
        actionManager = new DefaultActionManager(registry, originalSettings, Map.of());
        for (String name : List.of("warn_action", "critical_action", "emergency_action")) {
            registerCounting(name);
        }
    }

    private void registerCounting(String name) {
        runs.put(name, new AtomicInteger());
        actionManager.registerAction(MitigationAction.builder(name).build(), ctx -> {
            runs.get(name).incrementAndGet();
            return true;
        });
    }

    private List<FuseLevelConfig> levels(String... warningActions) {
        List<String> warning = warningActions.length > 0 ? List.of(warningActions) : List.of("warn_action");
        return List.of(
                new FuseLevelConfig(FuseLevel.WARNING, 70, warning),
                new FuseLevelConfig(FuseLevel.CRITICAL, 85, List.of("critical_action")),
                new FuseLevelConfig(FuseLevel.EMERGENCY, 95, List.of("emergency_action")));
    }

    private FuseController controller(List<FuseLevelConfig> levels) {
        return new FuseController(levels, actionManager, null, audit, originalSettings, clock)
                .setCooldownMs(10_000)
                .setRollbackExecutor(Runnable::run);
    }

    private int runsOf(String name) {
        return runs.get(name).get();
    }

    private List<String> historyActions(FuseController controller) {
        List<String> names = new ArrayList<>();
        controller.getActionHistory().forEach(r -> names.add(r.getAction()));
        return names;
    }

    // ==================== 升级 ====================

    @Test
    void risingPressureWalksUpEveryLevel() {
        FuseController controller = controller(levels());
        List<FuseLevel> seen = new ArrayList<>();

        for (double pressure : new double[]{60, 75, 90, 97}) {
            seen.add(controller.evaluate(pressure));
            clock.advanceSeconds(1);
        }

        assertThat(seen).containsExactly(FuseLevel.NORMAL, FuseLevel.WARNING, FuseLevel.CRITICAL, FuseLevel.EMERGENCY);
        assertThat(historyActions(controller)).containsExactly("warn_action", "critical_action", "emergency_action");
        assertThat(controller.getActionHistory()).allMatch(ActionRecord::isSuccess);
    }

    @Test
    void triggerIsAuditedWithCompletionLinkedToIt() {
        FuseController controller = controller(levels());

        controller.evaluate(88);

        List<FuseEvent> triggered = audit.query(EventQuery.ofType(EventType.FUSE_TRIGGERED));
        assertThat(triggered).singleElement().satisfies(e -> assertThat(e.getDetails())
                .containsEntry("level", "CRITICAL")
                .containsEntry("previous_level", "NORMAL")
                .containsEntry("threshold", 85.0));
        FuseEvent completed = audit.query(EventQuery.ofType(EventType.FUSE_COMPLETED)).get(0);
        assertThat(completed.getRelatedIds()).containsExactly(triggered.get(0).getEventId());
        assertThat(completed.getDetails()).containsEntry("success_count", 1);
    }

    @Test
    void jumpingLevelsRunsOnlyTheReachedLevelByDefault() {
        FuseController controller = controller(levels());

        assertThat(controller.evaluate(97)).isEqualTo(FuseLevel.EMERGENCY);

        assertThat(runsOf("warn_action")).isZero();
        assertThat(runsOf("critical_action")).isZero();
        assertThat(runsOf("emergency_action")).isEqualTo(1);
    }

    @Test
    void skippedLevelsRunWhenEnabled() {
        FuseController controller = controller(levels()).setRunSkippedLevels(true);

        controller.evaluate(97);

        assertThat(historyActions(controller)).containsExactly("warn_action", "critical_action", "emergency_action");
    }

    @Test
    void actionsRunOncePerEpisode() {
        FuseController controller = controller(levels());

        controller.evaluate(75);
        clock.advanceSeconds(1);
        controller.evaluate(80);
        clock.advanceSeconds(1);
        controller.evaluate(76);

        assertThat(runsOf("warn_action")).isEqualTo(1);
    }

    @Test
    void unregisteredActionIsRecordedAsFailure() {
        FuseController controller = controller(levels("warn_action", "missing_action"));

        controller.evaluate(72);

        assertThat(controller.getActionHistory()).filteredOn(r -> r.getAction().equals("missing_action"))
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.isSuccess()).isFalse();
                    assertThat(r.getError()).isEqualTo("action not registered");
                });
        assertThat(runsOf("warn_action")).isEqualTo(1);
    }

    @Test
    void orderingStrategyDecidesExecutionOrder() {
        registerCounting("second");
        FuseController controller = controller(levels("warn_action", "second"))
                .setOrderingStrategy((actions, pressure) -> {
                    List<MitigationAction> reversed = new ArrayList<>(actions);
                    Collections.reverse(reversed);
                    return reversed;
                });

        controller.evaluate(72);

        assertThat(historyActions(controller)).containsExactly("second", "warn_action");
    }

    @Test
    void failingActionDoesNotStopTheRest() {
        actionManager.registerAction(MitigationAction.builder("broken").build(), ctx -> {
            throw new IllegalStateException("nope");
        });
        FuseController controller = controller(levels("broken", "warn_action"));

        assertThat(controller.evaluate(72)).isEqualTo(FuseLevel.WARNING);

        assertThat(runsOf("warn_action")).isEqualTo(1);
        assertThat(controller.getActionHistory().get(0).isSuccess()).isFalse();
    }

    // ==================== 强制触发 ====================

    @Test
    void forceTriggerRunsActionsOnceWithinStabilization() {
        FuseController controller = controller(levels());

        assertThat(controller.forceTrigger(FuseLevel.CRITICAL, false)).isTrue();
        assertThat(controller.getCurrentLevel()).isEqualTo(FuseLevel.CRITICAL);
        assertThat(runsOf("critical_action")).isEqualTo(1);

        clock.advanceSeconds(5);
        assertThat(controller.forceTrigger(FuseLevel.CRITICAL, false)).isFalse();
        assertThat(runsOf("critical_action")).isEqualTo(1);
    }

    @Test
    void forceTriggerInTestModeOnlyRecords() {
        FuseController controller = controller(levels());

        assertThat(controller.forceTrigger(FuseLevel.EMERGENCY, true)).isTrue();

        assertThat(controller.getCurrentLevel()).isEqualTo(FuseLevel.NORMAL);
        assertThat(runsOf("emergency_action")).isZero();
        assertThat(historyActions(controller)).containsExactly("force_trigger_test");
    }

    @Test
    void forceTriggerRejectsNormalAndUnconfiguredLevels() {
        FuseController controller = controller(List.of(
                new FuseLevelConfig(FuseLevel.WARNING, 70, List.of("warn_action"))));

        assertThat(controller.forceTrigger(FuseLevel.NORMAL, false)).isFalse();
        assertThat(controller.forceTrigger(null, false)).isFalse();
        assertThat(controller.forceTrigger(FuseLevel.EMERGENCY, false)).isFalse();
        assertThat(controller.getCurrentLevel()).isEqualTo(FuseLevel.NORMAL);
    }

    // ==================== 恢复 ====================

    @Test
    void recoveryStepsDownOneLevelPerEvaluation() {
        FuseController controller = controller(levels());
        controller.evaluate(97);

        clock.advanceSeconds(1);
        assertThat(controller.evaluate(50)).isEqualTo(FuseLevel.EMERGENCY);

        clock.advanceSeconds(10);
        List<FuseLevel> seen = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            seen.add(controller.evaluate(50));
        }

        assertThat(seen).containsExactly(FuseLevel.CRITICAL, FuseLevel.WARNING, FuseLevel.NORMAL, FuseLevel.NORMAL);
        List<ActionRecord> recoveries = new ArrayList<>(controller.getActionHistory());
        recoveries.removeIf(r -> !r.getAction().equals("recovery"));
        assertThat(recoveries).extracting(ActionRecord::getTargetLevel)
                .containsExactly(FuseLevel.CRITICAL, FuseLevel.WARNING, FuseLevel.NORMAL);
        assertThat(audit.query(EventQuery.ofType(EventType.SYSTEM_STATE_CHANGE))).hasSize(3);
    }

    @Test
    void noRecoveryWhilePressureStaysHigh() {
        FuseController controller = controller(levels());
        controller.evaluate(90);

        for (int i = 0; i < 5; i++) {
            clock.advanceSeconds(30);
            assertThat(controller.evaluate(80)).isEqualTo(FuseLevel.CRITICAL);
        }
    }

    @Test
    void spikeAboveRecoveryThresholdRestartsCooldown() {
        FuseController controller = controller(levels());
        controller.evaluate(90);
        clock.advanceSeconds(20);

        controller.evaluate(60);
        clock.advanceSeconds(6);
        controller.evaluate(75);
        clock.advanceSeconds(6);

        assertThat(controller.evaluate(60)).isEqualTo(FuseLevel.CRITICAL);
        clock.advanceSeconds(10);
        assertThat(controller.evaluate(60)).isEqualTo(FuseLevel.WARNING);
    }

    @Test
    void directRecoveryGoesStraightToNormal() {
        FuseController controller = controller(levels()).setStepRecovery(false);
        controller.evaluate(97);
        controller.evaluate(40);
        clock.advanceSeconds(10);

        assertThat(controller.evaluate(40)).isEqualTo(FuseLevel.NORMAL);
    }

    @Test
    void levelIsReTriggeredOnlyAfterStabilization() {
        FuseController controller = controller(levels());
        controller.evaluate(75);
        controller.evaluate(50);
        clock.advanceSeconds(10);
        assertThat(controller.evaluate(50)).isEqualTo(FuseLevel.NORMAL);

        assertThat(controller.evaluate(75)).isEqualTo(FuseLevel.NORMAL);

        clock.advanceSeconds(30);
        assertThat(controller.evaluate(75)).isEqualTo(FuseLevel.WARNING);
        assertThat(runsOf("warn_action")).isEqualTo(2);
    }

    @Test
    void modifiedSettingsAreRestoredAtNormal() {
        AtomicBoolean restored = new AtomicBoolean(false);
        actionManager.registerAction(MitigationAction.builder("tweak").build(), ctx -> {
            ctx.saveOriginalSetting("tweak", () -> restored.set(true));
            return true;
        });
        FuseController controller = controller(levels("tweak"));
        controller.evaluate(75);
        controller.evaluate(50);
        clock.advanceSeconds(10);

        controller.evaluate(50);

        assertThat(restored).isTrue();
        assertThat(originalSettings.size()).isZero();
    }

    @Test
    void settingsAreRestoredOnEachStepDown() {
        AtomicInteger restores = new AtomicInteger();
        actionManager.registerAction(MitigationAction.builder("tweak").build(), ctx -> {
            ctx.saveOriginalSetting("tweak", restores::incrementAndGet);
            return true;
        });
        FuseController controller = controller(List.of(
                new FuseLevelConfig(FuseLevel.WARNING, 70, List.of("warn_action")),
                new FuseLevelConfig(FuseLevel.CRITICAL, 85, List.of("tweak"))));
        controller.evaluate(90);
        controller.evaluate(50);
        clock.advanceSeconds(10);

        assertThat(controller.evaluate(50)).isEqualTo(FuseLevel.WARNING);
        assertThat(restores.get()).isEqualTo(1);
        assertThat(originalSettings.size()).isZero();
    }

    @Test
    void reEscalationWithinEpisodeDoesNotRepeatActions() {
        FuseController controller = controller(levels());
        controller.evaluate(90);
        controller.evaluate(50);
        clock.advanceSeconds(11);
        assertThat(controller.evaluate(50)).isEqualTo(FuseLevel.WARNING);

        clock.advanceSeconds(30);
        assertThat(controller.evaluate(90)).isEqualTo(FuseLevel.CRITICAL);

        assertThat(runsOf("critical_action")).isEqualTo(1);
    }

    @Test
    void actionsRunAgainAfterEpisodeEndsAtNormal() {
        FuseController controller = controller(levels());
        controller.evaluate(90);
        controller.evaluate(50);
        clock.advanceSeconds(11);
        controller.evaluate(50);
        assertThat(controller.evaluate(50)).isEqualTo(FuseLevel.NORMAL);

        clock.advanceSeconds(30);
        assertThat(controller.evaluate(90)).isEqualTo(FuseLevel.CRITICAL);

        assertThat(runsOf("critical_action")).isEqualTo(2);
    }

    @Test
    void resourcesAreRolledBackAfterFullRecovery() {
        registry.register("render_cache:scene", new ArrayList<>(), Map.of(), null);
        actionManager.registerAction(MitigationAction.builder("drop_cache").build(),
                ctx -> ctx.getResourceRegistry().release("render_cache:scene"));
        RecoveryCoordinator coordinator = new RecoveryCoordinator(registry, probe, audit, clock, null);
        coordinator.registerRestorer("render_cache", snapshot -> new ArrayList<>());
        FuseController controller = controller(levels("drop_cache")).setRecoveryCoordinator(coordinator);

        controller.evaluate(75);
        assertThat(registry.contains("render_cache:scene")).isFalse();

        controller.evaluate(50);
        clock.advanceSeconds(10);
        controller.evaluate(50);

        assertThat(registry.contains("render_cache:scene")).isTrue();
        assertThat(coordinator.hasPendingState()).isFalse();
    }

    // ==================== 配置 ====================

    @Test
    void invalidReconfigurationFallsBackToDefaults() {
        FuseController controller = controller(levels());

        controller.reconfigure(List.of(
                new FuseLevelConfig(FuseLevel.WARNING, 90, List.of()),
                new FuseLevelConfig(FuseLevel.CRITICAL, 80, List.of())));

        assertThat(controller.getLevels()).extracting(FuseLevelConfig::getThreshold)
                .containsExactly(85.0, 95.0, 98.0);
    }

    @Test
    void levelsAreKeptSortedByThreshold() {
        FuseController controller = controller(List.of(
                new FuseLevelConfig(FuseLevel.WARNING, 70, List.of()),
                new FuseLevelConfig(FuseLevel.EMERGENCY, 95, List.of()),
                new FuseLevelConfig(FuseLevel.CRITICAL, 85, List.of())));

        assertThat(controller.getLevels()).extracting(FuseLevelConfig::getLevel)
                .containsExactly(FuseLevel.WARNING, FuseLevel.CRITICAL, FuseLevel.EMERGENCY);
    }

    @Test
    void rejectsRecoveryThresholdOutOfRange() {
        FuseController controller = controller(levels());
        assertThatThrownBy(() -> controller.setRecoveryThreshold(120))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void historyIsCapped() {
        FuseController controller = controller(levels()).setStabilizeMs(0).setCooldownMs(0);
        for (int i = 0; i < 80; i++) {
            controller.evaluate(75);
            controller.evaluate(10);
        }
        assertThat(controller.getActionHistory()).hasSize(FuseController.HISTORY_LIMIT);
    }
}
