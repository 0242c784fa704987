package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.ActionManager;
import com.clipsmaster.fuse.core.ActionOrderingStrategy;
import com.clipsmaster.fuse.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * 熔断控制器：压力级别状态机。
 *
 * 级别只在阈值穿越（或强制触发）时上升，只在恢复检查时下降且每次最多一级。
 * 单次触发的动作在控制器锁内串行执行；回滚在锁外进行。
 * 锁顺序单向：控制器可调用调度、验证、动作、注册表与审计，它们从不回调控制器。
 */
public class FuseController {

    private static final Logger log = LoggerFactory.getLogger(FuseController.class);

    public static final int HISTORY_LIMIT = 100;
    public static final long DEFAULT_STABILIZE_MS = 30_000L;
    public static final double DEFAULT_RECOVERY_THRESHOLD = 70.0;
    public static final long DEFAULT_COOLDOWN_MS = 60_000L;
    private static final double FORCED_PRESSURE = 100.0;

    private final ActionManager actionManager;
    private final EffectValidator validator;
    private final FuseAudit audit;
    private final OriginalSettings originalSettings;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    /** 按阈值升序 */
    private List<FuseLevelConfig> levels;

    // ---- 策略 ----
    private ActionOrderingStrategy orderingStrategy = ActionOrderingStrategy.IDENTITY;
    private RecoveryCoordinator recoveryCoordinator;
    private Executor rollbackExecutor = task -> {
        Thread thread = new Thread(task, "fuse-rollback");
        thread.setDaemon(true);
        thread.start();
    };
    private long stabilizeMs = DEFAULT_STABILIZE_MS;
    private double recoveryThreshold = DEFAULT_RECOVERY_THRESHOLD;
    private long cooldownMs = DEFAULT_COOLDOWN_MS;
    private boolean stepRecovery = true;
    private boolean restoreSettings = true;
    private boolean snapshotOnTrigger = true;
    private boolean rollbackOnNormal = true;
    private boolean runSkippedLevels = false;
    /** 动作效果不达标时的处理策略，null表示只记录 */
    private FailureHandlingStrategy failureStrategy;

    // ---- 状态 ----
    private FuseLevel currentLevel = FuseLevel.NORMAL;
    private final EnumMap<FuseLevel, Long> lastTriggerTimes = new EnumMap<>(FuseLevel.class);
    private final EnumMap<FuseLevel, Set<String>> executedActions = new EnumMap<>(FuseLevel.class);
    /** 压力持续低于恢复阈值的起点，null表示当前不在恢复区 */
    private Long belowRecoverySince;
    private final ArrayDeque<ActionRecord> actionHistory = new ArrayDeque<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread evaluationThread;

    public FuseController(List<FuseLevelConfig> levels, ActionManager actionManager,
                          EffectValidator validator, FuseAudit audit,
                          OriginalSettings originalSettings, Clock clock) {
        FuseLevelConfig.validate(levels);
        this.levels = sortByThreshold(levels);
        this.actionManager = actionManager;
        this.validator = validator;
        this.audit = audit;
        this.originalSettings = originalSettings;
        this.clock = clock;
    }

    // ==================== 评估 ====================

    /**
     * 一次评估：先检查是否需要升级，再检查是否可以恢复。从不抛出异常。
     *
     * @return 评估后的级别
     */
    public FuseLevel evaluate(double pressure) {
        boolean startRollback = false;
        FuseLevel result;
        lock.lock();
        try {
            long now = clock.millis();
            trackRecoveryZone(pressure, now);

            FuseLevelConfig candidate = findCandidate(pressure, now);
            if (candidate != null && candidate.getLevel().isHigherThan(currentLevel)) {
                trigger(candidate, pressure, now);
            }
            if (currentLevel != FuseLevel.NORMAL) {
                startRollback = checkRecovery(pressure, now);
            }
        } catch (RuntimeException e) {
            log.error("Fuse evaluation failed at pressure {}: {}", pressure, e.getMessage(), e);
        } finally {
            result = currentLevel;
            lock.unlock();
        }

        if (startRollback) {
            scheduleRollback();
        }
        return result;
    }

    private void trackRecoveryZone(double pressure, long now) {
        if (pressure <= recoveryThreshold) {
            if (belowRecoverySince == null) {
                belowRecoverySince = now;
            }
        } else {
            belowRecoverySince = null;
        }
    }

    /** 从高到低找第一个阈值已达到且不在稳定期内的级别 */
    private FuseLevelConfig findCandidate(double pressure, long now) {
        for (int i = levels.size() - 1; i >= 0; i--) {
            FuseLevelConfig config = levels.get(i);
            if (pressure >= config.getThreshold() && !inStabilization(config.getLevel(), now)) {
                return config;
            }
        }
        return null;
    }

    private boolean inStabilization(FuseLevel level, long now) {
        Long last = lastTriggerTimes.get(level);
        return last != null && now - last < stabilizeMs;
    }

    // ==================== 触发 ====================

    /** 调用方需持有锁 */
    private void trigger(FuseLevelConfig config, double pressure, long now) {
        FuseLevel previous = currentLevel;
        FuseLevel target = FuseLevel.max(currentLevel, config.getLevel());

        if (previous == FuseLevel.NORMAL && snapshotOnTrigger && recoveryCoordinator != null) {
            try {
                recoveryCoordinator.snapshot();
            } catch (RuntimeException e) {
                log.error("Snapshot before fuse trigger failed: {}", e.getMessage(), e);
            }
        }

        currentLevel = target;
        lastTriggerTimes.put(config.getLevel(), now);

        List<FuseLevelConfig> toRun = new ArrayList<>();
        if (runSkippedLevels) {
            for (FuseLevelConfig lc : levels) {
                if (lc.getLevel().isHigherThan(previous) && lc.getLevel().compareTo(config.getLevel()) < 0) {
                    toRun.add(lc);
                }
            }
        }
        toRun.add(config);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("level", config.getLevel().name());
        details.put("previous_level", previous.name());
        details.put("pressure", pressure);
        details.put("threshold", config.getThreshold());
        details.put("actions", config.getActions());
        String triggerId = audit.record(EventType.FUSE_TRIGGERED, details);

        log.warn("Fuse triggered: {} -> {} at pressure {}%", previous, target, String.format("%.1f", pressure));

        List<String> taken = new ArrayList<>();
        int succeeded = 0;
        for (FuseLevelConfig lc : toRun) {
            succeeded += executeLevelActions(lc, pressure, taken);
        }

        Map<String, Object> completed = new LinkedHashMap<>();
        completed.put("level", config.getLevel().name());
        completed.put("actions_taken", taken);
        completed.put("success_count", succeeded);
        audit.record(EventType.FUSE_COMPLETED, completed, triggerId);
    }

    /**
     * 执行一个级别中本轮尚未执行过的动作。
     *
     * @return 成功执行的动作数
     */
    private int executeLevelActions(FuseLevelConfig config, double pressure, List<String> taken) {
        Set<String> executed = executedActions.computeIfAbsent(config.getLevel(), k -> new HashSet<>());

        List<MitigationAction> known = new ArrayList<>();
        for (String name : config.getActions()) {
            if (executed.contains(name)) continue;
            MitigationAction action = actionManager.getAction(name);
            if (action == null) {
                executed.add(name);
                addHistory(new ActionRecord(name, config.getLevel(), null, clock.millis(), false,
                        "action not registered"));
                log.warn("Configured action '{}' for {} is not registered", name, config.getLevel());
                continue;
            }
            known.add(action);
        }

        int succeeded = 0;
        for (MitigationAction action : orderingStrategy.order(known, pressure)) {
            if (!executed.add(action.getName())) continue;
            if (runAction(action.getName(), config.getLevel())) {
                succeeded++;
            }
            taken.add(action.getName());
        }
        return succeeded;
    }

    private boolean runAction(String name, FuseLevel level) {
        boolean success;
        String error = null;
        try {
            if (validator != null) {
                ValidationResult result = validator.executeAndValidate(name, level);
                success = result.isActionExecuted();
                if (!result.isSuccess() && failureStrategy != null) {
                    RemediationOutcome outcome = validator.handleFailure(name, result, failureStrategy, level);
                    log.info("Failure handling for '{}': {}", name, outcome);
                }
            } else {
                success = actionManager.executeAction(name, level);
            }
            if (!success) {
                error = "action reported failure";
            }
        } catch (RuntimeException e) {
            log.error("Action '{}' raised: {}", name, e.getMessage(), e);
            success = false;
            error = e.getMessage();
        }
        addHistory(new ActionRecord(name, level, null, clock.millis(), success, error));
        return success;
    }

    /**
     * 强制触发指定级别。
     *
     * @param testMode 测试模式只记录历史，不执行动作
     * @return 是否实际触发；稳定期内的重复调用返回false
     */
    public boolean forceTrigger(FuseLevel level, boolean testMode) {
        if (level == null || level == FuseLevel.NORMAL) {
            log.warn("Cannot force trigger level {}", level);
            return false;
        }
        lock.lock();
        try {
            long now = clock.millis();
            if (testMode) {
                addHistory(new ActionRecord("force_trigger_test", level, null, now, true, null));
                audit.record(EventType.CUSTOM_EVENT, Map.of("action", "force_trigger_test", "level", level.name()));
                log.info("Force trigger of {} recorded in test mode", level);
                return true;
            }
            FuseLevelConfig config = configFor(level);
            if (config == null) {
                log.warn("Level {} is not configured, force trigger ignored", level);
                return false;
            }
            if (inStabilization(level, now)) {
                log.info("Level {} is within its stabilization window, force trigger ignored", level);
                return false;
            }
            log.warn("Force triggering {}", level);
            trigger(config, FORCED_PRESSURE, now);
            return true;
        } catch (RuntimeException e) {
            log.error("Force trigger of {} failed: {}", level, e.getMessage(), e);
            return false;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 恢复 ====================

    /**
     * 调用方需持有锁。
     *
     * @return 是否需要在锁外启动回滚
     */
    private boolean checkRecovery(double pressure, long now) {
        if (pressure > recoveryThreshold || belowRecoverySince == null) {
            return false;
        }
        if (now - belowRecoverySince < cooldownMs) {
            return false;
        }
        long lastTrigger = lastTriggerTimes.values().stream().mapToLong(Long::longValue).max().orElse(0L);
        if (now - lastTrigger < cooldownMs) {
            return false;
        }

        FuseLevel previous = currentLevel;
        FuseLevel target = stepRecovery ? previous.stepDown() : FuseLevel.NORMAL;
        currentLevel = target;

        // 一轮熔断在回到NORMAL时结束，此后各级别的动作才允许重新执行
        if (target == FuseLevel.NORMAL) {
            executedActions.clear();
        }
        if (restoreSettings && originalSettings != null) {
            originalSettings.restoreAll();
        }

        addHistory(new ActionRecord("recovery", previous, target, now, true, null));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", previous.name());
        details.put("to", target.name());
        details.put("pressure", pressure);
        details.put("reason", "recovery");
        audit.record(EventType.SYSTEM_STATE_CHANGE, details);
        log.info("Fuse recovered: {} -> {} at pressure {}%", previous, target, String.format("%.1f", pressure));

        return target == FuseLevel.NORMAL && rollbackOnNormal
                && recoveryCoordinator != null && recoveryCoordinator.hasPendingState();
    }

    private void scheduleRollback() {
        RecoveryCoordinator coordinator = recoveryCoordinator;
        try {
            rollbackExecutor.execute(() -> {
                try {
                    coordinator.rollback();
                } catch (RuntimeException e) {
                    log.error("Rollback after recovery failed: {}", e.getMessage(), e);
                }
            });
        } catch (RuntimeException e) {
            log.error("Could not schedule rollback: {}", e.getMessage(), e);
        }
    }

    // ==================== 配置 ====================

    /**
     * 重新登记级别配置。配置不合法时记录错误并退回内置默认配置。
     */
    public void reconfigure(List<FuseLevelConfig> newLevels) {
        List<FuseLevelConfig> accepted;
        try {
            FuseLevelConfig.validate(newLevels);
            accepted = newLevels;
        } catch (IllegalArgumentException e) {
            log.error("Invalid fuse level configuration ({}), falling back to defaults", e.getMessage());
            accepted = FuseLevelConfig.defaults();
        }
        lock.lock();
        try {
            this.levels = sortByThreshold(accepted);
        } finally {
            lock.unlock();
        }
        log.info("Fuse levels configured: {}", accepted);
    }

    private static List<FuseLevelConfig> sortByThreshold(List<FuseLevelConfig> levels) {
        List<FuseLevelConfig> sorted = new ArrayList<>(levels);
        sorted.sort(Comparator.comparingDouble(FuseLevelConfig::getThreshold));
        return Collections.unmodifiableList(sorted);
    }

    private FuseLevelConfig configFor(FuseLevel level) {
        for (FuseLevelConfig config : levels) {
            if (config.getLevel() == level) {
                return config;
            }
        }
        return null;
    }

    public FuseController setOrderingStrategy(ActionOrderingStrategy strategy) {
        this.orderingStrategy = strategy != null ? strategy : ActionOrderingStrategy.IDENTITY;
        return this;
    }

    public FuseController setRecoveryCoordinator(RecoveryCoordinator recoveryCoordinator) {
        this.recoveryCoordinator = recoveryCoordinator;
        return this;
    }

    public FuseController setRollbackExecutor(Executor rollbackExecutor) {
        this.rollbackExecutor = rollbackExecutor;
        return this;
    }

    public FuseController setStabilizeMs(long stabilizeMs) {
        this.stabilizeMs = Math.max(0, stabilizeMs);
        return this;
    }

    public FuseController setRecoveryThreshold(double recoveryThreshold) {
        if (recoveryThreshold < 0 || recoveryThreshold > 100) {
            throw new IllegalArgumentException("Recovery threshold must be within [0,100], got: " + recoveryThreshold);
        }
        this.recoveryThreshold = recoveryThreshold;
        return this;
    }

    public FuseController setCooldownMs(long cooldownMs) {
        this.cooldownMs = Math.max(0, cooldownMs);
        return this;
    }

    public FuseController setStepRecovery(boolean stepRecovery) {
        this.stepRecovery = stepRecovery;
        return this;
    }

    public FuseController setRestoreSettings(boolean restoreSettings) {
        this.restoreSettings = restoreSettings;
        return this;
    }

    public FuseController setSnapshotOnTrigger(boolean snapshotOnTrigger) {
        this.snapshotOnTrigger = snapshotOnTrigger;
        return this;
    }

    public FuseController setRollbackOnNormal(boolean rollbackOnNormal) {
        this.rollbackOnNormal = rollbackOnNormal;
        return this;
    }

    public FuseController setRunSkippedLevels(boolean runSkippedLevels) {
        this.runSkippedLevels = runSkippedLevels;
        return this;
    }

    public FuseController setFailureStrategy(FailureHandlingStrategy failureStrategy) {
        this.failureStrategy = failureStrategy;
        return this;
    }

    // ==================== 评估循环 ====================

    /**
     * 启动后台评估循环，每个周期读取一次压力源。
     */
    public void start(long intervalMs, DoubleSupplier pressureSource) {
        if (!running.compareAndSet(false, true)) {
            log.warn("FuseController is already running, ignoring duplicate start.");
            return;
        }
        evaluationThread = new Thread(() -> evaluationLoop(intervalMs, pressureSource), "fuse-controller");
        evaluationThread.setDaemon(true);
        evaluationThread.start();
        log.info("FuseController started. Interval: {}ms, levels: {}", intervalMs, levels);
    }

    private void evaluationLoop(long intervalMs, DoubleSupplier pressureSource) {
        while (running.get()) {
            long start = System.currentTimeMillis();
            try {
                evaluate(pressureSource.getAsDouble());
            } catch (Exception e) {
                log.error("Error during fuse evaluation", e);
            }

            // 补齐到评估间隔
            long elapsed = System.currentTimeMillis() - start;
            long sleepTime = intervalMs - elapsed;
            if (sleepTime > 0) {
                try {
                    Thread.sleep(sleepTime);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            } else {
                log.warn("Fuse evaluation took {}ms, exceeding interval of {}ms", elapsed, intervalMs);
            }
        }
        log.info("FuseController evaluation loop stopped.");
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (evaluationThread != null) {
            evaluationThread.interrupt();
            try {
                evaluationThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for evaluation thread to finish.");
            }
        }
    }

    // ==================== 状态查询 ====================

    private void addHistory(ActionRecord record) {
        actionHistory.addLast(record);
        while (actionHistory.size() > HISTORY_LIMIT) {
            actionHistory.removeFirst();
        }
    }

    public FuseLevel getCurrentLevel() {
        lock.lock();
        try {
            return currentLevel;
        } finally {
            lock.unlock();
        }
    }

    public List<ActionRecord> getActionHistory() {
        lock.lock();
        try {
            return new ArrayList<>(actionHistory);
        } finally {
            lock.unlock();
        }
    }

    public List<FuseLevelConfig> getLevels() {
        lock.lock();
        try {
            return levels;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() { return running.get(); }
}
