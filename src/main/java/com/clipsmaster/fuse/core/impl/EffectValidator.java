package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.ActionManager;
import com.clipsmaster.fuse.core.MemoryProbe;
import com.clipsmaster.fuse.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 动作效果验证器。
 *
 * 测量动作执行前后的进程内存，判断是否达到目录中的预期释放量与时限；
 * 不达标时按策略重试、升级、告警、改用备选或组合执行。
 */
public class EffectValidator {

    private static final Logger log = LoggerFactory.getLogger(EffectValidator.class);

    public static final long DEFAULT_SETTLE_MS = 200L;
    public static final int DEFAULT_HISTORY_SIZE = 100;
    public static final int MEMORY_RECORD_LIMIT = 30;

    public static final List<String> DEFAULT_FALLBACK = List.of("force_gc", "release_resources");
    public static final List<String> DEFAULT_COMBINATION = List.of("force_gc", "clear_cache", "release_resources");

    private final ActionManager actionManager;
    private final MemoryProbe probe;
    private final FuseAudit audit;
    private final Clock clock;

    private long settleMs = DEFAULT_SETTLE_MS;
    private int historySize = DEFAULT_HISTORY_SIZE;
    /** RETRY在第二次及以后重试前执行的回收操作 */
    private Runnable gcPass = System::gc;

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<ValidationResult> history = new ArrayDeque<>();
    private final List<Consumer<ValidationResult>> callbacks = new CopyOnWriteArrayList<>();

    // ---- 内存记录 ----
    private final ArrayDeque<double[]> memoryRecords = new ArrayDeque<>();
    private final AtomicBoolean recording = new AtomicBoolean(false);
    private Thread recorderThread;

    public EffectValidator(ActionManager actionManager, MemoryProbe probe, FuseAudit audit, Clock clock) {
        this.actionManager = actionManager;
        this.probe = probe;
        this.audit = audit;
        this.clock = clock;
    }

    public EffectValidator setSettleMs(long settleMs) {
        this.settleMs = Math.max(0, settleMs);
        return this;
    }

    public EffectValidator setHistorySize(int historySize) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("History size must be positive, got: " + historySize);
        }
        this.historySize = historySize;
        return this;
    }

    public EffectValidator setGcPass(Runnable gcPass) {
        this.gcPass = gcPass;
        return this;
    }

    // ==================== 执行与验证 ====================

    /**
     * 执行动作并验证效果。从不抛出异常。
     */
    public ValidationResult executeAndValidate(String actionName, FuseLevel level) {
        MitigationAction action = actionManager.getAction(actionName);
        Double before = readProcessUsedMb(actionName);

        if (action == null) {
            log.warn("Cannot validate unknown action '{}'", actionName);
            double known = before != null ? before : 0.0;
            return new ValidationResult(actionName, known, known, 0.0, 0.0, false, false, clock.millis());
        }

        long start = System.nanoTime();
        boolean executed;
        try {
            executed = actionManager.executeAction(actionName, level);
        } catch (RuntimeException e) {
            log.error("Action '{}' raised during validation: {}", actionName, e.getMessage(), e);
            executed = false;
        }
        double executionSeconds = (System.nanoTime() - start) / 1_000_000_000.0;

        settle();
        Double after = readProcessUsedMb(actionName);
        ValidationResult result;
        if (before == null || after == null) {
            // 读数缺失时无法判断效果，按不达标处理
            result = new ValidationResult(actionName, 0.0, 0.0, action.getExpectedReductionMb(),
                    executionSeconds, false, executed, clock.millis());
            record(result);
            return result;
        }
        double reduction = before - after;
        boolean success = reduction >= action.getExpectedReductionMb()
                && executionSeconds <= action.getMaxExecutionSeconds();

        result = new ValidationResult(actionName, before, after,
                action.getExpectedReductionMb(), executionSeconds, success, executed, clock.millis());
        if (!executed) {
            log.debug("Action '{}' reported no effect; measured reduction {}MB", actionName, reduction);
        }
        record(result);
        return result;
    }

    private Double readProcessUsedMb(String actionName) {
        try {
            return probe.getProcessUsedMb();
        } catch (RuntimeException e) {
            log.error("Memory reading for validation of '{}' failed: {}", actionName, e.getMessage(), e);
            return null;
        }
    }

    private void settle() {
        if (settleMs <= 0) return;
        try {
            Thread.sleep(settleMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void record(ValidationResult result) {
        lock.lock();
        try {
            history.addLast(result);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        } finally {
            lock.unlock();
        }

        log.info("Validation of '{}': reduced {}MB of expected {}MB in {}s -> {}",
                result.getAction(),
                String.format("%.1f", result.getReductionMb()),
                String.format("%.1f", result.getExpectedReductionMb()),
                String.format("%.3f", result.getExecutionTimeSeconds()),
                result.isSuccess() ? "PASS" : "FAIL");

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", result.getAction());
        details.put("memory_before", result.getMemoryBeforeMb());
        details.put("memory_after", result.getMemoryAfterMb());
        details.put("reduction", result.getReductionMb());
        details.put("expected", result.getExpectedReductionMb());
        details.put("execution_time", result.getExecutionTimeSeconds());
        details.put("success", result.isSuccess());
        audit.record(EventType.VALIDATION_RESULT, details);

        for (Consumer<ValidationResult> callback : callbacks) {
            try {
                callback.accept(result);
            } catch (Exception e) {
                log.error("Validation callback failed: {}", e.getMessage(), e);
            }
        }
    }

    // ==================== 失败处理 ====================

    public RemediationOutcome handleFailure(String actionName, ValidationResult result,
                                            FailureHandlingStrategy strategy, FuseLevel level) {
        return handleFailure(actionName, result, strategy, 0, level, null);
    }

    /**
     * 按策略处理不达标的动作。
     *
     * @param retryCount   已重试次数
     * @param alternatives FALLBACK的备选动作或COMBINE的组合动作，为null时使用默认列表
     */
    public RemediationOutcome handleFailure(String actionName, ValidationResult result,
                                            FailureHandlingStrategy strategy, int retryCount,
                                            FuseLevel level, List<String> alternatives) {
        if (result != null && result.isSuccess()) {
            return new RemediationOutcome(true, result, strategy);
        }

        if (strategy == null) {
            log.warn("No failure handling strategy given for '{}'", actionName);
            return new RemediationOutcome(false, result, null);
        }

        switch (strategy) {
            case RETRY:
                return retry(actionName, result, retryCount, level);
            case ESCALATE:
                return escalate(actionName, result, level);
            case ALERT:
                return alert(actionName, result);
            case FALLBACK:
                return fallback(alternatives != null ? alternatives : DEFAULT_FALLBACK, result, level);
            case COMBINE:
                return combine(alternatives != null ? alternatives : DEFAULT_COMBINATION, result, level);
            default:
                log.error("Unhandled failure handling strategy {} for '{}'", strategy, actionName);
                return new RemediationOutcome(false, result, strategy);
        }
    }

    private RemediationOutcome retry(String actionName, ValidationResult result, int retryCount, FuseLevel level) {
        MitigationAction action = actionManager.getAction(actionName);
        int budget = action != null ? action.getRetryBudget() : 0;

        if (retryCount >= budget) {
            log.warn("Action '{}' exhausted retry budget {}, escalating", actionName, budget);
            return escalate(actionName, result, level);
        }

        if (retryCount > 0) {
            gcPass.run();
        }
        log.info("Retrying action '{}' ({}/{})", actionName, retryCount + 1, budget);
        ValidationResult retried = executeAndValidate(actionName, level);
        if (retried.isSuccess()) {
            return new RemediationOutcome(true, retried, FailureHandlingStrategy.RETRY);
        }
        return retry(actionName, retried, retryCount + 1, level);
    }

    private RemediationOutcome escalate(String actionName, ValidationResult result, FuseLevel level) {
        MitigationAction action = actionManager.getAction(actionName);
        String target = action != null ? action.getEscalationTarget() : null;
        if (target == null || actionManager.getAction(target) == null) {
            log.warn("Action '{}' has no escalation target", actionName);
            return alert(actionName, result);
        }

        log.warn("Escalating '{}' to '{}'", actionName, target);
        ValidationResult escalated = executeAndValidate(target, level);
        if (escalated.isSuccess()) {
            return new RemediationOutcome(true, escalated, FailureHandlingStrategy.ESCALATE);
        }
        return alert(target, escalated);
    }

    private RemediationOutcome alert(String actionName, ValidationResult result) {
        log.error("ALERT: mitigation action '{}' failed to reach its expected effect: {}", actionName, result);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action", actionName);
        details.put("alert", true);
        if (result != null) {
            details.put("reduction", result.getReductionMb());
            details.put("expected", result.getExpectedReductionMb());
        }
        audit.record(EventType.ERROR_OCCURRED, details);
        return new RemediationOutcome(false, result, FailureHandlingStrategy.ALERT);
    }

    private RemediationOutcome fallback(List<String> alternatives, ValidationResult result, FuseLevel level) {
        ValidationResult last = result;
        for (String alternative : alternatives) {
            last = executeAndValidate(alternative, level);
            if (last.isSuccess()) {
                log.info("Fallback action '{}' succeeded", alternative);
                return new RemediationOutcome(true, last, FailureHandlingStrategy.FALLBACK);
            }
        }
        log.warn("All fallback actions {} failed", alternatives);
        return new RemediationOutcome(false, last, FailureHandlingStrategy.FALLBACK);
    }

    private RemediationOutcome combine(List<String> combination, ValidationResult result, FuseLevel level) {
        ValidationResult last = result;
        boolean allSucceeded = true;
        for (String member : combination) {
            last = executeAndValidate(member, level);
            allSucceeded &= last.isSuccess();
        }
        log.info("Combined actions {} -> {}", combination, allSucceeded ? "all succeeded" : "partial");
        return new RemediationOutcome(allSucceeded, last, FailureHandlingStrategy.COMBINE);
    }

    // ==================== 统计 ====================

    public List<ValidationResult> getHistory() {
        lock.lock();
        try {
            return new ArrayList<>(history);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 每个动作的平均效果（实际/预期）。
     */
    public Map<String, Double> getActionEffectiveness() {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (ValidationResult result : getHistory()) {
            double[] acc = sums.computeIfAbsent(result.getAction(), k -> new double[2]);
            acc[0] += result.getEffectiveness();
            acc[1] += 1;
        }
        Map<String, Double> averages = new LinkedHashMap<>();
        sums.forEach((action, acc) -> averages.put(action, acc[0] / acc[1]));
        return averages;
    }

    public void addResultCallback(Consumer<ValidationResult> callback) {
        callbacks.add(callback);
    }

    // ==================== 内存记录 ====================

    /**
     * 后台按间隔记录进程内存，保留最近30条。
     */
    public void startMemoryRecorder(long intervalMs) {
        if (!recording.compareAndSet(false, true)) {
            return;
        }
        recorderThread = new Thread(() -> {
            while (recording.get()) {
                recordMemory();
                try {
                    Thread.sleep(intervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }, "fuse-memory-recorder");
        recorderThread.setDaemon(true);
        recorderThread.start();
    }

    public void stopMemoryRecorder() {
        if (recording.compareAndSet(true, false) && recorderThread != null) {
            recorderThread.interrupt();
        }
    }

    public void recordMemory() {
        lock.lock();
        try {
            memoryRecords.addLast(new double[]{clock.millis(), probe.getProcessUsedMb()});
            while (memoryRecords.size() > MEMORY_RECORD_LIMIT) {
                memoryRecords.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /** [时间戳, 进程内存MB] 列表，按时间正序 */
    public List<double[]> getMemoryRecords() {
        lock.lock();
        try {
            return new ArrayList<>(memoryRecords);
        } finally {
            lock.unlock();
        }
    }
}
