package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.FuseConfig;
import com.clipsmaster.fuse.actions.BuiltinActions;
import com.clipsmaster.fuse.core.*;
import com.clipsmaster.fuse.diagnosis.DiagnosisKnowledgeBase;
import com.clipsmaster.fuse.diagnosis.DiagnosisResult;
import com.clipsmaster.fuse.model.*;
import com.clipsmaster.fuse.storage.JsonlEventStorage;
import com.clipsmaster.fuse.storage.KafkaEventPublisher;
import com.clipsmaster.fuse.storage.MemoryEventStorage;
import com.clipsmaster.fuse.storage.SQLiteEventStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 熔断器上下文默认实现。
 * 按依赖顺序组装全部组件，管理采样、评估、快照三个后台循环的启停。
 */
public class DefaultFuseContext implements FuseContext {

    private static final Logger log = LoggerFactory.getLogger(DefaultFuseContext.class);

    private final FuseConfig config;
    private final MemoryProbe probe;
    private final Clock clock;

    private final EventStorage storage;
    private final FuseAudit audit;
    private final EventAnalyzer analyzer;
    private final DefaultResourceRegistry registry;
    private final OriginalSettings originalSettings;
    private final DefaultActionManager actionManager;
    private final ActionScheduler scheduler;
    private final EffectValidator validator;
    private final RecoveryCoordinator recoveryCoordinator;
    private final PressureMonitor monitor;
    private final FuseController controller;
    private final DiagnosisKnowledgeBase knowledgeBase;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread snapshotThread;

    private DefaultFuseContext(FuseConfig config, MemoryProbe probe, EventStorage storage, Clock clock) {
        this.config = config;
        this.probe = probe;
        this.clock = clock;

        // 按依赖顺序初始化：审计 → 资源 → 动作 → 验证/恢复 → 监控/控制 → 诊断
        this.storage = storage;
        this.audit = new FuseAudit(storage, probe, clock);
        this.analyzer = new EventAnalyzer(audit);

        this.registry = new DefaultResourceRegistry(ResourceReaper.withDefaults(clock), audit, clock);
        this.originalSettings = new OriginalSettings();

        this.actionManager = new DefaultActionManager(registry, originalSettings, config.getActionParameters());
        BuiltinActions.registerAll(actionManager, probe);
        this.scheduler = new ActionScheduler(actionManager);

        this.validator = new EffectValidator(actionManager, probe, audit, clock)
                .setSettleMs(config.getValidatorSettleMs())
                .setHistorySize(config.getValidatorHistorySize());

        this.recoveryCoordinator = new RecoveryCoordinator(registry, probe, audit, clock,
                Paths.get(config.getRecoveryDirectory()));
        recoveryCoordinator.setMemoryThreshold(config.getRecoveryMemoryThreshold());
        recoveryCoordinator.setRecoveryIntervalMs(config.getRecoveryIntervalMs());
        recoveryCoordinator.setMaxPauseSeconds(config.getMaxPauseSeconds());

        this.monitor = new PressureMonitor(probe, clock, config.getWindowSize());
        this.controller = new FuseController(config.getLevels(), actionManager, validator, audit,
                originalSettings, clock)
                .setOrderingStrategy(scheduler)
                .setRecoveryCoordinator(recoveryCoordinator)
                .setStabilizeMs(config.getStabilizeSeconds() * 1000L)
                .setRecoveryThreshold(config.getRecoveryThreshold())
                .setCooldownMs(config.getCooldownSeconds() * 1000L)
                .setStepRecovery(config.isStepRecovery())
                .setRestoreSettings(config.isRestoreSettings())
                .setSnapshotOnTrigger(config.isSnapshotOnTrigger())
                .setRollbackOnNormal(config.isRollbackOnNormal())
                .setRunSkippedLevels(config.isRunSkippedLevels())
                .setFailureStrategy(config.getFailureStrategy());

        this.knowledgeBase = new DiagnosisKnowledgeBase(clock, config.getDiagnosisMinConfidence());
        if (config.getDiagnosisCasesPath() != null) {
            knowledgeBase.importCases(Paths.get(config.getDiagnosisCasesPath()));
        }
    }

    /**
     * 用给定的探针、事件存储和时钟组装上下文。
     */
    public static DefaultFuseContext create(FuseConfig config, MemoryProbe probe, EventStorage storage, Clock clock) {
        log.info("Initializing memory fuse context with {} probe...", probe.getName());
        return new DefaultFuseContext(config, probe, storage, clock);
    }

    /**
     * 按配置选择探针与事件存储并组装上下文。
     */
    public static DefaultFuseContext create(FuseConfig config) {
        return create(config, MemoryProbes.detect(), openStorage(config), Clock.systemUTC());
    }

    /**
     * 按 audit.storage 打开事件存储，开启Kafka时在外层包装转发。
     */
    public static EventStorage openStorage(FuseConfig config) {
        EventStorage base;
        switch (config.getAuditStorage()) {
            case "jsonl":
                base = new JsonlEventStorage(Paths.get(config.getAuditJsonlPath()));
                break;
            case "sqlite":
                base = new SQLiteEventStorage(config.getAuditSqlitePath());
                break;
            case "memory":
                base = new MemoryEventStorage(config.getAuditMemoryMaxEvents());
                break;
            default:
                log.warn("Unknown audit.storage '{}', using in-memory storage", config.getAuditStorage());
                base = new MemoryEventStorage(config.getAuditMemoryMaxEvents());
        }
        if (config.isKafkaEnabled()) {
            log.info("Forwarding fuse events to Kafka topic {} at {}",
                    config.getKafkaTopic(), config.getKafkaBootstrapServers());
            return KafkaEventPublisher.create(base, config.getKafkaBootstrapServers(), config.getKafkaTopic());
        }
        return base;
    }

    // ==================== 生命周期 ====================

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Fuse context is already running, ignoring duplicate start.");
            return;
        }
        log.info("Starting memory fuse: {}", config);

        // 跨越阈值时立即评估一次，不必等下一个评估周期
        for (FuseLevelConfig level : controller.getLevels()) {
            monitor.addThresholdListener(level.getThreshold(),
                    (threshold, sample) -> controller.evaluate(monitor.index()));
        }
        monitor.addEscalationListener((sample, slope) ->
                log.warn("Pressure escalating at {}%, predicted {}% in 5 samples",
                        String.format("%.1f", sample.getUsagePercent()),
                        String.format("%.1f", monitor.predict(5))));

        monitor.start(config.getSampleIntervalSeconds() * 1000L);
        controller.start(config.getCheckIntervalSeconds() * 1000L, monitor::index);
        if (config.isRecorderEnabled()) {
            validator.startMemoryRecorder(1000L);
        }

        long snapshotIntervalMs = config.getSnapshotIntervalSeconds() * 1000L;
        if (snapshotIntervalMs > 0) {
            snapshotThread = new Thread(() -> snapshotLoop(snapshotIntervalMs), "fuse-audit-snapshot");
            snapshotThread.setDaemon(true);
            snapshotThread.start();
        }

        audit.record(EventType.SYSTEM_STATE_CHANGE, Map.of("state", "started", "probe", probe.getName()));
        log.info("Memory fuse started.");
    }

    private void snapshotLoop(long intervalMs) {
        while (running.get()) {
            try {
                audit.recordMemorySnapshot();
            } catch (Exception e) {
                log.error("Periodic memory snapshot failed", e);
            }
            try {
                Thread.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    @Override
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Fuse context is not running, closing storage only.");
            storage.close();
            return;
        }
        log.info("Shutting down memory fuse...");

        // 按与启动相反的顺序关闭
        if (snapshotThread != null) {
            snapshotThread.interrupt();
        }
        validator.stopMemoryRecorder();
        controller.stop();
        monitor.stop();

        audit.record(EventType.SYSTEM_STATE_CHANGE, Map.of("state", "stopped"));
        storage.close();
        log.info("Memory fuse shut down.");
    }

    // ==================== 资源 ====================

    @Override
    public void registerResource(String resourceId, Object resource, Map<String, Object> metadata, Releaser releaser) {
        registry.register(resourceId, resource, metadata, releaser);
    }

    @Override
    public boolean releaseResource(String resourceId) {
        return registry.release(resourceId);
    }

    // ==================== 熔断 ====================

    @Override
    public boolean forceTrigger(FuseLevel level, boolean testMode) {
        return controller.forceTrigger(level, testMode);
    }

    @Override
    public FuseLevel getCurrentLevel() {
        return controller.getCurrentLevel();
    }

    @Override
    public List<ActionRecord> getActionHistory() {
        return controller.getActionHistory();
    }

    // ==================== 审计 ====================

    @Override
    public String recordEvent(String eventType, Map<String, Object> details, String relatedId) {
        return audit.record(eventType, details, relatedId);
    }

    @Override
    public List<FuseEvent> queryEvents(EventQuery query, TimeRange timeRange, int limit) {
        return audit.query(query, timeRange, limit);
    }

    // ==================== 诊断 ====================

    @Override
    public DiagnosisResult diagnose(List<Double> samples, Map<String, Object> context) {
        DiagnosisResult result = knowledgeBase.diagnose(samples, context);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("diagnosis_id", result.getDiagnosisId());
        details.put("pattern", result.getPattern());
        details.put("matched_case", result.getMatchedCase() != null ? result.getMatchedCase() : "");
        details.put("confidence", result.getConfidence());
        audit.record(EventType.CUSTOM_EVENT.value(), details, null);
        return result;
    }

    /** 用监控窗口中的采样序列诊断当前状态 */
    public DiagnosisResult diagnoseCurrent(Map<String, Object> context) {
        return diagnose(monitor.getUsageSeries(), context);
    }

    @Override
    public boolean exportCases(Path path) {
        return knowledgeBase.exportCases(path);
    }

    @Override
    public int importCases(Path path) {
        return knowledgeBase.importCases(path);
    }

    // ---- Getter methods for inter-component access ----

    public FuseConfig getConfig() { return config; }
    public MemoryProbe getProbe() { return probe; }
    public Clock getClock() { return clock; }
    public EventStorage getStorage() { return storage; }
    public FuseAudit getAudit() { return audit; }
    public EventAnalyzer getAnalyzer() { return analyzer; }
    public DefaultResourceRegistry getRegistry() { return registry; }
    public DefaultActionManager getActionManager() { return actionManager; }
    public ActionScheduler getScheduler() { return scheduler; }
    public EffectValidator getValidator() { return validator; }
    public RecoveryCoordinator getRecoveryCoordinator() { return recoveryCoordinator; }
    public PressureMonitor getMonitor() { return monitor; }
    public FuseController getController() { return controller; }
    public DiagnosisKnowledgeBase getKnowledgeBase() { return knowledgeBase; }
    public boolean isRunning() { return running.get(); }
}
