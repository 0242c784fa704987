package com.clipsmaster.fuse;

import com.clipsmaster.fuse.model.FailureHandlingStrategy;
import com.clipsmaster.fuse.model.FuseLevel;
import com.clipsmaster.fuse.model.FuseLevelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * 熔断器配置。
 * 对应配置文件中的检测、恢复、验证、审计、诊断参数以及各动作的参数。
 */
public class FuseConfig {

    private static final Logger log = LoggerFactory.getLogger(FuseConfig.class);

    private static final String ACTION_PREFIX = "action.";

    // ---- 熔断级别 ----
    private List<FuseLevelConfig> levels = FuseLevelConfig.defaults();

    // ---- 检测 ----
    private long checkIntervalSeconds = 5;
    private long stabilizeSeconds = 30;
    private double recoveryThreshold = 70.0;
    private long sampleIntervalSeconds = 1;
    private int windowSize = 60;
    private boolean runSkippedLevels = false;

    // ---- 恢复 ----
    private long cooldownSeconds = 60;
    private boolean stepRecovery = true;
    private boolean restoreSettings = true;
    private boolean snapshotOnTrigger = true;
    private boolean rollbackOnNormal = true;
    private double recoveryMemoryThreshold = 80.0;
    private long recoveryIntervalMs = 100;
    private long maxPauseSeconds = 60;
    private String recoveryDirectory = "data/recovery";

    // ---- 效果验证 ----
    private long validatorSettleMs = 200;
    private FailureHandlingStrategy failureStrategy = null;
    private int validatorHistorySize = 100;
    private boolean recorderEnabled = false;

    // ---- 审计 ----
    private String auditStorage = "memory";
    private int auditMemoryMaxEvents = 1000;
    private String auditJsonlPath = "data/audit/fuse_events.jsonl";
    private String auditSqlitePath = "data/audit/fuse_events.db";
    private boolean kafkaEnabled = false;
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaTopic = "fuse-events";
    private long snapshotIntervalSeconds = 60;

    // ---- 诊断 ----
    private String diagnosisCasesPath = null;
    private double diagnosisMinConfidence = 0.5;

    // ---- 动作参数：动作名 -> 参数名 -> 原始值 ----
    private Map<String, Map<String, Object>> actionParameters = new LinkedHashMap<>();

    /** 全部取内置默认值的配置 */
    public static FuseConfig defaults() {
        return new FuseConfig();
    }

    /**
     * 从properties文件加载配置。文件不存在或不可读时使用默认值。
     *
     * @throws ConfigurationException 熔断级别配置不合法
     */
    public static FuseConfig load(String configPath) {
        Path path = Paths.get(configPath);
        if (!Files.isRegularFile(path)) {
            log.warn("Config file {} not found, using defaults", configPath);
            return defaults();
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.warn("Failed to read config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return defaults();
        }
        FuseConfig config = fromProperties(props);
        log.info("Loaded config from {}: {}", configPath, config);
        return config;
    }

    /**
     * @throws ConfigurationException 熔断级别配置不合法
     */
    public static FuseConfig fromProperties(Properties props) {
        FuseConfig config = new FuseConfig();
        config.levels = parseLevels(props);

        config.checkIntervalSeconds = longValue(props, "detection.check_interval_seconds", 5);
        config.stabilizeSeconds = longValue(props, "detection.stabilize_seconds", 30);
        config.recoveryThreshold = doubleValue(props, "detection.recovery_threshold", 70.0);
        config.sampleIntervalSeconds = longValue(props, "detection.sample_interval_seconds", 1);
        config.windowSize = (int) longValue(props, "detection.window_size", 60);
        config.runSkippedLevels = boolValue(props, "detection.run_skipped_levels", false);

        config.cooldownSeconds = longValue(props, "recovery.cooldown_seconds", 60);
        config.stepRecovery = boolValue(props, "recovery.step_recovery", true);
        config.restoreSettings = boolValue(props, "recovery.restore_settings", true);
        config.snapshotOnTrigger = boolValue(props, "recovery.snapshot_on_trigger", true);
        config.rollbackOnNormal = boolValue(props, "recovery.rollback_on_normal", true);
        config.recoveryMemoryThreshold = doubleValue(props, "recovery.memory_threshold", 80.0);
        config.recoveryIntervalMs = longValue(props, "recovery.interval_ms", 100);
        config.maxPauseSeconds = longValue(props, "recovery.max_pause_seconds", 60);
        config.recoveryDirectory = props.getProperty("recovery.directory", "data/recovery");

        config.validatorSettleMs = longValue(props, "validator.settle_ms", 200);
        String strategy = props.getProperty("validator.failure_strategy", "NONE");
        try {
            config.failureStrategy = FailureHandlingStrategy.parse(strategy);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown validator.failure_strategy '{}', failure handling disabled", strategy);
        }
        config.validatorHistorySize = (int) longValue(props, "validator.history_size", 100);
        config.recorderEnabled = boolValue(props, "validator.recorder_enabled", false);

        config.auditStorage = props.getProperty("audit.storage", "memory").trim().toLowerCase(Locale.ROOT);
        config.auditMemoryMaxEvents = (int) longValue(props, "audit.memory.max_events", 1000);
        config.auditJsonlPath = props.getProperty("audit.jsonl.path", config.auditJsonlPath);
        config.auditSqlitePath = props.getProperty("audit.sqlite.path", config.auditSqlitePath);
        config.kafkaEnabled = boolValue(props, "audit.kafka.enabled", false);
        config.kafkaBootstrapServers = props.getProperty("audit.kafka.bootstrap.servers", "localhost:9092");
        config.kafkaTopic = props.getProperty("audit.kafka.topic", "fuse-events");
        config.snapshotIntervalSeconds = longValue(props, "audit.snapshot_interval_seconds", 60);

        String casesPath = props.getProperty("diagnosis.cases.path");
        config.diagnosisCasesPath = (casesPath == null || casesPath.isBlank()) ? null : casesPath.trim();
        config.diagnosisMinConfidence = doubleValue(props, "diagnosis.min_confidence", 0.5);

        config.actionParameters = parseActionParameters(props);
        return config;
    }

    // ---- 熔断级别解析 ----

    private static List<FuseLevelConfig> parseLevels(Properties props) {
        Map<FuseLevel, FuseLevelConfig> defaults = new EnumMap<>(FuseLevel.class);
        for (FuseLevelConfig d : FuseLevelConfig.defaults()) {
            defaults.put(d.getLevel(), d);
        }

        String names = props.getProperty("fuse.levels", "WARNING,CRITICAL,EMERGENCY");
        List<FuseLevelConfig> levels = new ArrayList<>();
        for (String raw : names.split(",")) {
            String name = raw.trim();
            if (name.isEmpty()) {
                continue;
            }
            FuseLevel level = FuseLevel.parse(name);
            if (level == null) {
                throw new ConfigurationException("Unknown fuse level in fuse.levels: " + name);
            }
            if (level == FuseLevel.NORMAL) {
                throw new ConfigurationException("NORMAL cannot be configured as a fuse level");
            }
            FuseLevelConfig fallback = defaults.get(level);

            String key = "fuse.level." + level.name();
            String thresholdText = props.getProperty(key + ".threshold");
            double threshold;
            if (thresholdText == null || thresholdText.isBlank()) {
                if (fallback == null) {
                    throw new ConfigurationException("Missing threshold: " + key + ".threshold");
                }
                threshold = fallback.getThreshold();
            } else {
                try {
                    threshold = Double.parseDouble(thresholdText.trim());
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("Threshold " + key + ".threshold is not a number: "
                            + thresholdText, e);
                }
            }

            String actionsText = props.getProperty(key + ".actions");
            List<String> actions = actionsText != null
                    ? splitList(actionsText)
                    : (fallback != null ? fallback.getActions() : List.of());
            levels.add(new FuseLevelConfig(level, threshold, actions));
        }

        try {
            FuseLevelConfig.validate(levels);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid fuse levels: " + e.getMessage(), e);
        }
        return levels;
    }

    private static Map<String, Map<String, Object>> parseActionParameters(Properties props) {
        Map<String, Map<String, Object>> params = new LinkedHashMap<>();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            if (!key.startsWith(ACTION_PREFIX)) {
                continue;
            }
            String rest = key.substring(ACTION_PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0 || dot == rest.length() - 1) {
                log.warn("Ignoring malformed action parameter key: {}", key);
                continue;
            }
            params.computeIfAbsent(rest.substring(0, dot), k -> new LinkedHashMap<>())
                    .put(rest.substring(dot + 1), props.getProperty(key).trim());
        }
        return params;
    }

    // ---- 取值工具 ----

    static List<String> splitList(String text) {
        List<String> values = new ArrayList<>();
        for (String item : text.split(",")) {
            if (!item.isBlank()) {
                values.add(item.trim());
            }
        }
        return values;
    }

    private static long longValue(Properties props, String key, long defaultValue) {
        String text = props.getProperty(key);
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not an integer, using default {}", key, text, defaultValue);
            return defaultValue;
        }
    }

    private static double doubleValue(Properties props, String key, double defaultValue) {
        String text = props.getProperty(key);
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            log.warn("Config {}='{}' is not a number, using default {}", key, text, defaultValue);
            return defaultValue;
        }
    }

    private static boolean boolValue(Properties props, String key, boolean defaultValue) {
        String text = props.getProperty(key);
        return (text == null || text.isBlank()) ? defaultValue : Boolean.parseBoolean(text.trim());
    }

    // ---- Getters ----
    public List<FuseLevelConfig> getLevels() { return levels; }
    public long getCheckIntervalSeconds() { return checkIntervalSeconds; }
    public long getStabilizeSeconds() { return stabilizeSeconds; }
    public double getRecoveryThreshold() { return recoveryThreshold; }
    public long getSampleIntervalSeconds() { return sampleIntervalSeconds; }
    public int getWindowSize() { return windowSize; }
    public boolean isRunSkippedLevels() { return runSkippedLevels; }
    public long getCooldownSeconds() { return cooldownSeconds; }
    public boolean isStepRecovery() { return stepRecovery; }
    public boolean isRestoreSettings() { return restoreSettings; }
    public boolean isSnapshotOnTrigger() { return snapshotOnTrigger; }
    public boolean isRollbackOnNormal() { return rollbackOnNormal; }
    public double getRecoveryMemoryThreshold() { return recoveryMemoryThreshold; }
    public long getRecoveryIntervalMs() { return recoveryIntervalMs; }
    public long getMaxPauseSeconds() { return maxPauseSeconds; }
    public String getRecoveryDirectory() { return recoveryDirectory; }
    public long getValidatorSettleMs() { return validatorSettleMs; }
    public FailureHandlingStrategy getFailureStrategy() { return failureStrategy; }
    public int getValidatorHistorySize() { return validatorHistorySize; }
    public boolean isRecorderEnabled() { return recorderEnabled; }
    public String getAuditStorage() { return auditStorage; }
    public int getAuditMemoryMaxEvents() { return auditMemoryMaxEvents; }
    public String getAuditJsonlPath() { return auditJsonlPath; }
    public String getAuditSqlitePath() { return auditSqlitePath; }
    public boolean isKafkaEnabled() { return kafkaEnabled; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaTopic() { return kafkaTopic; }
    public long getSnapshotIntervalSeconds() { return snapshotIntervalSeconds; }
    public String getDiagnosisCasesPath() { return diagnosisCasesPath; }
    public double getDiagnosisMinConfidence() { return diagnosisMinConfidence; }
    public Map<String, Map<String, Object>> getActionParameters() { return actionParameters; }

    @Override
    public String toString() {
        return "FuseConfig{levels=" + levels
                + ", checkInterval=" + checkIntervalSeconds + "s"
                + ", stabilize=" + stabilizeSeconds + "s"
                + ", recoveryThreshold=" + recoveryThreshold
                + ", cooldown=" + cooldownSeconds + "s"
                + ", audit='" + auditStorage + "'"
                + ", kafka=" + kafkaEnabled + "}";
    }
}
