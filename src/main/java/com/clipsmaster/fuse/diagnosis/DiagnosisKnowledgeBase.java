package com.clipsmaster.fuse.diagnosis;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存问题诊断知识库。
 *
 * 以压力模式、症状关键词和运行上下文三项打分，与库中案例做相似度匹配：
 * score = 0.5 * 模式亲和度 + 0.3 * 症状匹配度 + 0.2 * 上下文匹配度。
 * 最佳匹配低于置信度下限或库为空时，返回按模式生成的通用建议。
 *
 * 案例库只追加；学习到的案例与效果验证器的期望释放量表互不影响。
 */
public class DiagnosisKnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisKnowledgeBase.class);

    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;
    private static final double DEFAULT_AFFINITY = 0.1;
    private static final int RUNNER_UP_COUNT = 2;
    private static final int TOP_MATCHES = 5;
    private static final List<String> REQUIRED_FIELDS = List.of("pattern", "root_cause", "solution", "symptoms");

    /** 模式之间的亲和度，未列出的组合取 DEFAULT_AFFINITY */
    private static final Map<String, Map<String, Double>> PATTERN_AFFINITY = new HashMap<>();

    static {
        PATTERN_AFFINITY.put("rapid_increase", Map.of("steady_increase", 0.6, "spike", 0.7, "gradual_increase", 0.5));
        PATTERN_AFFINITY.put("steady_increase", Map.of("rapid_increase", 0.6, "gradual_increase", 0.8, "plateau_high", 0.4));
        PATTERN_AFFINITY.put("spike", Map.of("rapid_increase", 0.7, "fluctuation", 0.5));
        PATTERN_AFFINITY.put("fluctuation", Map.of("spike", 0.5));
        PATTERN_AFFINITY.put("plateau_high", Map.of("immediate_high", 0.6, "steady_increase", 0.4));
        PATTERN_AFFINITY.put("immediate_high", Map.of("plateau_high", 0.6));
        PATTERN_AFFINITY.put("fragmentation", Map.of("gradual_increase", 0.3));
        PATTERN_AFFINITY.put("gradual_increase", Map.of("steady_increase", 0.8, "rapid_increase", 0.5));
    }

    private final Clock clock;
    private final double minConfidence;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ReentrantLock lock = new ReentrantLock();

    private final LinkedHashMap<String, DiagnosisCase> cases = new LinkedHashMap<>();
    private final Map<String, Integer> matchCounts = new HashMap<>();
    private int diagnosisCount;
    private long lastUpdateTime;

    public DiagnosisKnowledgeBase(Clock clock) {
        this(clock, DEFAULT_MIN_CONFIDENCE);
    }

    public DiagnosisKnowledgeBase(Clock clock, double minConfidence) {
        this.clock = clock;
        this.minConfidence = minConfidence;
        for (DiagnosisCase seed : seedCases()) {
            cases.put(seed.getCaseId(), seed);
        }
        this.lastUpdateTime = clock.millis();
        log.info("Diagnosis knowledge base initialized with {} cases", cases.size());
    }

    // ==================== 诊断 ====================

    /**
     * 诊断一段压力序列。从不抛出异常；无法确定时返回通用建议。
     *
     * @param samples 压力样本（百分比），按时间先后
     * @param context 运行上下文（task_type、uptime_hours、video_size_gb），可为null
     */
    public DiagnosisResult diagnose(List<Double> samples, Map<String, Object> context) {
        PatternFeatures features = FeatureExtractor.extract(samples != null ? samples : List.of());
        long now = clock.millis();

        List<Map.Entry<DiagnosisCase, Double>> ranked = new ArrayList<>();
        String diagnosisId;
        lock.lock();
        try {
            diagnosisCount++;
            diagnosisId = "DIAG_" + now / 1000 + "_" + diagnosisCount;
            for (DiagnosisCase candidate : cases.values()) {
                ranked.add(Map.entry(candidate, score(features, candidate, context)));
            }
        } finally {
            lock.unlock();
        }
        // 稳定排序，同分时保留案例库顺序
        ranked.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));

        if (ranked.isEmpty() || ranked.get(0).getValue() < minConfidence) {
            DiagnosisResult generic = genericAdvice(diagnosisId, now, features);
            log.info("Diagnosis {} inconclusive for pattern {}, returning generic advice",
                    diagnosisId, features.getPattern());
            return generic;
        }

        DiagnosisCase best = ranked.get(0).getKey();
        double confidence = ranked.get(0).getValue();
        List<String> runnersUp = new ArrayList<>();
        for (int i = 1; i < ranked.size() && runnersUp.size() < RUNNER_UP_COUNT; i++) {
            runnersUp.add(ranked.get(i).getKey().getCaseId());
        }

        lock.lock();
        try {
            matchCounts.merge(best.getCaseId(), 1, Integer::sum);
        } finally {
            lock.unlock();
        }

        log.info("Diagnosis {} matched case {} (pattern {}, confidence {})",
                diagnosisId, best.getCaseId(), features.getPattern(), String.format("%.2f", confidence));
        return new DiagnosisResult(diagnosisId, now, best.getCaseId(), confidence,
                best.getRootCause(), best.getSolution(), best.getSeverity(), best.getImpact(),
                runnersUp, features);
    }

    double score(PatternFeatures features, DiagnosisCase candidate, Map<String, Object> context) {
        double affinity = patternAffinity(features.getPattern(), candidate.getPattern());
        double symptom = symptomMatch(features, candidate);
        double contextScore = (context == null || context.isEmpty()) ? 1.0 : contextMatch(context, candidate);
        return affinity * 0.5 + symptom * 0.3 + contextScore * 0.2;
    }

    static double patternAffinity(String current, String casePattern) {
        if (current != null && current.equals(casePattern)) {
            return 1.0;
        }
        Map<String, Double> related = PATTERN_AFFINITY.get(current);
        if (related != null && related.containsKey(casePattern)) {
            return related.get(casePattern);
        }
        return DEFAULT_AFFINITY;
    }

    /** 症状描述中的关键词与当前特征的吻合程度，基准0.5 */
    static double symptomMatch(PatternFeatures f, DiagnosisCase candidate) {
        String symptoms = candidate.getSymptoms().toLowerCase(Locale.ROOT);
        double score = 0.5;

        if (containsAny(symptoms, "使用率", "usage") && containsAny(symptoms, "高", "high")) {
            if (f.getMax() > 90) {
                score += 0.2;
            } else if (f.getMax() > 80) {
                score += 0.1;
            }
        }
        if (containsAny(symptoms, "增长", "increase", "grow")) {
            if (containsAny(symptoms, "快速", "飙升", "rapid", "fast")) {
                if (f.getTrend() > 3) {
                    score += 0.3;
                } else if (f.getTrend() > 1) {
                    score += 0.1;
                }
            } else if (containsAny(symptoms, "缓慢", "逐渐", "slow", "gradual")) {
                if (f.getTrend() > 0 && f.getTrend() < 2) {
                    score += 0.3;
                }
            }
        }
        if (containsAny(symptoms, "波动", "忽高忽低", "fluctuat")) {
            if (f.getVolatility() > 0.25) {
                score += 0.2;
            }
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    /** 运行上下文与案例影响、检测描述的吻合程度，基准0.5 */
    static double contextMatch(Map<String, Object> context, DiagnosisCase candidate) {
        double score = 0.5;
        List<String> impacts = candidate.getImpact();
        String detection = candidate.getDetection();

        Object task = context.get("task_type");
        if (task != null) {
            String taskText = String.valueOf(task).toLowerCase(Locale.ROOT);
            if (impacts.stream().anyMatch(i -> i.toLowerCase(Locale.ROOT).contains(taskText))) {
                score += 0.2;
            }
        }
        double uptime = number(context.get("uptime_hours"));
        if (uptime > 72 && containsAny(detection, "长时间", "72小时", "long running")) {
            score += 0.2;
        }
        double videoSize = number(context.get("video_size_gb"));
        if (videoSize > 2 && impacts.stream().anyMatch(i -> i.contains("大型视频"))) {
            score += 0.2;
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static double number(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private DiagnosisResult genericAdvice(String diagnosisId, long now, PatternFeatures features) {
        String id = "GENERIC_" + diagnosisId;
        switch (features.getPattern()) {
            case "rapid_increase":
                return new DiagnosisResult(id, now, null, 0.4,
                        "可能存在大量资源未释放或内存泄漏",
                        "检查最近添加的代码，启用详细内存监控，考虑增加内存释放点",
                        "high", List.of("系统可能很快发生内存不足", "处理大型数据可能失败"),
                        List.of(), features);
            case "steady_increase":
                return new DiagnosisResult(id, now, null, 0.4,
                        "可能存在累积性内存泄漏",
                        "启用定期内存清理，检查循环中的资源管理，考虑定期重启服务",
                        "medium", List.of("长时间运行后系统将变慢", "最终可能需要重启"),
                        List.of(), features);
            case "fluctuation":
                return new DiagnosisResult(id, now, null, 0.3,
                        "资源争用或不当的内存管理策略",
                        "优化并发任务调度，检查内存分配与释放的时机",
                        "low", List.of("系统性能不稳定", "可能在高负载时出现问题"),
                        List.of(), features);
            default:
                return new DiagnosisResult(id, now, null, 0.2,
                        "未知原因导致的内存压力",
                        "监控内存使用情况，收集更多诊断信息，如问题持续可考虑减少并发任务数量",
                        "unknown", List.of("可能影响系统稳定性"),
                        List.of(), features);
        }
    }

    // ==================== 学习 ====================

    /**
     * 从一次事故中学习新案例。
     *
     * @param incident 必须包含 pattern、root_cause、solution、symptoms；
     *                 可选 case_type（默认OOM）、severity、impact、detection
     * @return 新案例ID；缺少必要字段时返回null
     */
    public String learn(Map<String, Object> incident) {
        for (String field : REQUIRED_FIELDS) {
            if (incident == null || incident.get(field) == null) {
                log.error("Cannot learn incident: missing required field '{}'", field);
                return null;
            }
        }
        String caseType = incident.get("case_type") != null ? String.valueOf(incident.get("case_type")) : "OOM";

        lock.lock();
        try {
            int maxSeq = 0;
            String prefix = caseType + "_";
            for (String existing : cases.keySet()) {
                if (existing.startsWith(prefix)) {
                    try {
                        maxSeq = Math.max(maxSeq, Integer.parseInt(existing.substring(prefix.length())));
                    } catch (NumberFormatException e) {
                        log.debug("Case id {} has a non-numeric sequence", existing);
                    }
                }
            }
            String newId = String.format("%s_%03d", caseType, maxSeq + 1);

            DiagnosisCase learned = new DiagnosisCase(newId,
                    String.valueOf(incident.get("pattern")),
                    String.valueOf(incident.get("symptoms")),
                    String.valueOf(incident.get("root_cause")),
                    String.valueOf(incident.get("solution")),
                    incident.get("severity") != null ? String.valueOf(incident.get("severity")) : "medium",
                    toStringList(incident.get("impact")),
                    incident.get("detection") != null ? String.valueOf(incident.get("detection")) : "",
                    "learned",
                    Instant.ofEpochMilli(clock.millis()).toString());
            cases.put(newId, learned);
            lastUpdateTime = clock.millis();
            log.info("Learned new diagnosis case {} (pattern {})", newId, learned.getPattern());
            return newId;
        } finally {
            lock.unlock();
        }
    }

    private static List<String> toStringList(Object value) {
        if (value instanceof Collection) {
            List<String> list = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                list.add(String.valueOf(item));
            }
            return list;
        }
        return value != null ? List.of(String.valueOf(value)) : List.of();
    }

    // ==================== 导入导出 ====================

    /**
     * 将案例库导出为JSON数组。
     */
    public boolean exportCases(Path path) {
        List<DiagnosisCase> snapshot = getCases();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            mapper.writeValue(path.toFile(), snapshot);
            log.info("Exported {} diagnosis cases to {}", snapshot.size(), path);
            return true;
        } catch (IOException e) {
            log.error("Failed to export diagnosis cases to {}: {}", path, e.getMessage(), e);
            return false;
        }
    }

    /**
     * 从JSON数组导入案例，同ID的案例被覆盖。
     *
     * @return 导入的案例数；文件不存在或格式错误时返回-1
     */
    public int importCases(Path path) {
        if (!Files.isRegularFile(path)) {
            log.warn("Diagnosis case file not found: {}", path);
            return -1;
        }
        List<DiagnosisCase> imported;
        try {
            imported = mapper.readValue(path.toFile(), new TypeReference<List<DiagnosisCase>>() {});
        } catch (IOException e) {
            log.error("Failed to import diagnosis cases from {}: {}", path, e.getMessage(), e);
            return -1;
        }
        int count = 0;
        lock.lock();
        try {
            for (DiagnosisCase c : imported) {
                if (c == null || c.getCaseId() == null || c.getPattern() == null) {
                    log.warn("Skipping diagnosis case without id or pattern: {}", c);
                    continue;
                }
                cases.put(c.getCaseId(), c);
                count++;
            }
            lastUpdateTime = clock.millis();
        } finally {
            lock.unlock();
        }
        log.info("Imported {} diagnosis cases from {}", count, path);
        return count;
    }

    // ==================== 查询 ====================

    public DiagnosisCase getCase(String caseId) {
        lock.lock();
        try {
            return cases.get(caseId);
        } finally {
            lock.unlock();
        }
    }

    public List<DiagnosisCase> getCases() {
        lock.lock();
        try {
            return new ArrayList<>(cases.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 统计信息：案例总数、按前缀分类计数、诊断次数、匹配次数最多的案例。
     */
    public Map<String, Object> getStats() {
        lock.lock();
        try {
            Map<String, Integer> byType = new TreeMap<>();
            for (DiagnosisCase c : cases.values()) {
                byType.merge(c.typePrefix(), 1, Integer::sum);
            }
            Map<String, Integer> top = new LinkedHashMap<>();
            matchCounts.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                            .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                    .limit(TOP_MATCHES)
                    .forEach(e -> top.put(e.getKey(), e.getValue()));

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("total_cases", cases.size());
            stats.put("case_types", byType);
            stats.put("diagnosis_count", diagnosisCount);
            stats.put("top_matched_cases", top);
            stats.put("last_update", lastUpdateTime);
            return stats;
        } finally {
            lock.unlock();
        }
    }

    public double getMinConfidence() { return minConfidence; }

    // ---- 种子案例 ----

    static List<DiagnosisCase> seedCases() {
        return List.of(
                DiagnosisCase.seed("OOM_001", "rapid_increase", "内存5分钟内从60%升至98%",
                        "模型分片泄漏", "升级分片加载器v2.3+", "critical",
                        List.of("视频处理中断", "可能导致系统崩溃"),
                        "检测到内存使用率在短时间内快速增长超过35%"),
                DiagnosisCase.seed("OOM_002", "steady_increase", "内存缓慢增长不释放，最终达到95%以上",
                        "视频缓冲区未释放", "在视频切换时强制回收并手动清理缓冲区", "high",
                        List.of("系统变慢", "最终导致内存不足"),
                        "监测到GC后内存占用无明显下降"),
                DiagnosisCase.seed("OOM_003", "spike", "处理大型视频时内存瞬间飙升至90%以上",
                        "视频解码缓冲区过大", "使用流式解码方式，限制最大缓冲区大小", "high",
                        List.of("大型视频处理失败"),
                        "监测到内存使用率瞬间增加超过40%"),
                DiagnosisCase.seed("FRAG_001", "fragmentation", "内存使用率中等但分配新内存时失败",
                        "长时间运行导致内存碎片化", "定期完全重启服务或使用压缩内存分配器", "medium",
                        List.of("大型视频处理失败", "系统不稳定"),
                        "已使用内存低于70%但内存分配仍然失败"),
                DiagnosisCase.seed("FRAG_002", "fragmentation", "系统长时间运行后逐渐变慢，内存使用不高",
                        "字幕处理导致的内存碎片", "优化字幕缓存管理，定期整理内存", "low",
                        List.of("系统性能下降"),
                        "系统长时间运行超过72小时且处理速度下降30%以上"),
                DiagnosisCase.seed("LEAK_001", "steady_increase", "内存使用率稳定增长，重启后恢复",
                        "字幕解析器资源未释放", "修复字幕解析器的资源管理机制", "medium",
                        List.of("需要频繁重启", "长视频处理失败"),
                        "每处理100个字幕内存增加约5MB且不释放"),
                DiagnosisCase.seed("LEAK_002", "steady_increase", "GPU内存缓慢增长直至耗尽",
                        "CUDA张量缓存未正确释放", "在模型推理后显式清理CUDA缓存", "high",
                        List.of("GPU加速失效", "系统自动切换到CPU模式变慢"),
                        "GPU内存监控显示使用量持续增长不释放"),
                DiagnosisCase.seed("CONT_001", "fluctuation", "并行处理时内存使用忽高忽低",
                        "多任务资源争用", "实现更智能的任务调度和资源分配机制", "medium",
                        List.of("处理效率下降", "任务完成时间不稳定"),
                        "内存使用率波动超过25%且CPU使用率达到90%以上"),
                DiagnosisCase.seed("CONF_001", "immediate_high", "启动即达到高内存占用",
                        "视频缓冲区初始配置过大", "调整配置文件中的max_buffer_size参数", "medium",
                        List.of("无法处理多个视频", "系统启动慢"),
                        "启动5分钟内内存使用率即超过60%"),
                DiagnosisCase.seed("CONF_002", "specific_trigger", "特定类型视频处理时内存溢出",
                        "高分辨率视频的缓冲策略不当", "为高分辨率视频实现自适应缓冲策略", "medium",
                        List.of("高清视频处理失败"),
                        "处理分辨率高于4K的视频时内存使用率超过85%")
        );
    }
}
