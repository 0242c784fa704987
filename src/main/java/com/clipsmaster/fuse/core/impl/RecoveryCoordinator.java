package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.MemoryProbe;
import com.clipsmaster.fuse.core.ResourceRegistry;
import com.clipsmaster.fuse.core.Restorer;
import com.clipsmaster.fuse.model.EventType;
import com.clipsmaster.fuse.model.ResourceHandle;
import com.clipsmaster.fuse.model.ResourceSnapshot;
import com.clipsmaster.fuse.model.ResourceType;
import com.clipsmaster.fuse.model.RollbackReport;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 恢复协调器。
 *
 * 熔断前对受管资源做快照（类型、元数据、依赖关系），熔断过后按快照逆序逐个重建。
 * 回滚期间后台节流线程监视内存：超过阈值时暂停恢复并触发回收，
 * 降到阈值以下5个百分点后继续。
 */
public class RecoveryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String LATEST_FILE = "state_latest.json";
    private static final double RESUME_MARGIN = 5.0;
    private static final long PACER_POLL_MS = 100L;

    public static final long DEFAULT_INTERVAL_MS = 100L;
    public static final double DEFAULT_MEMORY_THRESHOLD = 80.0;
    public static final long DEFAULT_MAX_PAUSE_SECONDS = 60L;

    private final ResourceRegistry registry;
    private final MemoryProbe probe;
    private final FuseAudit audit;
    private final Clock clock;
    /** 快照持久化目录，为null时只保存在内存中 */
    private final Path stateDirectory;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** 资源恢复器注册表：resourceType -> Restorer */
    private final ConcurrentHashMap<String, Restorer> restorers = new ConcurrentHashMap<>();

    private final ReentrantLock lock = new ReentrantLock();
    /** 快照状态，按注册顺序 */
    private final LinkedHashMap<String, ResourceSnapshot> state = new LinkedHashMap<>();

    private volatile long recoveryIntervalMs = DEFAULT_INTERVAL_MS;
    private volatile double memoryThreshold = DEFAULT_MEMORY_THRESHOLD;
    private volatile long maxPauseSeconds = DEFAULT_MAX_PAUSE_SECONDS;
    private volatile Runnable gcPass = System::gc;

    private final AtomicBoolean rollingBack = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    // ---- 统计 ----
    private final AtomicInteger totalRollbacks = new AtomicInteger();
    private final AtomicInteger successfulRollbacks = new AtomicInteger();
    private final AtomicInteger totalRestored = new AtomicInteger();
    private final AtomicInteger totalFailed = new AtomicInteger();
    private final AtomicInteger pauseCount = new AtomicInteger();
    private final AtomicLong lastRollbackTime = new AtomicLong();

    public RecoveryCoordinator(ResourceRegistry registry, MemoryProbe probe, FuseAudit audit,
                               Clock clock, Path stateDirectory) {
        this.registry = registry;
        this.probe = probe;
        this.audit = audit;
        this.clock = clock;
        this.stateDirectory = stateDirectory;
    }

    public void registerRestorer(String resourceType, Restorer restorer) {
        restorers.put(resourceType, restorer);
        log.debug("Restorer registered for resource type '{}'", resourceType);
    }

    // ==================== 快照 ====================

    /**
     * 对当前全部受管资源做快照，覆盖之前的状态。
     */
    public List<ResourceSnapshot> snapshot() {
        List<ResourceSnapshot> snapshots = new ArrayList<>();
        long now = clock.millis();
        for (ResourceHandle handle : registry.listHandles()) {
            String type = inferType(handle);
            snapshots.add(new ResourceSnapshot(handle.getId(), type,
                    extractMetadata(handle, type), inferDependencies(handle), now));
        }

        lock.lock();
        try {
            state.clear();
            for (ResourceSnapshot snapshot : snapshots) {
                state.put(snapshot.getResourceId(), snapshot);
            }
        } finally {
            lock.unlock();
        }

        persist(snapshots);
        log.info("Snapshot taken of {} resources", snapshots.size());
        return snapshots;
    }

    /** 声明的类型标签优先，其次按标识符前缀，最后用对象类名 */
    static String inferType(ResourceHandle handle) {
        if (handle.getType() != ResourceType.UNKNOWN) {
            return handle.getType().getTag();
        }
        String id = handle.getId();
        if (id.startsWith("model_")) return "model";
        if (id.startsWith("video_")) return "video";
        if (id.startsWith("subtitle_")) return "subtitle";
        if (id.startsWith("temp_")) return "temporary";
        Object resource = handle.getResource();
        return resource != null ? resource.getClass().getSimpleName().toLowerCase() : "unknown";
    }

    private static Map<String, Object> extractMetadata(ResourceHandle handle, String type) {
        Map<String, Object> metadata = new LinkedHashMap<>(handle.getMetadata());
        String id = handle.getId().toLowerCase();
        if ("model".equals(type) && !metadata.containsKey("language")) {
            if (id.contains("zh")) {
                metadata.put("language", "zh");
            } else if (id.contains("en")) {
                metadata.put("language", "en");
            }
        } else if ("temporary".equals(type)) {
            metadata.put("cleanup_required", true);
        }
        Object resource = handle.getResource();
        if (resource != null && !metadata.containsKey("object_class")) {
            metadata.put("object_class", resource.getClass().getName());
        }
        return metadata;
    }

    /**
     * 依赖推断：processed_派生资源依赖其源资源；元数据 used_models / depends_on 列出的资源。
     */
    static List<String> inferDependencies(ResourceHandle handle) {
        Set<String> dependencies = new LinkedHashSet<>();
        String id = handle.getId();
        if (id.contains("processed_")) {
            dependencies.add(id.replace("processed_", ""));
        }
        addIds(dependencies, handle.getMetadata().get("used_models"));
        addIds(dependencies, handle.getMetadata().get("depends_on"));
        dependencies.remove(id);
        return new ArrayList<>(dependencies);
    }

    private static void addIds(Set<String> target, Object value) {
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                target.add(String.valueOf(item));
            }
        } else if (value instanceof String) {
            for (String item : ((String) value).split(",")) {
                if (!item.isBlank()) {
                    target.add(item.trim());
                }
            }
        }
    }

    private void persist(List<ResourceSnapshot> snapshots) {
        if (stateDirectory == null) {
            return;
        }
        Map<String, ResourceSnapshot> byId = new LinkedHashMap<>();
        for (ResourceSnapshot snapshot : snapshots) {
            byId.put(snapshot.getResourceId(), snapshot);
        }
        try {
            Files.createDirectories(stateDirectory);
            String stamp = LocalDateTime.now(clock).format(FILE_TIME);
            Path file = stateDirectory.resolve("state_" + stamp + ".json");
            mapper.writeValue(file.toFile(), byId);
            Files.copy(file, stateDirectory.resolve(LATEST_FILE), StandardCopyOption.REPLACE_EXISTING);
            log.debug("Snapshot persisted to {}", file);
        } catch (IOException e) {
            log.error("Failed to persist recovery snapshot to {}: {}", stateDirectory, e.getMessage(), e);
        }
    }

    /**
     * 从 state_latest.json 加载快照（进程重启后的恢复）。
     *
     * @return 加载的资源数
     */
    public int loadLatest() {
        if (stateDirectory == null) {
            return 0;
        }
        Path latest = stateDirectory.resolve(LATEST_FILE);
        if (!Files.exists(latest)) {
            log.info("No persisted recovery snapshot at {}", latest);
            return 0;
        }
        try {
            LinkedHashMap<String, ResourceSnapshot> loaded = mapper.readValue(latest.toFile(),
                    new TypeReference<LinkedHashMap<String, ResourceSnapshot>>() {});
            lock.lock();
            try {
                state.clear();
                state.putAll(loaded);
            } finally {
                lock.unlock();
            }
            log.info("Loaded {} resource snapshots from {}", loaded.size(), latest);
            return loaded.size();
        } catch (IOException e) {
            log.error("Failed to load recovery snapshot {}: {}", latest, e.getMessage(), e);
            return 0;
        }
    }

    // ==================== 回滚 ====================

    /**
     * 按快照逆序恢复资源。已有回滚在运行或没有快照时不启动。
     */
    public RollbackReport rollback() {
        if (!rollingBack.compareAndSet(false, true)) {
            log.warn("Rollback already in progress, request ignored.");
            return RollbackReport.notStarted();
        }
        try {
            List<ResourceSnapshot> pending = getSnapshots();
            if (pending.isEmpty()) {
                log.info("No resource state to roll back.");
                return RollbackReport.notStarted();
            }
            return doRollback(pending);
        } finally {
            rollingBack.set(false);
        }
    }

    private RollbackReport doRollback(List<ResourceSnapshot> pending) {
        long start = System.currentTimeMillis();
        totalRollbacks.incrementAndGet();
        lastRollbackTime.set(clock.millis());
        String startId = audit.record(EventType.RECOVERY_STARTED,
                Map.of("resource_count", pending.size()));
        log.info("Rolling back {} resources", pending.size());

        AtomicBoolean pacing = new AtomicBoolean(true);
        Thread pacer = new Thread(() -> pacingLoop(pacing), "fuse-recovery-pacer");
        pacer.setDaemon(true);
        pacer.start();

        List<String> restored = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        try {
            for (int i = pending.size() - 1; i >= 0; i--) {
                waitWhilePaused();
                ResourceSnapshot snapshot = pending.get(i);
                if (restoreOne(snapshot)) {
                    restored.add(snapshot.getResourceId());
                } else {
                    failed.add(snapshot.getResourceId());
                }
                if (i > 0) {
                    pause(recoveryIntervalMs);
                }
            }
        } finally {
            pacing.set(false);
            paused.set(false);
            pacer.interrupt();
        }

        lock.lock();
        try {
            if (failed.isEmpty()) {
                state.clear();
            } else {
                // 只保留失败的资源，等待下次回滚
                state.keySet().retainAll(new HashSet<>(failed));
            }
        } finally {
            lock.unlock();
        }

        RollbackReport report = new RollbackReport(restored, failed, true, System.currentTimeMillis() - start);
        totalRestored.addAndGet(restored.size());
        totalFailed.addAndGet(failed.size());
        if (report.isSuccess()) {
            successfulRollbacks.incrementAndGet();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("restored", restored.size());
        details.put("failed", failed.size());
        details.put("success_rate", report.getSuccessRate());
        details.put("success", report.isSuccess());
        audit.record(EventType.RECOVERY_COMPLETED, details, startId);

        log.info("Rollback finished: {}", report);
        return report;
    }

    private boolean restoreOne(ResourceSnapshot snapshot) {
        Restorer restorer = restorers.get(snapshot.getResourceType());
        if (restorer == null) {
            log.warn("No restorer for resource '{}' of type '{}'",
                    snapshot.getResourceId(), snapshot.getResourceType());
            return false;
        }
        try {
            Object resource = restorer.restore(snapshot);
            if (resource == null) {
                log.warn("Restorer returned nothing for resource '{}'", snapshot.getResourceId());
                return false;
            }
            // 重新注册，使用默认的按类型释放
            registry.register(snapshot.getResourceId(), resource, snapshot.getMetadata(), null);
            log.debug("Resource '{}' restored", snapshot.getResourceId());
            return true;
        } catch (Exception e) {
            log.error("Failed to restore resource '{}': {}", snapshot.getResourceId(), e.getMessage(), e);
            return false;
        }
    }

    private void pacingLoop(AtomicBoolean pacing) {
        long pausedAt = 0;
        while (pacing.get()) {
            double usage = probe.getUsagePercent();
            if (!paused.get() && usage > memoryThreshold) {
                paused.set(true);
                pausedAt = System.currentTimeMillis();
                pauseCount.incrementAndGet();
                log.warn("Memory at {}% during rollback, pausing restores", String.format("%.1f", usage));
                gcPass.run();
            } else if (paused.get()) {
                boolean recovered = usage <= memoryThreshold - RESUME_MARGIN;
                boolean timedOut = System.currentTimeMillis() - pausedAt > maxPauseSeconds * 1000;
                if (recovered || timedOut) {
                    paused.set(false);
                    log.info("Resuming rollback ({})", recovered ? "memory recovered" : "pause timed out");
                }
            }
            if (!pause(PACER_POLL_MS)) {
                break;
            }
        }
    }

    private void waitWhilePaused() {
        while (paused.get()) {
            if (!pause(PACER_POLL_MS / 2)) {
                return;
            }
        }
    }

    /** @return 被中断时返回false */
    private static boolean pause(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== 配置与统计 ====================

    /** 单个资源恢复后的间隔，截断到[10ms, 2s] */
    public void setRecoveryIntervalMs(long intervalMs) {
        this.recoveryIntervalMs = Math.max(10, Math.min(2000, intervalMs));
    }

    /** 暂停恢复的内存阈值，截断到[50, 95] */
    public void setMemoryThreshold(double threshold) {
        this.memoryThreshold = Math.max(50.0, Math.min(95.0, threshold));
    }

    public void setMaxPauseSeconds(long seconds) {
        this.maxPauseSeconds = Math.max(1, seconds);
    }

    public void setGcPass(Runnable gcPass) {
        this.gcPass = gcPass;
    }

    public List<ResourceSnapshot> getSnapshots() {
        lock.lock();
        try {
            return new ArrayList<>(state.values());
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPendingState() {
        lock.lock();
        try {
            return !state.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRollingBack() { return rollingBack.get(); }
    public long getRecoveryIntervalMs() { return recoveryIntervalMs; }
    public double getMemoryThreshold() { return memoryThreshold; }

    public Map<String, Object> getRecoveryStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_rollbacks", totalRollbacks.get());
        stats.put("successful_rollbacks", successfulRollbacks.get());
        stats.put("total_restored", totalRestored.get());
        stats.put("total_failed", totalFailed.get());
        stats.put("pause_count", pauseCount.get());
        stats.put("last_rollback_time", lastRollbackTime.get());
        stats.put("pending_resources", getSnapshots().size());
        stats.put("registered_restorers", new TreeSet<>(restorers.keySet()));
        return stats;
    }

    /** 清空快照状态与统计 */
    public void reset() {
        lock.lock();
        try {
            state.clear();
        } finally {
            lock.unlock();
        }
        totalRollbacks.set(0);
        successfulRollbacks.set(0);
        totalRestored.set(0);
        totalFailed.set(0);
        pauseCount.set(0);
        lastRollbackTime.set(0);
    }
}
