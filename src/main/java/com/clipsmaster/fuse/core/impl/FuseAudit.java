package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.EventStorage;
import com.clipsmaster.fuse.core.MemoryProbe;
import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.EventType;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 熔断审计日志。
 *
 * 为每个事件附加当时的内存快照后写入存储，并维护trace的开始/结束关联。
 * 事件按产生顺序追加；存储失败只记录日志，返回空ID。
 */
public class FuseAudit {

    private static final Logger log = LoggerFactory.getLogger(FuseAudit.class);

    public static final int DEFAULT_QUERY_LIMIT = 100;

    private final EventStorage storage;
    private final MemoryProbe probe;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    /** 进行中的trace：kind -> 开始事件ID */
    private final Map<String, String> activeTraces = new HashMap<>();

    public FuseAudit(EventStorage storage, MemoryProbe probe, Clock clock) {
        this.storage = storage;
        this.probe = probe;
        this.clock = clock;
    }

    // ==================== 记录 ====================

    public String record(EventType type, Map<String, Object> details) {
        return record(type.value(), details, null);
    }

    public String record(EventType type, Map<String, Object> details, String relatedId) {
        return record(type.value(), details, relatedId);
    }

    /**
     * 记录事件。
     *
     * @param relatedId 关联事件ID，可为null
     * @return 事件ID；存储失败时返回空字符串
     */
    public String record(String eventType, Map<String, Object> details, String relatedId) {
        List<String> related = (relatedId == null || relatedId.isEmpty())
                ? Collections.emptyList()
                : Collections.singletonList(relatedId);
        lock.lock();
        try {
            FuseEvent event = new FuseEvent(
                    UUID.randomUUID().toString(),
                    eventType,
                    clock.millis(),
                    memorySnapshot(),
                    details,
                    related);
            return storage.store(event);
        } catch (RuntimeException e) {
            log.error("Failed to record {} event: {}", eventType, e.getMessage(), e);
            return "";
        } finally {
            lock.unlock();
        }
    }

    /** 记录一次内存快照事件 */
    public String recordMemorySnapshot() {
        return record(EventType.MEMORY_SNAPSHOT, Collections.emptyMap());
    }

    /**
     * 开始一段trace，记录 {kind}_started 事件。
     */
    public String startTrace(String kind, Map<String, Object> details) {
        Map<String, Object> merged = new LinkedHashMap<>(details != null ? details : Map.of());
        merged.put("trace_type", kind);
        merged.put("trace_start", clock.millis());
        String id = record(kind + "_started", merged, null);
        if (!id.isEmpty()) {
            lock.lock();
            try {
                activeTraces.put(kind, id);
            } finally {
                lock.unlock();
            }
        }
        return id;
    }

    /**
     * 结束trace，记录与开始事件关联的 {kind}_completed 事件。
     *
     * @return 事件ID；没有进行中的同类trace时返回空字符串
     */
    public String endTrace(String kind, Map<String, Object> details) {
        String startId;
        lock.lock();
        try {
            startId = activeTraces.remove(kind);
        } finally {
            lock.unlock();
        }
        if (startId == null) {
            log.warn("No active trace of kind '{}' to end", kind);
            return "";
        }
        Map<String, Object> merged = new LinkedHashMap<>(details != null ? details : Map.of());
        merged.put("trace_type", kind);
        return record(kind + "_completed", merged, startId);
    }

    // ==================== 查询 ====================

    public FuseEvent getEvent(String eventId) {
        return storage.get(eventId);
    }

    public List<FuseEvent> query(EventQuery query, TimeRange timeRange, int limit) {
        return storage.query(query != null ? query : EventQuery.any(), timeRange, limit);
    }

    public List<FuseEvent> query(EventQuery query) {
        return query(query, null, DEFAULT_QUERY_LIMIT);
    }

    /**
     * 关联事件：该事件引用的事件，以及引用了该事件的事件，按时间正序。
     */
    public List<FuseEvent> getRelatedEvents(String eventId) {
        FuseEvent event = storage.get(eventId);
        if (event == null) {
            return Collections.emptyList();
        }
        Map<String, FuseEvent> related = new LinkedHashMap<>();
        for (String id : event.getRelatedIds()) {
            FuseEvent target = storage.get(id);
            if (target != null) {
                related.put(id, target);
            }
        }
        for (FuseEvent referencing : storage.findReferencing(eventId)) {
            related.put(referencing.getEventId(), referencing);
        }
        List<FuseEvent> result = new ArrayList<>(related.values());
        result.sort(Comparator.comparingLong(FuseEvent::getTimestamp));
        return result;
    }

    /**
     * 当前内存快照：进程读数与受控范围（系统）读数。
     */
    public Map<String, Object> memorySnapshot() {
        Map<String, Object> process = new LinkedHashMap<>();
        process.put("used_mb", round(probe.getProcessUsedMb()));
        process.put("max_mb", round(probe.getProcessMaxMb()));

        Map<String, Object> system = new LinkedHashMap<>();
        system.put("total_mb", round(probe.getTotalMb()));
        system.put("available_mb", round(probe.getAvailableMb()));
        system.put("used_mb", round(probe.getUsedMb()));
        system.put("percent", round(probe.getUsagePercent()));

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("process", process);
        snapshot.put("system", system);
        return snapshot;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public EventStorage getStorage() { return storage; }
    public Clock getClock() { return clock; }
}
