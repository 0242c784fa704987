package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.core.EventStorage;
import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存事件存储。容量有限，超出时淘汰最旧事件，并维护按类型的索引。
 */
public class MemoryEventStorage implements EventStorage {

    private static final Logger log = LoggerFactory.getLogger(MemoryEventStorage.class);

    private final int maxEvents;
    private final ReentrantLock lock = new ReentrantLock();

    /** 按写入顺序保存：eventId -> event */
    private final LinkedHashMap<String, FuseEvent> events = new LinkedHashMap<>();
    /** 类型索引：eventType -> eventId集合 */
    private final Map<String, LinkedHashSet<String>> typeIndex = new HashMap<>();

    public MemoryEventStorage() {
        this(1000);
    }

    public MemoryEventStorage(int maxEvents) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive, got: " + maxEvents);
        }
        this.maxEvents = maxEvents;
    }

    @Override
    public String store(FuseEvent event) {
        lock.lock();
        try {
            events.put(event.getEventId(), event);
            typeIndex.computeIfAbsent(event.getEventType(), k -> new LinkedHashSet<>())
                    .add(event.getEventId());

            while (events.size() > maxEvents) {
                evictOldest();
            }
            return event.getEventId();
        } finally {
            lock.unlock();
        }
    }

    private void evictOldest() {
        Iterator<Map.Entry<String, FuseEvent>> it = events.entrySet().iterator();
        Map.Entry<String, FuseEvent> eldest = it.next();
        it.remove();
        Set<String> ids = typeIndex.get(eldest.getValue().getEventType());
        if (ids != null) {
            ids.remove(eldest.getKey());
            if (ids.isEmpty()) {
                typeIndex.remove(eldest.getValue().getEventType());
            }
        }
        log.debug("Evicted oldest event {}", eldest.getKey());
    }

    @Override
    public FuseEvent get(String eventId) {
        lock.lock();
        try {
            return events.get(eventId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<FuseEvent> query(EventQuery query, TimeRange timeRange, int limit) {
        List<FuseEvent> candidates = new ArrayList<>();
        lock.lock();
        try {
            if (query.getEventType() != null) {
                Set<String> ids = typeIndex.getOrDefault(query.getEventType(), new LinkedHashSet<>());
                for (String id : ids) {
                    candidates.add(events.get(id));
                }
            } else {
                candidates.addAll(events.values());
            }
        } finally {
            lock.unlock();
        }
        return EventFilters.newestFirst(candidates, query, timeRange, limit);
    }

    @Override
    public List<FuseEvent> findReferencing(String eventId) {
        List<FuseEvent> result = new ArrayList<>();
        lock.lock();
        try {
            for (FuseEvent event : events.values()) {
                if (event.getRelatedIds().contains(eventId)) {
                    result.add(event);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            events.clear();
            typeIndex.clear();
        } finally {
            lock.unlock();
        }
    }
}
