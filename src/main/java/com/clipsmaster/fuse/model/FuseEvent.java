package com.clipsmaster.fuse.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 审计事件。写入存储后不可变。
 *
 * JSON行格式：{event_id, event_type, timestamp, memory_usage, details, related_ids}
 *
 * 数值字段按JSON读回后的形态归一：落在int范围内的整数存为Integer，超出的存为Long，
 * 浮点数存为Double。同一事件写入任何存储再读回都与原事件相等。
 */
public class FuseEvent {

    private final String eventId;
    private final String eventType;
    /** 毫秒时间戳 */
    private final long timestamp;
    private final Map<String, Object> memoryUsage;
    private final Map<String, Object> details;
    private final List<String> relatedIds;

    @JsonCreator
    public FuseEvent(@JsonProperty("event_id") String eventId,
                     @JsonProperty("event_type") String eventType,
                     @JsonProperty("timestamp") long timestamp,
                     @JsonProperty("memory_usage") Map<String, Object> memoryUsage,
                     @JsonProperty("details") Map<String, Object> details,
                     @JsonProperty("related_ids") List<String> relatedIds) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.timestamp = timestamp;
        this.memoryUsage = immutableCopy(memoryUsage);
        this.details = immutableCopy(details);
        this.relatedIds = relatedIds != null ? List.copyOf(relatedIds) : Collections.emptyList();
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, normalize(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object normalize(Object value) {
        if (value instanceof Long) {
            long v = (Long) value;
            return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE ? (Object) (int) v : value;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<Object, Object>) value).forEach((k, v) -> copy.put(k, normalize(v)));
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(normalize(item));
            }
            return copy;
        }
        return value;
    }

    @JsonProperty("event_id")
    public String getEventId() { return eventId; }

    @JsonProperty("event_type")
    public String getEventType() { return eventType; }

    @JsonProperty("timestamp")
    public long getTimestamp() { return timestamp; }

    @JsonProperty("memory_usage")
    public Map<String, Object> getMemoryUsage() { return memoryUsage; }

    @JsonProperty("details")
    public Map<String, Object> getDetails() { return details; }

    @JsonProperty("related_ids")
    public List<String> getRelatedIds() { return relatedIds; }

    public boolean isType(EventType type) {
        return type.value().equals(eventType);
    }

    /** 读取details中的数值字段，不存在或非数值时返回null */
    public Double getNumberDetail(String key) {
        Object value = details.get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FuseEvent)) return false;
        FuseEvent that = (FuseEvent) o;
        return timestamp == that.timestamp
                && Objects.equals(eventId, that.eventId)
                && Objects.equals(eventType, that.eventType)
                && Objects.equals(memoryUsage, that.memoryUsage)
                && Objects.equals(details, that.details)
                && Objects.equals(relatedIds, that.relatedIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, eventType, timestamp, memoryUsage, details, relatedIds);
    }

    @Override
    public String toString() {
        return "FuseEvent{" + eventType + ", id=" + eventId + ", ts=" + timestamp
                + ", details=" + details + "}";
    }
}
