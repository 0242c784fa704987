package com.clipsmaster.fuse.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 事件查询条件：事件类型 + details子字段相等匹配。
 */
public class EventQuery {

    private final String eventType;
    private final Map<String, Object> detailFilters;

    private EventQuery(String eventType, Map<String, Object> detailFilters) {
        this.eventType = eventType;
        this.detailFilters = detailFilters;
    }

    public static EventQuery any() {
        return new EventQuery(null, Collections.emptyMap());
    }

    public static EventQuery ofType(EventType type) {
        return new EventQuery(type.value(), Collections.emptyMap());
    }

    public static EventQuery ofType(String type) {
        return new EventQuery(type, Collections.emptyMap());
    }

    /** 追加一个details字段过滤条件，返回新的查询对象 */
    public EventQuery withDetail(String key, Object value) {
        Map<String, Object> filters = new LinkedHashMap<>(detailFilters);
        filters.put(key, value);
        return new EventQuery(eventType, Collections.unmodifiableMap(filters));
    }

    public boolean matches(FuseEvent event) {
        if (eventType != null && !eventType.equals(event.getEventType())) {
            return false;
        }
        for (Map.Entry<String, Object> filter : detailFilters.entrySet()) {
            Object actual = event.getDetails().get(filter.getKey());
            if (!valueEquals(filter.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    /** 数值按double比较，避免Integer/Long/Double混用导致不相等 */
    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return ((Number) expected).doubleValue() == ((Number) actual).doubleValue();
        }
        return Objects.equals(expected, actual);
    }

    public String getEventType() { return eventType; }
    public Map<String, Object> getDetailFilters() { return detailFilters; }
}
