package com.clipsmaster.fuse.model;

import com.clipsmaster.fuse.core.Releaser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 受管资源句柄。注册表是资源引用的唯一持有者，释放后引用被清空。
 */
public class ResourceHandle {

    private final String id;
    private final ResourceType type;
    private final Map<String, Object> metadata;
    /** 资源自带的释放函数，null表示按类型分派 */
    private final Releaser releaser;
    private final long registeredAt;

    private volatile Object resource;

    public ResourceHandle(String id, Object resource, Map<String, Object> metadata,
                          Releaser releaser, long registeredAt) {
        this.id = id;
        this.resource = resource;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
        this.type = ResourceType.resolve(id, this.metadata);
        this.releaser = releaser;
        this.registeredAt = registeredAt;
    }

    /** 元数据标记 pinned 或 is_locked 的资源不可释放 */
    public boolean isPinned() {
        return isTrue(metadata.get("pinned")) || isTrue(metadata.get("is_locked"));
    }

    /** 元数据中的 size_mb，缺省为0 */
    public double getSizeMb() {
        Object size = metadata.get("size_mb");
        if (size instanceof Number) {
            return ((Number) size).doubleValue();
        }
        if (size instanceof String) {
            try {
                return Double.parseDouble((String) size);
            } catch (NumberFormatException ignored) {
                return 0.0;
            }
        }
        return 0.0;
    }

    public boolean getBooleanMetadata(String key) {
        return isTrue(metadata.get(key));
    }

    /** 清空资源引用 */
    public void clearResource() {
        this.resource = null;
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(String.valueOf(value));
    }

    public String getId() { return id; }
    public ResourceType getType() { return type; }
    public Object getResource() { return resource; }
    public Map<String, Object> getMetadata() { return metadata; }
    public Releaser getReleaser() { return releaser; }
    public long getRegisteredAt() { return registeredAt; }

    @Override
    public String toString() {
        return "ResourceHandle{" + id + ", type=" + type.getTag() + ", pinned=" + isPinned() + "}";
    }
}
