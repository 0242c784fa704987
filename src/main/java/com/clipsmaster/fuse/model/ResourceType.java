package com.clipsmaster.fuse.model;

import java.util.Map;

/**
 * 受管资源类型标签。标识符形如 "render_cache:frame_12"，冒号前为类型标签。
 */
public enum ResourceType {
    MODEL_SHARDS("model_shards"),
    MODEL_WEIGHTS_CACHE("model_weights_cache"),
    RENDER_CACHE("render_cache"),
    TEMP_BUFFERS("temp_buffers"),
    AUDIO_CACHE("audio_cache"),
    SUBTITLE_INDEX("subtitle_index"),
    UNKNOWN("unknown");

    private final String tag;

    ResourceType(String tag) {
        this.tag = tag;
    }

    public String getTag() { return tag; }

    public static ResourceType fromTag(String tag) {
        if (tag == null) {
            return UNKNOWN;
        }
        for (ResourceType type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    /**
     * 从资源标识符前缀或元数据中的type字段推断类型。
     */
    public static ResourceType resolve(String resourceId, Map<String, Object> metadata) {
        if (resourceId != null) {
            int colon = resourceId.indexOf(':');
            if (colon > 0) {
                ResourceType byPrefix = fromTag(resourceId.substring(0, colon));
                if (byPrefix != UNKNOWN) {
                    return byPrefix;
                }
            }
        }
        if (metadata != null && metadata.get("type") != null) {
            return fromTag(String.valueOf(metadata.get("type")));
        }
        return UNKNOWN;
    }
}
