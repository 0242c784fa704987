package com.clipsmaster.fuse.releasers;

import com.clipsmaster.fuse.model.ReleaseResult;
import com.clipsmaster.fuse.model.ResourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * 字幕索引释放。
 * 元数据 incremental_release=true 时只保留最近 keep_segments 段（默认10），句柄继续保留；
 * 否则整体释放。
 */
public class SubtitleIndexReleaser extends GenericReleaser {

    private static final Logger log = LoggerFactory.getLogger(SubtitleIndexReleaser.class);

    public static final int DEFAULT_KEEP_SEGMENTS = 10;

    @Override
    public ReleaseResult release(ResourceHandle handle) throws Exception {
        if (handle.getBooleanMetadata("incremental_release")) {
            List<?> segments = segmentsOf(handle.getResource());
            int keep = keepSegments(handle);
            if (segments != null && segments.size() > keep) {
                int removed = segments.size() - keep;
                segments.subList(0, removed).clear();
                log.info("Trimmed {} old segments from subtitle index '{}', kept {}",
                        removed, handle.getId(), keep);
                return ReleaseResult.PARTIAL;
            }
        }
        return super.release(handle);
    }

    private static List<?> segmentsOf(Object resource) {
        if (resource instanceof List) {
            return (List<?>) resource;
        }
        if (resource instanceof Map) {
            Object segments = ((Map<?, ?>) resource).get("segments");
            if (segments instanceof List) {
                return (List<?>) segments;
            }
        }
        return null;
    }

    private static int keepSegments(ResourceHandle handle) {
        Object value = handle.getMetadata().get("keep_segments");
        if (value instanceof Number) {
            return Math.max(0, ((Number) value).intValue());
        }
        return DEFAULT_KEEP_SEGMENTS;
    }
}
