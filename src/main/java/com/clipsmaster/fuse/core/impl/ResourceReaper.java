package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.Releaser;
import com.clipsmaster.fuse.model.ReleaseResult;
import com.clipsmaster.fuse.model.ReleaseStats;
import com.clipsmaster.fuse.model.ResourceHandle;
import com.clipsmaster.fuse.model.ResourceType;
import com.clipsmaster.fuse.releasers.GenericReleaser;
import com.clipsmaster.fuse.releasers.ModelWeightsReleaser;
import com.clipsmaster.fuse.releasers.RenderCacheReleaser;
import com.clipsmaster.fuse.releasers.SubtitleIndexReleaser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * 资源回收器：按类型标签分派释放策略，并累计释放统计。
 *
 * 分派顺序：句柄自带释放函数 → 类型释放策略 → 通用释放策略。
 */
public class ResourceReaper {

    private static final Logger log = LoggerFactory.getLogger(ResourceReaper.class);

    /** 类型释放策略注册表：typeTag -> Releaser */
    private final ConcurrentHashMap<String, Releaser> releasers = new ConcurrentHashMap<>();
    private final Releaser genericReleaser = new GenericReleaser();
    private final Clock clock;

    // ---- 统计 ----
    private final AtomicLong totalReleased = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> releasedByType = new ConcurrentHashMap<>();
    private final DoubleAdder estimatedMbFreed = new DoubleAdder();
    private final AtomicLong lastReleaseTime = new AtomicLong();

    public ResourceReaper(Clock clock) {
        this.clock = clock;
    }

    /** 注册内置的类型释放策略 */
    public static ResourceReaper withDefaults(Clock clock) {
        ResourceReaper reaper = new ResourceReaper(clock);
        reaper.registerReleaser(ResourceType.MODEL_WEIGHTS_CACHE.getTag(), new ModelWeightsReleaser());
        reaper.registerReleaser(ResourceType.RENDER_CACHE.getTag(), new RenderCacheReleaser());
        reaper.registerReleaser(ResourceType.SUBTITLE_INDEX.getTag(), new SubtitleIndexReleaser());
        return reaper;
    }

    public void registerReleaser(String typeTag, Releaser releaser) {
        Releaser previous = releasers.put(typeTag, releaser);
        if (previous != null) {
            log.info("Releaser for type '{}' replaced by {}", typeTag, releaser.getClass().getSimpleName());
        }
    }

    /**
     * 释放句柄并更新统计。释放策略抛出异常视为失败。
     */
    public ReleaseResult release(ResourceHandle handle) {
        Releaser releaser = resolve(handle);
        ReleaseResult result;
        try {
            result = releaser.release(handle);
            if (result == null) {
                result = ReleaseResult.FAILED;
            }
        } catch (Exception e) {
            log.error("Releasing resource '{}' failed: {}", handle.getId(), e.getMessage(), e);
            result = ReleaseResult.FAILED;
        }

        if (result.isSuccess()) {
            totalReleased.incrementAndGet();
            releasedByType.computeIfAbsent(handle.getType().getTag(), k -> new AtomicLong()).incrementAndGet();
            estimatedMbFreed.add(handle.getSizeMb());
            lastReleaseTime.set(clock.millis());
        } else {
            totalFailed.incrementAndGet();
        }
        return result;
    }

    private Releaser resolve(ResourceHandle handle) {
        if (handle.getReleaser() != null) {
            return handle.getReleaser();
        }
        Releaser typed = releasers.get(handle.getType().getTag());
        return typed != null ? typed : genericReleaser;
    }

    public ReleaseStats getStats() {
        Map<String, Long> byType = new LinkedHashMap<>();
        releasedByType.forEach((type, count) -> byType.put(type, count.get()));
        return new ReleaseStats(totalReleased.get(), totalFailed.get(), byType,
                estimatedMbFreed.sum(), lastReleaseTime.get());
    }
}
