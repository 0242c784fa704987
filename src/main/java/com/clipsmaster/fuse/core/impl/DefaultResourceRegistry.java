package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.Releaser;
import com.clipsmaster.fuse.core.ResourceRegistry;
import com.clipsmaster.fuse.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * 资源注册表默认实现。
 *
 * 每次实际分派的释放（成功、增量或失败）都更新统计并产生一条 resource_released 审计事件；
 * 未知标识与被锁定资源不分派，也不留痕迹。
 */
public class DefaultResourceRegistry implements ResourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultResourceRegistry.class);

    /** 按注册顺序保存：resourceId -> handle */
    private final LinkedHashMap<String, ResourceHandle> handles = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final ResourceReaper reaper;
    private final FuseAudit audit;
    private final Clock clock;

    public DefaultResourceRegistry(ResourceReaper reaper, FuseAudit audit, Clock clock) {
        this.reaper = reaper;
        this.audit = audit;
        this.clock = clock;
    }

    @Override
    public void register(String resourceId, Object resource, Map<String, Object> metadata, Releaser releaser) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("Resource id must not be null or blank");
        }
        ResourceHandle handle = new ResourceHandle(resourceId, resource, metadata, releaser, clock.millis());
        ResourceHandle previous;
        lock.lock();
        try {
            // 覆盖时移到末尾，保持“最近注册在后”的顺序
            previous = handles.remove(resourceId);
            handles.put(resourceId, handle);
        } finally {
            lock.unlock();
        }
        if (previous != null) {
            log.info("Resource '{}' re-registered, previous handle replaced.", resourceId);
        } else {
            log.debug("Resource '{}' registered as {}", resourceId, handle.getType().getTag());
        }
    }

    @Override
    public boolean release(String resourceId) {
        ResourceHandle handle;
        ReleaseResult result;
        lock.lock();
        try {
            handle = handles.get(resourceId);
            if (handle == null) {
                log.debug("Release requested for unknown resource '{}'", resourceId);
                return false;
            }
            if (handle.isPinned()) {
                log.warn("Resource '{}' is pinned, release rejected.", resourceId);
                return false;
            }
            result = reaper.release(handle);
            if (result == ReleaseResult.RELEASED) {
                handles.remove(resourceId);
                handle.clearResource();
            }
        } finally {
            lock.unlock();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource_id", resourceId);
        details.put("resource_type", handle.getType().getTag());
        details.put("result", result.name());
        details.put("success", result.isSuccess());
        details.put("size_mb", handle.getSizeMb());
        audit.record(EventType.RESOURCE_RELEASED, details);

        if (result.isSuccess()) {
            log.info("Resource '{}' released ({}), ~{}MB", resourceId, result, handle.getSizeMb());
        }
        return result.isSuccess();
    }

    @Override
    public int releaseAll(Predicate<ResourceHandle> filter) {
        int released = 0;
        for (ResourceHandle handle : listHandles()) {
            if (handle.isPinned() || !filter.test(handle)) {
                continue;
            }
            if (release(handle.getId())) {
                released++;
            }
        }
        return released;
    }

    @Override
    public boolean contains(String resourceId) {
        lock.lock();
        try {
            return handles.containsKey(resourceId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ResourceHandle> listHandles() {
        lock.lock();
        try {
            return new ArrayList<>(handles.values());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void registerReleaser(String typeTag, Releaser releaser) {
        reaper.registerReleaser(typeTag, releaser);
    }

    @Override
    public ReleaseStats getStats() {
        return reaper.getStats();
    }
}
