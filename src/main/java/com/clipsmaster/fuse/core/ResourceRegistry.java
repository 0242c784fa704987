package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.model.ReleaseStats;
import com.clipsmaster.fuse.model.ResourceHandle;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 资源注册表接口：受管资源引用的唯一持有者。
 *
 * 外部协作方（如分析模块）通过注册把大对象交给熔断器托管，
 * 压力升高时由缓解动作按类型批量释放。
 */
public interface ResourceRegistry {

    /**
     * 注册资源。标识符重复时覆盖旧句柄。
     *
     * @param resourceId 资源标识，推荐格式 "类型标签:具体名称"
     * @param resource   资源对象
     * @param metadata   元数据（size_mb、pinned、incremental_release等），可为null
     * @param releaser   资源专属释放函数，为null时按类型分派
     */
    void register(String resourceId, Object resource, Map<String, Object> metadata, Releaser releaser);

    /**
     * 释放资源。未知标识或被锁定的资源返回false且不产生副作用。
     *
     * @return 释放（含增量释放）成功返回true
     */
    boolean release(String resourceId);

    /**
     * 批量释放满足条件的资源（跳过锁定资源）。
     *
     * @return 成功释放的数量
     */
    int releaseAll(Predicate<ResourceHandle> filter);

    boolean contains(String resourceId);

    /** 按注册顺序返回当前全部句柄 */
    List<ResourceHandle> listHandles();

    /**
     * 为资源类型注册释放策略，覆盖默认策略。
     */
    void registerReleaser(String typeTag, Releaser releaser);

    ReleaseStats getStats();
}
