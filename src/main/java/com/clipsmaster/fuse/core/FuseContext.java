package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.diagnosis.DiagnosisResult;
import com.clipsmaster.fuse.model.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 熔断器上下文：对外暴露的全部操作入口。
 *
 * 持有监控、控制、调度、释放、验证、恢复、审计、诊断各组件，
 * 取代全局单例；同一进程可以存在多个互不影响的上下文。
 *
 * 典型用法：
 * <pre>
 * FuseContext fuse = DefaultFuseContext.create(config, probe, storage, clock);
 * fuse.registerResource("render_cache:frame_12", frames, Map.of("size_mb", 64), null);
 * fuse.start();
 * ...
 * fuse.shutdown();
 * </pre>
 */
public interface FuseContext {

    // ---- 资源 ----

    /**
     * 把资源交给熔断器托管。
     *
     * @param releaser 资源专属释放函数，为null时按类型分派
     */
    void registerResource(String resourceId, Object resource, Map<String, Object> metadata, Releaser releaser);

    /**
     * 立即释放一个资源。未知或锁定的资源返回false。
     */
    boolean releaseResource(String resourceId);

    // ---- 熔断 ----

    /**
     * 强制触发指定级别。
     *
     * @param testMode 只记录，不执行动作
     * @return 是否实际触发
     */
    boolean forceTrigger(FuseLevel level, boolean testMode);

    FuseLevel getCurrentLevel();

    /** 最近的动作与恢复记录，按时间正序 */
    List<ActionRecord> getActionHistory();

    // ---- 审计 ----

    /**
     * 记录一条事件。
     *
     * @param relatedId 关联事件ID，可为null
     * @return 事件ID，存储失败时为空字符串
     */
    String recordEvent(String eventType, Map<String, Object> details, String relatedId);

    /** 按条件查询事件，最新的在前 */
    List<FuseEvent> queryEvents(EventQuery query, TimeRange timeRange, int limit);

    // ---- 诊断 ----

    DiagnosisResult diagnose(List<Double> samples, Map<String, Object> context);

    boolean exportCases(Path path);

    /**
     * @return 导入的案例数，失败时为-1
     */
    int importCases(Path path);

    // ---- 生命周期 ----

    /**
     * 启动后台采样与评估循环。
     */
    void start();

    /**
     * 停止后台循环并关闭事件存储。
     */
    void shutdown();
}
