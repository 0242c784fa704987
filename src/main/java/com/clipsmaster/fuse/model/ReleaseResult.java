package com.clipsmaster.fuse.model;

/**
 * 单次资源释放的结果。
 */
public enum ReleaseResult {
    /** 已完全释放，句柄从注册表移除 */
    RELEASED,
    /** 增量释放：只裁剪了部分内容，句柄保留 */
    PARTIAL,
    /** 释放失败，句柄保留以便后续重试 */
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }
}
