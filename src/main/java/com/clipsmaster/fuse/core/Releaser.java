package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.model.ReleaseResult;
import com.clipsmaster.fuse.model.ResourceHandle;

/**
 * 资源释放策略。按资源类型标签注册，或随资源句柄单独提供。
 */
@FunctionalInterface
public interface Releaser {

    /**
     * 释放句柄持有的资源。抛出异常视为释放失败。
     *
     * @return RELEASED表示可移除句柄，PARTIAL表示只做了增量裁剪
     */
    ReleaseResult release(ResourceHandle handle) throws Exception;
}
