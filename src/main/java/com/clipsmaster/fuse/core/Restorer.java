package com.clipsmaster.fuse.core;

import com.clipsmaster.fuse.model.ResourceSnapshot;

/**
 * 资源恢复器。按快照中的资源类型注册，回滚时根据快照重建资源对象。
 */
@FunctionalInterface
public interface Restorer {

    /**
     * @return 重建的资源对象；返回null视为恢复失败
     */
    Object restore(ResourceSnapshot snapshot) throws Exception;
}
