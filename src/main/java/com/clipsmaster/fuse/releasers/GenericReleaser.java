package com.clipsmaster.fuse.releasers;

import com.clipsmaster.fuse.core.Releaser;
import com.clipsmaster.fuse.model.ReleaseResult;
import com.clipsmaster.fuse.model.ResourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;

/**
 * 通用释放策略：清空容器、关闭可关闭对象，最后丢弃引用。
 */
public class GenericReleaser implements Releaser {

    private static final Logger log = LoggerFactory.getLogger(GenericReleaser.class);

    @Override
    public ReleaseResult release(ResourceHandle handle) throws Exception {
        Object resource = handle.getResource();
        try {
            if (resource instanceof Map) {
                ((Map<?, ?>) resource).clear();
            } else if (resource instanceof Collection) {
                ((Collection<?>) resource).clear();
            }
        } catch (UnsupportedOperationException e) {
            // 不可变容器无法清空，丢弃引用即可
            log.debug("Resource '{}' is an immutable container, dropping reference only", handle.getId());
        }
        if (resource instanceof AutoCloseable) {
            ((AutoCloseable) resource).close();
        }
        handle.clearResource();
        return ReleaseResult.RELEASED;
    }
}
