package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ResourceRegistry;
import com.clipsmaster.fuse.model.ResourceHandle;
import com.clipsmaster.fuse.model.ResourceType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 按类型从注册表中挑选资源句柄的工具方法。
 */
final class HandleSelection {

    private HandleSelection() {}

    static Predicate<ResourceHandle> ofTypes(ResourceType first, ResourceType... rest) {
        Set<ResourceType> types = EnumSet.of(first, rest);
        return handle -> types.contains(handle.getType());
    }

    /** 按注册顺序返回指定类型的未锁定句柄 */
    static List<ResourceHandle> releasable(ResourceRegistry registry, Predicate<ResourceHandle> filter) {
        List<ResourceHandle> selected = new ArrayList<>();
        for (ResourceHandle handle : registry.listHandles()) {
            if (!handle.isPinned() && filter.test(handle)) {
                selected.add(handle);
            }
        }
        return selected;
    }

    /**
     * 逐个释放句柄。
     *
     * @return 成功释放的数量
     */
    static int releaseEach(ResourceRegistry registry, List<ResourceHandle> handles) {
        int released = 0;
        for (ResourceHandle handle : handles) {
            if (registry.release(handle.getId())) {
                released++;
            }
        }
        return released;
    }
}
