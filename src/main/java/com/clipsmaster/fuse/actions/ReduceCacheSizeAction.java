package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.core.ResourceRegistry;
import com.clipsmaster.fuse.model.ResourceHandle;
import com.clipsmaster.fuse.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 缩减缓存：释放较早注册的一半渲染缓存，并对支持增量释放的字幕索引做裁剪。
 */
public class ReduceCacheSizeAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReduceCacheSizeAction.class);

    @Override
    public boolean execute(ActionContext context) {
        ResourceRegistry registry = context.getResourceRegistry();

        List<ResourceHandle> renderCaches = HandleSelection.releasable(registry,
                HandleSelection.ofTypes(ResourceType.RENDER_CACHE));
        int olderHalf = renderCaches.isEmpty() ? 0 : Math.max(1, renderCaches.size() / 2);
        int released = HandleSelection.releaseEach(registry, renderCaches.subList(0, olderHalf));

        List<ResourceHandle> subtitleIndexes = HandleSelection.releasable(registry,
                handle -> handle.getType() == ResourceType.SUBTITLE_INDEX
                        && handle.getBooleanMetadata("incremental_release"));
        int trimmed = HandleSelection.releaseEach(registry, subtitleIndexes);

        log.info("Cache reduced: {} of {} render caches released, {} subtitle indexes trimmed",
                released, renderCaches.size(), trimmed);
        return true;
    }
}
