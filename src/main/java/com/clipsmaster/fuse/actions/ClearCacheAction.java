package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 清空渲染缓存与音频缓存。
 */
public class ClearCacheAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ClearCacheAction.class);

    @Override
    public boolean execute(ActionContext context) {
        int released = context.getResourceRegistry().releaseAll(
                HandleSelection.ofTypes(ResourceType.RENDER_CACHE, ResourceType.AUDIO_CACHE));
        log.info("Cleared {} cache resources", released);
        return true;
    }
}
