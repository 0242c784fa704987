package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 释放临时缓冲、音频缓存和字幕索引（锁定的资源除外）。
 */
public class ReleaseResourcesAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReleaseResourcesAction.class);

    @Override
    public boolean execute(ActionContext context) {
        int released = context.getResourceRegistry().releaseAll(HandleSelection.ofTypes(
                ResourceType.TEMP_BUFFERS, ResourceType.AUDIO_CACHE, ResourceType.SUBTITLE_INDEX));
        log.info("Released {} transient resources", released);
        return true;
    }
}
