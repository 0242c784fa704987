package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 卸载模型权重缓存。
 */
public class UnloadModelAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(UnloadModelAction.class);

    @Override
    public boolean execute(ActionContext context) {
        int released = context.getResourceRegistry().releaseAll(
                HandleSelection.ofTypes(ResourceType.MODEL_WEIGHTS_CACHE));
        log.info("Unloaded {} model weight caches", released);
        return true;
    }
}
