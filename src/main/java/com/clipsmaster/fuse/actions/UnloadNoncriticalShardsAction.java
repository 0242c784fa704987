package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.model.ResourceHandle;
import com.clipsmaster.fuse.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 卸载非关键模型分片。
 *
 * 参数：
 * - shards: 只卸载这些分片（资源ID或冒号后的名称），为空时卸载全部非关键分片 (LIST)
 */
public class UnloadNoncriticalShardsAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(UnloadNoncriticalShardsAction.class);

    @Override
    public boolean execute(ActionContext context) {
        List<String> shards = context.getListParameter("shards", List.of());

        List<ResourceHandle> candidates = HandleSelection.releasable(context.getResourceRegistry(),
                handle -> handle.getType() == ResourceType.MODEL_SHARDS
                        && !handle.getBooleanMetadata("critical")
                        && (shards.isEmpty() || shards.contains(handle.getId()) || shards.contains(shortName(handle))));
        int released = HandleSelection.releaseEach(context.getResourceRegistry(), candidates);

        log.info("Unloaded {} of {} non-critical model shards", released, candidates.size());
        return true;
    }

    private static String shortName(ResourceHandle handle) {
        String id = handle.getId();
        int colon = id.indexOf(':');
        return colon >= 0 ? id.substring(colon + 1) : id;
    }
}
