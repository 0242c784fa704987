package com.clipsmaster.fuse.releasers;

import com.clipsmaster.fuse.model.ReleaseResult;
import com.clipsmaster.fuse.model.ResourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 模型权重缓存释放：先关闭其中的模型与分词器，再按通用方式释放。
 */
public class ModelWeightsReleaser extends GenericReleaser {

    private static final Logger log = LoggerFactory.getLogger(ModelWeightsReleaser.class);

    private static final String[] CLOSEABLE_KEYS = {"model", "tokenizer"};

    @Override
    public ReleaseResult release(ResourceHandle handle) throws Exception {
        Object resource = handle.getResource();
        if (resource instanceof Map) {
            Map<?, ?> weights = (Map<?, ?>) resource;
            for (String key : CLOSEABLE_KEYS) {
                Object part = weights.get(key);
                if (part instanceof AutoCloseable) {
                    ((AutoCloseable) part).close();
                    log.debug("Closed {} of model cache '{}'", key, handle.getId());
                }
            }
        }
        return super.release(handle);
    }
}
