package com.clipsmaster.fuse.releasers;

import com.clipsmaster.fuse.model.ReleaseResult;
import com.clipsmaster.fuse.model.ResourceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 渲染缓存释放。元数据 persist_to_disk=true 时先把字节内容写到 persist_path。
 */
public class RenderCacheReleaser extends GenericReleaser {

    private static final Logger log = LoggerFactory.getLogger(RenderCacheReleaser.class);

    @Override
    public ReleaseResult release(ResourceHandle handle) throws Exception {
        if (handle.getBooleanMetadata("persist_to_disk")) {
            Object pathValue = handle.getMetadata().get("persist_path");
            if (pathValue != null) {
                persist(handle, Paths.get(String.valueOf(pathValue)));
            } else {
                log.warn("Render cache '{}' requests persistence but has no persist_path", handle.getId());
            }
        }
        return super.release(handle);
    }

    private void persist(ResourceHandle handle, Path target) throws Exception {
        byte[] bytes;
        Object resource = handle.getResource();
        if (resource instanceof byte[]) {
            bytes = (byte[]) resource;
        } else if (resource instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) resource).duplicate();
            buffer.rewind();
            bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
        } else {
            log.warn("Render cache '{}' payload {} cannot be persisted", handle.getId(),
                    resource != null ? resource.getClass().getSimpleName() : "null");
            return;
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, bytes);
        log.info("Persisted render cache '{}' ({} bytes) to {}", handle.getId(), bytes.length, target);
    }
}
