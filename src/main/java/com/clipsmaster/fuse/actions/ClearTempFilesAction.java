package com.clipsmaster.fuse.actions;

import com.clipsmaster.fuse.core.ActionContext;
import com.clipsmaster.fuse.core.ActionHandler;
import com.clipsmaster.fuse.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 清理临时文件。
 * 删除指定目录下匹配模式且超过保留时间的文件，并释放 temp_buffers 类资源。
 *
 * 参数：
 * - directories: 要清理的目录 (LIST, 默认 系统临时目录/clipsmaster_temp)
 * - file_patterns: 文件名模式 (LIST, 默认 *.tmp,*.temp,*.bak)
 * - max_file_age_hours: 最小文件年龄（小时）(NUMBER, 默认 2)
 */
public class ClearTempFilesAction implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(ClearTempFilesAction.class);

    static final List<String> DEFAULT_PATTERNS = List.of("*.tmp", "*.temp", "*.bak");

    private final Clock clock;

    public ClearTempFilesAction() {
        this(Clock.systemUTC());
    }

    public ClearTempFilesAction(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean execute(ActionContext context) {
        List<String> directories = context.getListParameter("directories", List.of(
                Paths.get(System.getProperty("java.io.tmpdir"), "clipsmaster_temp").toString()));
        List<String> patterns = context.getListParameter("file_patterns", DEFAULT_PATTERNS);
        double maxAgeHours = context.getParameter("max_file_age_hours", 2.0);
        long maxAgeMs = (long) (maxAgeHours * 3_600_000L);

        List<PathMatcher> matchers = new ArrayList<>();
        FileSystem fs = FileSystems.getDefault();
        for (String pattern : patterns) {
            matchers.add(fs.getPathMatcher("glob:" + pattern));
        }

        long now = clock.millis();
        int deletedCount = 0;
        long deletedBytes = 0;
        for (String directory : directories) {
            Path dir = Paths.get(directory);
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> files = Files.walk(dir)) {
                for (Path file : (Iterable<Path>) files::iterator) {
                    if (!Files.isRegularFile(file) || !matchesAny(matchers, file.getFileName())) {
                        continue;
                    }
                    try {
                        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                        if (now - attrs.lastModifiedTime().toMillis() >= maxAgeMs) {
                            Files.deleteIfExists(file);
                            deletedCount++;
                            deletedBytes += attrs.size();
                        }
                    } catch (IOException e) {
                        log.debug("Skipping temp file {}: {}", file, e.getMessage());
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                log.warn("Failed to scan temp directory {}: {}", dir, e.getMessage());
            }
        }

        int buffers = HandleSelection.releaseEach(context.getResourceRegistry(),
                HandleSelection.releasable(context.getResourceRegistry(),
                        HandleSelection.ofTypes(ResourceType.TEMP_BUFFERS)));

        log.info("Cleared {} temp files ({} MB) and {} temp buffers",
                deletedCount, String.format("%.2f", deletedBytes / 1024.0 / 1024.0), buffers);
        return true;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path fileName) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }
}
