package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.core.EventStorage;
import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON行文件事件存储。
 *
 * 文件只追加，每行一个事件；内存中只保留索引（ID→文件位置、类型、时间戳、引用关系），
 * 事件内容按需从文件读取。打开已有文件时重建索引，损坏的行跳过。
 */
public class JsonlEventStorage implements EventStorage {

    private static final Logger log = LoggerFactory.getLogger(JsonlEventStorage.class);
    private static final byte NEWLINE = '\n';

    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReentrantLock lock = new ReentrantLock();
    private final RandomAccessFile file;

    /** 按写入顺序的索引 */
    private final LinkedHashMap<String, IndexEntry> index = new LinkedHashMap<>();
    private final Map<String, List<String>> typeIndex = new HashMap<>();
    /** 被引用事件ID -> 引用它的事件ID */
    private final Map<String, List<String>> referencedBy = new HashMap<>();

    public JsonlEventStorage(Path path) {
        this.path = path;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.file = new RandomAccessFile(path.toFile(), "rw");
            rebuildIndex();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open event log: " + path, e);
        }
        log.info("JsonlEventStorage opened at {} with {} existing events", path, index.size());
    }

    private void rebuildIndex() throws IOException {
        byte[] content = Files.readAllBytes(path);
        int lineStart = 0;
        int lineNo = 0;
        for (int i = 0; i < content.length; i++) {
            if (content[i] != NEWLINE) continue;
            lineNo++;
            int length = i - lineStart;
            if (length > 0) {
                String line = new String(content, lineStart, length, StandardCharsets.UTF_8);
                try {
                    FuseEvent event = mapper.readValue(line, FuseEvent.class);
                    addToIndex(event, lineStart, length);
                } catch (IOException e) {
                    log.warn("Skipping malformed event line {} in {}: {}", lineNo, path, e.getMessage());
                }
            }
            lineStart = i + 1;
        }
    }

    private void addToIndex(FuseEvent event, long offset, int length) {
        index.put(event.getEventId(), new IndexEntry(event.getTimestamp(), offset, length));
        typeIndex.computeIfAbsent(event.getEventType(), k -> new ArrayList<>()).add(event.getEventId());
        for (String related : event.getRelatedIds()) {
            referencedBy.computeIfAbsent(related, k -> new ArrayList<>()).add(event.getEventId());
        }
    }

    @Override
    public String store(FuseEvent event) {
        lock.lock();
        try {
            byte[] line = mapper.writeValueAsBytes(event);
            long offset = file.length();
            file.seek(offset);
            file.write(line);
            file.write(NEWLINE);
            addToIndex(event, offset, line.length);
            return event.getEventId();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append event " + event.getEventId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public FuseEvent get(String eventId) {
        lock.lock();
        try {
            IndexEntry entry = index.get(eventId);
            return entry != null ? read(entry) : null;
        } finally {
            lock.unlock();
        }
    }

    private FuseEvent read(IndexEntry entry) {
        try {
            byte[] buffer = new byte[entry.length];
            file.seek(entry.offset);
            file.readFully(buffer);
            return mapper.readValue(buffer, FuseEvent.class);
        } catch (IOException e) {
            log.error("Failed to read event at offset {}: {}", entry.offset, e.getMessage());
            return null;
        }
    }

    @Override
    public List<FuseEvent> query(EventQuery query, TimeRange timeRange, int limit) {
        List<FuseEvent> candidates = new ArrayList<>();
        lock.lock();
        try {
            Collection<String> ids = query.getEventType() != null
                    ? typeIndex.getOrDefault(query.getEventType(), Collections.emptyList())
                    : index.keySet();
            for (String id : ids) {
                IndexEntry entry = index.get(id);
                // 先用索引中的时间戳过滤，避免无谓的文件读取
                if (timeRange != null && !timeRange.contains(entry.timestamp)) continue;
                candidates.add(read(entry));
            }
        } finally {
            lock.unlock();
        }
        return EventFilters.newestFirst(candidates, query, timeRange, limit);
    }

    @Override
    public List<FuseEvent> findReferencing(String eventId) {
        List<FuseEvent> result = new ArrayList<>();
        lock.lock();
        try {
            for (String id : referencedBy.getOrDefault(eventId, Collections.emptyList())) {
                FuseEvent event = read(index.get(id));
                if (event != null) {
                    result.add(event);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            file.close();
            log.info("JsonlEventStorage closed: {}", path);
        } catch (IOException e) {
            log.warn("Failed to close event log {}: {}", path, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    static class IndexEntry {
        final long timestamp;
        final long offset;
        final int length;

        IndexEntry(long timestamp, long offset, int length) {
            this.timestamp = timestamp;
            this.offset = offset;
            this.length = length;
        }
    }
}
