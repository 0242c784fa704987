package com.clipsmaster.fuse.storage;

import com.clipsmaster.fuse.core.EventStorage;
import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于SQLite的事件存储实现。
 *
 * 核心设计：
 * - 单库单表，事件类型与时间戳建B-tree索引
 * - memory_usage/details/related_ids以JSON文本列保存
 * - 引用关系单独建表，支持按被引用事件反查
 */
public class SQLiteEventStorage implements EventStorage {

    private static final Logger log = LoggerFactory.getLogger(SQLiteEventStorage.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final String dbPath;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ReentrantLock lock = new ReentrantLock();
    private final Connection connection;

    public SQLiteEventStorage(String dbPath) {
        this.dbPath = dbPath;

        // 确保存储目录存在
        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new RuntimeException("Failed to create storage directory: " + parent);
        }

        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            connection.setAutoCommit(true);
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("CREATE TABLE IF NOT EXISTS fuse_events ("
                        + "event_id TEXT PRIMARY KEY, "
                        + "event_type TEXT NOT NULL, "
                        + "timestamp INTEGER NOT NULL, "
                        + "memory_usage TEXT, "
                        + "details TEXT, "
                        + "related_ids TEXT)");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_type ON fuse_events (event_type)");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_events_ts ON fuse_events (timestamp)");
                stmt.execute("CREATE TABLE IF NOT EXISTS fuse_event_links ("
                        + "event_id TEXT NOT NULL, "
                        + "related_id TEXT NOT NULL)");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_links_related ON fuse_event_links (related_id)");
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize event database at " + dbPath, e);
        }
        log.info("SQLiteEventStorage initialized at: {}", dbPath);
    }

    // ==================== 写入 ====================

    @Override
    public String store(FuseEvent event) {
        lock.lock();
        try {
            String sql = "INSERT OR REPLACE INTO fuse_events "
                    + "(event_id, event_type, timestamp, memory_usage, details, related_ids) "
                    + "VALUES (?, ?, ?, ?, ?, ?)";
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.setString(1, event.getEventId());
                stmt.setString(2, event.getEventType());
                stmt.setLong(3, event.getTimestamp());
                stmt.setString(4, mapper.writeValueAsString(event.getMemoryUsage()));
                stmt.setString(5, mapper.writeValueAsString(event.getDetails()));
                stmt.setString(6, mapper.writeValueAsString(event.getRelatedIds()));
                stmt.executeUpdate();
            }
            if (!event.getRelatedIds().isEmpty()) {
                try (PreparedStatement stmt = connection.prepareStatement(
                        "INSERT INTO fuse_event_links (event_id, related_id) VALUES (?, ?)")) {
                    for (String related : event.getRelatedIds()) {
                        stmt.setString(1, event.getEventId());
                        stmt.setString(2, related);
                        stmt.addBatch();
                    }
                    stmt.executeBatch();
                }
            }
            return event.getEventId();
        } catch (SQLException | JsonProcessingException e) {
            log.error("Failed to store event '{}': {}", event.getEventId(), e.getMessage(), e);
            throw new RuntimeException("Failed to store event", e);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 查询 ====================

    @Override
    public FuseEvent get(String eventId) {
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT * FROM fuse_events WHERE event_id = ?")) {
            stmt.setString(1, eventId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? mapResultSetToEvent(rs) : null;
            }
        } catch (SQLException e) {
            log.error("Failed to query event '{}': {}", eventId, e.getMessage(), e);
            return null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<FuseEvent> query(EventQuery query, TimeRange timeRange, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM fuse_events WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (query.getEventType() != null) {
            sql.append(" AND event_type = ?");
            args.add(query.getEventType());
        }
        if (timeRange != null && timeRange.getStart() != null) {
            sql.append(" AND timestamp >= ?");
            args.add(timeRange.getStart());
        }
        if (timeRange != null && timeRange.getEnd() != null) {
            sql.append(" AND timestamp <= ?");
            args.add(timeRange.getEnd());
        }
        sql.append(" ORDER BY timestamp ASC, rowid ASC");

        List<FuseEvent> candidates = new ArrayList<>();
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                stmt.setObject(i + 1, args.get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    candidates.add(mapResultSetToEvent(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query events of type '{}': {}", query.getEventType(), e.getMessage(), e);
        } finally {
            lock.unlock();
        }
        // details子字段过滤在内存中完成
        return EventFilters.newestFirst(candidates, query, timeRange, limit);
    }

    @Override
    public List<FuseEvent> findReferencing(String eventId) {
        List<FuseEvent> result = new ArrayList<>();
        String sql = "SELECT e.* FROM fuse_events e JOIN fuse_event_links l ON e.event_id = l.event_id "
                + "WHERE l.related_id = ? ORDER BY e.timestamp ASC, e.rowid ASC";
        lock.lock();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, eventId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapResultSetToEvent(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query events referencing '{}': {}", eventId, e.getMessage(), e);
        } finally {
            lock.unlock();
        }
        return result;
    }

    @Override
    public int size() {
        lock.lock();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM fuse_events")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            log.error("Failed to count events: {}", e.getMessage(), e);
            return 0;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 内部工具方法 ====================

    private FuseEvent mapResultSetToEvent(ResultSet rs) throws SQLException {
        try {
            return new FuseEvent(
                    rs.getString("event_id"),
                    rs.getString("event_type"),
                    rs.getLong("timestamp"),
                    mapper.readValue(rs.getString("memory_usage"), MAP_TYPE),
                    mapper.readValue(rs.getString("details"), MAP_TYPE),
                    mapper.readValue(rs.getString("related_ids"), LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupted event row " + rs.getString("event_id"), e);
        }
    }

    /** 关闭数据库连接 */
    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
            log.info("SQLiteEventStorage shut down: {}", dbPath);
        } catch (SQLException e) {
            log.warn("Failed to close event database {}: {}", dbPath, e.getMessage());
        } finally {
            lock.unlock();
        }
    }
}
