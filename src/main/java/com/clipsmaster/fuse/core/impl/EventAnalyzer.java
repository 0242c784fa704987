package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.model.EventQuery;
import com.clipsmaster.fuse.model.EventType;
import com.clipsmaster.fuse.model.FuseEvent;
import com.clipsmaster.fuse.model.TimeRange;

import java.util.*;

/**
 * 审计事件分析：内存趋势、动作耗时、熔断效率、恢复状态。
 */
public class EventAnalyzer {

    /** 快照事件少于该数量时，改用全部事件按时间分桶 */
    private static final int MIN_SNAPSHOTS = 5;

    private final FuseAudit audit;

    public EventAnalyzer(FuseAudit audit) {
        this.audit = audit;
    }

    // ==================== 内存趋势 ====================

    public List<TrendPoint> memoryTrend(TimeRange timeRange, long bucketMs) {
        List<FuseEvent> snapshots = chronological(
                audit.query(EventQuery.ofType(EventType.MEMORY_SNAPSHOT), timeRange, Integer.MAX_VALUE));
        List<TrendPoint> points = new ArrayList<>();

        if (snapshots.size() >= MIN_SNAPSHOTS) {
            for (FuseEvent event : snapshots) {
                points.add(new TrendPoint(event.getTimestamp(),
                        readMemory(event, "process", "used_mb"),
                        readMemory(event, "system", "percent"), 1));
            }
            return points;
        }

        // 快照不足，按桶聚合全部事件的内存读数
        List<FuseEvent> all = chronological(audit.query(EventQuery.any(), timeRange, Integer.MAX_VALUE));
        long interval = Math.max(1, bucketMs);
        TreeMap<Long, List<FuseEvent>> buckets = new TreeMap<>();
        for (FuseEvent event : all) {
            long bucket = (event.getTimestamp() / interval) * interval;
            buckets.computeIfAbsent(bucket, k -> new ArrayList<>()).add(event);
        }
        for (Map.Entry<Long, List<FuseEvent>> entry : buckets.entrySet()) {
            double usedSum = 0;
            double percentSum = 0;
            for (FuseEvent event : entry.getValue()) {
                usedSum += readMemory(event, "process", "used_mb");
                percentSum += readMemory(event, "system", "percent");
            }
            int n = entry.getValue().size();
            points.add(new TrendPoint(entry.getKey(), usedSum / n, percentSum / n, n));
        }
        return points;
    }

    // ==================== 动作耗时 ====================

    /**
     * 统计 {kind}_started / {kind}_completed 成对事件的耗时。
     */
    public ActionTiming actionTiming(String kind, TimeRange timeRange) {
        List<FuseEvent> starts = audit.query(EventQuery.ofType(kind + "_started"), timeRange, Integer.MAX_VALUE);
        List<Long> durations = new ArrayList<>();
        for (FuseEvent start : starts) {
            FuseEvent completed = firstReferencing(start, kind + "_completed");
            if (completed != null) {
                durations.add(completed.getTimestamp() - start.getTimestamp());
            }
        }
        return new ActionTiming(kind, starts.size(), durations);
    }

    // ==================== 熔断效率 ====================

    public FuseEfficiency fuseEfficiency(TimeRange timeRange) {
        List<FuseEvent> triggers = audit.query(
                EventQuery.ofType(EventType.FUSE_TRIGGERED), timeRange, Integer.MAX_VALUE);
        int completed = 0;
        double responseSum = 0;
        double freedSum = 0;
        int freedCount = 0;

        for (FuseEvent trigger : triggers) {
            FuseEvent done = firstReferencing(trigger, EventType.FUSE_COMPLETED.value());
            if (done == null) continue;
            completed++;
            responseSum += (done.getTimestamp() - trigger.getTimestamp()) / 1000.0;

            Double freed = memoryFreed(trigger, done);
            if (freed != null) {
                freedSum += freed;
                freedCount++;
            }
        }

        double successRate = triggers.isEmpty() ? 0.0 : completed * 100.0 / triggers.size();
        return new FuseEfficiency(triggers.size(), completed, successRate,
                completed > 0 ? responseSum / completed : 0.0,
                freedCount > 0 ? freedSum / freedCount : 0.0);
    }

    /** 优先用进程读数差，缺失时用系统可用内存差 */
    private Double memoryFreed(FuseEvent before, FuseEvent after) {
        Double usedBefore = readMemoryOrNull(before, "process", "used_mb");
        Double usedAfter = readMemoryOrNull(after, "process", "used_mb");
        if (usedBefore != null && usedAfter != null) {
            return usedBefore - usedAfter;
        }
        Double availBefore = readMemoryOrNull(before, "system", "available_mb");
        Double availAfter = readMemoryOrNull(after, "system", "available_mb");
        if (availBefore != null && availAfter != null) {
            return availAfter - availBefore;
        }
        return null;
    }

    // ==================== 恢复状态 ====================

    public RecoveryStatus recoveryStatus(TimeRange timeRange) {
        List<FuseEvent> starts = audit.query(
                EventQuery.ofType(EventType.RECOVERY_STARTED), timeRange, Integer.MAX_VALUE);
        int completed = 0;
        int successful = 0;
        Boolean lastSuccess = null;

        // starts为最新在前，倒序遍历使lastSuccess停在最近一次
        for (int i = starts.size() - 1; i >= 0; i--) {
            FuseEvent done = firstReferencing(starts.get(i), EventType.RECOVERY_COMPLETED.value());
            if (done == null) continue;
            completed++;
            boolean success = Boolean.TRUE.equals(done.getDetails().get("success"));
            if (success) successful++;
            lastSuccess = success;
        }
        return new RecoveryStatus(starts.size(), completed, successful, lastSuccess);
    }

    // ==================== 内部工具方法 ====================

    private FuseEvent firstReferencing(FuseEvent event, String type) {
        for (FuseEvent candidate : audit.getStorage().findReferencing(event.getEventId())) {
            if (type.equals(candidate.getEventType())) {
                return candidate;
            }
        }
        return null;
    }

    private static List<FuseEvent> chronological(List<FuseEvent> newestFirst) {
        List<FuseEvent> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return copy;
    }

    private static double readMemory(FuseEvent event, String scope, String key) {
        Double value = readMemoryOrNull(event, scope, key);
        return value != null ? value : 0.0;
    }

    @SuppressWarnings("unchecked")
    private static Double readMemoryOrNull(FuseEvent event, String scope, String key) {
        Object section = event.getMemoryUsage().get(scope);
        if (!(section instanceof Map)) {
            return null;
        }
        Object value = ((Map<String, Object>) section).get(key);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    // ==================== 结果类型 ====================

    public static class TrendPoint {
        private final long timestamp;
        private final double processUsedMb;
        private final double systemPercent;
        private final int eventCount;

        TrendPoint(long timestamp, double processUsedMb, double systemPercent, int eventCount) {
            this.timestamp = timestamp;
            this.processUsedMb = processUsedMb;
            this.systemPercent = systemPercent;
            this.eventCount = eventCount;
        }

        public long getTimestamp() { return timestamp; }
        public double getProcessUsedMb() { return processUsedMb; }
        public double getSystemPercent() { return systemPercent; }
        public int getEventCount() { return eventCount; }
    }

    public static class ActionTiming {
        private final String kind;
        private final int started;
        private final List<Long> durationsMs;

        ActionTiming(String kind, int started, List<Long> durationsMs) {
            this.kind = kind;
            this.started = started;
            this.durationsMs = List.copyOf(durationsMs);
        }

        public String getKind() { return kind; }
        public int getStarted() { return started; }
        public int getCompleted() { return durationsMs.size(); }

        public double getAverageMs() {
            return durationsMs.stream().mapToLong(Long::longValue).average().orElse(0.0);
        }

        public long getMaxMs() {
            return durationsMs.stream().mapToLong(Long::longValue).max().orElse(0L);
        }

        public long getMinMs() {
            return durationsMs.stream().mapToLong(Long::longValue).min().orElse(0L);
        }
    }

    public static class FuseEfficiency {
        private final int totalFuses;
        private final int completedFuses;
        /** 百分比 */
        private final double successRate;
        private final double avgResponseSeconds;
        private final double avgMemoryFreedMb;

        FuseEfficiency(int totalFuses, int completedFuses, double successRate,
                       double avgResponseSeconds, double avgMemoryFreedMb) {
            this.totalFuses = totalFuses;
            this.completedFuses = completedFuses;
            this.successRate = successRate;
            this.avgResponseSeconds = avgResponseSeconds;
            this.avgMemoryFreedMb = avgMemoryFreedMb;
        }

        public int getTotalFuses() { return totalFuses; }
        public int getCompletedFuses() { return completedFuses; }
        public double getSuccessRate() { return successRate; }
        public double getAvgResponseSeconds() { return avgResponseSeconds; }
        public double getAvgMemoryFreedMb() { return avgMemoryFreedMb; }
    }

    public static class RecoveryStatus {
        private final int started;
        private final int completed;
        private final int successful;
        /** 最近一次完成的恢复是否成功，没有完成过时为null */
        private final Boolean lastSuccess;

        RecoveryStatus(int started, int completed, int successful, Boolean lastSuccess) {
            this.started = started;
            this.completed = completed;
            this.successful = successful;
            this.lastSuccess = lastSuccess;
        }

        public int getStarted() { return started; }
        public int getCompleted() { return completed; }
        public int getSuccessful() { return successful; }
        public Boolean getLastSuccess() { return lastSuccess; }
        public boolean isInProgress() { return started > completed; }
    }
}
