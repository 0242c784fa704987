package com.clipsmaster.fuse.model;

/**
 * 闭区间时间范围（毫秒时间戳）。任一端为null表示该端不限。
 */
public class TimeRange {

    private final Long start;
    private final Long end;

    public TimeRange(Long start, Long end) {
        this.start = start;
        this.end = end;
    }

    public static TimeRange since(long start) {
        return new TimeRange(start, null);
    }

    public static TimeRange all() {
        return new TimeRange(null, null);
    }

    public boolean contains(long timestamp) {
        if (start != null && timestamp < start) return false;
        if (end != null && timestamp > end) return false;
        return true;
    }

    public Long getStart() { return start; }
    public Long getEnd() { return end; }
}
