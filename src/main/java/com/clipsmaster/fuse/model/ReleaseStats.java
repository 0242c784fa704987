package com.clipsmaster.fuse.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 资源释放统计快照。
 */
public class ReleaseStats {

    private final long totalReleased;
    private final long totalFailed;
    private final Map<String, Long> releasedByType;
    private final double estimatedMbFreed;
    /** 最近一次成功释放的时间戳，0表示从未释放 */
    private final long lastReleaseTime;

    public ReleaseStats(long totalReleased, long totalFailed,
                        Map<String, Long> releasedByType, double estimatedMbFreed, long lastReleaseTime) {
        this.totalReleased = totalReleased;
        this.totalFailed = totalFailed;
        this.releasedByType = Collections.unmodifiableMap(new LinkedHashMap<>(releasedByType));
        this.estimatedMbFreed = estimatedMbFreed;
        this.lastReleaseTime = lastReleaseTime;
    }

    public long getTotalReleased() { return totalReleased; }
    public long getTotalFailed() { return totalFailed; }
    public Map<String, Long> getReleasedByType() { return releasedByType; }
    public double getEstimatedMbFreed() { return estimatedMbFreed; }
    public long getLastReleaseTime() { return lastReleaseTime; }

    @Override
    public String toString() {
        return "ReleaseStats{released=" + totalReleased + ", failed=" + totalFailed
                + ", freed=" + estimatedMbFreed + "MB, byType=" + releasedByType + "}";
    }
}
