package com.clipsmaster.fuse.model;

/**
 * 单次内存压力采样。
 */
public class PressureSample {

    private final long timestamp;
    private final double usagePercent;

    public PressureSample(long timestamp, double usagePercent) {
        this.timestamp = timestamp;
        this.usagePercent = usagePercent;
    }

    public long getTimestamp() { return timestamp; }
    public double getUsagePercent() { return usagePercent; }

    @Override
    public String toString() {
        return "PressureSample{" + usagePercent + "% @" + timestamp + "}";
    }
}
