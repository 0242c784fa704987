package com.clipsmaster.fuse.support;

import com.clipsmaster.fuse.core.MemoryProbe;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 脚本化的内存探针：占用百分比按脚本依次返回，脚本用完后保持最后一个值。
 */
public class FakeMemoryProbe implements MemoryProbe {

    private final Deque<Double> script = new ArrayDeque<>();
    private volatile double usagePercent;
    private volatile double processUsedMb = 1000.0;
    private volatile double processMaxMb = 2048.0;
    private volatile double totalMb = 4096.0;

    public FakeMemoryProbe(double usagePercent) {
        this.usagePercent = usagePercent;
    }

    public synchronized FakeMemoryProbe script(double... values) {
        for (double v : values) {
            script.addLast(v);
        }
        return this;
    }

    public void setUsagePercent(double usagePercent) {
        this.usagePercent = usagePercent;
    }

    public void setProcessUsedMb(double processUsedMb) {
        this.processUsedMb = processUsedMb;
    }

    /** 模拟释放内存 */
    public synchronized void free(double mb) {
        processUsedMb = Math.max(0, processUsedMb - mb);
    }

    public void setTotalMb(double totalMb) {
        this.totalMb = totalMb;
    }

    @Override
    public synchronized double getUsagePercent() {
        if (!script.isEmpty()) {
            usagePercent = script.removeFirst();
        }
        return usagePercent;
    }

    @Override
    public double getUsedMb() {
        return totalMb * usagePercent / 100.0;
    }

    @Override
    public double getTotalMb() {
        return totalMb;
    }

    @Override
    public synchronized double getProcessUsedMb() {
        return processUsedMb;
    }

    @Override
    public double getProcessMaxMb() {
        return processMaxMb;
    }

    @Override
    public String getName() {
        return "fake";
    }
}
