package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.MemoryProbe;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * JVM堆内存探针。平台无法提供物理内存读数时使用。
 */
public class HeapMemoryProbe implements MemoryProbe {

    static final double MB = 1024.0 * 1024.0;

    private final MemoryMXBean memoryBean;

    public HeapMemoryProbe() {
        this.memoryBean = ManagementFactory.getMemoryMXBean();
    }

    @Override
    public double getUsagePercent() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        return max > 0 ? Math.min(100.0, heap.getUsed() * 100.0 / max) : 0.0;
    }

    @Override
    public double getUsedMb() {
        return memoryBean.getHeapMemoryUsage().getUsed() / MB;
    }

    @Override
    public double getTotalMb() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        return (heap.getMax() > 0 ? heap.getMax() : heap.getCommitted()) / MB;
    }

    @Override
    public double getProcessUsedMb() {
        return (memoryBean.getHeapMemoryUsage().getUsed()
                + memoryBean.getNonHeapMemoryUsage().getUsed()) / MB;
    }

    @Override
    public double getProcessMaxMb() {
        return Runtime.getRuntime().maxMemory() / MB;
    }

    @Override
    public String getName() {
        return "heap";
    }
}
