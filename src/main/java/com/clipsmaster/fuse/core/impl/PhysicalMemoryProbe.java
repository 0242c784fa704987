package com.clipsmaster.fuse.core.impl;

import java.lang.management.ManagementFactory;

/**
 * 物理内存探针。受控范围为整机物理内存，进程读数沿用堆探针。
 */
public class PhysicalMemoryProbe extends HeapMemoryProbe {

    private final com.sun.management.OperatingSystemMXBean osBean;

    public PhysicalMemoryProbe(com.sun.management.OperatingSystemMXBean osBean) {
        this.osBean = osBean;
    }

    @Override
    public double getUsagePercent() {
        long total = osBean.getTotalMemorySize();
        if (total <= 0) {
            return 0.0;
        }
        return (total - osBean.getFreeMemorySize()) * 100.0 / total;
    }

    @Override
    public double getUsedMb() {
        return (osBean.getTotalMemorySize() - osBean.getFreeMemorySize()) / MB;
    }

    @Override
    public double getTotalMb() {
        return osBean.getTotalMemorySize() / MB;
    }

    @Override
    public double getAvailableMb() {
        return osBean.getFreeMemorySize() / MB;
    }

    @Override
    public String getName() {
        return "physical";
    }
}
