package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.MemoryProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * 按平台能力选择内存探针。
 */
public final class MemoryProbes {

    private static final Logger log = LoggerFactory.getLogger(MemoryProbes.class);

    private MemoryProbes() {}

    public static MemoryProbe detect() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean sunOs = (com.sun.management.OperatingSystemMXBean) os;
            try {
                if (sunOs.getTotalMemorySize() > 0) {
                    log.info("Using physical memory probe. Total: {}MB",
                            sunOs.getTotalMemorySize() / (1024 * 1024));
                    return new PhysicalMemoryProbe(sunOs);
                }
            } catch (RuntimeException e) {
                log.warn("Physical memory readings unavailable: {}", e.getMessage());
            }
        }
        log.info("Physical memory probe not supported on this platform, falling back to heap probe.");
        return new HeapMemoryProbe();
    }
}
