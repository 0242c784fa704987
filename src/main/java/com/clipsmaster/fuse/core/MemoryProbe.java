package com.clipsmaster.fuse.core;

/**
 * 内存探针：读取受控范围内的内存占用。
 *
 * 启动时按平台能力选择实现：能读取物理内存时使用物理内存探针，
 * 否则退化为JVM堆内存探针。测试中以脚本化探针替代。
 */
public interface MemoryProbe {

    /** 受控范围内存占用百分比 [0,100] */
    double getUsagePercent();

    /** 受控范围已用内存（MB） */
    double getUsedMb();

    /** 受控范围总内存（MB） */
    double getTotalMb();

    /** 受控范围可用内存（MB） */
    default double getAvailableMb() {
        return Math.max(0.0, getTotalMb() - getUsedMb());
    }

    /** 当前进程占用内存（MB），用于衡量单个动作的释放效果 */
    double getProcessUsedMb();

    /** 当前进程内存上限（MB） */
    double getProcessMaxMb();

    String getName();
}
