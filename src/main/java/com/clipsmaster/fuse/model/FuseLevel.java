package com.clipsmaster.fuse.model;

/**
 * 熔断级别，按严重程度递增排列。
 */
public enum FuseLevel {
    NORMAL,
    WARNING,
    CRITICAL,
    EMERGENCY;

    public boolean isHigherThan(FuseLevel other) {
        return this.ordinal() > other.ordinal();
    }

    /** 向下一级；NORMAL保持不变 */
    public FuseLevel stepDown() {
        return this == NORMAL ? NORMAL : values()[ordinal() - 1];
    }

    public static FuseLevel max(FuseLevel a, FuseLevel b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * 按名称解析级别，忽略大小写。
     *
     * @return 未识别时返回null
     */
    public static FuseLevel parse(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            return FuseLevel.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
