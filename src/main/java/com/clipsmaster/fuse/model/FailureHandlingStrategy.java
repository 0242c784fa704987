package com.clipsmaster.fuse.model;

/**
 * 动作效果不达标时的处理策略。
 */
public enum FailureHandlingStrategy {
    /** 先做一轮GC，再重新执行；超过重试预算后转为ESCALATE */
    RETRY,
    /** 执行目录中配置的升级目标动作 */
    ESCALATE,
    /** 记录告警，终止处理 */
    ALERT,
    /** 依次尝试备选动作，直到有一个成功 */
    FALLBACK,
    /** 执行一组固定动作，全部成功才算成功 */
    COMBINE;

    public static FailureHandlingStrategy parse(String name) {
        if (name == null || name.isBlank() || "NONE".equalsIgnoreCase(name.trim())) {
            return null;
        }
        return valueOf(name.trim().toUpperCase());
    }
}
