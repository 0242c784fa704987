package com.clipsmaster.fuse.model;

/**
 * 动作效果验证结果：执行前后的内存读数与是否达到预期释放量。
 */
public class ValidationResult {

    private final String action;
    private final double memoryBeforeMb;
    private final double memoryAfterMb;
    private final double expectedReductionMb;
    private final double executionTimeSeconds;
    private final boolean success;
    /** 动作处理器本身是否执行成功 */
    private final boolean actionExecuted;
    private final long timestamp;

    public ValidationResult(String action, double memoryBeforeMb, double memoryAfterMb,
                            double expectedReductionMb, double executionTimeSeconds,
                            boolean success, boolean actionExecuted, long timestamp) {
        this.action = action;
        this.memoryBeforeMb = memoryBeforeMb;
        this.memoryAfterMb = memoryAfterMb;
        this.expectedReductionMb = expectedReductionMb;
        this.executionTimeSeconds = executionTimeSeconds;
        this.success = success;
        this.actionExecuted = actionExecuted;
        this.timestamp = timestamp;
    }

    /** 实际释放量（MB），可能为负 */
    public double getReductionMb() {
        return memoryBeforeMb - memoryAfterMb;
    }

    /** 实际释放量相对执行前内存的百分比 */
    public double getReductionPercent() {
        return memoryBeforeMb > 0 ? getReductionMb() / memoryBeforeMb * 100.0 : 0.0;
    }

    /** 实际/预期，预期为0时为0 */
    public double getEffectiveness() {
        return expectedReductionMb > 0 ? getReductionMb() / expectedReductionMb : 0.0;
    }

    public String getAction() { return action; }
    public double getMemoryBeforeMb() { return memoryBeforeMb; }
    public double getMemoryAfterMb() { return memoryAfterMb; }
    public double getExpectedReductionMb() { return expectedReductionMb; }
    public double getExecutionTimeSeconds() { return executionTimeSeconds; }
    public boolean isSuccess() { return success; }
    public boolean isActionExecuted() { return actionExecuted; }
    public long getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("ValidationResult{%s, reduced=%.1fMB/%.1fMB, time=%.3fs, success=%s}",
                action, getReductionMb(), expectedReductionMb, executionTimeSeconds, success);
    }
}
