package com.clipsmaster.fuse.model;

import java.util.Collections;
import java.util.List;

/**
 * 一次回滚恢复的结果报告。
 */
public class RollbackReport {

    /** 成功率达到该比例即视为回滚成功 */
    public static final double SUCCESS_RATE_THRESHOLD = 0.8;

    private final List<String> restoredIds;
    private final List<String> failedIds;
    private final boolean started;
    private final long durationMs;

    public RollbackReport(List<String> restoredIds, List<String> failedIds, boolean started, long durationMs) {
        this.restoredIds = List.copyOf(restoredIds);
        this.failedIds = List.copyOf(failedIds);
        this.started = started;
        this.durationMs = durationMs;
    }

    /** 未能启动的回滚（无快照或已有回滚在运行） */
    public static RollbackReport notStarted() {
        return new RollbackReport(Collections.emptyList(), Collections.emptyList(), false, 0);
    }

    public int getTotal() {
        return restoredIds.size() + failedIds.size();
    }

    public double getSuccessRate() {
        int total = getTotal();
        return total == 0 ? 0.0 : (double) restoredIds.size() / total;
    }

    public boolean isSuccess() {
        return started && getTotal() > 0 && getSuccessRate() >= SUCCESS_RATE_THRESHOLD;
    }

    /** 恢复顺序即列表顺序 */
    public List<String> getRestoredIds() { return restoredIds; }
    public List<String> getFailedIds() { return failedIds; }
    public boolean isStarted() { return started; }
    public long getDurationMs() { return durationMs; }

    @Override
    public String toString() {
        return "RollbackReport{restored=" + restoredIds.size() + ", failed=" + failedIds
                + ", rate=" + String.format("%.2f", getSuccessRate()) + "}";
    }
}
