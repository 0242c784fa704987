package com.clipsmaster.fuse.model;

/**
 * 失败处理的最终结果。
 */
public class RemediationOutcome {

    private final boolean handled;
    /** 最后一次执行的验证结果；COMBINE下为组内最后一个 */
    private final ValidationResult finalResult;
    /** 最终生效的策略（RETRY可能转为ESCALATE，再转为ALERT） */
    private final FailureHandlingStrategy appliedStrategy;

    public RemediationOutcome(boolean handled, ValidationResult finalResult,
                              FailureHandlingStrategy appliedStrategy) {
        this.handled = handled;
        this.finalResult = finalResult;
        this.appliedStrategy = appliedStrategy;
    }

    public boolean isHandled() { return handled; }
    public ValidationResult getFinalResult() { return finalResult; }
    public FailureHandlingStrategy getAppliedStrategy() { return appliedStrategy; }

    @Override
    public String toString() {
        return "RemediationOutcome{handled=" + handled + ", strategy=" + appliedStrategy
                + ", result=" + finalResult + "}";
    }
}
