package com.clipsmaster.fuse.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 缓解动作目录条目。
 *
 * 描述一个动作的代价（影响权重）、预期效果（预期释放MB数）、执行时限、
 * 重试预算以及失败后的升级目标。目录在启动时加载一次，之后只允许显式重新注册。
 */
public class MitigationAction {

    private final String name;
    private final String description;
    /** 影响权重 [0,1]，越大代价越高 */
    private final double impactWeight;
    /** 预期释放内存（MB） */
    private final double expectedReductionMb;
    /** 最大执行时长（秒） */
    private final double maxExecutionSeconds;
    /** 重试预算 */
    private final int retryBudget;
    /** 效果不达标时的升级目标，null表示无 */
    private final String escalationTarget;
    /** 仅在EMERGENCY级别允许执行 */
    private final boolean emergencyOnly;
    private final List<ParameterDefinition> parameterDefinitions;

    private MitigationAction(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.impactWeight = Math.max(0.0, Math.min(1.0, b.impactWeight));
        this.expectedReductionMb = b.expectedReductionMb;
        this.maxExecutionSeconds = b.maxExecutionSeconds;
        this.retryBudget = b.retryBudget;
        this.escalationTarget = b.escalationTarget;
        this.emergencyOnly = b.emergencyOnly;
        this.parameterDefinitions = Collections.unmodifiableList(new ArrayList<>(b.parameters));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public double getImpactWeight() { return impactWeight; }
    public double getExpectedReductionMb() { return expectedReductionMb; }
    public double getMaxExecutionSeconds() { return maxExecutionSeconds; }
    public int getRetryBudget() { return retryBudget; }
    public String getEscalationTarget() { return escalationTarget; }
    public boolean isEmergencyOnly() { return emergencyOnly; }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }

    @Override
    public String toString() {
        return "MitigationAction{" + name + ", weight=" + impactWeight
                + ", expected=" + expectedReductionMb + "MB}";
    }

    public static class Builder {
        private final String name;
        private String description = "";
        private double impactWeight = 0.5;
        private double expectedReductionMb = 0.0;
        private double maxExecutionSeconds = 1.0;
        private int retryBudget = 1;
        private String escalationTarget;
        private boolean emergencyOnly;
        private final List<ParameterDefinition> parameters = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder impactWeight(double impactWeight) { this.impactWeight = impactWeight; return this; }
        public Builder expectedReductionMb(double mb) { this.expectedReductionMb = mb; return this; }
        public Builder maxExecutionSeconds(double seconds) { this.maxExecutionSeconds = seconds; return this; }
        public Builder retryBudget(int retryBudget) { this.retryBudget = retryBudget; return this; }
        public Builder escalateTo(String target) { this.escalationTarget = target; return this; }
        public Builder emergencyOnly() { this.emergencyOnly = true; return this; }
        public Builder parameter(ParameterDefinition definition) { this.parameters.add(definition); return this; }

        public MitigationAction build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Action name must not be blank");
            }
            return new MitigationAction(this);
        }
    }
}
