package com.clipsmaster.fuse.diagnosis;

/**
 * 压力序列的模式分类与统计特征。
 */
public class PatternFeatures {

    public static final String UNKNOWN = "unknown";

    private final String pattern;
    private final double mean;
    private final double std;
    private final double min;
    private final double max;
    private final double current;
    private final double growthRate;
    private final double recentGrowth;
    private final double volatility;
    private final double trend;
    private final int sampleCount;

    PatternFeatures(String pattern, double mean, double std, double min, double max, double current,
                    double growthRate, double recentGrowth, double volatility, double trend, int sampleCount) {
        this.pattern = pattern;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.max = max;
        this.current = current;
        this.growthRate = growthRate;
        this.recentGrowth = recentGrowth;
        this.volatility = volatility;
        this.trend = trend;
        this.sampleCount = sampleCount;
    }

    /** 样本不足时的结果，全部特征为0 */
    static PatternFeatures unknown(int sampleCount) {
        return new PatternFeatures(UNKNOWN, 0, 0, 0, 0, 0, 0, 0, 0, 0, sampleCount);
    }

    PatternFeatures withPattern(String newPattern) {
        return new PatternFeatures(newPattern, mean, std, min, max, current,
                growthRate, recentGrowth, volatility, trend, sampleCount);
    }

    public boolean isUnknown() { return UNKNOWN.equals(pattern); }

    public String getPattern() { return pattern; }
    public double getMean() { return mean; }
    public double getStd() { return std; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public double getRange() { return max - min; }
    public double getCurrent() { return current; }
    public double getGrowthRate() { return growthRate; }
    public double getRecentGrowth() { return recentGrowth; }
    public double getVolatility() { return volatility; }
    public double getTrend() { return trend; }
    public int getSampleCount() { return sampleCount; }

    @Override
    public String toString() {
        return String.format("PatternFeatures{%s, mean=%.1f, range=%.1f, trend=%.2f, volatility=%.3f}",
                pattern, mean, getRange(), trend, volatility);
    }
}
