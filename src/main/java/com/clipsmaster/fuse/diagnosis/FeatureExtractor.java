package com.clipsmaster.fuse.diagnosis;

import com.clipsmaster.fuse.model.TrendFit;

import java.util.List;

/**
 * 从压力样本序列提取统计特征并分类压力模式。
 *
 * 分类按顺序取第一个满足的规则：
 * rapid_increase → steady_increase → spike → fluctuation → plateau_high → immediate_high，
 * 都不满足时按趋势符号归为 gradual_increase / gradual_decrease / stable。
 */
public final class FeatureExtractor {

    public static final int MIN_SAMPLES = 3;

    private FeatureExtractor() {}

    public static PatternFeatures extract(List<Double> samples) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i);
        }
        return extract(values);
    }

    public static PatternFeatures extract(double[] data) {
        int n = data.length;
        if (n < MIN_SAMPLES) {
            return PatternFeatures.unknown(n);
        }

        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : data) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / n;

        double squares = 0;
        for (double v : data) {
            squares += (v - mean) * (v - mean);
        }
        // 总体标准差
        double std = Math.sqrt(squares / n);

        double current = data[n - 1];
        double growthRate = (data[n - 1] - data[0]) / n;
        double recentGrowth = (data[n - 1] - data[n - 3]) / 2;
        double volatility = mean > 0 ? std / mean : 0.0;
        double trend = TrendFit.fit(data).getSlope();

        PatternFeatures features = new PatternFeatures(null, mean, std, min, max, current,
                growthRate, recentGrowth, volatility, trend, n);
        return features.withPattern(classify(features));
    }

    static String classify(PatternFeatures f) {
        double trend = f.getTrend();
        double range = f.getRange();
        double volatility = f.getVolatility();

        if (trend > 5 && range > 30) {
            return "rapid_increase";
        }
        if (trend > 0.5 && trend < 5 && volatility < 0.2) {
            return "steady_increase";
        }
        if (range > 40 && volatility > 0.3) {
            return "spike";
        }
        if (volatility > 0.25 && Math.abs(trend) < 1) {
            return "fluctuation";
        }
        if (f.getMean() > 75 && volatility < 0.15) {
            return "plateau_high";
        }
        if (f.getMin() > 60) {
            return "immediate_high";
        }
        if (trend > 0) {
            return "gradual_increase";
        }
        if (trend < 0) {
            return "gradual_decrease";
        }
        return "stable";
    }
}
