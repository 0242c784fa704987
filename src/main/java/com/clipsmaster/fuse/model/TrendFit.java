package com.clipsmaster.fuse.model;

/**
 * 最小二乘线性拟合结果：斜率（每个采样点的变化量）与决定系数R²。
 */
public class TrendFit {

    public static final TrendFit NONE = new TrendFit(0.0, 0.0);

    private final double slope;
    private final double rSquared;

    public TrendFit(double slope, double rSquared) {
        this.slope = slope;
        this.rSquared = rSquared;
    }

    /**
     * 对序列按下标做最小二乘拟合。少于2个点返回{@link #NONE}；
     * 序列完全平坦时视为完美拟合（R²=1）。
     */
    public static TrendFit fit(double[] values) {
        int n = values.length;
        if (n < 2) {
            return NONE;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (double v : values) {
            meanY += v;
        }
        meanY /= n;

        double sxy = 0;
        double sxx = 0;
        for (int i = 0; i < n; i++) {
            sxy += (i - meanX) * (values[i] - meanY);
            sxx += (i - meanX) * (i - meanX);
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssTot = 0;
        double ssRes = 0;
        for (int i = 0; i < n; i++) {
            double predicted = intercept + slope * i;
            ssRes += (values[i] - predicted) * (values[i] - predicted);
            ssTot += (values[i] - meanY) * (values[i] - meanY);
        }
        double r2 = ssTot == 0 ? 1.0 : 1.0 - ssRes / ssTot;
        return new TrendFit(slope, r2);
    }

    public double getSlope() { return slope; }
    public double getRSquared() { return rSquared; }

    @Override
    public String toString() {
        return String.format("TrendFit{slope=%.3f, r2=%.3f}", slope, rSquared);
    }
}
