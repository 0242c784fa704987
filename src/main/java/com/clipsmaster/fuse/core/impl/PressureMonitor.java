package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.core.MemoryProbe;
import com.clipsmaster.fuse.model.PressureSample;
import com.clipsmaster.fuse.model.TrendFit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存压力监控器。
 *
 * 维护固定大小的采样窗口，计算压力指数、趋势与预测；
 * 阈值回调只在向上穿越时触发，升级回调在每次检测到持续上升时触发。
 * 回调在释放监控器锁之后执行。
 */
public class PressureMonitor {

    private static final Logger log = LoggerFactory.getLogger(PressureMonitor.class);

    /** 压力指数中参与平均的近期采样数 */
    private static final int RECENT_SAMPLES = 5;
    /** 压力指数放大区起点 */
    private static final double AMPLIFY_FROM = 80.0;
    private static final double AMPLIFY_FACTOR = 1.5;
    /** 升级判定：近5个采样的斜率外推5步超过该值 */
    private static final double ESCALATION_DELTA = 5.0;
    /** 预测所需的最小拟合优度 */
    private static final double MIN_PREDICT_R2 = 0.5;

    public static final int DEFAULT_WINDOW_SIZE = 60;
    public static final int DEFAULT_TREND_WINDOW = 30;

    /** 阈值回调 */
    @FunctionalInterface
    public interface ThresholdListener {
        void onThresholdCrossed(double threshold, PressureSample sample);
    }

    /** 升级回调 */
    @FunctionalInterface
    public interface EscalationListener {
        void onEscalation(PressureSample sample, double slope);
    }

    private final MemoryProbe probe;
    private final Clock clock;
    private final int windowSize;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<PressureSample> window;

    private final List<ThresholdEntry> thresholdListeners = new CopyOnWriteArrayList<>();
    private final List<EscalationListener> escalationListeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread samplerThread;

    public PressureMonitor(MemoryProbe probe, Clock clock) {
        this(probe, clock, DEFAULT_WINDOW_SIZE);
    }

    public PressureMonitor(MemoryProbe probe, Clock clock, int windowSize) {
        if (windowSize < RECENT_SAMPLES) {
            throw new IllegalArgumentException("Window size must be at least " + RECENT_SAMPLES + ", got: " + windowSize);
        }
        this.probe = probe;
        this.clock = clock;
        this.windowSize = windowSize;
        this.window = new ArrayDeque<>(windowSize);
    }

    // ==================== 采样 ====================

    /**
     * 从内存探针读取一次并追加到窗口。
     */
    public PressureSample sample() {
        return update(probe.getUsagePercent());
    }

    /**
     * 追加一个占用百分比读数并触发回调。
     */
    public PressureSample update(double usagePercent) {
        PressureSample sample = new PressureSample(clock.millis(), usagePercent);
        Double previous;
        boolean escalating;
        double slope;

        lock.lock();
        try {
            PressureSample last = window.peekLast();
            previous = last != null ? last.getUsagePercent() : null;
            window.addLast(sample);
            while (window.size() > windowSize) {
                window.removeFirst();
            }
            TrendFit recent = fitLast(RECENT_SAMPLES);
            slope = recent.getSlope();
            escalating = window.size() >= RECENT_SAMPLES && slope * RECENT_SAMPLES > ESCALATION_DELTA;
        } finally {
            lock.unlock();
        }

        fireThresholdCallbacks(previous, sample);
        if (escalating) {
            fireEscalationCallbacks(sample, slope);
        }
        return sample;
    }

    private void fireThresholdCallbacks(Double previous, PressureSample sample) {
        for (ThresholdEntry entry : thresholdListeners) {
            // 首个样本没有参照，不算跨越；启动时已超阈值由周期评估处理
            boolean crossed = previous != null
                    && previous < entry.threshold
                    && sample.getUsagePercent() >= entry.threshold;
            if (!crossed) continue;
            try {
                entry.listener.onThresholdCrossed(entry.threshold, sample);
            } catch (Exception e) {
                log.error("Threshold callback for {}% failed: {}", entry.threshold, e.getMessage(), e);
            }
        }
    }

    private void fireEscalationCallbacks(PressureSample sample, double slope) {
        log.warn("Memory pressure escalating: {}% (slope {}/sample)",
                String.format("%.1f", sample.getUsagePercent()), String.format("%.2f", slope));
        for (EscalationListener listener : escalationListeners) {
            try {
                listener.onEscalation(sample, slope);
            } catch (Exception e) {
                log.error("Escalation callback failed: {}", e.getMessage(), e);
            }
        }
    }

    // ==================== 指标 ====================

    /**
     * 压力指数：0.4×当前值 + 0.6×近5个采样均值；超过80的部分放大1.5倍；截断到[0,100]。
     */
    public double index() {
        lock.lock();
        try {
            if (window.isEmpty()) {
                return 0.0;
            }
            double current = window.peekLast().getUsagePercent();
            double[] recent = lastValues(RECENT_SAMPLES);
            double avg = Arrays.stream(recent).average().orElse(current);

            double idx = 0.4 * current + 0.6 * avg;
            if (idx > AMPLIFY_FROM) {
                idx = AMPLIFY_FROM + (idx - AMPLIFY_FROM) * AMPLIFY_FACTOR;
            }
            return clamp(idx);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 近5个采样的斜率外推5步是否超过5个百分点。采样不足5个时为false。
     */
    public boolean isEscalating() {
        lock.lock();
        try {
            return window.size() >= RECENT_SAMPLES
                    && fitLast(RECENT_SAMPLES).getSlope() * RECENT_SAMPLES > ESCALATION_DELTA;
        } finally {
            lock.unlock();
        }
    }

    public TrendFit trend() {
        return trend(DEFAULT_TREND_WINDOW);
    }

    /**
     * 对最近window个采样做线性拟合。
     */
    public TrendFit trend(int trendWindow) {
        lock.lock();
        try {
            return fitLast(trendWindow);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 预测lookahead个采样周期后的压力指数。拟合优度不足（R²&lt;0.5）时返回当前指数。
     */
    public double predict(int lookahead) {
        TrendFit fit = trend(DEFAULT_TREND_WINDOW);
        double current = index();
        if (fit.getRSquared() < MIN_PREDICT_R2) {
            return current;
        }
        return clamp(current + fit.getSlope() * lookahead);
    }

    /** 最新采样值，没有采样时返回0 */
    public double latest() {
        lock.lock();
        try {
            PressureSample last = window.peekLast();
            return last != null ? last.getUsagePercent() : 0.0;
        } finally {
            lock.unlock();
        }
    }

    public List<PressureSample> getSamples() {
        lock.lock();
        try {
            return new ArrayList<>(window);
        } finally {
            lock.unlock();
        }
    }

    /** 采样序列的占用百分比，按时间正序 */
    public List<Double> getUsageSeries() {
        List<Double> series = new ArrayList<>();
        for (PressureSample sample : getSamples()) {
            series.add(sample.getUsagePercent());
        }
        return series;
    }

    // ==================== 回调注册 ====================

    /** 相邻两个样本从阈值以下升到阈值及以上时回调 */
    public void addThresholdListener(double threshold, ThresholdListener listener) {
        thresholdListeners.add(new ThresholdEntry(threshold, listener));
    }

    public void addEscalationListener(EscalationListener listener) {
        escalationListeners.add(listener);
    }

    // ==================== 后台采样 ====================

    public void start(long intervalMs) {
        if (!running.compareAndSet(false, true)) {
            log.warn("PressureMonitor is already running.");
            return;
        }
        samplerThread = new Thread(() -> samplingLoop(intervalMs), "fuse-pressure-sampler");
        samplerThread.setDaemon(true);
        samplerThread.start();
        log.info("PressureMonitor started with {} probe, interval {}ms, window {}",
                probe.getName(), intervalMs, windowSize);
    }

    private void samplingLoop(long intervalMs) {
        while (running.get()) {
            long start = System.currentTimeMillis();
            try {
                sample();
            } catch (Exception e) {
                log.error("Memory sampling failed", e);
            }
            long sleepTime = intervalMs - (System.currentTimeMillis() - start);
            if (sleepTime > 0) {
                try {
                    Thread.sleep(sleepTime);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        log.info("PressureMonitor sampling stopped.");
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (samplerThread != null) {
            samplerThread.interrupt();
            try {
                samplerThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() { return running.get(); }

    // ==================== 内部工具方法 ====================

    /** 调用方需持有锁 */
    private double[] lastValues(int count) {
        int n = Math.min(count, window.size());
        double[] values = new double[n];
        Iterator<PressureSample> it = window.descendingIterator();
        for (int i = n - 1; i >= 0; i--) {
            values[i] = it.next().getUsagePercent();
        }
        return values;
    }

    /** 调用方需持有锁 */
    private TrendFit fitLast(int count) {
        return TrendFit.fit(lastValues(count));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    static class ThresholdEntry {
        final double threshold;
        final ThresholdListener listener;

        ThresholdEntry(double threshold, ThresholdListener listener) {
            this.threshold = threshold;
            this.listener = listener;
        }
    }
}
