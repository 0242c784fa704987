package com.clipsmaster.fuse.core.impl;

import com.clipsmaster.fuse.support.FakeMemoryProbe;
import com.clipsmaster.fuse.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PressureMonitorTest {

    private MutableClock clock;
    private PressureMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        monitor = new PressureMonitor(new FakeMemoryProbe(0), clock, 10);
    }

    private void feed(double... values) {
        for (double v : values) {
            monitor.update(v);
            clock.advanceSeconds(1);
        }
    }

    @Test
    void indexIsZeroWithoutSamples() {
        assertThat(monitor.index()).isZero();
        assertThat(monitor.latest()).isZero();
    }

    @Test
    void indexBlendsCurrentWithRecentAverage() {
        feed(50);
        assertThat(monitor.index()).isCloseTo(50.0, within(1e-9));

        feed(60, 70, 80, 90);
        // 0.4*90 + 0.6*70 = 78，未进入放大区
        assertThat(monitor.index()).isCloseTo(78.0, within(1e-9));
    }

    @Test
    void indexAmplifiesAboveEightyAndIsClamped() {
        feed(60, 70, 80, 90, 100);
        // 0.4*100 + 0.6*80 = 88 -> 80 + 8*1.5 = 92
        assertThat(monitor.index()).isCloseTo(92.0, within(1e-9));

        feed(100, 100, 100, 100, 100);
        assertThat(monitor.index()).isEqualTo(100.0);
    }

    @Test
    void indexNeverDecreasesUnderRisingSamples() {
        double previous = -1;
        for (double v = 40; v <= 100; v += 3) {
            monitor.update(v);
            double idx = monitor.index();
            assertThat(idx).isGreaterThanOrEqualTo(previous).isBetween(0.0, 100.0);
            previous = idx;
        }
    }

    @Test
    void windowKeepsOnlyNewestSamples() {
        for (int i = 0; i < 25; i++) {
            monitor.update(i);
        }
        assertThat(monitor.getSamples()).hasSize(10);
        assertThat(monitor.getUsageSeries().get(0)).isEqualTo(15.0);
        assertThat(monitor.latest()).isEqualTo(24.0);
    }

    @Test
    void escalationNeedsFiveSamplesAndSteepSlope() {
        List<Double> slopes = new ArrayList<>();
        monitor.addEscalationListener((sample, slope) -> slopes.add(slope));

        feed(50, 52, 54, 56);
        assertThat(monitor.isEscalating()).isFalse();

        feed(58);
        assertThat(monitor.isEscalating()).isTrue();
        assertThat(slopes).hasSize(1);
        assertThat(slopes.get(0)).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void gentleRiseIsNotEscalation() {
        feed(50, 51, 52, 53, 54);
        assertThat(monitor.isEscalating()).isFalse();
    }

    @Test
    void thresholdListenerFiresOnlyOnUpwardCrossing() {
        List<Double> crossings = new ArrayList<>();
        monitor.addThresholdListener(80, (threshold, sample) -> crossings.add(sample.getUsagePercent()));

        feed(70, 85, 90, 75, 82);

        assertThat(crossings).containsExactly(85.0, 82.0);
    }

    @Test
    void firstSampleAboveThresholdIsNotACrossing() {
        List<Double> crossings = new ArrayList<>();
        monitor.addThresholdListener(80, (threshold, sample) -> crossings.add(sample.getUsagePercent()));

        feed(90, 95);
        assertThat(crossings).isEmpty();

        feed(60, 88);
        assertThat(crossings).containsExactly(88.0);
    }

    @Test
    void failingListenerDoesNotBreakSampling() {
        monitor.addThresholdListener(10, (threshold, sample) -> {
            throw new IllegalStateException("boom");
        });
        feed(5, 50);
        assertThat(monitor.latest()).isEqualTo(50.0);
        assertThat(monitor.getSamples()).hasSize(2);
    }

    @Test
    void predictExtrapolatesWellFittedTrend() {
        feed(50, 52, 54, 56, 58);
        // 指数 0.4*58 + 0.6*54 = 55.6，斜率2
        assertThat(monitor.predict(5)).isCloseTo(65.6, within(1e-9));
    }

    @Test
    void predictFallsBackToIndexWhenTrendIsNoisy() {
        feed(50, 60, 50, 60, 50, 60);
        assertThat(monitor.trend().getRSquared()).isLessThan(0.5);
        assertThat(monitor.predict(10)).isEqualTo(monitor.index());
    }

    @Test
    void predictIsClamped() {
        feed(80, 85, 90, 95, 99);
        assertThat(monitor.predict(100)).isEqualTo(100.0);
    }

    @Test
    void sampleReadsFromProbe() {
        FakeMemoryProbe probe = new FakeMemoryProbe(0).script(30, 40);
        PressureMonitor sampling = new PressureMonitor(probe, clock);
        sampling.sample();
        sampling.sample();
        assertThat(sampling.getUsageSeries()).containsExactly(30.0, 40.0);
    }

    @Test
    void rejectsTinyWindow() {
        assertThatThrownBy(() -> new PressureMonitor(new FakeMemoryProbe(0), clock, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
