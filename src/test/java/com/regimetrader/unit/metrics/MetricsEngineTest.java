package com.regimetrader.unit.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.metrics.MetricsBaseline;
import com.regimetrader.metrics.MetricsEngine;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MetricsEngineTest {

    private static MarketMetrics feed(MetricsEngine engine, double mid, int times) {
        MarketMetrics metrics = null;
        for (int i = 0; i < times; i++) {
            metrics = engine.update(mid, 0.2, 500, 500);
        }
        return metrics;
    }

    @Nested
    @DisplayName("Rolling statistics")
    class RollingStatistics {

        @Test
        @DisplayName("Mean equals the mean of the retained window after evictions")
        void meanAfterEvictions() {
            MetricsEngine engine = new MetricsEngine(5, 100, 20, 10);
            for (int i = 1; i <= 12; i++) {
                engine.update(i, 0.2, 500, 500);
            }

            double direct = Arrays.stream(engine.midWindow()).average().orElseThrow();
            assertThat(engine.midWindow()).containsExactly(8.0, 9.0, 10.0, 11.0, 12.0);
            assertThat(engine.getMeanMid()).isCloseTo(direct, within(1e-9));
            assertThat(engine.getMeanMid()).isCloseTo(10.0, within(1e-9));
        }

        @Test
        @DisplayName("Constant prices give zero volatility and a zero z-score")
        void constantPrices() {
            MetricsEngine engine = new MetricsEngine(100, 100, 20, 10);

            MarketMetrics metrics = feed(engine, 100.0, 150);

            assertThat(metrics.getVolatility()).isGreaterThanOrEqualTo(0.0).isLessThan(1e-6);
            assertThat(metrics.getZScore()).isZero();
        }

        @Test
        @DisplayName("z-score is (mid - mean) / volatility once volatility clears epsilon")
        void zScoreFormula() {
            MetricsEngine engine = new MetricsEngine(100, 10, 20, 10);
            feed(engine, 100.0, 50);

            MarketMetrics metrics = engine.update(101.0, 0.2, 500, 500);

            assertThat(metrics.getVolatility()).isGreaterThan(MetricsEngine.EPSILON);
            assertThat(metrics.getZScore())
                    .isCloseTo((metrics.getMid() - metrics.getMeanMid()) / metrics.getVolatility(), within(1e-9))
                    .isPositive();
        }

        @Test
        @DisplayName("Momentum compares against the mid ten samples back, counting the current one")
        void momentum() {
            MetricsEngine engine = new MetricsEngine(100, 100, 20, 10);
            MarketMetrics metrics = null;
            for (int i = 0; i < 10; i++) {
                metrics = engine.update(100.0 + i, 0.2, 500, 500);
                if (i < 9) {
                    assertThat(metrics.getMomentum()).isZero();
                }
            }

            assertThat(metrics.getMomentum()).isCloseTo(0.9, within(1e-9));
        }

        @Test
        @DisplayName("Imbalance is signed depth difference over total depth")
        void imbalance() {
            MetricsEngine engine = new MetricsEngine(100, 100, 20, 10);

            assertThat(engine.update(100, 0.2, 300, 100).getImbalance()).isCloseTo(0.5, within(1e-12));
            assertThat(engine.update(100, 0.2, 100, 300).getImbalance()).isCloseTo(-0.5, within(1e-12));
            assertThat(engine.update(100, 0.2, 0, 0).getImbalance()).isZero();
        }
    }

    @Nested
    @DisplayName("Churn")
    class Churn {

        @Test
        @DisplayName("Churn is the share of mid changes in the last completed block")
        void churnPerBlock() {
            MetricsEngine engine = new MetricsEngine(100, 100, 20, 10);
            MarketMetrics metrics = null;
            for (int i = 1; i <= 20; i++) {
                metrics = engine.update(i % 2 == 0 ? 100.1 : 100.0, 0.2, 500, 500);
                if (i < 20) {
                    assertThat(metrics.getChurn()).isZero();
                }
            }
            // first sample has nothing to compare with: 19 changes in 20 steps
            assertThat(metrics.getChurn()).isCloseTo(0.95, within(1e-12));

            // held until the next block completes
            assertThat(engine.update(100.1, 0.2, 500, 500).getChurn()).isCloseTo(0.95, within(1e-12));
        }

        @Test
        @DisplayName("A quiet block resets churn to zero")
        void quietBlockResets() {
            MetricsEngine engine = new MetricsEngine(100, 100, 20, 10);
            for (int i = 1; i <= 20; i++) {
                engine.update(i % 2 == 0 ? 100.1 : 100.0, 0.2, 500, 500);
            }

            MarketMetrics metrics = feed(engine, 100.1, 20);

            assertThat(metrics.getChurn()).isZero();
        }
    }

    @Nested
    @DisplayName("Calibration")
    class Calibration {

        @Test
        @DisplayName("Uncalibrated metrics carry neutral ratios and no baseline")
        void beforeCalibration() {
            MetricsEngine engine = new MetricsEngine(100, 10, 20, 10);

            MarketMetrics metrics = feed(engine, 100.0, 9);

            assertThat(metrics.isCalibrated()).isFalse();
            assertThat(metrics.getBaseline()).isNull();
            assertThat(metrics.getSpreadRatio()).isEqualTo(1.0);
            assertThat(metrics.getDepthRatio()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Baseline is captured once and never recomputed")
        void baselineCapturedOnce() {
            MetricsEngine engine = new MetricsEngine(100, 10, 20, 10);
            for (int i = 0; i < 10; i++) {
                engine.update(100.0, 0.2, 400, 600);
            }
            MetricsBaseline baseline = engine.getBaseline();

            assertThat(baseline).isNotNull();
            assertThat(baseline.spread()).isCloseTo(0.2, within(1e-12));
            assertThat(baseline.depth()).isCloseTo(1000.0, within(1e-9));
            assertThat(baseline.mid()).isCloseTo(100.0, within(1e-9));

            MarketMetrics metrics = null;
            for (int i = 0; i < 20; i++) {
                metrics = engine.update(100.0, 1.0, 200, 300);
            }

            assertThat(engine.getBaseline()).isSameAs(baseline);
            assertThat(metrics.getSpreadRatio()).isCloseTo(5.0, within(1e-9));
            assertThat(metrics.getDepthRatio()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        @DisplayName("Non-finite input is ignored")
        void nonFiniteIgnored() {
            MetricsEngine engine = new MetricsEngine(100, 10, 20, 10);
            MarketMetrics before = engine.update(100.0, 0.2, 500, 500);

            MarketMetrics after = engine.update(Double.NaN, 0.2, 500, 500);

            assertThat(after).isSameAs(before);
            assertThat(engine.getSampleCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Reset discards samples and baseline")
        void reset() {
            MetricsEngine engine = new MetricsEngine(100, 10, 20, 10);
            feed(engine, 100.0, 15);

            engine.reset();

            assertThat(engine.isCalibrated()).isFalse();
            assertThat(engine.getSampleCount()).isZero();
            assertThat(engine.midWindow()).isEmpty();
        }
    }

    @Test
    @DisplayName("Non-positive window sizes are rejected at construction")
    void rejectsNonPositiveWindows() {
        assertThatThrownBy(() -> new MetricsEngine(100, 100, 0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("churnWindow");
        assertThatThrownBy(() -> new MetricsEngine(100, 100, 20, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricsEngine(0, 100, 20, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
