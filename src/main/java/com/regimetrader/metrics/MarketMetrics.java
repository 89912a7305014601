package com.regimetrader.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Derived signal set produced by {@link MetricsEngine} for one update.
 *
 * <p>Ratios are 1.0 and the baseline is null until calibration completes.
 */
@Value
@Builder
public class MarketMetrics {

    long sampleCount;
    boolean calibrated;

    double mid;
    double spread;
    double depth;

    double meanMid;
    double meanSpread;
    double volatility;
    double zScore;
    double momentum;
    double imbalance;
    double churn;
    double spreadRatio;
    double depthRatio;

    MetricsBaseline baseline;

    /** Metrics before the first update: uncalibrated, neutral ratios. */
    public static MarketMetrics empty() {
        return MarketMetrics.builder().spreadRatio(1.0).depthRatio(1.0).build();
    }
}
