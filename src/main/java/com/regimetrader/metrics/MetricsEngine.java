package com.regimetrader.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw quote stream into O(1)-updated statistical signals.
 *
 * <p>Keeps rolling windows of mid, spread and total depth. Each {@link #update} call appends one
 * sample and recomputes:
 * <ul>
 *   <li>volatility = sqrt(max(0, Var(mid))), z-score = (mid - mean) / volatility, or 0 when
 *       volatility is at most {@link #EPSILON}</li>
 *   <li>momentum = (mid - mid 10 samples back, counting the current one) / 10</li>
 *   <li>book imbalance = (bidDepth - askDepth) / (bidDepth + askDepth)</li>
 *   <li>churn = share of steps in the last completed block of {@code churnWindow} steps
 *       in which mid moved by more than {@link #EPSILON}</li>
 *   <li>spread and depth ratios against the calibration baseline</li>
 * </ul>
 *
 * <p>The baseline is captured on the update at which the sample count first reaches
 * {@code calibrationSteps} and is never recomputed. One instance per engine; not thread-safe.
 */
public class MetricsEngine {

    private static final Logger log = LoggerFactory.getLogger(MetricsEngine.class);

    /** Threshold for "mid changed" in churn and for the z-score volatility guard. */
    public static final double EPSILON = 0.001;

    private final int calibrationSteps;
    private final int churnWindow;
    private final int momentumLookback;

    private final RollingWindow mids;
    private final RollingWindow spreads;
    private final RollingWindow depths;

    private long sampleCount;
    private int churnChanges;
    private double churn;
    private MetricsBaseline baseline;
    private MarketMetrics latest = MarketMetrics.empty();

    public MetricsEngine(int windowSize, int calibrationSteps, int churnWindow, int momentumLookback) {
        if (calibrationSteps <= 0 || churnWindow <= 0 || momentumLookback <= 0) {
            throw new IllegalArgumentException(String.format(
                    "calibrationSteps, churnWindow and momentumLookback must be positive: %d, %d, %d",
                    calibrationSteps, churnWindow, momentumLookback));
        }
        this.calibrationSteps = calibrationSteps;
        this.churnWindow = churnWindow;
        this.momentumLookback = momentumLookback;
        this.mids = new RollingWindow(windowSize);
        this.spreads = new RollingWindow(windowSize);
        this.depths = new RollingWindow(windowSize);
    }

    /**
     * Ingests one snapshot and returns the recomputed signal set.
     * Non-finite inputs are ignored and the previous metrics are returned.
     */
    public MarketMetrics update(double mid, double spread, double bidDepth, double askDepth) {
        if (!Double.isFinite(mid) || !Double.isFinite(spread)
                || !Double.isFinite(bidDepth) || !Double.isFinite(askDepth)) {
            log.warn("Skipping non-finite metrics input: mid={}, spread={}, bidDepth={}, askDepth={}",
                    mid, spread, bidDepth, askDepth);
            return latest;
        }

        boolean hasPrevious = mids.size() > 0;
        double previousMid = hasPrevious ? mids.fromNewest(0) : mid;
        double totalDepth = bidDepth + askDepth;

        mids.add(mid);
        spreads.add(spread);
        depths.add(totalDepth);
        sampleCount++;

        updateChurn(hasPrevious && Math.abs(mid - previousMid) > EPSILON);

        if (baseline == null && sampleCount >= calibrationSteps) {
            baseline = new MetricsBaseline(spreads.mean(), depths.mean(), mids.mean());
            log.info("Metrics calibrated after {} samples: baselineSpread={}, baselineDepth={}, baselineMid={}",
                    sampleCount, baseline.spread(), baseline.depth(), baseline.mid());
        }

        double meanMid = mids.mean();
        double volatility = Math.sqrt(Math.max(0.0, mids.variance()));
        double zScore = volatility > EPSILON ? (mid - meanMid) / volatility : 0.0;

        latest = MarketMetrics.builder()
                .sampleCount(sampleCount)
                .calibrated(baseline != null)
                .mid(mid)
                .spread(spread)
                .depth(totalDepth)
                .meanMid(meanMid)
                .meanSpread(spreads.mean())
                .volatility(volatility)
                .zScore(zScore)
                .momentum(momentum(mid))
                .imbalance(totalDepth > 0 ? (bidDepth - askDepth) / totalDepth : 0.0)
                .churn(churn)
                .spreadRatio(baseline != null ? ratio(spread, baseline.spread()) : 1.0)
                .depthRatio(baseline != null ? ratio(totalDepth, baseline.depth()) : 1.0)
                .baseline(baseline)
                .build();
        return latest;
    }

    public MarketMetrics getLatest() {
        return latest;
    }

    public MetricsBaseline getBaseline() {
        return baseline;
    }

    public boolean isCalibrated() {
        return baseline != null;
    }

    /** Current mean of the mid window, for checks against the raw window contents. */
    public double getMeanMid() {
        return mids.mean();
    }

    /** Mid window contents, oldest first. */
    public double[] midWindow() {
        return mids.toArray();
    }

    public long getSampleCount() {
        return sampleCount;
    }

    /** Discards all samples and the baseline. Used when a new session starts. */
    public void reset() {
        mids.clear();
        spreads.clear();
        depths.clear();
        sampleCount = 0;
        churnChanges = 0;
        churn = 0.0;
        baseline = null;
        latest = MarketMetrics.empty();
    }

    private double momentum(double mid) {
        if (mids.size() < momentumLookback) {
            return 0.0;
        }
        return (mid - mids.fromNewest(momentumLookback - 1)) / momentumLookback;
    }

    private void updateChurn(boolean midChanged) {
        if (midChanged) {
            churnChanges++;
        }
        if (sampleCount % churnWindow == 0) {
            churn = Math.min(1.0, (double) churnChanges / churnWindow);
            churnChanges = 0;
        }
    }

    private static double ratio(double current, double base) {
        return base > 0 ? current / base : 1.0;
    }
}
