package com.regimetrader.metrics;

/** Average spread, depth and mid over the calibration period. Captured exactly once. */
public record MetricsBaseline(double spread, double depth, double mid) {}
