package com.regimetrader.domain.enums;

/**
 * Discrete label describing the current market behavior.
 *
 * <p>CALIBRATING is the initial state and holds until the metrics baseline is captured.
 * CRASH preempts every other label; RECOVERY is only reachable from CRASH.
 */
public enum MarketRegime {
    CALIBRATING,
    NORMAL,
    STRESSED,
    CRASH,
    HFT,
    RECOVERY;

    /** True for regimes in which new orders may be routed at all. */
    public boolean isTradable() {
        return this != CALIBRATING;
    }
}
