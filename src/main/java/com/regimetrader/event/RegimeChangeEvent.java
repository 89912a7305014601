package com.regimetrader.event;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.metrics.MarketMetrics;
import org.springframework.context.ApplicationEvent;

/** Published by the router whenever the classified regime differs from the previous step's. */
public class RegimeChangeEvent extends ApplicationEvent {

    private final long step;
    private final MarketRegime previousRegime;
    private final MarketRegime currentRegime;
    private final MarketMetrics metrics;

    public RegimeChangeEvent(
            Object source, long step, MarketRegime previousRegime, MarketRegime currentRegime, MarketMetrics metrics) {
        super(source);
        this.step = step;
        this.previousRegime = previousRegime;
        this.currentRegime = currentRegime;
        this.metrics = metrics;
    }

    public long getStep() {
        return step;
    }

    public MarketRegime getPreviousRegime() {
        return previousRegime;
    }

    public MarketRegime getCurrentRegime() {
        return currentRegime;
    }

    /** Signals that triggered the transition. */
    public MarketMetrics getMetrics() {
        return metrics;
    }
}
