package com.regimetrader.strategy;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.risk.RiskAdjustment;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the router decided for one snapshot: regime, chosen strategy, the raw candidate
 * and what the risk overlay made of it.
 */
@Value
@Builder
public class RoutingDecision {

    long step;
    MarketRegime regime;
    MarketMetrics metrics;

    /** False when the quote failed the guard and nothing else ran. */
    boolean routed;

    /** Null when no strategy is bound to the regime. */
    String strategyName;

    /** The strategy's proposal before risk checks, null if none. */
    OrderIntent candidate;

    RiskAdjustment adjustment;

    /** Order to submit after risk checks, null for no action. */
    public OrderIntent getOrder() {
        return adjustment != null ? adjustment.getOrder() : null;
    }

    public static RoutingDecision skipped(long step, MarketRegime regime) {
        return RoutingDecision.builder()
                .step(step)
                .regime(regime)
                .routed(false)
                .adjustment(RiskAdjustment.noAction())
                .build();
    }
}
