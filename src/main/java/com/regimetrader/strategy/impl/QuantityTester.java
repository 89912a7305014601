package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.ExperimentStrategy;
import com.regimetrader.strategy.base.QuotePricing;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Alternates buys and sells of a fixed size at mid plus an offset, to see how size affects
 * fills. A buy is capped at the ask and a sell floored at the bid, so neither pays through the
 * touch.
 */
public class QuantityTester extends ExperimentStrategy {

    private final double priceOffset;

    public QuantityTester(BaseStrategyConfig config, double priceOffset) {
        super(String.format("qty_test_%d_offset%s_freq%d",
                config.getQuantity(), priceOffset, config.getTradeFrequency()), config);
        this.priceOffset = priceOffset;
    }

    @Override
    protected Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step) {
        if (mid <= 0 || !config.isTradeStep(step)) {
            return Optional.empty();
        }
        BigDecimal target = QuotePricing.roundToCents(mid + priceOffset);
        if (config.isBuyCycle(step)) {
            return order(OrderSide.BUY, ask > 0 ? target.min(QuotePricing.roundToCents(ask)) : target);
        }
        return order(OrderSide.SELL, bid > 0 ? target.max(QuotePricing.roundToCents(bid)) : target);
    }

    public double getPriceOffset() {
        return priceOffset;
    }
}
