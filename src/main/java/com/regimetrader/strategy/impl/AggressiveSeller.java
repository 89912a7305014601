package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.ExperimentStrategy;
import java.util.Optional;

/** Hits the bid on every trade step. Mirror of {@link AggressiveBuyer}. */
public class AggressiveSeller extends ExperimentStrategy {

    public AggressiveSeller(BaseStrategyConfig config) {
        super(String.format("aggressive_sell_qty%d_freq%d", config.getQuantity(), config.getTradeFrequency()), config);
    }

    @Override
    protected Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step) {
        if (bid <= 0 || !config.isTradeStep(step)) {
            return Optional.empty();
        }
        return order(OrderSide.SELL, bid);
    }
}
