package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.ExperimentStrategy;
import java.util.Optional;

/** Lifts the ask on every trade step, measuring buy fills and market impact. */
public class AggressiveBuyer extends ExperimentStrategy {

    public AggressiveBuyer(BaseStrategyConfig config) {
        super(String.format("aggressive_buy_qty%d_freq%d", config.getQuantity(), config.getTradeFrequency()), config);
    }

    @Override
    protected Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step) {
        if (ask <= 0 || !config.isTradeStep(step)) {
            return Optional.empty();
        }
        return order(OrderSide.BUY, ask);
    }
}
