package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.ExperimentStrategy;
import java.util.Optional;

/** Crosses the spread in alternating directions: buys at the ask, then sells at the bid. */
public class SpreadCrosser extends ExperimentStrategy {

    public SpreadCrosser(BaseStrategyConfig config) {
        super(String.format("spread_cross_qty%d_freq%d", config.getQuantity(), config.getTradeFrequency()), config);
    }

    @Override
    protected Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step) {
        if (bid <= 0 || ask <= 0 || !config.isTradeStep(step)) {
            return Optional.empty();
        }
        return config.isBuyCycle(step) ? order(OrderSide.BUY, ask) : order(OrderSide.SELL, bid);
    }
}
