package com.regimetrader.strategy.impl;

import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.ExperimentStrategy;
import java.util.Optional;

/** Never trades. Records how the market evolves without our orders in it. */
public class PassiveObserver extends ExperimentStrategy {

    public PassiveObserver() {
        super("passive", BaseStrategyConfig.builder().quantity(0).build());
    }

    @Override
    protected Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step) {
        return Optional.empty();
    }
}
