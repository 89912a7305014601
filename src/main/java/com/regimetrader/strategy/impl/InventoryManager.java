package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.ExperimentStrategy;
import java.util.Optional;

/**
 * Trades only to pull inventory back inside +/-threshold: sells at the bid when too long,
 * buys at the ask when too short.
 */
public class InventoryManager extends ExperimentStrategy {

    private final int threshold;

    public InventoryManager(BaseStrategyConfig config, int threshold) {
        super(String.format("inventory_mgmt_qty%d_thresh%d_freq%d",
                config.getQuantity(), threshold, config.getTradeFrequency()), config);
        this.threshold = threshold;
    }

    @Override
    protected Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step) {
        if (bid <= 0 || ask <= 0 || !config.isTradeStep(step)) {
            return Optional.empty();
        }
        if (inventory > threshold) {
            return order(OrderSide.SELL, bid);
        }
        if (inventory < -threshold) {
            return order(OrderSide.BUY, ask);
        }
        return Optional.empty();
    }

    public int getThreshold() {
        return threshold;
    }
}
