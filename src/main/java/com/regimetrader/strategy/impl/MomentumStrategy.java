package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.strategy.base.QuotePricing;
import com.regimetrader.strategy.base.TradingStrategy;
import java.util.Optional;

/**
 * Follows the recent move: BUY at the ask on positive momentum, SELL at the bid on negative
 * momentum, when |momentum| clears the threshold. Optional NORMAL-regime fallback when the
 * mean-reversion signal is weak.
 */
public class MomentumStrategy implements TradingStrategy {

    private final String name;
    private final MomentumConfig config;

    public MomentumStrategy(String name, MomentumConfig config) {
        this.name = name;
        this.config = config;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<OrderIntent> decide(
            double bid, double ask, double mid, int inventory, long step, MarketMetrics metrics) {
        if (!config.isTradeStep(step)) {
            return Optional.empty();
        }

        double momentum = metrics.getMomentum();
        if (momentum > config.getMomentumThreshold() && inventory < config.getMaxInventory()) {
            return Optional.of(order(OrderSide.BUY, ask));
        }
        if (momentum < -config.getMomentumThreshold() && inventory > -config.getMaxInventory()) {
            return Optional.of(order(OrderSide.SELL, bid));
        }
        return Optional.empty();
    }

    public MomentumConfig getConfig() {
        return config;
    }

    private OrderIntent order(OrderSide side, double price) {
        return OrderIntent.builder()
                .side(side)
                .price(QuotePricing.roundToCents(price))
                .quantity(config.getQuantity())
                .source(name)
                .build();
    }
}
