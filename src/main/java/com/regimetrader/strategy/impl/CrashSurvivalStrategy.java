package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.strategy.base.QuantityNormalizer;
import com.regimetrader.strategy.base.QuotePricing;
import com.regimetrader.strategy.base.TradingStrategy;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only strategy active during CRASH. Never opens risk: when |inventory| exceeds the
 * flatten threshold it sends a marketable unwind through the touch, otherwise nothing.
 */
public class CrashSurvivalStrategy implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(CrashSurvivalStrategy.class);

    private final String name;
    private final CrashSurvivalConfig config;

    public CrashSurvivalStrategy(String name, CrashSurvivalConfig config) {
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
        if (Math.abs(inventory) <= config.getFlattenThreshold()) {
            return Optional.empty();
        }

        int quantity = QuantityNormalizer.normalize(Math.min(config.getQuantity(), Math.abs(inventory)));
        OrderIntent unwind = inventory > 0
                ? OrderIntent.builder()
                        .side(OrderSide.SELL)
                        .price(QuotePricing.roundToCents(Math.max(QuotePricing.TICK, bid - config.getCrossOffset())))
                        .quantity(quantity)
                        .source(name)
                        .build()
                : OrderIntent.builder()
                        .side(OrderSide.BUY)
                        .price(QuotePricing.roundToCents(ask + config.getCrossOffset()))
                        .quantity(quantity)
                        .source(name)
                        .build();

        log.info("[{}] flattening inventory={} at step {}: {} {} @ {}",
                name, inventory, step, unwind.getSide(), quantity, unwind.getPrice());
        return Optional.of(unwind);
    }

    public CrashSurvivalConfig getConfig() {
        return config;
    }
}
