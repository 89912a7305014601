package com.regimetrader.strategy.base;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.metrics.MarketMetrics;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Base for the data-collection experiments: fixed, signal-free behaviours used to measure how
 * the exchange fills orders at different sizes, prices and cadences.
 *
 * <p>Experiments see the quote, inventory and step only; the metrics argument is ignored.
 * Prices are rounded to cents, quantities are sent as configured.
 */
public abstract class ExperimentStrategy implements TradingStrategy {

    private final String name;
    protected final BaseStrategyConfig config;

    protected ExperimentStrategy(String name, BaseStrategyConfig config) {
        this.name = name;
        this.config = config;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public final Optional<OrderIntent> decide(
            double bid, double ask, double mid, int inventory, long step, MarketMetrics metrics) {
        return decideOrder(bid, ask, mid, inventory, step);
    }

    protected abstract Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step);

    protected Optional<OrderIntent> order(OrderSide side, double price) {
        return order(side, QuotePricing.roundToCents(price));
    }

    protected Optional<OrderIntent> order(OrderSide side, BigDecimal price) {
        return Optional.of(OrderIntent.builder()
                .side(side)
                .price(price)
                .quantity(config.getQuantity())
                .source(name)
                .build());
    }

    public BaseStrategyConfig getConfig() {
        return config;
    }
}
