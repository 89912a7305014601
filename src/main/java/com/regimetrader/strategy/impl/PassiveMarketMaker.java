package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.strategy.base.QuotePricing;
import com.regimetrader.strategy.base.TradingStrategy;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passive two-sided quoting with inventory skew.
 *
 * <p>Every {@code tradeFrequency} steps the strategy posts one side, alternating BUY and SELL by
 * the parity of {@code step / tradeFrequency}. Prices come from {@link QuotePricing}: improve
 * by a tick when the spread allows it, otherwise join; the skew leans both quotes against the
 * current inventory. Stops quoting once |inventory| reaches {@code maxInventory}.
 */
public class PassiveMarketMaker implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(PassiveMarketMaker.class);

    private final String name;
    private final PassiveMarketMakerConfig config;

    public PassiveMarketMaker(String name, PassiveMarketMakerConfig config) {
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
        if (Math.abs(inventory) >= config.getMaxInventory()) {
            log.debug("[{}] inventory {} at max {}, not quoting", name, inventory, config.getMaxInventory());
            return Optional.empty();
        }

        double skew = QuotePricing.skew(config.getSkewFactor(), inventory);
        OrderSide side = quoteSide(step);
        BigDecimal price = side == OrderSide.BUY
                ? QuotePricing.buyQuote(bid, ask, skew)
                : QuotePricing.sellQuote(bid, ask, skew);

        return Optional.of(OrderIntent.builder()
                .side(side)
                .price(price)
                .quantity(config.getQuantity())
                .source(name)
                .build());
    }

    public PassiveMarketMakerConfig getConfig() {
        return config;
    }

    private OrderSide quoteSide(long step) {
        long cycle = step / Math.max(1, config.getTradeFrequency());
        return cycle % 2 == 0 ? OrderSide.BUY : OrderSide.SELL;
    }
}
