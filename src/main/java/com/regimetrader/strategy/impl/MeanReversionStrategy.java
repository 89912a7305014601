package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.strategy.base.QuantityNormalizer;
import com.regimetrader.strategy.base.QuotePricing;
import com.regimetrader.strategy.base.TradingStrategy;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fades stretched prices using the mid z-score.
 *
 * <p>Entry: BUY near the bid when z &lt; -entryZ, SELL near the ask when z &gt; entryZ.
 * Exit: once |z| &lt; exitZ, reduce any position larger than the exit threshold at the touch,
 * sized at min(quantity, |inventory|) normalized to the lot rules.
 */
public class MeanReversionStrategy implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(MeanReversionStrategy.class);

    private final String name;
    private final MeanReversionConfig config;

    public MeanReversionStrategy(String name, MeanReversionConfig config) {
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
        if (Math.abs(inventory) >= config.getMaxInventory()) {
            return Optional.empty();
        }

        double z = metrics.getZScore();

        if (z < -config.getEntryZ()) {
            BigDecimal price = QuotePricing.roundToCents(Math.min(bid, ask - QuotePricing.TICK));
            log.debug("[{}] z={} below -{}, BUY @ {}", name, z, config.getEntryZ(), price);
            return Optional.of(order(OrderSide.BUY, price, config.getQuantity()));
        }
        if (z > config.getEntryZ()) {
            BigDecimal price = QuotePricing.roundToCents(Math.max(ask, bid + QuotePricing.TICK));
            log.debug("[{}] z={} above {}, SELL @ {}", name, z, config.getEntryZ(), price);
            return Optional.of(order(OrderSide.SELL, price, config.getQuantity()));
        }

        if (Math.abs(z) < config.getExitZ()) {
            int exitQuantity = QuantityNormalizer.normalize(Math.min(config.getQuantity(), Math.abs(inventory)));
            if (inventory > config.getExitThreshold()) {
                return Optional.of(order(OrderSide.SELL, QuotePricing.roundToCents(bid), exitQuantity));
            }
            if (inventory < -config.getExitThreshold()) {
                return Optional.of(order(OrderSide.BUY, QuotePricing.roundToCents(ask), exitQuantity));
            }
        }
        return Optional.empty();
    }

    public MeanReversionConfig getConfig() {
        return config;
    }

    private OrderIntent order(OrderSide side, BigDecimal price, int quantity) {
        return OrderIntent.builder().side(side).price(price).quantity(quantity).source(name).build();
    }
}
