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
 * Faster market maker for calm markets.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>inventory at or beyond +/-maxInventory: unwind at the touch (SELL at bid, BUY at ask),
 *       regardless of the quoting cadence</li>
 *   <li>off-cadence steps: nothing</li>
 *   <li>|inventory| above the flatten bias: quote only the side that reduces it</li>
 *   <li>otherwise alternate sides like {@link PassiveMarketMaker}</li>
 * </ol>
 * Quote prices use the same {@link QuotePricing} rules as the passive maker, with a steeper skew.
 */
public class AggressiveMarketMaker implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(AggressiveMarketMaker.class);

    private final String name;
    private final AggressiveMarketMakerConfig config;

    public AggressiveMarketMaker(String name, AggressiveMarketMakerConfig config) {
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
        if (inventory >= config.getMaxInventory()) {
            log.info("[{}] forced unwind: inventory={} >= {}, SELL {} @ bid {}",
                    name, inventory, config.getMaxInventory(), config.getUnwindQuantity(), bid);
            return Optional.of(order(OrderSide.SELL, QuotePricing.roundToCents(bid), config.getUnwindQuantity()));
        }
        if (inventory <= -config.getMaxInventory()) {
            log.info("[{}] forced unwind: inventory={} <= -{}, BUY {} @ ask {}",
                    name, inventory, config.getMaxInventory(), config.getUnwindQuantity(), ask);
            return Optional.of(order(OrderSide.BUY, QuotePricing.roundToCents(ask), config.getUnwindQuantity()));
        }
        if (!config.isTradeStep(step)) {
            return Optional.empty();
        }

        OrderSide side;
        if (inventory > config.getFlattenBias()) {
            side = OrderSide.SELL;
        } else if (inventory < -config.getFlattenBias()) {
            side = OrderSide.BUY;
        } else {
            long cycle = step / Math.max(1, config.getTradeFrequency());
            side = cycle % 2 == 0 ? OrderSide.BUY : OrderSide.SELL;
        }

        double skew = QuotePricing.skew(config.getSkewFactor(), inventory);
        BigDecimal price = side == OrderSide.BUY
                ? QuotePricing.buyQuote(bid, ask, skew)
                : QuotePricing.sellQuote(bid, ask, skew);
        return Optional.of(order(side, price, config.getQuantity()));
    }

    public AggressiveMarketMakerConfig getConfig() {
        return config;
    }

    private OrderIntent order(OrderSide side, BigDecimal price, int quantity) {
        return OrderIntent.builder().side(side).price(price).quantity(quantity).source(name).build();
    }
}
