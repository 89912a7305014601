package com.regimetrader.strategy.impl;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.ExperimentStrategy;
import java.util.Optional;

/** Alternates buys and sells at one fixed reference price to map fill rates by price level. */
public class PriceExplorer extends ExperimentStrategy {

    /** Reference prices, relative to the current quote. */
    public enum PriceLevel {
        BID("bid"),
        ASK("ask"),
        MID("mid"),
        /** One cent below the bid. */
        BID_MINUS_1("bid-1"),
        /** One cent above the ask. */
        ASK_PLUS_1("ask+1"),
        MID_MINUS_HALF("mid-0.5"),
        MID_PLUS_HALF("mid+0.5");

        private final String label;

        PriceLevel(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        double price(double bid, double ask, double mid) {
            return switch (this) {
                case BID -> bid;
                case ASK -> ask;
                case MID -> mid;
                case BID_MINUS_1 -> bid - 0.01;
                case ASK_PLUS_1 -> ask + 0.01;
                case MID_MINUS_HALF -> mid - 0.5;
                case MID_PLUS_HALF -> mid + 0.5;
            };
        }
    }

    private final PriceLevel priceLevel;

    public PriceExplorer(PriceLevel priceLevel, BaseStrategyConfig config) {
        super(String.format("price_explore_%s_qty%d_freq%d",
                priceLevel.getLabel(), config.getQuantity(), config.getTradeFrequency()), config);
        this.priceLevel = priceLevel;
    }

    @Override
    protected Optional<OrderIntent> decideOrder(double bid, double ask, double mid, int inventory, long step) {
        if (bid <= 0 || ask <= 0 || mid <= 0 || !config.isTradeStep(step)) {
            return Optional.empty();
        }
        double target = priceLevel.price(bid, ask, mid);
        return order(config.isBuyCycle(step) ? OrderSide.BUY : OrderSide.SELL, target);
    }

    public PriceLevel getPriceLevel() {
        return priceLevel;
    }
}
