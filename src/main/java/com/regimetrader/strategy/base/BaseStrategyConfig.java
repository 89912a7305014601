package com.regimetrader.strategy.base;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Parameters shared by all strategy types: order size and how often the strategy quotes.
 *
 * <p>Uses {@code @SuperBuilder} so subclasses can chain builder calls:
 * {@code PassiveMarketMakerConfig.builder().quantity(100).tradeFrequency(1).skewFactor(0.0001).build()}.
 * The no-args constructor plus setters let Spring bind the same classes from properties.
 */
@Data
@SuperBuilder
@NoArgsConstructor
public class BaseStrategyConfig {

    /** Intended order size before normalization. */
    @Builder.Default
    private int quantity = 200;

    /** Quote only on steps where {@code step % tradeFrequency == 0}. */
    @Builder.Default
    private int tradeFrequency = 1;

    /** True when this step falls on the strategy's quoting cadence. */
    public boolean isTradeStep(long step) {
        return tradeFrequency <= 1 || step % tradeFrequency == 0;
    }

    /** Alternating strategies buy on even trade cycles ({@code step / tradeFrequency}) and sell on odd ones. */
    public boolean isBuyCycle(long step) {
        return (step / Math.max(1, tradeFrequency)) % 2 == 0;
    }
}
