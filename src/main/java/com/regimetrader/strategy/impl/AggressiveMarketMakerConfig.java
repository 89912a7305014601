package com.regimetrader.strategy.impl;

import com.regimetrader.strategy.base.BaseStrategyConfig;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/** Configuration for {@link AggressiveMarketMaker}. */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class AggressiveMarketMakerConfig extends BaseStrategyConfig {

    /** At or beyond this |inventory| the strategy unwinds at the touch every step. */
    @Builder.Default
    private int maxInventory = 3500;

    /** Size of the forced unwind order. */
    @Builder.Default
    private int unwindQuantity = 300;

    /** Above this |inventory| only the flattening side is quoted. */
    @Builder.Default
    private int flattenBias = 1000;

    @Builder.Default
    private double skewFactor = 0.008;
}
