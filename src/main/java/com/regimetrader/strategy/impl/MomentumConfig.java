package com.regimetrader.strategy.impl;

import com.regimetrader.strategy.base.BaseStrategyConfig;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/** Configuration for {@link MomentumStrategy}. */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MomentumConfig extends BaseStrategyConfig {

    /** Minimum |momentum| (price per step) before following the move. */
    @Builder.Default
    private double momentumThreshold = 0.02;

    @Builder.Default
    private int maxInventory = 2500;
}
