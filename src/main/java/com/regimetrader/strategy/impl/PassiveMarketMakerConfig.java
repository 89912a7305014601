package com.regimetrader.strategy.impl;

import com.regimetrader.strategy.base.BaseStrategyConfig;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Configuration for {@link PassiveMarketMaker}.
 *
 * <p>The router runs two instances: a conservative one for STRESSED/RECOVERY (size 200,
 * every 5 steps) and a fast, small one for HFT (size 100, every step, half the skew).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class PassiveMarketMakerConfig extends BaseStrategyConfig {

    /** Price skew per unit of inventory, before the +/-0.2 clamp. */
    @Builder.Default
    private double skewFactor = 0.0002;

    /** No quotes at all once |inventory| reaches this level. */
    @Builder.Default
    private int maxInventory = 3000;
}
