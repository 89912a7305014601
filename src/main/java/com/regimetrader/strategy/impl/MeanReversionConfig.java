package com.regimetrader.strategy.impl;

import com.regimetrader.strategy.base.BaseStrategyConfig;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/** Configuration for {@link MeanReversionStrategy}. */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MeanReversionConfig extends BaseStrategyConfig {

    /** Enter against the move when |z| exceeds this. */
    @Builder.Default
    private double entryZ = 1.5;

    /** Reduce inventory when |z| falls below this. */
    @Builder.Default
    private double exitZ = 0.5;

    @Builder.Default
    private int maxInventory = 2500;

    /** Only positions larger than this are reduced on exit. */
    @Builder.Default
    private int exitThreshold = 300;
}
