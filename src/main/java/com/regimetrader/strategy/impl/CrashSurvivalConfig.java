package com.regimetrader.strategy.impl;

import com.regimetrader.strategy.base.BaseStrategyConfig;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/** Configuration for {@link CrashSurvivalStrategy}. Quantity defaults to 500 in the router. */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class CrashSurvivalConfig extends BaseStrategyConfig {

    /** Flatten only when |inventory| exceeds this. */
    @Builder.Default
    private int flattenThreshold = 200;

    /** Distance through the touch that makes the unwind marketable. */
    @Builder.Default
    private double crossOffset = 0.10;
}
