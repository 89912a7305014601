package com.regimetrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * Position limits enforced by {@link RiskOverlay}. Built by
 * {@link com.regimetrader.config.RiskConfig} from {@code regimetrader.risk.*}.
 */
@Getter
@Builder
public class RiskLimits {

    /** |inventory| the overlay never knowingly lets an order reach. */
    @Builder.Default
    private final int hardLimit = 4500;

    /** Target |inventory| a blocked candidate is unwound back towards. */
    @Builder.Default
    private final int safetyBuffer = 3000;

    /** Size of the emergency unwind sent when no strategy proposed anything. */
    @Builder.Default
    private final int emergencyQuantity = 500;

    /** Distance through the touch for emergency unwinds. */
    @Builder.Default
    private final double emergencyOffset = 0.05;

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }
}
