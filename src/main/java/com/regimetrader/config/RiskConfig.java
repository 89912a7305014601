package com.regimetrader.config;

import com.regimetrader.risk.RiskLimits;
import com.regimetrader.risk.RiskOverlay;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} and {@link RiskOverlay} beans from application.properties.
 *
 * <p>Properties prefix: {@code regimetrader.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${regimetrader.risk.hard-limit:4500}") int hardLimit,
            @Value("${regimetrader.risk.safety-buffer:3000}") int safetyBuffer,
            @Value("${regimetrader.risk.emergency-quantity:500}") int emergencyQuantity,
            @Value("${regimetrader.risk.emergency-offset:0.05}") double emergencyOffset) {
        if (safetyBuffer >= hardLimit) {
            throw new IllegalStateException(
                    "regimetrader.risk.safety-buffer (" + safetyBuffer + ") must be below hard-limit (" + hardLimit + ")");
        }
        return RiskLimits.builder()
                .hardLimit(hardLimit)
                .safetyBuffer(safetyBuffer)
                .emergencyQuantity(emergencyQuantity)
                .emergencyOffset(emergencyOffset)
                .build();
    }

    @Bean
    public RiskOverlay riskOverlay(RiskLimits riskLimits) {
        return new RiskOverlay(riskLimits);
    }
}
