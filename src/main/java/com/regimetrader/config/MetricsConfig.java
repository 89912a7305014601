package com.regimetrader.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer configuration. Registers common tags (application, scenario) applied to every
 * meter; the trading meters themselves live in
 * {@link com.regimetrader.observability.TradingMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ExchangeConfig exchangeConfig;

    public MetricsConfig(MeterRegistry meterRegistry, ExchangeConfig exchangeConfig) {
        this.meterRegistry = meterRegistry;
        this.exchangeConfig = exchangeConfig;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "regime-trader", "scenario", exchangeConfig.getScenario());
    }
}
