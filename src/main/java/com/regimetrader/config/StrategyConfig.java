package com.regimetrader.config;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.strategy.ExperimentCatalog;
import com.regimetrader.strategy.StrategyRegistry;
import com.regimetrader.strategy.base.TradingStrategy;
import com.regimetrader.strategy.impl.AggressiveMarketMaker;
import com.regimetrader.strategy.impl.AggressiveMarketMakerConfig;
import com.regimetrader.strategy.impl.CrashSurvivalConfig;
import com.regimetrader.strategy.impl.CrashSurvivalStrategy;
import com.regimetrader.strategy.impl.MeanReversionConfig;
import com.regimetrader.strategy.impl.MeanReversionStrategy;
import com.regimetrader.strategy.impl.MomentumConfig;
import com.regimetrader.strategy.impl.MomentumStrategy;
import com.regimetrader.strategy.impl.PassiveMarketMaker;
import com.regimetrader.strategy.impl.PassiveMarketMakerConfig;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Strategy parameters and the regime-to-strategy registry.
 *
 * <p>Binds to {@code regimetrader.strategy.*}. Each nested config starts from the tuned
 * defaults below and can be overridden field by field, e.g.
 * {@code regimetrader.strategy.passive-hft.quantity=200}.
 *
 * <p>Bindings: CRASH -> crash_survival, STRESSED and RECOVERY -> passive_mm_normal,
 * HFT -> passive_mm_hft, NORMAL -> mean_reversion on a strong z-score, else the configured
 * fallback (aggressive_mm or momentum).
 *
 * <p>Also exposes the {@link ExperimentCatalog} of fixed data-collection strategies.
 */
@Configuration
@ConfigurationProperties(prefix = "regimetrader.strategy")
@Getter
@Setter
public class StrategyConfig {

    private static final Logger log = LoggerFactory.getLogger(StrategyConfig.class);

    public enum NormalFallback {
        AGGRESSIVE,
        MOMENTUM
    }

    /** |z| above which NORMAL routes to mean reversion. */
    private double strongSignalZ = 1.5;

    private NormalFallback normalFallback = NormalFallback.AGGRESSIVE;

    private PassiveMarketMakerConfig passiveNormal = PassiveMarketMakerConfig.builder()
            .skewFactor(0.0002)
            .maxInventory(3000)
            .quantity(200)
            .tradeFrequency(5)
            .build();

    private PassiveMarketMakerConfig passiveHft = PassiveMarketMakerConfig.builder()
            .skewFactor(0.0001)
            .maxInventory(3000)
            .quantity(100)
            .tradeFrequency(1)
            .build();

    private AggressiveMarketMakerConfig aggressive =
            AggressiveMarketMakerConfig.builder().quantity(200).tradeFrequency(2).build();

    private MeanReversionConfig meanReversion =
            MeanReversionConfig.builder().quantity(200).build();

    private CrashSurvivalConfig crashSurvival =
            CrashSurvivalConfig.builder().quantity(500).build();

    private MomentumConfig momentum =
            MomentumConfig.builder().quantity(200).tradeFrequency(5).build();

    @Bean
    public StrategyRegistry strategyRegistry() {
        TradingStrategy passiveNormalMaker = new PassiveMarketMaker("passive_mm_normal", passiveNormal);
        TradingStrategy fallback = normalFallback == NormalFallback.MOMENTUM
                ? new MomentumStrategy("momentum", momentum)
                : new AggressiveMarketMaker("aggressive_mm", aggressive);

        StrategyRegistry registry = new StrategyRegistry(
                        new MeanReversionStrategy("mean_reversion", meanReversion), fallback, strongSignalZ)
                .register(MarketRegime.CRASH, new CrashSurvivalStrategy("crash_survival", crashSurvival))
                .register(MarketRegime.STRESSED, passiveNormalMaker)
                .register(MarketRegime.RECOVERY, passiveNormalMaker)
                .register(MarketRegime.HFT, new PassiveMarketMaker("passive_mm_hft", passiveHft));

        log.info("Strategy registry: NORMAL -> mean_reversion (|z|>{}) / {}, others -> {}",
                strongSignalZ, fallback.getName(), registry.getRegimeStrategies().keySet());
        return registry;
    }

    @Bean
    public ExperimentCatalog experimentCatalog() {
        return ExperimentCatalog.defaults();
    }
}
