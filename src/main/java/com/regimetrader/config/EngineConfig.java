package com.regimetrader.config;

import com.regimetrader.core.engine.TradingSession;
import com.regimetrader.core.engine.TradingSessionFactory;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.regime.RegimeClassifier;
import com.regimetrader.regime.RegimeThresholds;
import com.regimetrader.risk.RiskOverlay;
import com.regimetrader.strategy.ExperimentCatalog;
import com.regimetrader.strategy.StrategyRegistry;
import com.regimetrader.transport.ExchangeMessageCodec;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Clock;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.socket.client.WebSocketClient;

/**
 * Engine sizing and the factory that builds one {@link TradingSession} per run.
 *
 * <p>Binds to {@code regimetrader.engine.*} for window sizes, the event queue bound and the
 * stream-close grace period; regime thresholds bind separately to {@code regimetrader.regime.*}.
 * Window sizes must be positive; startup fails on a non-positive value.
 *
 * <p>Only stateless collaborators are beans. Per-run state (metrics, regime, position, open
 * orders) lives in the session and is touched only from that session's event loop thread.
 */
@Configuration
@ConfigurationProperties(prefix = "regimetrader.engine")
@Validated
@Getter
@Setter
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /** Rolling window length for mid, spread and depth statistics. */
    @Positive
    private int windowSize = 100;

    /** Updates observed before the baseline is captured and regimes are classified. */
    @Positive
    private int calibrationSteps = 100;

    /** Block length, in updates, of the mid-change churn estimate. */
    @Positive
    private int churnWindow = 20;

    /** Momentum compares the newest mid to the one this many updates back. */
    @Positive
    private int momentumLookback = 10;

    /** Bound on queued engine events; producers block when it is reached. */
    @Positive
    private int eventQueueCapacity = 10_000;

    /** After one stream closes, the run ends once no event has arrived for this long. */
    @NotNull
    private Duration streamCloseGrace = Duration.ofSeconds(2);

    @Bean
    @ConfigurationProperties(prefix = "regimetrader.regime")
    public RegimeThresholds regimeThresholds() {
        return new RegimeThresholds();
    }

    @Bean
    public RegimeClassifier regimeClassifier(RegimeThresholds regimeThresholds) {
        return new RegimeClassifier(regimeThresholds);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TradingSessionFactory tradingSessionFactory(
            ExchangeConfig exchangeConfig,
            OrderLifecycleConfig orderLifecycleConfig,
            StepRecorderConfig stepRecorderConfig,
            RegimeClassifier regimeClassifier,
            StrategyRegistry strategyRegistry,
            ExperimentCatalog experimentCatalog,
            RiskOverlay riskOverlay,
            ExchangeMessageCodec exchangeMessageCodec,
            WebSocketClient exchangeWebSocketClient,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        log.info("Engine: window={}, calibration={}, churnWindow={}, momentumLookback={}, queue={}, closeGrace={}",
                windowSize, calibrationSteps, churnWindow, momentumLookback, eventQueueCapacity, streamCloseGrace);
        return new TradingSessionFactory(
                this,
                exchangeConfig,
                orderLifecycleConfig,
                regimeClassifier,
                strategyRegistry,
                experimentCatalog,
                riskOverlay,
                exchangeMessageCodec,
                exchangeWebSocketClient,
                eventPublisherHelper,
                clock,
                stepRecorderConfig.getMode());
    }
}
