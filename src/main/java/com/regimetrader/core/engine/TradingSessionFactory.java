package com.regimetrader.core.engine;

import com.regimetrader.config.EngineConfig;
import com.regimetrader.config.ExchangeConfig;
import com.regimetrader.config.OrderLifecycleConfig;
import com.regimetrader.domain.model.PositionState;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.metrics.MetricsEngine;
import com.regimetrader.oms.LatencyTracker;
import com.regimetrader.oms.OrderIdGenerator;
import com.regimetrader.oms.OrderLifecycleManager;
import com.regimetrader.oms.StaleOrderMonitor;
import com.regimetrader.regime.RegimeClassifier;
import com.regimetrader.regime.RegimeState;
import com.regimetrader.risk.RiskOverlay;
import com.regimetrader.strategy.ExperimentCatalog;
import com.regimetrader.strategy.FixedStrategySelector;
import com.regimetrader.strategy.StrategyRegistry;
import com.regimetrader.strategy.StrategyRouter;
import com.regimetrader.strategy.StrategySelector;
import com.regimetrader.transport.ExchangeConnector;
import com.regimetrader.transport.ExchangeMessageCodec;
import com.regimetrader.transport.WebSocketOrderGateway;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.client.WebSocketClient;

/**
 * Builds a {@link TradingSession} per run from the shared, stateless collaborators.
 *
 * <p>An experiment name found in the {@link ExperimentCatalog} pins that experiment's strategy
 * for every step. Any other name runs the regime-switching {@link StrategyRegistry} and is used
 * as a label only.
 */
public class TradingSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(TradingSessionFactory.class);

    private final EngineConfig engineConfig;
    private final ExchangeConfig exchangeConfig;
    private final OrderLifecycleConfig orderLifecycleConfig;
    private final RegimeClassifier regimeClassifier;
    private final StrategyRegistry strategyRegistry;
    private final ExperimentCatalog experimentCatalog;
    private final RiskOverlay riskOverlay;
    private final ExchangeMessageCodec codec;
    private final WebSocketClient webSocketClient;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final String defaultMode;

    public TradingSessionFactory(
            EngineConfig engineConfig,
            ExchangeConfig exchangeConfig,
            OrderLifecycleConfig orderLifecycleConfig,
            RegimeClassifier regimeClassifier,
            StrategyRegistry strategyRegistry,
            ExperimentCatalog experimentCatalog,
            RiskOverlay riskOverlay,
            ExchangeMessageCodec codec,
            WebSocketClient webSocketClient,
            EventPublisherHelper eventPublisherHelper,
            Clock clock,
            String defaultMode) {
        this.engineConfig = engineConfig;
        this.exchangeConfig = exchangeConfig;
        this.orderLifecycleConfig = orderLifecycleConfig;
        this.regimeClassifier = regimeClassifier;
        this.strategyRegistry = strategyRegistry;
        this.experimentCatalog = experimentCatalog;
        this.riskOverlay = riskOverlay;
        this.codec = codec;
        this.webSocketClient = webSocketClient;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.defaultMode = defaultMode;
    }

    /** Resolves the labels of a run; catalog experiments carry their own mode. */
    public SessionPlan plan(String scenario, String experiment) {
        String mode = experimentCatalog.find(experiment)
                .map(ExperimentCatalog.Experiment::mode)
                .orElse(defaultMode);
        return new SessionPlan(scenario, experiment, mode);
    }

    public TradingSession create(SessionPlan plan) {
        Optional<ExperimentCatalog.Experiment> experiment = experimentCatalog.find(plan.experiment());
        StrategySelector selector = experiment
                .<StrategySelector>map(e -> new FixedStrategySelector(e.strategy()))
                .orElse(strategyRegistry);
        log.info("Building session for {} / {}: {}", plan.scenario(), plan.experiment(),
                experiment.map(e -> "fixed strategy " + e.strategy().getName()).orElse("regime-switching strategies"));

        MetricsEngine metricsEngine = new MetricsEngine(
                engineConfig.getWindowSize(),
                engineConfig.getCalibrationSteps(),
                engineConfig.getChurnWindow(),
                engineConfig.getMomentumLookback());
        RegimeState regimeState = new RegimeState();
        StrategyRouter router = new StrategyRouter(
                metricsEngine, regimeClassifier, regimeState, selector, riskOverlay, eventPublisherHelper);

        WebSocketOrderGateway gateway = new WebSocketOrderGateway(codec);
        OrderLifecycleManager orderLifecycleManager = new OrderLifecycleManager(
                gateway,
                orderLifecycleConfig,
                new OrderIdGenerator(exchangeConfig.getTeamName()),
                new PositionState(),
                new LatencyTracker(clock, orderLifecycleConfig.getMaxTrackedSendTimes()),
                eventPublisherHelper);
        StaleOrderMonitor staleOrderMonitor = new StaleOrderMonitor(orderLifecycleManager, orderLifecycleConfig);

        TradingEngine engine = new TradingEngine(
                router, orderLifecycleManager, staleOrderMonitor, gateway, eventPublisherHelper);
        EngineEventLoop eventLoop = new EngineEventLoop(
                engine,
                engineConfig.getEventQueueCapacity(),
                Set.of(ExchangeConnector.MARKET_STREAM, ExchangeConnector.ORDER_STREAM),
                engineConfig.getStreamCloseGrace());
        ExchangeConnector connector =
                new ExchangeConnector(webSocketClient, exchangeConfig, codec, gateway, eventLoop);

        return new TradingSession(plan, engine, eventLoop, connector, orderLifecycleManager, regimeState);
    }
}
