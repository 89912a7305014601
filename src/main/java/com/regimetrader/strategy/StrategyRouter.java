package com.regimetrader.strategy;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.domain.model.MarketSnapshot;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.metrics.MetricsEngine;
import com.regimetrader.regime.RegimeClassifier;
import com.regimetrader.regime.RegimeState;
import com.regimetrader.risk.RiskAdjustment;
import com.regimetrader.risk.RiskOverlay;
import com.regimetrader.strategy.base.TradingStrategy;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-step decision pipeline: metrics, regime, strategy, risk.
 *
 * <ol>
 *   <li>Guard: a snapshot with a non-positive bid, ask or mid is skipped entirely and does not
 *       reach the metrics engine.</li>
 *   <li>Feed the {@link MetricsEngine}, classify with the {@link RegimeClassifier}; transitions
 *       are logged and published.</li>
 *   <li>Ask the strategy picked by the {@link StrategySelector} for a candidate. A strategy that
 *       throws is treated as proposing nothing.</li>
 *   <li>Hand the candidate (or its absence) to the {@link RiskOverlay}, which can still produce
 *       an emergency unwind.</li>
 * </ol>
 *
 * <p>Owns no threads; called from the engine's consumer thread only.
 */
public class StrategyRouter {

    private static final Logger log = LoggerFactory.getLogger(StrategyRouter.class);

    private final MetricsEngine metricsEngine;
    private final RegimeClassifier regimeClassifier;
    private final RegimeState regimeState;
    private final StrategySelector strategySelector;
    private final RiskOverlay riskOverlay;
    private final EventPublisherHelper eventPublisherHelper;

    public StrategyRouter(
            MetricsEngine metricsEngine,
            RegimeClassifier regimeClassifier,
            RegimeState regimeState,
            StrategySelector strategySelector,
            RiskOverlay riskOverlay,
            EventPublisherHelper eventPublisherHelper) {
        this.metricsEngine = metricsEngine;
        this.regimeClassifier = regimeClassifier;
        this.regimeState = regimeState;
        this.strategySelector = strategySelector;
        this.riskOverlay = riskOverlay;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public RoutingDecision route(MarketSnapshot snapshot, int inventory) {
        long step = snapshot.getStep();
        if (!snapshot.isQuoteValid()) {
            log.debug("Step {}: invalid quote bid={} ask={} mid={}, no action",
                    step, snapshot.getBid(), snapshot.getAsk(), snapshot.getMid());
            return RoutingDecision.skipped(step, regimeState.getCurrentRegime());
        }

        MarketMetrics metrics = metricsEngine.update(
                snapshot.getMid(), snapshot.getSpread(), snapshot.getBidDepth(), snapshot.getAskDepth());
        MarketRegime regime = regimeClassifier.classify(metrics, regimeState);

        if (regimeState.isTransition()) {
            log.info("Step {}: regime {} -> {} (spreadRatio={}, momentum={}, imbalance={}, churn={}, z={})",
                    step, regimeState.getPreviousRegime(), regime,
                    format(metrics.getSpreadRatio()), format(metrics.getMomentum()),
                    format(metrics.getImbalance()), format(metrics.getChurn()), format(metrics.getZScore()));
            eventPublisherHelper.publishRegimeChange(this, step, regimeState.getPreviousRegime(), regime, metrics);
        }

        Optional<TradingStrategy> strategy = strategySelector.select(regime, metrics);
        OrderIntent candidate = strategy.flatMap(s -> decide(s, snapshot, inventory, metrics)).orElse(null);

        RiskAdjustment adjustment =
                riskOverlay.adjust(candidate, inventory, snapshot.getBid(), snapshot.getAsk());

        return RoutingDecision.builder()
                .step(step)
                .regime(regime)
                .metrics(metrics)
                .routed(true)
                .strategyName(strategy.map(TradingStrategy::getName).orElse(null))
                .candidate(candidate)
                .adjustment(adjustment)
                .build();
    }

    public RegimeState getRegimeState() {
        return regimeState;
    }

    public MetricsEngine getMetricsEngine() {
        return metricsEngine;
    }

    private Optional<OrderIntent> decide(
            TradingStrategy strategy, MarketSnapshot snapshot, int inventory, MarketMetrics metrics) {
        try {
            return strategy.decide(
                    snapshot.getBid(), snapshot.getAsk(), snapshot.getMid(), inventory, snapshot.getStep(), metrics);
        } catch (RuntimeException e) {
            log.error("Strategy {} failed at step {}, no candidate this step", strategy.getName(), snapshot.getStep(), e);
            return Optional.empty();
        }
    }

    private static String format(double value) {
        return String.format("%.4f", value);
    }
}
