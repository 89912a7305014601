package com.regimetrader.core.engine;

import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.MarketSnapshot;
import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.domain.model.PositionState;
import com.regimetrader.domain.model.StepRecord;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.oms.OrderGateway;
import com.regimetrader.oms.OrderLifecycleManager;
import com.regimetrader.oms.StaleOrderMonitor;
import com.regimetrader.oms.SubmitResult;
import com.regimetrader.strategy.RoutingDecision;
import com.regimetrader.strategy.StrategyRouter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The core state machine behind the event loop. Owns nothing thread-related: every method is
 * called from the {@link EngineEventLoop} consumer thread, which is what makes the shared state
 * (metrics, regime, position, resting orders) race-free.
 *
 * <p>Per snapshot: route (metrics, regime, strategy, risk) -> stale sweep -> submit -> publish
 * the step record -> send DONE. DONE is sent for every snapshot, including ones that were
 * skipped or failed, so the exchange never stalls waiting for us.
 *
 * <p>Fills are applied whenever they arrive, matched by order id, and attached to the next
 * step record.
 */
public class TradingEngine implements EngineEventHandler {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final StrategyRouter strategyRouter;
    private final OrderLifecycleManager orderLifecycleManager;
    private final StaleOrderMonitor staleOrderMonitor;
    private final OrderGateway orderGateway;
    private final EventPublisherHelper eventPublisherHelper;

    private final List<Fill> fillsSinceLastStep = new ArrayList<>();
    private double lastMid;
    private long lastStep = -1;
    private long stepsProcessed;
    private boolean authenticated;

    public TradingEngine(
            StrategyRouter strategyRouter,
            OrderLifecycleManager orderLifecycleManager,
            StaleOrderMonitor staleOrderMonitor,
            OrderGateway orderGateway,
            EventPublisherHelper eventPublisherHelper) {
        this.strategyRouter = strategyRouter;
        this.orderLifecycleManager = orderLifecycleManager;
        this.staleOrderMonitor = staleOrderMonitor;
        this.orderGateway = orderGateway;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void handle(EngineEvent event) {
        if (event instanceof EngineEvent.MarketUpdate update) {
            onMarketUpdate(update.snapshot());
        } else if (event instanceof EngineEvent.FillReport report) {
            onFill(report.fill());
        } else if (event instanceof EngineEvent.ExchangeError error) {
            log.warn("Exchange error: {}", error.message());
        } else if (event instanceof EngineEvent.SessionAuthenticated) {
            authenticated = true;
            log.info("Order session authenticated");
        } else if (event instanceof EngineEvent.StreamClosed closed) {
            log.info("Stream {} closed: {}", closed.stream(), closed.reason());
        } else {
            log.warn("Ignoring unknown engine event {}", event);
        }
    }

    /** Runs one decision step and always finishes by signalling step completion. */
    public void onMarketUpdate(MarketSnapshot snapshot) {
        long step = snapshot.getStep();
        Long stepLatencyMs = orderLifecycleManager.getLatencyTracker().onSnapshotReceived().orElse(null);

        try {
            if (snapshot.isQuoteValid()) {
                lastMid = snapshot.getMid();
            }
            PositionState position = orderLifecycleManager.getPositionState();
            RoutingDecision decision = strategyRouter.route(snapshot, position.getInventory());

            if (decision.isRouted()) {
                staleOrderMonitor.sweep(step, decision.getRegime());
            }

            OrderRecord action = null;
            if (decision.getOrder() != null) {
                SubmitResult result = orderLifecycleManager.submit(decision.getOrder(), step);
                if (result.isAccepted()) {
                    action = result.getOrder();
                }
            }

            StepRecord record = StepRecord.builder()
                    .step(step)
                    .market(snapshot)
                    .position(position.snapshot())
                    .regime(decision.getRegime())
                    .strategyName(decision.getStrategyName())
                    .action(action)
                    .fills(List.copyOf(fillsSinceLastStep))
                    .build();
            fillsSinceLastStep.clear();

            eventPublisherHelper.publishStepCompleted(this, record, stepLatencyMs);
        } catch (RuntimeException e) {
            log.error("Step {} failed, continuing with the next step", step, e);
        } finally {
            stepsProcessed++;
            lastStep = step;
            completeStep(step);
        }
    }

    /** Applies an exchange fill; the exchange is authoritative even for ids we no longer track. */
    public void onFill(Fill fill) {
        Fill reconciled = orderLifecycleManager.onFill(fill, lastMid);
        fillsSinceLastStep.add(reconciled);
    }

    public SessionSummary summarize() {
        PositionState position = orderLifecycleManager.getPositionState();
        return SessionSummary.builder()
                .stepsProcessed(stepsProcessed)
                .lastStep(lastStep)
                .ordersSent(position.getOrdersSent())
                .fills(position.getFillCount())
                .openOrders(orderLifecycleManager.getOpenOrders().size())
                .inventory(position.getInventory())
                .cashFlow(position.getCashFlow())
                .pnl(position.getPnl())
                .finalRegime(strategyRouter.getRegimeState().getCurrentRegime())
                .build();
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    public double getLastMid() {
        return lastMid;
    }

    private void completeStep(long step) {
        try {
            orderGateway.completeStep();
            orderLifecycleManager.getLatencyTracker().markStepCompleted();
        } catch (Exception e) {
            log.error("Failed to signal completion of step {}", step, e);
        }
    }
}
