package com.regimetrader.core.engine;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.domain.model.PositionState;
import com.regimetrader.oms.OrderLifecycleManager;
import com.regimetrader.regime.RegimeState;
import com.regimetrader.transport.ExchangeConnector;
import com.regimetrader.transport.SessionCredentials;
import java.time.Duration;

/**
 * One run's engine: fresh metrics, regime, position and order state, its own event loop and
 * its own pair of exchange streams. Built by {@link TradingSessionFactory}; used once.
 */
public class TradingSession {

    private final SessionPlan plan;
    private final TradingEngine engine;
    private final EngineEventLoop eventLoop;
    private final ExchangeConnector connector;
    private final OrderLifecycleManager orderLifecycleManager;
    private final RegimeState regimeState;

    public TradingSession(
            SessionPlan plan,
            TradingEngine engine,
            EngineEventLoop eventLoop,
            ExchangeConnector connector,
            OrderLifecycleManager orderLifecycleManager,
            RegimeState regimeState) {
        this.plan = plan;
        this.engine = engine;
        this.eventLoop = eventLoop;
        this.connector = connector;
        this.orderLifecycleManager = orderLifecycleManager;
        this.regimeState = regimeState;
    }

    /** Starts the event loop, then opens both streams. */
    public void open(SessionCredentials credentials) {
        eventLoop.start();
        connector.connect(credentials);
    }

    /** Waits for the exchange to end the run. */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return eventLoop.awaitCompletion(timeout);
    }

    /**
     * Closes the streams and waits for the loop to drain before summarizing, so fills queued
     * at teardown are part of the summary.
     */
    public SessionSummary close() {
        try {
            connector.disconnect();
        } finally {
            eventLoop.stop();
        }
        return engine.summarize();
    }

    public SessionPlan getPlan() {
        return plan;
    }

    public TradingEngine getEngine() {
        return engine;
    }

    public int getInventory() {
        return getPositionState().getInventory();
    }

    public double getPnl() {
        return getPositionState().getPnl().doubleValue();
    }

    public int getOpenOrderCount() {
        return orderLifecycleManager.getBook().size();
    }

    public MarketRegime getCurrentRegime() {
        return regimeState.getCurrentRegime();
    }

    private PositionState getPositionState() {
        return orderLifecycleManager.getPositionState();
    }
}
