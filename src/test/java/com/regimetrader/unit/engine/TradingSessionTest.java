package com.regimetrader.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.regimetrader.config.OrderLifecycleConfig;
import com.regimetrader.core.engine.EngineEvent;
import com.regimetrader.core.engine.EngineEventLoop;
import com.regimetrader.core.engine.SessionPlan;
import com.regimetrader.core.engine.SessionSummary;
import com.regimetrader.core.engine.TradingEngine;
import com.regimetrader.core.engine.TradingSession;
import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.PositionState;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.oms.LatencyTracker;
import com.regimetrader.oms.OrderGateway;
import com.regimetrader.oms.OrderIdGenerator;
import com.regimetrader.oms.OrderLifecycleManager;
import com.regimetrader.oms.StaleOrderMonitor;
import com.regimetrader.regime.RegimeState;
import com.regimetrader.strategy.StrategyRouter;
import com.regimetrader.transport.ExchangeConnector;
import com.regimetrader.transport.SessionCredentials;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class TradingSessionTest {

    private static final SessionCredentials CREDENTIALS = new SessionCredentials("tok-1", "run-42");

    private ExchangeConnector connector;
    private EngineEventLoop eventLoop;
    private TradingSession session;

    @BeforeEach
    void setUp() {
        StrategyRouter strategyRouter = mock(StrategyRouter.class);
        RegimeState regimeState = new RegimeState();
        when(strategyRouter.getRegimeState()).thenReturn(regimeState);
        OrderGateway orderGateway = mock(OrderGateway.class);
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(event -> { });

        OrderLifecycleConfig config = new OrderLifecycleConfig();
        OrderLifecycleManager orderLifecycleManager = new OrderLifecycleManager(
                orderGateway,
                config,
                new OrderIdGenerator("team_alpha"),
                new PositionState(),
                new LatencyTracker(Clock.systemUTC(), 100),
                eventPublisherHelper);
        TradingEngine engine = new TradingEngine(
                strategyRouter,
                orderLifecycleManager,
                new StaleOrderMonitor(orderLifecycleManager, config),
                orderGateway,
                eventPublisherHelper);

        connector = mock(ExchangeConnector.class);
        eventLoop = new EngineEventLoop(
                engine, 1024, Set.of(ExchangeConnector.MARKET_STREAM, ExchangeConnector.ORDER_STREAM),
                Duration.ofSeconds(2));
        session = new TradingSession(
                new SessionPlan("flash_crash", "default", "active"),
                engine, eventLoop, connector, orderLifecycleManager, regimeState);
    }

    private static Fill fill(int i) {
        return Fill.builder()
                .orderId("ORD_team_alpha_" + i + "_0")
                .side(OrderSide.BUY)
                .price(new BigDecimal("100.0"))
                .quantity(100)
                .build();
    }

    @Test
    @DisplayName("Fills still queued at teardown are in the summary")
    void summaryIncludesFillsQueuedAtClose() {
        // the order stream delivers a burst of fills while the sockets are being closed
        doAnswer(invocation -> {
            for (int i = 0; i < 300; i++) {
                eventLoop.submit(new EngineEvent.FillReport(fill(i)));
            }
            return null;
        }).when(connector).disconnect();
        session.open(CREDENTIALS);

        SessionSummary summary = session.close();

        assertThat(summary.getFills()).isEqualTo(300);
        assertThat(summary.getInventory()).isEqualTo(30_000);
        assertThat(session.getInventory()).isEqualTo(30_000);
        assertThat(eventLoop.isRunning()).isFalse();
        assertThat(eventLoop.pendingEvents()).isZero();
    }

    @Test
    @DisplayName("Open starts the loop before connecting; close disconnects before stopping")
    void lifecycleOrder() throws Exception {
        session.open(CREDENTIALS);
        assertThat(eventLoop.isRunning()).isTrue();

        eventLoop.submit(new EngineEvent.StreamClosed(ExchangeConnector.MARKET_STREAM, "done"));
        eventLoop.submit(new EngineEvent.StreamClosed(ExchangeConnector.ORDER_STREAM, "done"));
        assertThat(session.awaitCompletion(Duration.ofSeconds(5))).isTrue();
        session.close();

        InOrder order = inOrder(connector);
        order.verify(connector).connect(CREDENTIALS);
        order.verify(connector).disconnect();
        assertThat(session.getOpenOrderCount()).isZero();
    }
}
