package com.regimetrader.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.regimetrader.config.OrderLifecycleConfig;
import com.regimetrader.config.StrategyConfig;
import com.regimetrader.core.engine.TradingEngine;
import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.BookLevel;
import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.MarketSnapshot;
import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.domain.model.PositionState;
import com.regimetrader.domain.model.StepRecord;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.StepCompletedEvent;
import com.regimetrader.metrics.MetricsEngine;
import com.regimetrader.oms.LatencyTracker;
import com.regimetrader.oms.OrderGateway;
import com.regimetrader.oms.OrderIdGenerator;
import com.regimetrader.oms.OrderLifecycleManager;
import com.regimetrader.oms.StaleOrderMonitor;
import com.regimetrader.regime.RegimeClassifier;
import com.regimetrader.regime.RegimeState;
import com.regimetrader.regime.RegimeThresholds;
import com.regimetrader.risk.RiskLimits;
import com.regimetrader.risk.RiskOverlay;
import com.regimetrader.strategy.StrategyRouter;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Drives the whole decision pipeline (metrics, regime, strategy, risk, order lifecycle)
 * against an in-memory paper exchange through a calm period and a flash crash.
 */
class CrashScenarioIntegrationTest {

    private List<Object> events;
    private PaperExchange exchange;
    private PositionState positionState;
    private TradingEngine engine;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(events::add);
        exchange = new PaperExchange();
        positionState = new PositionState();

        OrderLifecycleConfig orderConfig = new OrderLifecycleConfig();
        OrderLifecycleManager manager = new OrderLifecycleManager(
                exchange,
                orderConfig,
                new OrderIdGenerator("team_alpha"),
                positionState,
                new LatencyTracker(Clock.systemUTC(), orderConfig.getMaxTrackedSendTimes()),
                eventPublisherHelper);

        StrategyRouter router = new StrategyRouter(
                new MetricsEngine(100, 100, 20, 10),
                new RegimeClassifier(new RegimeThresholds()),
                new RegimeState(),
                new StrategyConfig().strategyRegistry(),
                new RiskOverlay(RiskLimits.defaults()),
                eventPublisherHelper);

        engine = new TradingEngine(
                router, manager, new StaleOrderMonitor(manager, orderConfig), exchange, eventPublisherHelper);
    }

    private static MarketSnapshot snapshot(long step, double bid, double ask) {
        return MarketSnapshot.of(step, bid, ask, (bid + ask) / 2,
                List.of(BookLevel.builder().price(bid).quantity(500).build()),
                List.of(BookLevel.builder().price(ask).quantity(500).build()));
    }

    /** One exchange round trip: publish the snapshot, let the engine decide, then deliver fills. */
    private void step(MarketSnapshot snapshot) {
        exchange.quote(snapshot);
        engine.onMarketUpdate(snapshot);
        exchange.drainFills().forEach(engine::onFill);
    }

    private List<StepRecord> stepRecords() {
        return events.stream()
                .filter(StepCompletedEvent.class::isInstance)
                .map(e -> ((StepCompletedEvent) e).getRecord())
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Flash crash: regime flips to CRASH and the long position is flattened")
    void flashCrash() {
        for (int s = 1; s <= 100; s++) {
            step(snapshot(s, 99.9, 100.1));
        }
        // step 100 is the first calibrated step; the market maker leaves a bid resting
        assertThat(exchange.resting).containsKey("ORD_team_alpha_100_0");

        // a position carried over from before the session, reported by the exchange
        engine.onFill(Fill.builder()
                .orderId("EXTERNAL_1").side(OrderSide.BUY).price(new BigDecimal("100.0")).quantity(600).build());
        assertThat(positionState.getInventory()).isEqualTo(600);

        step(snapshot(101, 95.0, 106.0));
        step(snapshot(102, 95.0, 106.0));

        List<StepRecord> records = stepRecords();
        assertThat(records).hasSize(102);
        assertThat(exchange.stepsCompleted).isEqualTo(102);

        assertThat(records.subList(0, 99)).allSatisfy(r -> {
            assertThat(r.getRegime()).isEqualTo(MarketRegime.CALIBRATING);
            assertThat(r.getAction()).isNull();
        });

        StepRecord crash = records.get(100);
        assertThat(crash.getRegime()).isEqualTo(MarketRegime.CRASH);
        assertThat(crash.getStrategyName()).isEqualTo("crash_survival");
        assertThat(crash.getAction().getSide()).isEqualTo(OrderSide.SELL);
        assertThat(crash.getAction().getQuantity()).isEqualTo(500);
        assertThat(crash.getAction().getPrice()).isEqualByComparingTo("94.90");
        assertThat(crash.getFills()).extracting(Fill::getOrderId).containsExactly("EXTERNAL_1");

        // the resting bid would have traded against the unwind
        assertThat(exchange.cancelled).containsExactly("ORD_team_alpha_100_0");
        assertThat(exchange.resting).isEmpty();

        StepRecord afterCrash = records.get(101);
        assertThat(afterCrash.getRegime()).isEqualTo(MarketRegime.CRASH);
        assertThat(afterCrash.getAction()).isNull();
        assertThat(afterCrash.getFills()).singleElement().satisfies(fill -> {
            assertThat(fill.getOrderId()).isEqualTo(crash.getAction().getId());
            assertThat(fill.getLatencyMs()).isNotNull();
        });
        assertThat(afterCrash.getPosition().inventory()).isEqualTo(100);

        assertThat(positionState.getInventory()).isEqualTo(100);
        assertThat(positionState.getCashFlow()).isEqualByComparingTo("-12500");
        assertThat(positionState.getPnl()).isEqualByComparingTo("-2450");
        assertThat(engine.summarize().getFinalRegime()).isEqualTo(MarketRegime.CRASH);
    }

    @Test
    @DisplayName("Steps with a missing quote still complete")
    void missingQuote() {
        step(snapshot(1, 99.9, 100.1));
        step(snapshot(2, 0.0, 100.1));
        step(snapshot(3, 99.9, 100.1));

        assertThat(exchange.stepsCompleted).isEqualTo(3);
        assertThat(stepRecords()).extracting(StepRecord::getStep).containsExactly(1L, 2L, 3L);
        assertThat(exchange.resting).isEmpty();
    }

    /**
     * Fills an order immediately when it is marketable against the current quote, at the
     * touch; otherwise rests it until a later quote crosses it or it is cancelled.
     */
    static class PaperExchange implements OrderGateway {

        final Map<String, OrderRecord> resting = new LinkedHashMap<>();
        final List<String> cancelled = new ArrayList<>();
        private final List<Fill> pendingFills = new ArrayList<>();
        private MarketSnapshot quote;
        int stepsCompleted;

        void quote(MarketSnapshot snapshot) {
            this.quote = snapshot;
            new ArrayList<>(resting.values()).forEach(this::match);
        }

        List<Fill> drainFills() {
            List<Fill> fills = new ArrayList<>(pendingFills);
            pendingFills.clear();
            return fills;
        }

        @Override
        public void sendOrder(OrderRecord order) {
            resting.put(order.getId(), order);
            match(order);
        }

        @Override
        public void cancelOrder(String orderId) {
            if (resting.remove(orderId) != null) {
                cancelled.add(orderId);
            }
        }

        @Override
        public void completeStep() {
            stepsCompleted++;
        }

        private void match(OrderRecord order) {
            if (quote == null || !quote.isQuoteValid()) {
                return;
            }
            double limit = order.getPrice().doubleValue();
            boolean marketable = order.getSide() == OrderSide.BUY ? limit >= quote.getAsk() : limit <= quote.getBid();
            if (!marketable) {
                return;
            }
            double touch = order.getSide() == OrderSide.BUY ? quote.getAsk() : quote.getBid();
            resting.remove(order.getId());
            pendingFills.add(Fill.builder()
                    .orderId(order.getId())
                    .side(order.getSide())
                    .price(BigDecimal.valueOf(touch))
                    .quantity(order.getQuantity())
                    .build());
        }
    }
}
