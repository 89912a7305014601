package com.regimetrader.unit.reporting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.regimetrader.reporting.RecordedFill;
import com.regimetrader.reporting.RecordedStep;
import com.regimetrader.reporting.RunStatistics;
import com.regimetrader.reporting.RunSummaryCalculator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RunSummaryCalculatorTest {

    private RunSummaryCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new RunSummaryCalculator();
    }

    private static RecordedStep.RecordedStepBuilder step(long step, double bid, double ask) {
        return RecordedStep.builder()
                .step(step)
                .scenario("normal_market")
                .experiment("baseline")
                .runId("run-7")
                .mode("active")
                .bid(bid)
                .ask(ask)
                .mid(bid > 0 && ask > 0 ? (bid + ask) / 2 : 0)
                .spread(bid > 0 && ask > 0 ? ask - bid : 0);
    }

    private static RecordedFill fill(String side, double price, int quantity, Long latencyMs) {
        return RecordedFill.builder().orderId("ORD").side(side).price(price).quantity(quantity)
                .latencyMs(latencyMs).build();
    }

    @Test
    @DisplayName("Statistics cover prices, position, actions and fills")
    void statistics() {
        List<RecordedStep> steps = List.of(
                step(10, 99.0, 100.0).actionSide("BUY").actionPrice(99.1).actionQuantity(200).build(),
                step(11, 0, 0).inventory(200).pnl(-10).cashFlow(-19820)
                        .fills(List.of(fill("BUY", 99.1, 200, 10L))).build(),
                step(12, 98.0, 101.0).inventory(100).pnl(40).cashFlow(-9800)
                        .actionSide("SELL").actionPrice(100.0).actionQuantity(100)
                        .fills(List.of(fill("SELL", 100.0, 100, 30L), fill("SELL", 100.0, 100, null))).build());

        RunStatistics stats = calculator.calculate(steps, "normal_market_baseline.jsonl");

        assertThat(stats.getScenario()).isEqualTo("normal_market");
        assertThat(stats.getRunId()).isEqualTo("run-7");
        assertThat(stats.getTotalSteps()).isEqualTo(3);
        assertThat(stats.getFirstStep()).isEqualTo(10);
        assertThat(stats.getLastStep()).isEqualTo(12);

        assertThat(stats.getMinBid()).isEqualTo(98.0);
        assertThat(stats.getMaxBid()).isEqualTo(99.0);
        assertThat(stats.getAvgBid()).isCloseTo(98.5, within(1e-9));
        assertThat(stats.getMinSpread()).isCloseTo(1.0, within(1e-9));
        assertThat(stats.getMaxSpread()).isCloseTo(3.0, within(1e-9));
        assertThat(stats.getMidRange()).isCloseTo(0.0, within(1e-9));

        assertThat(stats.getMaxInventory()).isEqualTo(200);
        assertThat(stats.getFinalInventory()).isEqualTo(100);
        assertThat(stats.getMinPnl()).isEqualTo(-10.0);
        assertThat(stats.getFinalPnl()).isEqualTo(40.0);
        assertThat(stats.getFinalCashFlow()).isEqualTo(-9800.0);

        assertThat(stats.getTotalActions()).isEqualTo(2);
        assertThat(stats.getBuyActions()).isEqualTo(1);
        assertThat(stats.getSellActions()).isEqualTo(1);
        assertThat(stats.getTotalFills()).isEqualTo(3);
        assertThat(stats.getSellFills()).isEqualTo(2);
        assertThat(stats.getFillRatePct()).isCloseTo(150.0, within(1e-9));
        assertThat(stats.getTotalFillQty()).isEqualTo(400);

        assertThat(stats.getMinFillLatencyMs()).isEqualTo(10.0);
        assertThat(stats.getMaxFillLatencyMs()).isEqualTo(30.0);
        assertThat(stats.getAvgFillLatencyMs()).isEqualTo(20.0);
        assertThat(stats.getSourceFile()).isEqualTo("normal_market_baseline.jsonl");
    }

    @Test
    @DisplayName("A run without fills reports zero latency and fill rate")
    void noFills() {
        RunStatistics stats = calculator.calculate(List.of(step(1, 99.0, 100.0).build()), "x.jsonl");

        assertThat(stats.getTotalFills()).isZero();
        assertThat(stats.getFillRatePct()).isZero();
        assertThat(stats.getMinFillLatencyMs()).isZero();
        assertThat(stats.getAvgFillLatencyMs()).isZero();
    }

    @Test
    @DisplayName("An empty log yields a placeholder row")
    void empty() {
        RunStatistics stats = calculator.calculate(List.of(), "empty.jsonl");

        assertThat(stats.getTotalSteps()).isZero();
        assertThat(stats.getScenario()).isEqualTo("unknown");
        assertThat(stats.getSourceFile()).isEqualTo("empty.jsonl");
    }
}
