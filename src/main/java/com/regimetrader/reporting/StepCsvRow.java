package com.regimetrader.reporting;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/** One step flattened for the per-run CSV export. Fill columns describe the step's last fill. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
    "step", "timestamp", "scenario", "experiment", "run_id", "mode",
    "bid", "ask", "mid", "spread", "last_trade", "bid_depth", "ask_depth",
    "inventory", "cash_flow", "pnl", "orders_sent", "regime", "strategy",
    "action_side", "action_price", "action_qty",
    "fill_count", "fill_side", "fill_price", "fill_qty", "fill_latency_ms"
})
public class StepCsvRow {

    long step;
    String timestamp;
    String scenario;
    String experiment;
    String runId;
    String mode;
    double bid;
    double ask;
    double mid;
    double spread;
    double lastTrade;
    int bidDepth;
    int askDepth;
    int inventory;
    double cashFlow;
    double pnl;
    long ordersSent;
    String regime;
    String strategy;
    String actionSide;
    double actionPrice;
    int actionQty;
    int fillCount;
    String fillSide;
    double fillPrice;
    int fillQty;
    long fillLatencyMs;

    static StepCsvRow from(RecordedStep step) {
        RecordedFill lastFill = step.getFills().isEmpty() ? null : step.getFills().get(step.getFills().size() - 1);
        return StepCsvRow.builder()
                .step(step.getStep())
                .timestamp(step.getTimestamp())
                .scenario(step.getScenario())
                .experiment(step.getExperiment())
                .runId(step.getRunId())
                .mode(step.getMode())
                .bid(step.getBid())
                .ask(step.getAsk())
                .mid(step.getMid())
                .spread(step.getSpread())
                .lastTrade(step.getLastTrade())
                .bidDepth(step.getBidDepth())
                .askDepth(step.getAskDepth())
                .inventory(step.getInventory())
                .cashFlow(step.getCashFlow())
                .pnl(step.getPnl())
                .ordersSent(step.getOrdersSent())
                .regime(step.getRegime() != null ? step.getRegime() : "")
                .strategy(step.getStrategy() != null ? step.getStrategy() : "")
                .actionSide(step.hasAction() ? step.getActionSide() : "")
                .actionPrice(step.getActionPrice())
                .actionQty(step.getActionQuantity())
                .fillCount(step.getFills().size())
                .fillSide(lastFill != null ? lastFill.getSide() : "")
                .fillPrice(lastFill != null ? lastFill.getPrice() : 0)
                .fillQty(lastFill != null ? lastFill.getQuantity() : 0)
                .fillLatencyMs(lastFill != null && lastFill.getLatencyMs() != null ? lastFill.getLatencyMs() : 0)
                .build();
    }
}
