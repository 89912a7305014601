package com.regimetrader.reporting;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Summary statistics of one recorded run; one row of the summary CSV.
 *
 * <p>Price and spread statistics only consider strictly positive values. Latency figures are
 * 0 when no fill carried a latency.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
    "scenario", "experiment", "run_id", "mode",
    "total_steps", "first_step", "last_step",
    "min_bid", "max_bid", "avg_bid", "min_ask", "max_ask", "avg_ask",
    "min_mid", "max_mid", "avg_mid", "mid_range",
    "min_spread", "max_spread", "avg_spread",
    "min_inventory", "max_inventory", "avg_inventory", "final_inventory",
    "min_pnl", "max_pnl", "final_pnl", "avg_pnl", "final_cash_flow",
    "total_actions", "buy_actions", "sell_actions",
    "total_fills", "buy_fills", "sell_fills", "fill_rate_pct",
    "avg_fill_price", "total_fill_qty", "avg_fill_qty",
    "min_fill_latency_ms", "max_fill_latency_ms", "avg_fill_latency_ms",
    "source_file"
})
public class RunStatistics {

    private String scenario;
    private String experiment;
    private String runId;
    private String mode;

    private int totalSteps;
    private long firstStep;
    private long lastStep;

    private double minBid;
    private double maxBid;
    private double avgBid;
    private double minAsk;
    private double maxAsk;
    private double avgAsk;
    private double minMid;
    private double maxMid;
    private double avgMid;
    private double midRange;

    private double minSpread;
    private double maxSpread;
    private double avgSpread;

    private int minInventory;
    private int maxInventory;
    private double avgInventory;
    private int finalInventory;

    private double minPnl;
    private double maxPnl;
    private double finalPnl;
    private double avgPnl;
    private double finalCashFlow;

    private int totalActions;
    private int buyActions;
    private int sellActions;
    private int totalFills;
    private int buyFills;
    private int sellFills;
    private double fillRatePct;

    private double avgFillPrice;
    private long totalFillQty;
    private double avgFillQty;

    private double minFillLatencyMs;
    private double maxFillLatencyMs;
    private double avgFillLatencyMs;

    private String sourceFile;

    public static RunStatistics empty(String sourceFile) {
        return RunStatistics.builder()
                .scenario("unknown")
                .experiment("unknown")
                .runId("unknown")
                .mode("unknown")
                .sourceFile(sourceFile)
                .build();
    }
}
