package com.regimetrader.reporting;

import java.util.DoubleSummaryStatistics;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Computes per-run summary statistics from recorded steps.
 *
 * <p>Bid, ask, mid and spread statistics ignore non-positive values (missing quotes).
 * Fill rate is fills per sent action, in percent. Counts come from every fill in the log,
 * not only one per step.
 */
@Service
public class RunSummaryCalculator {

    /**
     * @param steps      recorded steps in file order
     * @param sourceFile file name carried into the summary row
     * @return statistics, or an empty row when there are no steps
     */
    public RunStatistics calculate(List<RecordedStep> steps, String sourceFile) {
        if (steps == null || steps.isEmpty()) {
            return RunStatistics.empty(sourceFile);
        }

        RecordedStep first = steps.get(0);
        RecordedStep last = steps.get(steps.size() - 1);

        LongSummaryStatistics stepStats = steps.stream().mapToLong(RecordedStep::getStep).summaryStatistics();
        DoubleSummaryStatistics bids = positive(steps, RecordedStep::getBid);
        DoubleSummaryStatistics asks = positive(steps, RecordedStep::getAsk);
        DoubleSummaryStatistics mids = positive(steps, RecordedStep::getMid);
        DoubleSummaryStatistics spreads = positive(steps, RecordedStep::getSpread);
        IntSummaryStatistics inventory = steps.stream().mapToInt(RecordedStep::getInventory).summaryStatistics();
        DoubleSummaryStatistics pnl = steps.stream().mapToDouble(RecordedStep::getPnl).summaryStatistics();

        List<RecordedStep> actions = steps.stream().filter(RecordedStep::hasAction).toList();
        int buyActions = (int) actions.stream().filter(s -> "BUY".equals(s.getActionSide())).count();
        int sellActions = (int) actions.stream().filter(s -> "SELL".equals(s.getActionSide())).count();

        List<RecordedFill> fills = steps.stream()
                .flatMap(s -> s.getFills().stream())
                .collect(Collectors.toList());
        int buyFills = (int) fills.stream().filter(f -> "BUY".equals(f.getSide())).count();
        int sellFills = (int) fills.stream().filter(f -> "SELL".equals(f.getSide())).count();
        double fillRate = actions.isEmpty() ? 0 : (double) fills.size() / actions.size() * 100.0;

        DoubleSummaryStatistics fillPrices = fills.stream().mapToDouble(RecordedFill::getPrice).summaryStatistics();
        LongSummaryStatistics fillQty = fills.stream().mapToLong(RecordedFill::getQuantity).summaryStatistics();
        LongSummaryStatistics latencies = fills.stream()
                .map(RecordedFill::getLatencyMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .summaryStatistics();
        boolean hasLatency = latencies.getCount() > 0;

        return RunStatistics.builder()
                .scenario(first.getScenario())
                .experiment(first.getExperiment())
                .runId(first.getRunId())
                .mode(first.getMode())
                .totalSteps(steps.size())
                .firstStep(stepStats.getMin())
                .lastStep(stepStats.getMax())
                .minBid(min(bids))
                .maxBid(max(bids))
                .avgBid(bids.getAverage())
                .minAsk(min(asks))
                .maxAsk(max(asks))
                .avgAsk(asks.getAverage())
                .minMid(min(mids))
                .maxMid(max(mids))
                .avgMid(mids.getAverage())
                .midRange(mids.getCount() > 0 ? mids.getMax() - mids.getMin() : 0)
                .minSpread(min(spreads))
                .maxSpread(max(spreads))
                .avgSpread(spreads.getAverage())
                .minInventory(inventory.getMin())
                .maxInventory(inventory.getMax())
                .avgInventory(inventory.getAverage())
                .finalInventory(last.getInventory())
                .minPnl(pnl.getMin())
                .maxPnl(pnl.getMax())
                .finalPnl(last.getPnl())
                .avgPnl(pnl.getAverage())
                .finalCashFlow(last.getCashFlow())
                .totalActions(actions.size())
                .buyActions(buyActions)
                .sellActions(sellActions)
                .totalFills(fills.size())
                .buyFills(buyFills)
                .sellFills(sellFills)
                .fillRatePct(fillRate)
                .avgFillPrice(fillPrices.getAverage())
                .totalFillQty(fillQty.getSum())
                .avgFillQty(fillQty.getAverage())
                .minFillLatencyMs(hasLatency ? latencies.getMin() : 0)
                .maxFillLatencyMs(hasLatency ? latencies.getMax() : 0)
                .avgFillLatencyMs(latencies.getAverage())
                .sourceFile(sourceFile)
                .build();
    }

    private static DoubleSummaryStatistics positive(List<RecordedStep> steps, ToDoubleFunction<RecordedStep> field) {
        return steps.stream().mapToDouble(field).filter(v -> v > 0).summaryStatistics();
    }

    // DoubleSummaryStatistics reports +/-Infinity for an empty set
    private static double min(DoubleSummaryStatistics stats) {
        return stats.getCount() > 0 ? stats.getMin() : 0;
    }

    private static double max(DoubleSummaryStatistics stats) {
        return stats.getCount() > 0 ? stats.getMax() : 0;
    }
}
