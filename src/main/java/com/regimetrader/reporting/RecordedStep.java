package com.regimetrader.reporting;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * One line of a step log, flattened into the fields reports need. Fields absent from the line
 * read as 0 or empty.
 */
@Value
@Builder
public class RecordedStep {

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

    /** Side of the order sent this step, null when none was sent. */
    String actionSide;
    double actionPrice;
    int actionQuantity;

    @Builder.Default
    List<RecordedFill> fills = List.of();

    public boolean hasAction() {
        return actionSide != null;
    }
}
