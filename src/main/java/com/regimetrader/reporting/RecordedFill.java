package com.regimetrader.reporting;

import lombok.Builder;
import lombok.Value;

/** A fill as read back from a step log. */
@Value
@Builder
public class RecordedFill {

    String orderId;
    String side;
    double price;
    int quantity;

    /** Null when the fill's order id was unknown at the time. */
    Long latencyMs;
}
