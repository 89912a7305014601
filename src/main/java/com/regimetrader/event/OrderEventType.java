package com.regimetrader.event;

/** Kind of order state change carried by an {@link OrderEvent}. */
public enum OrderEventType {
    SUBMITTED,
    REJECTED,
    CANCELLED,
    FILLED
}
