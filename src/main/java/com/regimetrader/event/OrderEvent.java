package com.regimetrader.event;

import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.OrderRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the order lifecycle manager when one of its orders changes state.
 *
 * <p>For FILLED events the order is null when the fill referenced an id the engine no longer
 * (or never) tracked; the fill itself is always present. Key listeners: TradingMetricsService
 * (counters, fill latency timer).
 */
public class OrderEvent extends ApplicationEvent {

    private final OrderRecord order;
    private final OrderEventType eventType;
    private final Fill fill;
    private final String reason;

    public OrderEvent(Object source, OrderRecord order, OrderEventType eventType, Fill fill, String reason) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.fill = fill;
        this.reason = reason;
    }

    public OrderEvent(Object source, OrderRecord order, OrderEventType eventType) {
        this(source, order, eventType, null, null);
    }

    public OrderRecord getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Execution details. Only set for FILLED. */
    public Fill getFill() {
        return fill;
    }

    /** Cancel or rejection reason, e.g. "self-cross", "stale", "capacity". */
    public String getReason() {
        return reason;
    }
}
