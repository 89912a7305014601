package com.regimetrader.domain.model;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Inventory and cash bookkeeping for one trading session.
 *
 * <p>Inventory, cash flow and P&amp;L change only through {@link #applyFill}. The ordersSent
 * counter is advanced by the order lifecycle manager after a successful send.
 * Not thread-safe: owned by the engine's single consumer thread.
 */
@Getter
public class PositionState {

    private int inventory;
    private BigDecimal cashFlow = BigDecimal.ZERO;
    private BigDecimal pnl = BigDecimal.ZERO;
    private long ordersSent;
    private long fillCount;

    /**
     * Applies a confirmed fill: BUY adds quantity and spends cash, SELL does the opposite.
     * P&amp;L is re-marked against the last observed mid.
     */
    public void applyFill(Fill fill, double lastMid) {
        BigDecimal notional = fill.getPrice().multiply(BigDecimal.valueOf(fill.getQuantity()));
        inventory += fill.getSide().sign() * fill.getQuantity();
        cashFlow = switch (fill.getSide()) {
            case BUY -> cashFlow.subtract(notional);
            case SELL -> cashFlow.add(notional);
        };
        fillCount++;
        pnl = cashFlow.add(BigDecimal.valueOf(lastMid).multiply(BigDecimal.valueOf(inventory)));
    }

    /** Counts an order the gateway accepted for sending. */
    public void recordOrderSent() {
        ordersSent++;
    }

    /** Immutable copy for step records and events. */
    public PositionSnapshot snapshot() {
        return new PositionSnapshot(inventory, cashFlow, pnl, ordersSent);
    }
}
