package com.regimetrader.risk;

import com.regimetrader.domain.model.OrderIntent;
import java.util.Optional;
import lombok.Getter;

/**
 * Outcome of {@link RiskOverlay#adjust}: the order to send (possibly a replacement) and why.
 */
@Getter
public class RiskAdjustment {

    private final RiskAction action;
    private final OrderIntent order;
    private final String reason;

    private RiskAdjustment(RiskAction action, OrderIntent order, String reason) {
        this.action = action;
        this.order = order;
        this.reason = reason;
    }

    public static RiskAdjustment noAction() {
        return new RiskAdjustment(RiskAction.NO_ACTION, null, null);
    }

    public static RiskAdjustment passed(OrderIntent order) {
        return new RiskAdjustment(RiskAction.PASSED, order, null);
    }

    public static RiskAdjustment resized(OrderIntent order, int requestedQuantity) {
        return new RiskAdjustment(
                RiskAction.RESIZED, order, "quantity " + requestedQuantity + " normalized to " + order.getQuantity());
    }

    public static RiskAdjustment blocked(String reason) {
        return new RiskAdjustment(RiskAction.BLOCKED, null, reason);
    }

    public static RiskAdjustment blockedWithUnwind(OrderIntent unwind, String reason) {
        return new RiskAdjustment(RiskAction.BLOCKED_UNWIND, unwind, reason);
    }

    public static RiskAdjustment emergencyUnwind(OrderIntent unwind, String reason) {
        return new RiskAdjustment(RiskAction.EMERGENCY_UNWIND, unwind, reason);
    }

    public Optional<OrderIntent> getOrderOptional() {
        return Optional.ofNullable(order);
    }

    public boolean hasOrder() {
        return order != null;
    }

    @Override
    public String toString() {
        return action + (reason != null ? ": " + reason : "");
    }
}
