package com.regimetrader.risk;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.strategy.base.QuantityNormalizer;
import com.regimetrader.strategy.base.QuotePricing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last line of defense between the strategies and the exchange.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>No candidate: if |inventory| is already at the hard limit, synthesize an emergency unwind
 *       through the touch (SELL below bid / BUY above ask) of the fixed emergency size.</li>
 *   <li>Candidate: normalize its quantity, then compute inventory after a full fill. If that
 *       reaches the hard limit, block it; when |inventory| is beyond the safety buffer, send an
 *       unwind at the touch sized to bring it back towards the buffer instead.</li>
 *   <li>Otherwise pass the normalized candidate through.</li>
 * </ol>
 *
 * <p>The hard-limit check uses the normalized quantity, so rounding a small request up to the
 * 100 minimum can never push inventory over the limit.
 */
public class RiskOverlay {

    private static final Logger log = LoggerFactory.getLogger(RiskOverlay.class);

    static final String SOURCE = "risk_overlay";

    private final RiskLimits riskLimits;

    public RiskOverlay(RiskLimits riskLimits) {
        this.riskLimits = riskLimits;
    }

    /**
     * @param candidate the strategy's order, or null when it proposed none
     * @param inventory current signed inventory
     * @param bid       best bid for unwind pricing
     * @param ask       best ask for unwind pricing
     */
    public RiskAdjustment adjust(OrderIntent candidate, int inventory, double bid, double ask) {
        int hardLimit = riskLimits.getHardLimit();

        if (candidate == null) {
            return emergencyIfBreached(inventory, bid, ask);
        }
        if (candidate.getSide() == null || candidate.getPrice() == null || candidate.getPrice().signum() <= 0) {
            log.warn("Blocked malformed candidate from {}: {}", candidate.getSource(), candidate);
            return RiskAdjustment.blocked("malformed candidate " + candidate);
        }

        int quantity = QuantityNormalizer.normalize(candidate.getQuantity());
        int resulting = inventory + candidate.getSide().sign() * quantity;

        if (Math.abs(resulting) >= hardLimit) {
            return blockCandidate(candidate, inventory, resulting, bid, ask);
        }

        if (quantity == candidate.getQuantity()) {
            return RiskAdjustment.passed(candidate);
        }
        OrderIntent resized = candidate.toBuilder().quantity(quantity).build();
        log.debug("Candidate from {} resized: {} -> {}", candidate.getSource(), candidate.getQuantity(), quantity);
        return RiskAdjustment.resized(resized, candidate.getQuantity());
    }

    public RiskLimits getRiskLimits() {
        return riskLimits;
    }

    private RiskAdjustment emergencyIfBreached(int inventory, double bid, double ask) {
        if (Math.abs(inventory) < riskLimits.getHardLimit()) {
            return RiskAdjustment.noAction();
        }

        OrderIntent unwind = inventory > 0
                ? unwind(OrderSide.SELL, Math.max(0.01, bid - riskLimits.getEmergencyOffset()),
                        riskLimits.getEmergencyQuantity())
                : unwind(OrderSide.BUY, ask + riskLimits.getEmergencyOffset(), riskLimits.getEmergencyQuantity());

        String reason = String.format("inventory %d at hard limit %d", inventory, riskLimits.getHardLimit());
        log.warn("Emergency unwind: {} -> {} {} @ {}", reason, unwind.getSide(), unwind.getQuantity(), unwind.getPrice());
        return RiskAdjustment.emergencyUnwind(unwind, reason);
    }

    private RiskAdjustment blockCandidate(
            OrderIntent candidate, int inventory, int resulting, double bid, double ask) {
        int buffer = riskLimits.getSafetyBuffer();
        String reason = String.format(
                "%s %d from %s would take inventory %d -> %d (hard limit %d)",
                candidate.getSide(), candidate.getQuantity(), candidate.getSource(),
                inventory, resulting, riskLimits.getHardLimit());

        if (inventory > buffer) {
            OrderIntent unwind = unwind(OrderSide.SELL, bid, QuantityNormalizer.normalize(inventory - buffer));
            log.warn("Blocked {}; unwinding SELL {} @ {}", reason, unwind.getQuantity(), unwind.getPrice());
            return RiskAdjustment.blockedWithUnwind(unwind, reason);
        }
        if (inventory < -buffer) {
            OrderIntent unwind = unwind(OrderSide.BUY, ask, QuantityNormalizer.normalize(-inventory - buffer));
            log.warn("Blocked {}; unwinding BUY {} @ {}", reason, unwind.getQuantity(), unwind.getPrice());
            return RiskAdjustment.blockedWithUnwind(unwind, reason);
        }

        log.warn("Blocked {}", reason);
        return RiskAdjustment.blocked(reason);
    }

    private static OrderIntent unwind(OrderSide side, double price, int quantity) {
        return OrderIntent.builder()
                .side(side)
                .price(QuotePricing.roundToCents(price))
                .quantity(quantity)
                .source(SOURCE)
                .build();
    }
}
