package com.regimetrader.oms;

import com.regimetrader.config.OrderLifecycleConfig;
import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.domain.model.PositionState;
import com.regimetrader.event.EventPublisherHelper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the engine's resting orders and reconciles fills against position and cash.
 *
 * <p>Submission pipeline:
 * <ol>
 *   <li>Self-cross: cancel opposite-side resting orders the new order would trade against</li>
 *   <li>Back-pressure: at the resting-order cap, cancel the oldest orders and defer this one
 *       to the next step</li>
 *   <li>Send via the {@link OrderGateway}; on success record it locally and count it</li>
 * </ol>
 *
 * <p>Cancels are fire-and-forget: the order leaves the local book immediately and no
 * acknowledgement is awaited. A fill that arrives for an already-cancelled (or unknown) id is
 * still applied, since the exchange is authoritative.
 *
 * <p>Every method runs on the engine's single consumer thread.
 */
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    public static final String REASON_SELF_CROSS = "self-cross";
    public static final String REASON_CAPACITY = "capacity";
    public static final String REASON_STALE = "stale";

    private final OpenOrderBook book = new OpenOrderBook();
    private final OrderGateway orderGateway;
    private final OrderLifecycleConfig config;
    private final OrderIdGenerator orderIdGenerator;
    private final PositionState positionState;
    private final LatencyTracker latencyTracker;
    private final EventPublisherHelper eventPublisherHelper;

    public OrderLifecycleManager(
            OrderGateway orderGateway,
            OrderLifecycleConfig config,
            OrderIdGenerator orderIdGenerator,
            PositionState positionState,
            LatencyTracker latencyTracker,
            EventPublisherHelper eventPublisherHelper) {
        this.orderGateway = orderGateway;
        this.config = config;
        this.orderIdGenerator = orderIdGenerator;
        this.positionState = positionState;
        this.latencyTracker = latencyTracker;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Runs the submission pipeline for a risk-approved candidate.
     *
     * @param intent normalized candidate from the risk overlay
     * @param step   current exchange step, stored as the order's submission step
     */
    public SubmitResult submit(OrderIntent intent, long step) {
        List<String> cancelled = new ArrayList<>();

        for (OrderRecord crossed : book.crossedBy(intent.getSide(), intent.getPrice())) {
            log.info("Cancelling {} {} @ {} ({}): new {} @ {} would cross it",
                    crossed.getSide(), crossed.getQuantity(), crossed.getPrice(), crossed.getId(),
                    intent.getSide(), intent.getPrice());
            cancel(crossed.getId(), REASON_SELF_CROSS);
            cancelled.add(crossed.getId());
        }

        if (book.size() >= config.getMaxOpenOrders()) {
            List<OrderRecord> oldest = book.oldest(config.getEvictionBatchSize());
            for (OrderRecord order : oldest) {
                cancel(order.getId(), REASON_CAPACITY);
                cancelled.add(order.getId());
            }
            String reason = String.format("resting-order cap %d reached, evicted %d oldest",
                    config.getMaxOpenOrders(), oldest.size());
            log.warn("Deferring {} {} @ {} from {}: {}",
                    intent.getSide(), intent.getQuantity(), intent.getPrice(), intent.getSource(), reason);
            return SubmitResult.deferred(cancelled, reason);
        }

        OrderRecord order = OrderRecord.builder()
                .id(orderIdGenerator.generate(step, positionState.getOrdersSent()))
                .side(intent.getSide())
                .price(intent.getPrice())
                .quantity(intent.getQuantity())
                .submittedStep(step)
                .build();

        try {
            orderGateway.sendOrder(order);
        } catch (Exception e) {
            log.error("Order send failed: id={}, {} {} @ {}",
                    order.getId(), order.getSide(), order.getQuantity(), order.getPrice(), e);
            eventPublisherHelper.publishOrderRejected(this, order, e.getMessage());
            return SubmitResult.rejected(order, cancelled, e.getMessage());
        }

        book.add(order);
        positionState.recordOrderSent();
        latencyTracker.recordSent(order.getId());
        eventPublisherHelper.publishOrderSubmitted(this, order);

        log.debug("Order sent: id={}, {} {} @ {}, source={}",
                order.getId(), order.getSide(), order.getQuantity(), order.getPrice(), intent.getSource());
        return SubmitResult.accepted(order, cancelled);
    }

    /**
     * Removes the order locally and asks the exchange to cancel it. Returns false if the id
     * was not resting. A gateway failure is logged; the order stays removed either way.
     */
    public boolean cancel(String orderId, String reason) {
        Optional<OrderRecord> removed = book.remove(orderId);
        if (removed.isEmpty()) {
            return false;
        }
        try {
            orderGateway.cancelOrder(orderId);
        } catch (Exception e) {
            log.error("Cancel send failed for {} ({}), dropped locally anyway", orderId, reason, e);
        }
        eventPublisherHelper.publishOrderCancelled(this, removed.get(), reason);
        return true;
    }

    /**
     * Applies an exchange fill: drops the order from the book if it is still there, then updates
     * inventory, cash flow and P&amp;L marked at {@code lastMid}.
     *
     * @return the fill with its latency filled in when the id is known
     */
    public Fill onFill(Fill fill, double lastMid) {
        Optional<OrderRecord> order = book.remove(fill.getOrderId());
        if (order.isEmpty()) {
            log.debug("Fill for order {} not resting locally (cancelled or unknown), applying anyway",
                    fill.getOrderId());
        }

        Long latencyMs = latencyTracker.onFill(fill.getOrderId()).orElse(null);
        Fill reconciled = fill.toBuilder().latencyMs(latencyMs).build();

        positionState.applyFill(reconciled, lastMid);
        eventPublisherHelper.publishOrderFilled(this, order.orElse(null), reconciled);

        log.info("Fill: {} {} @ {} ({}), inventory={}, pnl={}, latency={}ms",
                fill.getSide(), fill.getQuantity(), fill.getPrice(), fill.getOrderId(),
                positionState.getInventory(), positionState.getPnl(), latencyMs);
        return reconciled;
    }

    public List<OrderRecord> getOpenOrders() {
        return book.all();
    }

    public OpenOrderBook getBook() {
        return book;
    }

    public PositionState getPositionState() {
        return positionState;
    }

    public LatencyTracker getLatencyTracker() {
        return latencyTracker;
    }

    public OrderGateway getOrderGateway() {
        return orderGateway;
    }
}
