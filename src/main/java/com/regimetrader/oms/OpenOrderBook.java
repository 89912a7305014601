package com.regimetrader.oms;

import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.OrderRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The engine's own view of its resting orders: one map per side, keyed by order id.
 *
 * <p>An id lives in at most one map and is removed exactly once, on fill or on cancel.
 * Insertion order is preserved so ties on submission step resolve oldest-first.
 * Owned by {@link OrderLifecycleManager}; not thread-safe.
 */
public class OpenOrderBook {

    private static final Comparator<OrderRecord> BY_SUBMITTED_STEP =
            Comparator.comparingLong(OrderRecord::getSubmittedStep);

    private final Map<String, OrderRecord> buyOrders = new LinkedHashMap<>();
    private final Map<String, OrderRecord> sellOrders = new LinkedHashMap<>();

    public void add(OrderRecord order) {
        if (contains(order.getId())) {
            throw new IllegalStateException("Order id already resting: " + order.getId());
        }
        sideMap(order.getSide()).put(order.getId(), order);
    }

    /** Removes the order from whichever side holds it. Empty if it is not resting. */
    public Optional<OrderRecord> remove(String orderId) {
        OrderRecord removed = buyOrders.remove(orderId);
        if (removed == null) {
            removed = sellOrders.remove(orderId);
        }
        return Optional.ofNullable(removed);
    }

    public boolean contains(String orderId) {
        return buyOrders.containsKey(orderId) || sellOrders.containsKey(orderId);
    }

    /**
     * Resting orders on the opposite side that a new order at {@code price} would trade against:
     * sells priced at or below a BUY, buys priced at or above a SELL.
     */
    public List<OrderRecord> crossedBy(OrderSide side, BigDecimal price) {
        List<OrderRecord> crossed = new ArrayList<>();
        if (side == OrderSide.BUY) {
            for (OrderRecord sell : sellOrders.values()) {
                if (sell.getPrice().compareTo(price) <= 0) {
                    crossed.add(sell);
                }
            }
        } else {
            for (OrderRecord buy : buyOrders.values()) {
                if (buy.getPrice().compareTo(price) >= 0) {
                    crossed.add(buy);
                }
            }
        }
        return crossed;
    }

    /** Up to {@code count} orders with the lowest submission step, oldest first. */
    public List<OrderRecord> oldest(int count) {
        List<OrderRecord> all = all();
        all.sort(BY_SUBMITTED_STEP);
        return new ArrayList<>(all.subList(0, Math.min(count, all.size())));
    }

    /** All resting orders, buys first, each side in insertion order. */
    public List<OrderRecord> all() {
        List<OrderRecord> all = new ArrayList<>(buyOrders.size() + sellOrders.size());
        all.addAll(buyOrders.values());
        all.addAll(sellOrders.values());
        return all;
    }

    public List<OrderRecord> getBuyOrders() {
        return List.copyOf(buyOrders.values());
    }

    public List<OrderRecord> getSellOrders() {
        return List.copyOf(sellOrders.values());
    }

    public int size() {
        return buyOrders.size() + sellOrders.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    private Map<String, OrderRecord> sideMap(OrderSide side) {
        return side == OrderSide.BUY ? buyOrders : sellOrders;
    }
}
