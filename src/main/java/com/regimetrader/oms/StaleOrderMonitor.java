package com.regimetrader.oms;

import com.regimetrader.config.OrderLifecycleConfig;
import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.domain.model.OrderRecord;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancels resting orders that have outlived their usefulness.
 *
 * <p>Age is measured in exchange steps, not wall time, because the exchange paces the run.
 * Staleness rules per regime:
 * <ul>
 *   <li>HFT: {@code hftStaleAfterSteps} (20), quotes go stale quickly when the book churns</li>
 *   <li>everything else: {@code staleAfterSteps} (50)</li>
 * </ul>
 *
 * <p>Driven by the engine every step; the sweep itself only runs every
 * {@code staleSweepInterval} steps.
 */
public class StaleOrderMonitor {

    private static final Logger log = LoggerFactory.getLogger(StaleOrderMonitor.class);

    private final OrderLifecycleManager orderLifecycleManager;
    private final OrderLifecycleConfig config;

    public StaleOrderMonitor(OrderLifecycleManager orderLifecycleManager, OrderLifecycleConfig config) {
        this.orderLifecycleManager = orderLifecycleManager;
        this.config = config;
    }

    /**
     * Cancels stale orders if this step is on the sweep cadence.
     *
     * @return ids cancelled by this sweep
     */
    public List<String> sweep(long step, MarketRegime regime) {
        if (config.getStaleSweepInterval() > 1 && step % config.getStaleSweepInterval() != 0) {
            return List.of();
        }

        List<String> cancelled = new ArrayList<>();
        for (OrderRecord order : orderLifecycleManager.getOpenOrders()) {
            if (isStale(order, step, regime)) {
                handleStale(order, step, regime);
                cancelled.add(order.getId());
            }
        }
        return cancelled;
    }

    /** True when the order has rested for more steps than the regime allows. */
    public boolean isStale(OrderRecord order, long step, MarketRegime regime) {
        return step - order.getSubmittedStep() > getStalenessForRegime(regime);
    }

    public int getStalenessForRegime(MarketRegime regime) {
        return regime == MarketRegime.HFT ? config.getHftStaleAfterSteps() : config.getStaleAfterSteps();
    }

    void handleStale(OrderRecord order, long step, MarketRegime regime) {
        log.info("Stale order: id={}, {} {} @ {}, age={} steps, regime={}",
                order.getId(), order.getSide(), order.getQuantity(), order.getPrice(),
                step - order.getSubmittedStep(), regime);
        orderLifecycleManager.cancel(order.getId(), OrderLifecycleManager.REASON_STALE);
    }
}
