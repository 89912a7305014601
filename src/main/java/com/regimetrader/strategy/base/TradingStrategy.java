package com.regimetrader.strategy.base;

import com.regimetrader.domain.model.OrderIntent;
import com.regimetrader.metrics.MarketMetrics;
import java.util.Optional;

/**
 * Contract for every quoting strategy.
 *
 * <p>Strategies are stateless per call: everything they need arrives as arguments, so the
 * router can hold several instances of one strategy class with different parameters and
 * bind each to a regime. The returned intent is a candidate only; quantity normalization
 * and hard limits are applied afterwards by the risk overlay.
 */
public interface TradingStrategy {

    /** Instance name used in logs and step records, e.g. "passive_mm_hft". */
    String getName();

    /**
     * Decides the candidate order for one step.
     *
     * @param bid       best bid, strictly positive
     * @param ask       best ask, strictly positive
     * @param mid       mid price
     * @param inventory signed position in units
     * @param step      exchange step number
     * @param metrics   signals for this step
     * @return the candidate order, or empty to stay out of the market this step
     */
    Optional<OrderIntent> decide(double bid, double ask, double mid, int inventory, long step, MarketMetrics metrics);
}
