package com.regimetrader.strategy.base;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tick-aware quote placement shared by the market-making strategies.
 *
 * <p>Quotes improve the inside by one tick when the spread is at least two ticks wide and
 * join the touch otherwise. An inventory skew, clamped to +/-{@link #MAX_SKEW}, shifts both
 * quotes so that fills tend to flatten the position. BUY quotes never cross below one tick
 * or above ask minus one tick; SELL quotes never cross below bid plus one tick.
 */
public final class QuotePricing {

    public static final double TICK = 0.10;
    public static final double MAX_SKEW = 0.2;

    /** Absorbs binary round-off when comparing a spread against whole ticks. */
    private static final double PRICE_TOLERANCE = 1e-9;

    private QuotePricing() {}

    /** Skew = clamp(-skewFactor * inventory, -0.2, 0.2). */
    public static double skew(double skewFactor, int inventory) {
        double raw = -skewFactor * inventory;
        return Math.max(-MAX_SKEW, Math.min(MAX_SKEW, raw));
    }

    /** One tick when the spread is at least two ticks, else zero (join the touch). */
    public static double improvement(double bid, double ask) {
        return ask - bid >= 2 * TICK - PRICE_TOLERANCE ? TICK : 0.0;
    }

    public static BigDecimal buyQuote(double bid, double ask, double skew) {
        double base = bid + improvement(bid, ask);
        double price = Math.max(bid, Math.min(ask - TICK, base + skew));
        return roundToTick(Math.max(TICK, price));
    }

    public static BigDecimal sellQuote(double bid, double ask, double skew) {
        double base = ask - improvement(bid, ask);
        double price = Math.min(ask, Math.max(bid + TICK, base + skew));
        return roundToTick(price);
    }

    /** Rounds to one decimal, the tick grid. */
    public static BigDecimal roundToTick(double price) {
        return BigDecimal.valueOf(price).setScale(1, RoundingMode.HALF_UP);
    }

    /** Rounds to two decimals, used for touch and through-the-touch prices. */
    public static BigDecimal roundToCents(double price) {
        return BigDecimal.valueOf(price).setScale(2, RoundingMode.HALF_UP);
    }
}
