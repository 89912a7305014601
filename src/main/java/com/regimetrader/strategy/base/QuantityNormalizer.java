package com.regimetrader.strategy.base;

/**
 * Exchange quantity rule: multiples of 100 between 100 and 500 inclusive.
 */
public final class QuantityNormalizer {

    public static final int LOT_SIZE = 100;
    public static final int MIN_QUANTITY = 100;
    public static final int MAX_QUANTITY = 500;

    private QuantityNormalizer() {}

    /** Rounds down to a multiple of 100, then clamps to [100, 500]. 150 -> 100, 1000 -> 500, 50 -> 100. */
    public static int normalize(int quantity) {
        int rounded = (quantity / LOT_SIZE) * LOT_SIZE;
        return Math.max(MIN_QUANTITY, Math.min(MAX_QUANTITY, rounded));
    }

    public static boolean isValid(int quantity) {
        return quantity % LOT_SIZE == 0 && quantity >= MIN_QUANTITY && quantity <= MAX_QUANTITY;
    }
}
