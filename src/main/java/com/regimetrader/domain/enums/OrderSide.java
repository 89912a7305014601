package com.regimetrader.domain.enums;

/** Buy or sell side of an order. Serialized as-is on the order socket. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for self-cross checks and unwinds. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Signed inventory change per unit filled: +1 for BUY, -1 for SELL. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
