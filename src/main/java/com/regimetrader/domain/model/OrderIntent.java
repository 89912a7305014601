package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A candidate order produced by a strategy or the risk overlay, before it is assigned an id.
 *
 * <p>Immutable: the risk overlay returns a new intent instead of resizing in place.
 */
@Value
@Builder(toBuilder = true)
public class OrderIntent {

    OrderSide side;
    BigDecimal price;
    int quantity;

    /** Name of the strategy (or "risk_overlay") that proposed the order. */
    String source;

    /** Signed inventory change if this order fills completely. */
    public int signedQuantity() {
        return side.sign() * quantity;
    }
}
