package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * An execution reported by the exchange. Matched to the originating order by id only.
 *
 * <p>{@code latencyMs} is filled in by the engine from its send-time bookkeeping and stays
 * null when the order id is unknown.
 */
@Value
@Builder(toBuilder = true)
public class Fill {

    String orderId;
    OrderSide side;
    BigDecimal price;
    int quantity;
    Long latencyMs;
}
