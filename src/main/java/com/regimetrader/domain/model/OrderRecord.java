package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A locally-resting order: created on submit, destroyed on fill or cancel. */
@Value
@Builder
public class OrderRecord {

    String id;
    OrderSide side;
    BigDecimal price;
    int quantity;
    long submittedStep;
}
