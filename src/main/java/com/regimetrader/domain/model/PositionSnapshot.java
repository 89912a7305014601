package com.regimetrader.domain.model;

import java.math.BigDecimal;

/** Point-in-time copy of {@link PositionState} for step records. */
public record PositionSnapshot(int inventory, BigDecimal cashFlow, BigDecimal pnl, long ordersSent) {}
