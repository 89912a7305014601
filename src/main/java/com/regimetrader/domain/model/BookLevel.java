package com.regimetrader.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * A single price level of the exchange book (bid or ask side).
 * Only the top levels are kept in {@link MarketSnapshot} for step records.
 */
@Data
@Builder
public class BookLevel {

    private double price;

    /** Total quantity resting at this price level. */
    private int quantity;
}
