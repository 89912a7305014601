package com.regimetrader.core.engine;

import com.regimetrader.domain.enums.MarketRegime;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Final figures for a trading session, logged when the run ends. */
@Value
@Builder
public class SessionSummary {

    long stepsProcessed;
    long lastStep;
    long ordersSent;
    long fills;
    int openOrders;
    int inventory;
    BigDecimal cashFlow;
    BigDecimal pnl;
    MarketRegime finalRegime;

    @Override
    public String toString() {
        return String.format(
                "steps=%d (last=%d), ordersSent=%d, fills=%d, openOrders=%d, inventory=%d, cashFlow=%s, pnl=%s, regime=%s",
                stepsProcessed, lastStep, ordersSent, fills, openOrders, inventory, cashFlow, pnl, finalRegime);
    }
}
