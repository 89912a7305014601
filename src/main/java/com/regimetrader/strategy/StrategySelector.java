package com.regimetrader.strategy;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.strategy.base.TradingStrategy;
import java.util.Optional;

/** Chooses the strategy the router asks for a candidate on each step. */
public interface StrategySelector {

    /** The strategy to run for this regime and signal set, empty when nothing should trade. */
    Optional<TradingStrategy> select(MarketRegime regime, MarketMetrics metrics);
}
