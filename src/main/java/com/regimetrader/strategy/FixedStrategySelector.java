package com.regimetrader.strategy;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.strategy.base.TradingStrategy;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one strategy on every step regardless of regime, including during calibration.
 * Used by the data-collection experiments, whose behaviour must not depend on the classifier.
 */
public class FixedStrategySelector implements StrategySelector {

    private final TradingStrategy strategy;

    public FixedStrategySelector(TradingStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    @Override
    public Optional<TradingStrategy> select(MarketRegime regime, MarketMetrics metrics) {
        return Optional.of(strategy);
    }

    public TradingStrategy getStrategy() {
        return strategy;
    }
}
