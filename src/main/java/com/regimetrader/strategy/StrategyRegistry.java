package com.regimetrader.strategy;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.metrics.MarketMetrics;
import com.regimetrader.strategy.base.TradingStrategy;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Binds regimes to strategy instances.
 *
 * <p>Every regime except NORMAL maps to exactly one strategy. NORMAL holds two: a signal
 * strategy used when |z| exceeds {@code strongSignalZ} and a fallback used otherwise.
 * CALIBRATING has no binding, so nothing trades until the baseline exists.
 */
public class StrategyRegistry implements StrategySelector {

    private final Map<MarketRegime, TradingStrategy> regimeStrategies = new EnumMap<>(MarketRegime.class);
    private final TradingStrategy normalSignalStrategy;
    private final TradingStrategy normalFallbackStrategy;
    private final double strongSignalZ;

    public StrategyRegistry(
            TradingStrategy normalSignalStrategy, TradingStrategy normalFallbackStrategy, double strongSignalZ) {
        this.normalSignalStrategy = normalSignalStrategy;
        this.normalFallbackStrategy = normalFallbackStrategy;
        this.strongSignalZ = strongSignalZ;
    }

    public StrategyRegistry register(MarketRegime regime, TradingStrategy strategy) {
        if (regime == MarketRegime.NORMAL || regime == MarketRegime.CALIBRATING) {
            throw new IllegalArgumentException(regime + " bindings are fixed at construction");
        }
        regimeStrategies.put(regime, strategy);
        return this;
    }

    @Override
    public Optional<TradingStrategy> select(MarketRegime regime, MarketMetrics metrics) {
        return switch (regime) {
            case CALIBRATING -> Optional.empty();
            case NORMAL -> Optional.of(Math.abs(metrics.getZScore()) > strongSignalZ
                    ? normalSignalStrategy
                    : normalFallbackStrategy);
            default -> Optional.ofNullable(regimeStrategies.get(regime));
        };
    }

    public Map<MarketRegime, TradingStrategy> getRegimeStrategies() {
        return Collections.unmodifiableMap(regimeStrategies);
    }

    public TradingStrategy getNormalSignalStrategy() {
        return normalSignalStrategy;
    }

    public TradingStrategy getNormalFallbackStrategy() {
        return normalFallbackStrategy;
    }

    public double getStrongSignalZ() {
        return strongSignalZ;
    }
}
