package com.regimetrader.strategy;

import com.regimetrader.strategy.base.BaseStrategyConfig;
import com.regimetrader.strategy.base.TradingStrategy;
import com.regimetrader.strategy.impl.AggressiveBuyer;
import com.regimetrader.strategy.impl.AggressiveSeller;
import com.regimetrader.strategy.impl.InventoryManager;
import com.regimetrader.strategy.impl.PassiveObserver;
import com.regimetrader.strategy.impl.PriceExplorer;
import com.regimetrader.strategy.impl.PriceExplorer.PriceLevel;
import com.regimetrader.strategy.impl.QuantityTester;
import com.regimetrader.strategy.impl.SpreadCrosser;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named data-collection experiments, in registration order.
 *
 * <p>Each entry pins one {@link TradingStrategy} for a whole run. Experiment strategies are
 * stateless, so one instance serves every run that selects it.
 */
public class ExperimentCatalog {

    /** Mode label of runs that never send orders. */
    public static final String PASSIVE_MODE = "passive";

    public static final String ACTIVE_MODE = "active";

    public record Experiment(String name, String description, TradingStrategy strategy) {

        /** Recorder mode label: passive for the observer, active for everything else. */
        public String mode() {
            return strategy instanceof PassiveObserver ? PASSIVE_MODE : ACTIVE_MODE;
        }
    }

    private final Map<String, Experiment> experiments = new LinkedHashMap<>();

    public ExperimentCatalog register(String name, String description, TradingStrategy strategy) {
        if (experiments.containsKey(name)) {
            throw new IllegalArgumentException("Experiment already registered: " + name);
        }
        experiments.put(name, new Experiment(name, description, strategy));
        return this;
    }

    public Optional<Experiment> find(String name) {
        return Optional.ofNullable(experiments.get(name));
    }

    /** Looks up an experiment that must exist. */
    public Experiment get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "Unknown experiment '" + name + "', known: " + experiments.keySet()));
    }

    public Collection<Experiment> all() {
        return Collections.unmodifiableCollection(experiments.values());
    }

    /** The standard experiment set. */
    public static ExperimentCatalog defaults() {
        ExperimentCatalog catalog = new ExperimentCatalog()
                .register("passive", "Pure observation, no trading", new PassiveObserver())
                .register("aggressive_buy_100", "Buy 100 shares every 10 steps at ask",
                        new AggressiveBuyer(every(10, 100)))
                .register("aggressive_sell_100", "Sell 100 shares every 10 steps at bid",
                        new AggressiveSeller(every(10, 100)))
                .register("spread_cross_100", "Alternate buy/sell 100 shares every 10 steps",
                        new SpreadCrosser(every(10, 100)));

        for (int quantity = 100; quantity <= 500; quantity += 100) {
            catalog.register("qty_" + quantity, "Test " + quantity + " share orders at mid",
                    new QuantityTester(every(10, quantity), 0.0));
        }

        return catalog
                .register("price_bid", "Orders at bid price", new PriceExplorer(PriceLevel.BID, every(10, 100)))
                .register("price_ask", "Orders at ask price", new PriceExplorer(PriceLevel.ASK, every(10, 100)))
                .register("price_mid", "Orders at mid price", new PriceExplorer(PriceLevel.MID, every(10, 100)))
                .register("price_bid_minus_1", "Orders 1 cent below bid",
                        new PriceExplorer(PriceLevel.BID_MINUS_1, every(10, 100)))
                .register("price_ask_plus_1", "Orders 1 cent above ask",
                        new PriceExplorer(PriceLevel.ASK_PLUS_1, every(10, 100)))
                .register("inventory_mgmt", "Maintain inventory near zero (threshold 200)",
                        new InventoryManager(every(5, 100), 200));
    }

    private static BaseStrategyConfig every(int tradeFrequency, int quantity) {
        return BaseStrategyConfig.builder().quantity(quantity).tradeFrequency(tradeFrequency).build();
    }
}
