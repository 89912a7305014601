package com.regimetrader.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.regimetrader.strategy.ExperimentCatalog;
import com.regimetrader.strategy.ExperimentCatalog.Experiment;
import com.regimetrader.strategy.impl.InventoryManager;
import com.regimetrader.strategy.impl.PassiveObserver;
import com.regimetrader.strategy.impl.PriceExplorer;
import com.regimetrader.strategy.impl.QuantityTester;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExperimentCatalogTest {

    private final ExperimentCatalog catalog = ExperimentCatalog.defaults();

    @Test
    @DisplayName("The standard set is registered in order")
    void standardSet() {
        assertThat(catalog.all()).extracting(Experiment::name).containsExactly(
                "passive",
                "aggressive_buy_100",
                "aggressive_sell_100",
                "spread_cross_100",
                "qty_100", "qty_200", "qty_300", "qty_400", "qty_500",
                "price_bid", "price_ask", "price_mid", "price_bid_minus_1", "price_ask_plus_1",
                "inventory_mgmt");
        assertThat(catalog.all()).allSatisfy(e -> assertThat(e.description()).isNotBlank());
    }

    @Test
    @DisplayName("Entries carry the parameters of their experiment")
    void parameters() {
        QuantityTester qty300 = (QuantityTester) catalog.get("qty_300").strategy();
        assertThat(qty300.getConfig().getQuantity()).isEqualTo(300);
        assertThat(qty300.getConfig().getTradeFrequency()).isEqualTo(10);
        assertThat(qty300.getPriceOffset()).isZero();

        PriceExplorer askPlus = (PriceExplorer) catalog.get("price_ask_plus_1").strategy();
        assertThat(askPlus.getPriceLevel()).isEqualTo(PriceExplorer.PriceLevel.ASK_PLUS_1);

        InventoryManager inventory = (InventoryManager) catalog.get("inventory_mgmt").strategy();
        assertThat(inventory.getThreshold()).isEqualTo(200);
        assertThat(inventory.getConfig().getTradeFrequency()).isEqualTo(5);
    }

    @Test
    @DisplayName("Only the passive observer records in passive mode")
    void modes() {
        assertThat(catalog.get("passive").strategy()).isInstanceOf(PassiveObserver.class);
        assertThat(catalog.get("passive").mode()).isEqualTo(ExperimentCatalog.PASSIVE_MODE);
        assertThat(catalog.get("spread_cross_100").mode()).isEqualTo(ExperimentCatalog.ACTIVE_MODE);
    }

    @Test
    @DisplayName("Unknown names are empty on find and rejected on get")
    void unknown() {
        assertThat(catalog.find("default")).isEmpty();
        assertThatThrownBy(() -> catalog.get("qty_900"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("qty_900");
    }

    @Test
    @DisplayName("Duplicate names are rejected")
    void duplicate() {
        assertThatThrownBy(() -> catalog.register("passive", "again", new PassiveObserver()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
