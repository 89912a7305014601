package com.regimetrader.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Batch data collection: every configured scenario crossed with every configured experiment,
 * one registered run each.
 *
 * <p>Binds to {@code regimetrader.batch.*}, e.g.
 * {@code regimetrader.batch.enabled=true regimetrader.batch.experiments=passive,qty_100}.
 */
@Configuration
@ConfigurationProperties(prefix = "regimetrader.batch")
@Getter
@Setter
public class BatchConfig {

    /** Replay scenarios offered by the exchange simulator. */
    public static final List<String> KNOWN_SCENARIOS = List.of(
            "normal_market", "stressed_market", "flash_crash", "hft_dominated", "mini_flash_crash");

    /** Run the scenario x experiment grid instead of the single configured run. */
    private boolean enabled = false;

    /** Log the experiment catalog and known scenarios, then exit without trading. */
    private boolean listOnly = false;

    private List<String> scenarios = new ArrayList<>(KNOWN_SCENARIOS);

    /** Catalog experiment names; empty runs the whole catalog. */
    private List<String> experiments = new ArrayList<>();

    /** Pause between consecutive runs so the exchange can release the previous replay. */
    private Duration pauseBetweenRuns = Duration.ofSeconds(2);
}
