package com.regimetrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for resting-order management.
 *
 * <p>Controls the resting-order cap (back-pressure), how many of the oldest orders are
 * evicted when it is hit, and the stale-order sweep.
 */
@Configuration
@ConfigurationProperties(prefix = "regimetrader.orders")
@Getter
@Setter
public class OrderLifecycleConfig {

    /** Maximum number of locally-resting orders before new submissions are deferred. */
    private int maxOpenOrders = 20;

    /** Number of oldest orders cancelled when the cap is reached. */
    private int evictionBatchSize = 5;

    /** Run the stale-order sweep every this many steps. */
    private int staleSweepInterval = 10;

    /** Orders older than this many steps are cancelled in calm regimes. */
    private int staleAfterSteps = 50;

    /** Tighter staleness window while the regime is HFT. */
    private int hftStaleAfterSteps = 20;

    /** Bound on remembered send times for fill latency, oldest dropped first. */
    private int maxTrackedSendTimes = 10_000;
}
