package com.regimetrader.observability;

import com.regimetrader.core.engine.TradingSession;
import com.regimetrader.event.OrderEvent;
import com.regimetrader.event.RegimeChangeEvent;
import com.regimetrader.event.StepCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer meters.
 *
 * <ul>
 *   <li><b>orders.submitted / orders.rejected</b> (counters)</li>
 *   <li><b>orders.cancelled</b> (counter, tagged with the cancel reason)</li>
 *   <li><b>fills.count</b> (counter) and <b>fill.latency</b> (timer, send to fill)</li>
 *   <li><b>steps.processed</b> (counter) and <b>step.latency</b> (timer, DONE to next snapshot)</li>
 *   <li><b>regime.transitions</b> (counter, tagged with the target regime)</li>
 *   <li><b>position.inventory</b>, <b>position.pnl</b>, <b>orders.open</b>, <b>regime.current</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer against the session last passed to
 * {@link #bind}, and read NaN before the first run. Counters and timers are driven by
 * application events and accumulate across the runs of a batch.
 */
@Service
public class TradingMetricsService {

    private static final Logger log = LoggerFactory.getLogger(TradingMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter ordersSubmittedCounter;
    private final Counter ordersRejectedCounter;
    private final Counter fillsCounter;
    private final Counter stepsCounter;
    private final Timer fillLatencyTimer;
    private final Timer stepLatencyTimer;

    private volatile TradingSession session;

    public TradingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.ordersSubmittedCounter = Counter.builder("orders.submitted")
                .description("Orders written to the exchange")
                .register(meterRegistry);
        this.ordersRejectedCounter = Counter.builder("orders.rejected")
                .description("Orders that could not be sent")
                .register(meterRegistry);
        this.fillsCounter = Counter.builder("fills.count")
                .description("Fills applied to the position")
                .register(meterRegistry);
        this.stepsCounter = Counter.builder("steps.processed")
                .description("Market snapshots processed")
                .register(meterRegistry);

        this.fillLatencyTimer = Timer.builder("fill.latency")
                .description("Time from order send to fill receipt")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
        this.stepLatencyTimer = Timer.builder("step.latency")
                .description("Time from DONE to the next snapshot")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);

        meterRegistry.gauge("position.inventory", this, m -> m.read(TradingSession::getInventory));
        meterRegistry.gauge("position.pnl", this, m -> m.read(TradingSession::getPnl));
        meterRegistry.gauge("orders.open", this, m -> m.read(TradingSession::getOpenOrderCount));
        meterRegistry.gauge("regime.current", this, m -> m.read(s -> s.getCurrentRegime().ordinal()));
    }

    /** Points the gauges at the run now in progress. */
    public void bind(TradingSession session) {
        this.session = session;
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        switch (event.getEventType()) {
            case SUBMITTED -> ordersSubmittedCounter.increment();
            case REJECTED -> ordersRejectedCounter.increment();
            case CANCELLED -> meterRegistry
                    .counter("orders.cancelled", "reason", event.getReason() != null ? event.getReason() : "unknown")
                    .increment();
            case FILLED -> {
                fillsCounter.increment();
                Long latencyMs = event.getFill() != null ? event.getFill().getLatencyMs() : null;
                if (latencyMs != null) {
                    fillLatencyTimer.record(latencyMs, TimeUnit.MILLISECONDS);
                }
            }
        }
    }

    @EventListener
    @Order(20)
    public void onRegimeChange(RegimeChangeEvent event) {
        meterRegistry
                .counter("regime.transitions", "to", event.getCurrentRegime().name())
                .increment();
        log.debug("Regime transition recorded: {} -> {}", event.getPreviousRegime(), event.getCurrentRegime());
    }

    @EventListener
    @Order(20)
    public void onStepCompleted(StepCompletedEvent event) {
        stepsCounter.increment();
        if (event.getStepLatencyMs() != null) {
            stepLatencyTimer.record(event.getStepLatencyMs(), TimeUnit.MILLISECONDS);
        }
    }

    private double read(ToDoubleFunction<TradingSession> reader) {
        TradingSession current = session;
        return current == null ? Double.NaN : reader.applyAsDouble(current);
    }

    /** Latency digest for the session summary: count, mean and max in ms. */
    public String latencySummary() {
        return String.format("fill latency: n=%d avg=%.1fms max=%.1fms; step latency: n=%d avg=%.1fms max=%.1fms",
                fillLatencyTimer.count(),
                fillLatencyTimer.mean(TimeUnit.MILLISECONDS),
                fillLatencyTimer.max(TimeUnit.MILLISECONDS),
                stepLatencyTimer.count(),
                stepLatencyTimer.mean(TimeUnit.MILLISECONDS),
                stepLatencyTimer.max(TimeUnit.MILLISECONDS));
    }
}
