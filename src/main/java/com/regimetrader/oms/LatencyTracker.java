package com.regimetrader.oms;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wall-clock bookkeeping for two latencies:
 * <ul>
 *   <li><b>fill latency</b>: order send to fill receipt, keyed by order id</li>
 *   <li><b>step latency</b>: DONE sent to the next snapshot's arrival</li>
 * </ul>
 *
 * <p>Send times survive a local cancel, since a fill may still arrive for a cancelled order.
 * The map is bounded; the oldest entries are dropped first. Engine thread only.
 */
public class LatencyTracker {

    private static final Logger log = LoggerFactory.getLogger(LatencyTracker.class);

    private final Clock clock;
    private final Map<String, Long> sendTimes;
    private long stepCompletedAt = -1;

    public LatencyTracker(Clock clock, int maxTrackedOrders) {
        this.clock = clock;
        this.sendTimes = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
                return size() > maxTrackedOrders;
            }
        };
    }

    public void recordSent(String orderId) {
        sendTimes.put(orderId, clock.millis());
    }

    /**
     * Latency for a fill, in milliseconds. Empty when the id was never sent by this engine
     * (or has aged out), in which case no latency is recorded.
     */
    public Optional<Long> onFill(String orderId) {
        Long sentAt = sendTimes.remove(orderId);
        if (sentAt == null) {
            log.debug("No send time for order {}, skipping fill latency", orderId);
            return Optional.empty();
        }
        return Optional.of(clock.millis() - sentAt);
    }

    public void markStepCompleted() {
        stepCompletedAt = clock.millis();
    }

    /** Milliseconds since the last DONE, or empty before the first one. */
    public Optional<Long> onSnapshotReceived() {
        if (stepCompletedAt < 0) {
            return Optional.empty();
        }
        long latency = clock.millis() - stepCompletedAt;
        stepCompletedAt = -1;
        return Optional.of(latency);
    }

    public int trackedOrderCount() {
        return sendTimes.size();
    }
}
