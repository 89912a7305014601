package com.regimetrader.event;

import com.regimetrader.domain.enums.MarketRegime;
import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.domain.model.StepRecord;
import com.regimetrader.metrics.MarketMetrics;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed methods for
 * every engine event.
 *
 * <p>All listeners are synchronous {@code @EventListener}s, so they run on the engine's
 * consumer thread and see state exactly as of the publishing step.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderSubmitted(Object source, OrderRecord order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.SUBMITTED));
    }

    public void publishOrderRejected(Object source, OrderRecord order, String reason) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.REJECTED, null, reason));
    }

    public void publishOrderCancelled(Object source, OrderRecord order, String reason) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.CANCELLED, null, reason));
    }

    public void publishOrderFilled(Object source, OrderRecord order, Fill fill) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.FILLED, fill, null));
    }

    // ---- Regime ----

    public void publishRegimeChange(
            Object source, long step, MarketRegime previous, MarketRegime current, MarketMetrics metrics) {
        applicationEventPublisher.publishEvent(new RegimeChangeEvent(source, step, previous, current, metrics));
    }

    // ---- Step ----

    public void publishStepCompleted(Object source, StepRecord record, Long stepLatencyMs) {
        applicationEventPublisher.publishEvent(new StepCompletedEvent(source, record, stepLatencyMs));
    }
}
