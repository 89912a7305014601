package com.regimetrader.event;

import com.regimetrader.domain.model.StepRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per processed snapshot, after the step's action has been submitted and
 * before DONE is sent. Key listeners: StepEventRecorder (JSONL), TradingMetricsService.
 */
public class StepCompletedEvent extends ApplicationEvent {

    private final StepRecord record;

    /** Wall time between the previous DONE and this snapshot's arrival; null on the first step. */
    private final Long stepLatencyMs;

    public StepCompletedEvent(Object source, StepRecord record, Long stepLatencyMs) {
        super(source);
        this.record = record;
        this.stepLatencyMs = stepLatencyMs;
    }

    public StepRecord getRecord() {
        return record;
    }

    public Long getStepLatencyMs() {
        return stepLatencyMs;
    }
}
