package com.regimetrader.core.engine;

/**
 * Labels of one run: the replay scenario, the experiment name and the collection mode
 * (active or passive). Written into every step record and the step log's file name.
 */
public record SessionPlan(String scenario, String experiment, String mode) {
}
