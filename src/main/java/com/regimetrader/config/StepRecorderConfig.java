package com.regimetrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the per-step JSONL recorder.
 *
 * <p>Files are named {@code {scenario}_{experiment}_{yyyyMMdd_HHmmss}.jsonl} under
 * {@link #directory}.
 */
@Configuration
@ConfigurationProperties(prefix = "regimetrader.recorder")
@Getter
@Setter
public class StepRecorderConfig {

    /** Master switch. */
    private boolean enabled = true;

    private String directory = "data/raw";

    /**
     * Experiment of a single run, written into every record and the file name. A name from the
     * experiment catalog (e.g. passive, qty_100) pins that strategy for the run; any other value
     * runs the regime-switching strategies under that label.
     */
    private String experiment = "default";

    /** Mode label for runs that are not catalog experiments, which carry their own. */
    private String mode = "active";

    /** Book levels per side written per step. */
    private int topLevels = 10;
}
