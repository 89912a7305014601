package com.regimetrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Offline report mode, bound from {@code regimetrader.report.*}. When enabled the application
 * builds reports from recorded step logs instead of trading.
 */
@Configuration
@ConfigurationProperties(prefix = "regimetrader.report")
@Getter
@Setter
public class ReportConfig {

    public enum Mode {
        /** One summary row per step log in {@code inputDir}. */
        SUMMARY,
        /** Per-step CSV for every step log in {@code inputDir}. */
        CONVERT_ALL,
        /** Statistics and per-step CSV for {@code file}. */
        FILE
    }

    private boolean enabled = false;

    private Mode mode = Mode.SUMMARY;

    private String inputDir = "data/raw";

    private String outputDir = "data/processed";

    private String summaryFile = "data/processed/summary_report.csv";

    /** Step log for {@link Mode#FILE}. */
    private String file;
}
