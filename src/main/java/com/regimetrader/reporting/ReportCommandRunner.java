package com.regimetrader.reporting;

import com.regimetrader.config.ReportConfig;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the configured offline report, e.g.
 * {@code --regimetrader.report.enabled=true --regimetrader.report.mode=FILE --regimetrader.report.file=...}.
 */
@Component
@ConditionalOnProperty(name = "regimetrader.report.enabled", havingValue = "true")
public class ReportCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ReportCommandRunner.class);

    private final ReportService reportService;
    private final ReportConfig reportConfig;

    public ReportCommandRunner(ReportService reportService, ReportConfig reportConfig) {
        this.reportService = reportService;
        this.reportConfig = reportConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path outputDir = Paths.get(reportConfig.getOutputDir());
        switch (reportConfig.getMode()) {
            case SUMMARY -> {
                List<RunStatistics> summaries = reportService.generateSummaryReport(
                        Paths.get(reportConfig.getInputDir()), Paths.get(reportConfig.getSummaryFile()));
                log.info("Summary report: {} runs -> {}", summaries.size(), reportConfig.getSummaryFile());
            }
            case CONVERT_ALL -> reportService.convertAll(Paths.get(reportConfig.getInputDir()), outputDir);
            case FILE -> {
                if (reportConfig.getFile() == null || reportConfig.getFile().isBlank()) {
                    throw new IllegalStateException("regimetrader.report.file is required in FILE mode");
                }
                Path file = Paths.get(reportConfig.getFile());
                RunStatistics stats = reportService.summarize(file);
                log.info("Run {} ({} / {}): steps={}, actions={} (buy {} / sell {}), fills={} ({}%), "
                                + "final inventory={}, final pnl={}, avg fill latency={}ms",
                        stats.getRunId(), stats.getScenario(), stats.getExperiment(), stats.getTotalSteps(),
                        stats.getTotalActions(), stats.getBuyActions(), stats.getSellActions(),
                        stats.getTotalFills(), String.format("%.2f", stats.getFillRatePct()),
                        stats.getFinalInventory(), String.format("%.2f", stats.getFinalPnl()),
                        String.format("%.1f", stats.getAvgFillLatencyMs()));
                reportService.exportSteps(file, outputDir);
            }
        }
    }
}
