package com.regimetrader.reporting;

import com.regimetrader.exception.ReportException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Offline reports over recorded step logs:
 * <ul>
 *   <li>{@link #summarize}: statistics of a single run</li>
 *   <li>{@link #exportSteps}: one flattened CSV row per step</li>
 *   <li>{@link #generateSummaryReport}: one summary row per {@code .jsonl} file in a directory</li>
 *   <li>{@link #convertAll}: step CSV for every {@code .jsonl} file in a directory</li>
 * </ul>
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private static final String LOG_SUFFIX = ".jsonl";

    private final StepRecordReader stepRecordReader;
    private final RunSummaryCalculator runSummaryCalculator;
    private final CsvReportWriter csvReportWriter;

    public ReportService(
            StepRecordReader stepRecordReader,
            RunSummaryCalculator runSummaryCalculator,
            CsvReportWriter csvReportWriter) {
        this.stepRecordReader = stepRecordReader;
        this.runSummaryCalculator = runSummaryCalculator;
        this.csvReportWriter = csvReportWriter;
    }

    public RunStatistics summarize(Path logFile) {
        requireFile(logFile);
        return runSummaryCalculator.calculate(stepRecordReader.read(logFile), logFile.getFileName().toString());
    }

    /** Writes {@code <outputDir>/<name>.csv} for the given log and returns its path. */
    public Path exportSteps(Path logFile, Path outputDir) {
        requireFile(logFile);
        List<StepCsvRow> rows = stepRecordReader.read(logFile).stream()
                .map(StepCsvRow::from)
                .collect(Collectors.toList());
        if (rows.isEmpty()) {
            log.warn("No records found in {}", logFile);
        }
        return csvReportWriter.write(outputDir.resolve(csvName(logFile)), rows, StepCsvRow.class);
    }

    public List<RunStatistics> generateSummaryReport(Path dataDir, Path outputFile) {
        List<Path> logs = listLogs(dataDir);
        if (logs.isEmpty()) {
            log.warn("No {} files found in {}", LOG_SUFFIX, dataDir);
            return List.of();
        }
        log.info("Summarizing {} step logs from {}", logs.size(), dataDir);

        List<RunStatistics> summaries = new ArrayList<>();
        for (Path file : logs) {
            summaries.add(summarize(file));
        }
        csvReportWriter.write(outputFile, summaries, RunStatistics.class);
        return summaries;
    }

    public List<Path> convertAll(Path dataDir, Path outputDir) {
        List<Path> written = listLogs(dataDir).stream()
                .map(file -> exportSteps(file, outputDir))
                .collect(Collectors.toList());
        log.info("Converted {} step logs to CSV in {}", written.size(), outputDir);
        return written;
    }

    private List<Path> listLogs(Path dataDir) {
        if (!Files.isDirectory(dataDir)) {
            throw new ReportException("Data directory does not exist: " + dataDir);
        }
        try (Stream<Path> files = Files.list(dataDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(LOG_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ReportException("Failed to list " + dataDir, e);
        }
    }

    private static void requireFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ReportException("Step log does not exist: " + file);
        }
    }

    private static String csvName(Path logFile) {
        String name = logFile.getFileName().toString();
        return (name.endsWith(LOG_SUFFIX) ? name.substring(0, name.length() - LOG_SUFFIX.length()) : name) + ".csv";
    }
}
