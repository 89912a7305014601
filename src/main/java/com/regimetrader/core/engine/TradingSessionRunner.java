package com.regimetrader.core.engine;

import com.regimetrader.config.BatchConfig;
import com.regimetrader.config.ExchangeConfig;
import com.regimetrader.config.StepRecorderConfig;
import com.regimetrader.exception.BaseException;
import com.regimetrader.observability.StepEventRecorder;
import com.regimetrader.observability.TradingMetricsService;
import com.regimetrader.strategy.ExperimentCatalog;
import com.regimetrader.transport.ExchangeSessionClient;
import com.regimetrader.transport.SessionCredentials;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Drives trading sessions end to end: register, open both streams, wait for the exchange to
 * close the run, then tear down and log the session summary.
 *
 * <p>Three modes, checked in order:
 * <ul>
 *   <li>{@code regimetrader.batch.list-only}: log the experiment catalog and known scenarios.</li>
 *   <li>{@code regimetrader.batch.enabled}: one run per scenario x experiment pair. A failed run
 *       is logged and the batch moves on; a tally is logged at the end.</li>
 *   <li>Otherwise a single run of {@code regimetrader.exchange.scenario} with
 *       {@code regimetrader.recorder.experiment}. Registration and connection failures
 *       propagate and abort startup with a non-zero exit code.</li>
 * </ul>
 *
 * <p>Inactive in report mode.
 */
@Component
@ConditionalOnProperty(name = "regimetrader.report.enabled", havingValue = "false", matchIfMissing = true)
public class TradingSessionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TradingSessionRunner.class);

    private final ExchangeSessionClient exchangeSessionClient;
    private final TradingSessionFactory tradingSessionFactory;
    private final ExperimentCatalog experimentCatalog;
    private final StepEventRecorder stepEventRecorder;
    private final TradingMetricsService tradingMetricsService;
    private final ExchangeConfig exchangeConfig;
    private final StepRecorderConfig stepRecorderConfig;
    private final BatchConfig batchConfig;

    public TradingSessionRunner(
            ExchangeSessionClient exchangeSessionClient,
            TradingSessionFactory tradingSessionFactory,
            ExperimentCatalog experimentCatalog,
            StepEventRecorder stepEventRecorder,
            TradingMetricsService tradingMetricsService,
            ExchangeConfig exchangeConfig,
            StepRecorderConfig stepRecorderConfig,
            BatchConfig batchConfig) {
        this.exchangeSessionClient = exchangeSessionClient;
        this.tradingSessionFactory = tradingSessionFactory;
        this.experimentCatalog = experimentCatalog;
        this.stepEventRecorder = stepEventRecorder;
        this.tradingMetricsService = tradingMetricsService;
        this.exchangeConfig = exchangeConfig;
        this.stepRecorderConfig = stepRecorderConfig;
        this.batchConfig = batchConfig;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        if (batchConfig.isListOnly()) {
            listCatalog();
        } else if (batchConfig.isEnabled()) {
            runBatch();
        } else {
            runSession(tradingSessionFactory.plan(exchangeConfig.getScenario(), stepRecorderConfig.getExperiment()));
        }
    }

    /** Runs one registered session to completion; failures propagate to the caller. */
    public void runSession(SessionPlan plan) throws InterruptedException {
        SessionCredentials credentials;
        try {
            credentials = exchangeSessionClient.register(plan.scenario());
        } catch (BaseException e) {
            log.error("Session aborted [{}]: {} {}", e.getErrorCode().getCode(), e.getMessage(), e.getDetails());
            throw e;
        }
        stepEventRecorder.startRun(plan, credentials.runId());

        TradingSession session = tradingSessionFactory.create(plan);
        tradingMetricsService.bind(session);
        try {
            session.open(credentials);
            log.info("Trading scenario {} as {}, experiment {} ({})",
                    plan.scenario(), exchangeConfig.getTeamName(), plan.experiment(), plan.mode());

            Duration limit = Duration.ofSeconds(exchangeConfig.getMaxRunSeconds());
            if (!session.awaitCompletion(limit)) {
                log.warn("Run did not finish within {}, stopping", limit);
            }
        } finally {
            SessionSummary summary = session.close();
            stepEventRecorder.close();
            log.info("Session summary [{} / {}]: {}", plan.scenario(), plan.experiment(), summary);
            log.info("Latency: {}", tradingMetricsService.latencySummary());
        }
    }

    private void runBatch() throws InterruptedException {
        List<SessionPlan> plans = batchPlans();
        List<String> failed = new ArrayList<>();
        log.info("Starting batch of {} runs", plans.size());

        for (int i = 0; i < plans.size(); i++) {
            SessionPlan plan = plans.get(i);
            log.info("Batch run {}/{}: {} / {}", i + 1, plans.size(), plan.scenario(), plan.experiment());
            try {
                runSession(plan);
            } catch (RuntimeException e) {
                log.error("Batch run {} / {} failed: {}", plan.scenario(), plan.experiment(), e.getMessage(), e);
                failed.add(plan.scenario() + "/" + plan.experiment());
            }
            if (i < plans.size() - 1 && !batchConfig.getPauseBetweenRuns().isZero()) {
                Thread.sleep(batchConfig.getPauseBetweenRuns().toMillis());
            }
        }

        log.info("Batch finished: {} succeeded, {} failed", plans.size() - failed.size(), failed.size());
        if (!failed.isEmpty()) {
            log.warn("Failed runs: {}", failed);
        }
    }

    /** Scenario-major grid; unknown experiment names fail before anything is registered. */
    private List<SessionPlan> batchPlans() {
        List<String> experiments = batchConfig.getExperiments().isEmpty()
                ? experimentCatalog.all().stream().map(ExperimentCatalog.Experiment::name).toList()
                : batchConfig.getExperiments();
        experiments.forEach(experimentCatalog::get);

        List<SessionPlan> plans = new ArrayList<>();
        for (String scenario : batchConfig.getScenarios()) {
            if (!BatchConfig.KNOWN_SCENARIOS.contains(scenario)) {
                log.warn("Scenario {} is not one of {}, running it anyway", scenario, BatchConfig.KNOWN_SCENARIOS);
            }
            for (String experiment : experiments) {
                plans.add(tradingSessionFactory.plan(scenario, experiment));
            }
        }
        return plans;
    }

    private void listCatalog() {
        log.info("Available experiments:");
        for (ExperimentCatalog.Experiment experiment : experimentCatalog.all()) {
            log.info("  {}: {} [{}]", experiment.name(), experiment.description(), experiment.strategy().getName());
        }
        log.info("Available scenarios: {}", String.join(", ", BatchConfig.KNOWN_SCENARIOS));
    }
}
