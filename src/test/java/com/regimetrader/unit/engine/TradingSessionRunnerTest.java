package com.regimetrader.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.regimetrader.config.BatchConfig;
import com.regimetrader.config.ExchangeConfig;
import com.regimetrader.config.StepRecorderConfig;
import com.regimetrader.core.engine.SessionPlan;
import com.regimetrader.core.engine.SessionSummary;
import com.regimetrader.core.engine.TradingSession;
import com.regimetrader.core.engine.TradingSessionFactory;
import com.regimetrader.core.engine.TradingSessionRunner;
import com.regimetrader.exception.RegistrationException;
import com.regimetrader.observability.StepEventRecorder;
import com.regimetrader.observability.TradingMetricsService;
import com.regimetrader.strategy.ExperimentCatalog;
import com.regimetrader.transport.ExchangeSessionClient;
import com.regimetrader.transport.SessionCredentials;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class TradingSessionRunnerTest {

    private ExchangeSessionClient exchangeSessionClient;
    private TradingSessionFactory tradingSessionFactory;
    private TradingSession session;
    private StepEventRecorder stepEventRecorder;
    private TradingMetricsService tradingMetricsService;
    private ExchangeConfig exchangeConfig;
    private StepRecorderConfig stepRecorderConfig;
    private BatchConfig batchConfig;
    private TradingSessionRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        exchangeSessionClient = mock(ExchangeSessionClient.class);
        tradingSessionFactory = mock(TradingSessionFactory.class);
        session = mock(TradingSession.class);
        stepEventRecorder = mock(StepEventRecorder.class);
        tradingMetricsService = mock(TradingMetricsService.class);

        when(exchangeSessionClient.register(anyString())).thenReturn(new SessionCredentials("tok-1", "run-42"));
        when(tradingSessionFactory.plan(anyString(), anyString()))
                .thenAnswer(invocation -> new SessionPlan(invocation.getArgument(0), invocation.getArgument(1), "active"));
        when(tradingSessionFactory.create(any())).thenReturn(session);
        when(session.awaitCompletion(any())).thenReturn(true);
        when(session.close()).thenReturn(SessionSummary.builder().build());

        exchangeConfig = new ExchangeConfig();
        exchangeConfig.setScenario("flash_crash");
        stepRecorderConfig = new StepRecorderConfig();
        stepRecorderConfig.setExperiment("qty_200");
        batchConfig = new BatchConfig();
        batchConfig.setPauseBetweenRuns(Duration.ZERO);

        runner = new TradingSessionRunner(
                exchangeSessionClient,
                tradingSessionFactory,
                ExperimentCatalog.defaults(),
                stepEventRecorder,
                tradingMetricsService,
                exchangeConfig,
                stepRecorderConfig,
                batchConfig);
    }

    // ==============================
    // SINGLE RUN
    // ==============================

    @Nested
    @DisplayName("Single run")
    class SingleRun {

        @Test
        @DisplayName("Registers the configured scenario and tears the session down before closing the log")
        void runsConfiguredSession() throws Exception {
            runner.run(null);

            SessionPlan plan = new SessionPlan("flash_crash", "qty_200", "active");
            InOrder order = inOrder(exchangeSessionClient, stepEventRecorder, tradingMetricsService, session);
            order.verify(exchangeSessionClient).register("flash_crash");
            order.verify(stepEventRecorder).startRun(plan, "run-42");
            order.verify(tradingMetricsService).bind(session);
            order.verify(session).open(new SessionCredentials("tok-1", "run-42"));
            order.verify(session).awaitCompletion(Duration.ofSeconds(exchangeConfig.getMaxRunSeconds()));
            order.verify(session).close();
            order.verify(stepEventRecorder).close();
        }

        @Test
        @DisplayName("A registration failure propagates and nothing is started")
        void registrationFailure() {
            when(exchangeSessionClient.register(anyString())).thenThrow(new RegistrationException("rejected"));

            assertThatThrownBy(() -> runner.run(null)).isInstanceOf(RegistrationException.class);
            verify(tradingSessionFactory, never()).create(any());
            verify(stepEventRecorder, never()).startRun(any(), anyString());
        }

        @Test
        @DisplayName("The session is closed even when connecting fails")
        void connectFailureStillCloses() {
            doThrow(new IllegalStateException("refused")).when(session).open(any());

            assertThatThrownBy(() -> runner.run(null)).isInstanceOf(IllegalStateException.class);
            verify(session).close();
            verify(stepEventRecorder).close();
        }
    }

    // ==============================
    // BATCH
    // ==============================

    @Nested
    @DisplayName("Batch")
    class Batch {

        @BeforeEach
        void enableBatch() {
            batchConfig.setEnabled(true);
            batchConfig.setScenarios(List.of("normal_market", "flash_crash"));
            batchConfig.setExperiments(List.of("passive", "qty_100"));
        }

        @Test
        @DisplayName("Runs every scenario x experiment pair, scenario-major")
        void runsGrid() throws Exception {
            runner.run(null);

            ArgumentCaptor<SessionPlan> plans = ArgumentCaptor.forClass(SessionPlan.class);
            verify(tradingSessionFactory, times(4)).create(plans.capture());
            assertThat(plans.getAllValues())
                    .extracting(p -> p.scenario() + "/" + p.experiment())
                    .containsExactly(
                            "normal_market/passive", "normal_market/qty_100",
                            "flash_crash/passive", "flash_crash/qty_100");
            verify(session, times(4)).close();
        }

        @Test
        @DisplayName("A failed run is skipped and the batch continues")
        void continuesAfterFailure() throws Exception {
            when(exchangeSessionClient.register("normal_market"))
                    .thenThrow(new RegistrationException("scenario busy"));

            runner.run(null);

            verify(exchangeSessionClient, times(2)).register("normal_market");
            verify(exchangeSessionClient, times(2)).register("flash_crash");
            verify(tradingSessionFactory, times(2)).create(any());
        }

        @Test
        @DisplayName("Unknown experiment names fail before any run is registered")
        void unknownExperiment() {
            batchConfig.setExperiments(List.of("passive", "qty_700"));

            assertThatThrownBy(() -> runner.run(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("qty_700");
            verify(exchangeSessionClient, never()).register(anyString());
        }

        @Test
        @DisplayName("An empty experiment list runs the whole catalog")
        void wholeCatalog() throws Exception {
            batchConfig.setScenarios(List.of("hft_dominated"));
            batchConfig.setExperiments(List.of());

            runner.run(null);

            int catalogSize = ExperimentCatalog.defaults().all().size();
            verify(exchangeSessionClient, times(catalogSize)).register("hft_dominated");
            verify(tradingSessionFactory).plan("hft_dominated", "inventory_mgmt");
        }
    }

    @Test
    @DisplayName("List-only mode trades nothing")
    void listOnly() throws Exception {
        batchConfig.setListOnly(true);
        batchConfig.setEnabled(true);

        runner.run(null);

        verify(exchangeSessionClient, never()).register(anyString());
        verify(tradingSessionFactory, never()).plan(anyString(), eq("passive"));
    }
}
