package com.regimetrader.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.regimetrader.config.StepRecorderConfig;
import com.regimetrader.core.engine.SessionPlan;
import com.regimetrader.domain.model.BookLevel;
import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.MarketSnapshot;
import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.domain.model.PositionSnapshot;
import com.regimetrader.domain.model.StepRecord;
import com.regimetrader.event.StepCompletedEvent;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Writes one JSON line per processed step for offline analysis.
 *
 * <p>Each line carries run metadata (timestamp, scenario, experiment, run_id, mode) plus
 * {@code market}, {@code book} (top levels and depth), {@code state}, {@code regime},
 * {@code strategy}, {@code action}, the latest {@code fill} and every {@code fills} entry
 * received since the previous step. Lines are flushed as they are written so a killed run
 * still leaves a readable file.
 *
 * <p>Recording starts with {@link #startRun} once the run id is known and ends with
 * {@link #close}. A write failure disables the recorder for the rest of the run; trading
 * continues.
 */
@Service
@Slf4j
public class StepEventRecorder {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StepRecorderConfig recorderConfig;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private BufferedWriter writer;
    private Path filePath;
    private SessionPlan plan;
    private String runId;
    private long recordsWritten;

    public StepEventRecorder(
            StepRecorderConfig recorderConfig, ObjectMapper objectMapper, Clock clock) {
        this.recorderConfig = recorderConfig;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Opens a new output file for the given run, closing any previous one. Does nothing when
     * recording is disabled.
     *
     * @return the file being written, or null when recording is off or the file could not be opened
     */
    public synchronized Path startRun(SessionPlan plan, String runId) {
        if (!recorderConfig.isEnabled()) {
            log.info("Step recording disabled");
            return null;
        }
        close();

        String fileName = String.format("%s_%s_%s.jsonl",
                plan.scenario(),
                plan.experiment(),
                LocalDateTime.now(clock).format(FILE_TIMESTAMP));
        Path directory = Paths.get(recorderConfig.getDirectory());
        try {
            Files.createDirectories(directory);
            filePath = directory.resolve(fileName);
            writer = Files.newBufferedWriter(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Could not open step log in {}, recording disabled for this run", directory, e);
            writer = null;
            filePath = null;
            return null;
        }
        this.plan = plan;
        this.runId = runId;
        this.recordsWritten = 0;
        log.info("Recording steps to {}", filePath);
        return filePath;
    }

    @EventListener
    @Order(20)
    public synchronized void onStepCompleted(StepCompletedEvent event) {
        if (writer == null) {
            return;
        }
        try {
            writer.write(objectMapper.writeValueAsString(toJson(event.getRecord(), event.getStepLatencyMs())));
            writer.newLine();
            writer.flush();
            recordsWritten++;
        } catch (IOException e) {
            log.error("Failed writing step {} to {}, recording stopped", event.getRecord().getStep(), filePath, e);
            close();
        }
    }

    public synchronized void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
            log.info("Closed step log {} ({} records)", filePath, recordsWritten);
        } catch (IOException e) {
            log.warn("Error closing step log {}: {}", filePath, e.getMessage());
        } finally {
            writer = null;
        }
    }

    public synchronized Path getFilePath() {
        return filePath;
    }

    public synchronized long getRecordsWritten() {
        return recordsWritten;
    }

    ObjectNode toJson(StepRecord record, Long stepLatencyMs) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("step", record.getStep());
        root.put("timestamp", LocalDateTime.now(clock).toString());
        root.put("experiment", plan.experiment());
        root.put("scenario", plan.scenario());
        root.put("run_id", runId);
        root.put("mode", plan.mode());

        MarketSnapshot market = record.getMarket();
        ObjectNode marketNode = root.putObject("market");
        marketNode.put("bid", market.getBid());
        marketNode.put("ask", market.getAsk());
        marketNode.put("mid", market.getMid());
        marketNode.put("spread", BigDecimal.valueOf(market.getSpread()).setScale(4, RoundingMode.HALF_UP));
        marketNode.put("last_trade", market.getLastTrade());

        ObjectNode book = root.putObject("book");
        writeLevels(book.putArray("bids"), market.getBids());
        writeLevels(book.putArray("asks"), market.getAsks());
        book.put("bid_depth", market.getBidDepth());
        book.put("ask_depth", market.getAskDepth());

        PositionSnapshot position = record.getPosition();
        ObjectNode state = root.putObject("state");
        state.put("inventory", position.inventory());
        state.put("cash_flow", position.cashFlow());
        state.put("pnl", position.pnl());
        state.put("orders_sent", position.ordersSent());

        root.put("regime", record.getRegime() != null ? record.getRegime().name() : null);
        root.put("strategy", record.getStrategyName());

        OrderRecord action = record.getAction();
        if (action == null) {
            root.putNull("action");
        } else {
            ObjectNode actionNode = root.putObject("action");
            actionNode.put("order_id", action.getId());
            actionNode.put("side", action.getSide().name());
            actionNode.put("price", action.getPrice());
            actionNode.put("qty", action.getQuantity());
        }

        List<Fill> fills = record.getFills();
        ArrayNode fillsNode = objectMapper.createArrayNode();
        for (Fill fill : fills) {
            fillsNode.add(fillJson(fill));
        }
        if (fills.isEmpty()) {
            root.putNull("fill");
        } else {
            root.set("fill", fillJson(fills.get(fills.size() - 1)));
        }
        root.set("fills", fillsNode);

        if (stepLatencyMs == null) {
            root.putNull("step_latency_ms");
        } else {
            root.put("step_latency_ms", stepLatencyMs);
        }
        return root;
    }

    private ObjectNode fillJson(Fill fill) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("order_id", fill.getOrderId());
        node.put("side", fill.getSide().name());
        node.put("price", fill.getPrice());
        node.put("qty", fill.getQuantity());
        if (fill.getLatencyMs() == null) {
            node.putNull("latency_ms");
        } else {
            node.put("latency_ms", fill.getLatencyMs());
        }
        return node;
    }

    private void writeLevels(ArrayNode array, List<BookLevel> levels) {
        if (levels == null) {
            return;
        }
        int limit = Math.min(levels.size(), recorderConfig.getTopLevels());
        for (int i = 0; i < limit; i++) {
            BookLevel level = levels.get(i);
            ObjectNode node = array.addObject();
            node.put("price", level.getPrice());
            node.put("qty", level.getQuantity());
        }
    }
}
