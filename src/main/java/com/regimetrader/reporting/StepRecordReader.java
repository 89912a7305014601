package com.regimetrader.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.regimetrader.exception.ReportException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the JSONL step logs written by {@link com.regimetrader.observability.StepEventRecorder}.
 *
 * <p>Blank lines are ignored and lines that are not valid JSON objects are logged and skipped.
 * Logs that only carry a single {@code fill} per line (no {@code fills} array) are read too.
 */
@Component
public class StepRecordReader {

    private static final Logger log = LoggerFactory.getLogger(StepRecordReader.class);

    private final ObjectMapper objectMapper;

    public StepRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<RecordedStep> read(Path file) {
        List<RecordedStep> steps = new ArrayList<>();
        int lineNumber = 0;
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    JsonNode node = objectMapper.readTree(line);
                    if (node == null || !node.isObject()) {
                        log.warn("Skipping non-object line {} in {}", lineNumber, file.getFileName());
                        skipped++;
                        continue;
                    }
                    steps.add(toStep(node));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping invalid JSON at line {} in {}: {}",
                            lineNumber, file.getFileName(), e.getOriginalMessage());
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new ReportException("Failed to read step log " + file, e);
        }
        log.debug("Read {} steps from {} ({} lines skipped)", steps.size(), file.getFileName(), skipped);
        return steps;
    }

    RecordedStep toStep(JsonNode node) {
        JsonNode market = node.path("market");
        JsonNode book = node.path("book");
        JsonNode state = node.path("state");
        JsonNode action = node.path("action");

        RecordedStep.RecordedStepBuilder builder = RecordedStep.builder()
                .step(node.path("step").asLong(0))
                .timestamp(node.path("timestamp").asText(""))
                .scenario(node.path("scenario").asText("unknown"))
                .experiment(node.path("experiment").asText("unknown"))
                .runId(node.path("run_id").asText("unknown"))
                .mode(node.path("mode").asText("unknown"))
                .bid(market.path("bid").asDouble(0))
                .ask(market.path("ask").asDouble(0))
                .mid(market.path("mid").asDouble(0))
                .spread(market.path("spread").asDouble(0))
                .lastTrade(market.path("last_trade").asDouble(0))
                .bidDepth(book.path("bid_depth").asInt(0))
                .askDepth(book.path("ask_depth").asInt(0))
                .inventory(state.path("inventory").asInt(0))
                .cashFlow(state.path("cash_flow").asDouble(0))
                .pnl(state.path("pnl").asDouble(0))
                .ordersSent(state.path("orders_sent").asLong(0))
                .regime(textOrNull(node.get("regime")))
                .strategy(textOrNull(node.get("strategy")))
                .fills(fills(node));

        if (action.isObject()) {
            builder.actionSide(action.path("side").asText(""))
                    .actionPrice(action.path("price").asDouble(0))
                    .actionQuantity(action.path("qty").asInt(0));
        }
        return builder.build();
    }

    private List<RecordedFill> fills(JsonNode node) {
        JsonNode array = node.get("fills");
        List<RecordedFill> fills = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode fill : array) {
                fills.add(toFill(fill));
            }
        } else if (node.path("fill").isObject()) {
            fills.add(toFill(node.get("fill")));
        }
        return fills;
    }

    private RecordedFill toFill(JsonNode fill) {
        JsonNode latency = fill.get("latency_ms");
        return RecordedFill.builder()
                .orderId(fill.path("order_id").asText(""))
                .side(fill.path("side").asText(""))
                .price(fill.path("price").asDouble(0))
                .quantity(fill.path("qty").asInt(0))
                .latencyMs(latency != null && latency.isNumber() ? latency.asLong() : null)
                .build();
    }

    private static String textOrNull(JsonNode value) {
        return value == null || value.isNull() ? null : value.asText();
    }
}
