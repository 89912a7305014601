package com.regimetrader.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.regimetrader.core.engine.EngineEvent;
import com.regimetrader.domain.enums.OrderSide;
import com.regimetrader.domain.model.BookLevel;
import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.MarketSnapshot;
import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.exception.MalformedMessageException;
import com.regimetrader.exception.TransportException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JSON wire format of the exchange simulator.
 *
 * <p>Inbound, market stream: {@code {type?, step, bid, ask, last_trade, bids:[{price,qty}], asks}}.
 * Missing numeric fields default to 0. Inbound, order stream: {@code AUTHENTICATED},
 * {@code FILL {order_id, side, price, qty}} and {@code ERROR {message}}. {@code CONNECTED}
 * greetings and unrecognised types decode to empty.
 *
 * <p>Outbound: {@code {order_id, side, price, qty}}, {@code {action:"CANCEL", order_id}} and
 * {@code {action:"DONE"}}.
 */
@Component
public class ExchangeMessageCodec {

    private static final Logger log = LoggerFactory.getLogger(ExchangeMessageCodec.class);

    static final String TYPE_CONNECTED = "CONNECTED";
    static final String TYPE_MARKET_DATA = "MARKET_DATA";
    static final String TYPE_SNAPSHOT = "SNAPSHOT";
    static final String TYPE_AUTHENTICATED = "AUTHENTICATED";
    static final String TYPE_FILL = "FILL";
    static final String TYPE_ERROR = "ERROR";

    private final ObjectMapper objectMapper;

    public ExchangeMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ---- Inbound ----

    public Optional<EngineEvent> decodeMarketMessage(String payload) {
        JsonNode node = parse(payload);
        String type = node.path("type").asText("");

        if (TYPE_CONNECTED.equals(type)) {
            return Optional.empty();
        }
        if (TYPE_ERROR.equals(type)) {
            return Optional.of(new EngineEvent.ExchangeError(node.path("message").asText("")));
        }
        if (!type.isEmpty() && !TYPE_MARKET_DATA.equals(type) && !TYPE_SNAPSHOT.equals(type)) {
            log.debug("Ignoring market message of type {}", type);
            return Optional.empty();
        }

        MarketSnapshot snapshot = MarketSnapshot.of(
                node.path("step").asLong(0),
                number(node, "bid", payload),
                number(node, "ask", payload),
                number(node, "last_trade", payload),
                levels(node.get("bids"), payload),
                levels(node.get("asks"), payload));
        return Optional.of(new EngineEvent.MarketUpdate(snapshot));
    }

    public Optional<EngineEvent> decodeOrderMessage(String payload) {
        JsonNode node = parse(payload);
        String type = node.path("type").asText("");

        switch (type) {
            case TYPE_AUTHENTICATED:
                return Optional.of(new EngineEvent.SessionAuthenticated());
            case TYPE_FILL:
                return Optional.of(new EngineEvent.FillReport(fill(node, payload)));
            case TYPE_ERROR:
                return Optional.of(new EngineEvent.ExchangeError(node.path("message").asText("")));
            default:
                log.debug("Ignoring order message of type '{}'", type);
                return Optional.empty();
        }
    }

    // ---- Outbound ----

    public String encodeOrder(OrderRecord order) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("order_id", order.getId());
        node.put("side", order.getSide().name());
        node.put("price", order.getPrice());
        node.put("qty", order.getQuantity());
        return write(node);
    }

    public String encodeCancel(String orderId) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("action", "CANCEL");
        node.put("order_id", orderId);
        return write(node);
    }

    public String encodeDone() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("action", "DONE");
        return write(node);
    }

    private JsonNode parse(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Unparseable exchange message: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("Exchange message is not a JSON object", payload);
        }
        return node;
    }

    private Fill fill(JsonNode node, String payload) {
        String orderId = node.path("order_id").asText("");
        String side = node.path("side").asText("");
        if (orderId.isEmpty()) {
            throw new MalformedMessageException("FILL without order_id", payload);
        }
        OrderSide orderSide;
        try {
            orderSide = OrderSide.valueOf(side);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("FILL with unknown side '" + side + "'", payload);
        }
        JsonNode price = node.path("price");
        JsonNode qty = node.path("qty");
        // canConvertToInt alone would truncate a fractional qty such as 100.7
        if (!price.isNumber() || !qty.isIntegralNumber() || !qty.canConvertToInt() || qty.asInt() < 0) {
            throw new MalformedMessageException("FILL with invalid price or qty", payload);
        }
        return Fill.builder()
                .orderId(orderId)
                .side(orderSide)
                .price(price.decimalValue())
                .quantity(qty.asInt())
                .build();
    }

    private static double number(JsonNode node, String field, String payload) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return 0.0;
        }
        if (!value.isNumber()) {
            throw new MalformedMessageException("Field '" + field + "' is not numeric", payload);
        }
        return value.asDouble();
    }

    private static List<BookLevel> levels(JsonNode array, String payload) {
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new MalformedMessageException("Book side is not an array", payload);
        }
        List<BookLevel> levels = new ArrayList<>(array.size());
        for (JsonNode level : array) {
            levels.add(BookLevel.builder()
                    .price(level.path("price").asDouble(0.0))
                    .quantity(level.path("qty").asInt(0))
                    .build());
        }
        return levels;
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to encode outbound message", e);
        }
    }
}
