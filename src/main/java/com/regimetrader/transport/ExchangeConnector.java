package com.regimetrader.transport;

import com.regimetrader.config.ExchangeConfig;
import com.regimetrader.core.engine.EngineEventLoop;
import com.regimetrader.exception.TransportException;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Opens and closes the two exchange streams for a registered session.
 *
 * <ul>
 *   <li>market data: {@code /api/ws/market?run_id=}</li>
 *   <li>order entry: {@code /api/ws/orders?token=&run_id=}, attached to the
 *       {@link WebSocketOrderGateway} once open</li>
 * </ul>
 *
 * <p>The order stream is opened first so DONE can be sent for the very first snapshot.
 */
public class ExchangeConnector {

    private static final Logger log = LoggerFactory.getLogger(ExchangeConnector.class);

    public static final String MARKET_STREAM = "market";
    public static final String ORDER_STREAM = "orders";

    private final WebSocketClient webSocketClient;
    private final ExchangeConfig exchangeConfig;
    private final ExchangeMessageCodec codec;
    private final WebSocketOrderGateway orderGateway;
    private final EngineEventLoop eventLoop;

    private WebSocketSession marketSession;
    private WebSocketSession orderSession;

    public ExchangeConnector(
            WebSocketClient webSocketClient,
            ExchangeConfig exchangeConfig,
            ExchangeMessageCodec codec,
            WebSocketOrderGateway orderGateway,
            EngineEventLoop eventLoop) {
        this.webSocketClient = webSocketClient;
        this.exchangeConfig = exchangeConfig;
        this.codec = codec;
        this.orderGateway = orderGateway;
        this.eventLoop = eventLoop;
    }

    public void connect(SessionCredentials credentials) {
        URI orderUri = UriComponentsBuilder.fromUriString(exchangeConfig.wsBaseUrl())
                .path("/api/ws/orders")
                .queryParam("token", credentials.token())
                .queryParam("run_id", credentials.runId())
                .build()
                .toUri();
        URI marketUri = UriComponentsBuilder.fromUriString(exchangeConfig.wsBaseUrl())
                .path("/api/ws/market")
                .queryParam("run_id", credentials.runId())
                .build()
                .toUri();

        orderSession = open(orderUri, new ExchangeSocketHandler(ORDER_STREAM, codec::decodeOrderMessage, eventLoop));
        orderGateway.attach(orderSession);
        marketSession = open(marketUri, new ExchangeSocketHandler(MARKET_STREAM, codec::decodeMarketMessage, eventLoop));
        log.info("Connected to exchange streams for run {}", credentials.runId());
    }

    public void disconnect() {
        orderGateway.detach();
        close(marketSession, MARKET_STREAM);
        close(orderSession, ORDER_STREAM);
        marketSession = null;
        orderSession = null;
    }

    private WebSocketSession open(URI uri, ExchangeSocketHandler handler) {
        log.info("Opening {} stream: {}", handler.getStreamName(), uri.getPath());
        try {
            return webSocketClient
                    .execute(handler, new WebSocketHttpHeaders(), uri)
                    .get(exchangeConfig.getWebsocketConnectTimeout(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting " + handler.getStreamName() + " stream", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TransportException("Failed to connect " + handler.getStreamName() + " stream", e);
        }
    }

    private void close(WebSocketSession session, String streamName) {
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("Error closing {} stream: {}", streamName, e.getMessage());
        }
    }
}
