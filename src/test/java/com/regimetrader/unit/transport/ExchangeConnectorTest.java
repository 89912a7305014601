package com.regimetrader.unit.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.regimetrader.config.ExchangeConfig;
import com.regimetrader.core.engine.EngineEventLoop;
import com.regimetrader.exception.TransportException;
import com.regimetrader.transport.ExchangeConnector;
import com.regimetrader.transport.ExchangeMessageCodec;
import com.regimetrader.transport.SessionCredentials;
import com.regimetrader.transport.WebSocketOrderGateway;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

class ExchangeConnectorTest {

    private WebSocketClient webSocketClient;
    private WebSocketSession session;
    private WebSocketOrderGateway gateway;
    private ExchangeConnector connector;

    @BeforeEach
    void setUp() {
        webSocketClient = mock(WebSocketClient.class);
        session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);

        ExchangeMessageCodec codec = new ExchangeMessageCodec(new ObjectMapper());
        gateway = new WebSocketOrderGateway(codec);
        connector = new ExchangeConnector(
                webSocketClient, new ExchangeConfig(), codec, gateway, mock(EngineEventLoop.class));
    }

    @Test
    @DisplayName("Opens the order stream first, then the market stream, and attaches the gateway")
    void connects() {
        when(webSocketClient.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(CompletableFuture.completedFuture(session));

        connector.connect(new SessionCredentials("tok-1", "run-42"));

        ArgumentCaptor<URI> uris = ArgumentCaptor.forClass(URI.class);
        verify(webSocketClient, times(2))
                .execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), uris.capture());
        List<URI> opened = uris.getAllValues();
        assertThat(opened.get(0)).hasToString("ws://localhost:8080/api/ws/orders?token=tok-1&run_id=run-42");
        assertThat(opened.get(1)).hasToString("ws://localhost:8080/api/ws/market?run_id=run-42");
        assertThat(gateway.isConnected()).isTrue();
    }

    @Test
    @DisplayName("A failed handshake surfaces as TransportException")
    void handshakeFailure() {
        when(webSocketClient.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(CompletableFuture.failedFuture(new IOException("connection refused")));

        assertThatThrownBy(() -> connector.connect(new SessionCredentials("tok-1", "run-42")))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("orders");
    }

    @Test
    @DisplayName("Disconnect closes both sessions and detaches the gateway")
    void disconnects() throws Exception {
        when(webSocketClient.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(CompletableFuture.completedFuture(session));
        connector.connect(new SessionCredentials("tok-1", "run-42"));

        connector.disconnect();

        verify(session, times(2)).close(CloseStatus.NORMAL);
        assertThat(gateway.isConnected()).isFalse();
    }
}
