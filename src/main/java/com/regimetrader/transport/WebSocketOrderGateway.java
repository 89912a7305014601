package com.regimetrader.transport;

import com.regimetrader.domain.model.OrderRecord;
import com.regimetrader.exception.TransportException;
import com.regimetrader.oms.OrderGateway;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * {@link OrderGateway} over the order-entry WebSocket.
 *
 * <p>Frames are written only from the engine's consumer thread, so the session needs no send
 * lock. The session is attached once the stream is connected; sending before that, or after
 * it closed, raises a {@link TransportException}.
 */
public class WebSocketOrderGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(WebSocketOrderGateway.class);

    private final ExchangeMessageCodec codec;
    private volatile WebSocketSession session;

    public WebSocketOrderGateway(ExchangeMessageCodec codec) {
        this.codec = codec;
    }

    public void attach(WebSocketSession session) {
        this.session = session;
    }

    public void detach() {
        this.session = null;
    }

    @Override
    public void sendOrder(OrderRecord order) {
        send(codec.encodeOrder(order));
    }

    @Override
    public void cancelOrder(String orderId) {
        send(codec.encodeCancel(orderId));
    }

    @Override
    public void completeStep() {
        send(codec.encodeDone());
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    private void send(String frame) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            throw new TransportException("Order stream is not connected");
        }
        try {
            current.sendMessage(new TextMessage(frame));
        } catch (IOException e) {
            throw new TransportException("Failed to write to order stream", e);
        }
        log.trace("Sent {}", frame);
    }
}
