package com.regimetrader.transport;

import com.regimetrader.core.engine.EngineEvent;
import com.regimetrader.core.engine.EngineEventLoop;
import com.regimetrader.exception.MalformedMessageException;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Receive side of one exchange stream. Decodes each frame and hands the result to the
 * {@link EngineEventLoop}; it never touches engine state itself.
 *
 * <p>Malformed frames are logged and skipped. Closing the stream enqueues a
 * {@link EngineEvent.StreamClosed}; the loop decides when the run is over.
 */
public class ExchangeSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ExchangeSocketHandler.class);

    private final String streamName;
    private final Function<String, Optional<EngineEvent>> decoder;
    private final EngineEventLoop eventLoop;

    public ExchangeSocketHandler(
            String streamName, Function<String, Optional<EngineEvent>> decoder, EngineEventLoop eventLoop) {
        this.streamName = streamName;
        this.decoder = decoder;
        this.eventLoop = eventLoop;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("{} stream connected: {}", streamName, session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String payload = message.getPayload();
        Optional<EngineEvent> event;
        try {
            event = decoder.apply(payload);
        } catch (MalformedMessageException e) {
            log.warn("Skipping malformed {} message: {}", streamName, e.getMessage());
            return;
        }
        event.ifPresent(eventLoop::submit);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("{} stream transport error", streamName, exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("{} stream closed: {}", streamName, status);
        eventLoop.submit(new EngineEvent.StreamClosed(streamName, status.toString()));
    }

    public String getStreamName() {
        return streamName;
    }
}
