package com.regimetrader.core.engine;

import com.regimetrader.domain.model.Fill;
import com.regimetrader.domain.model.MarketSnapshot;

/**
 * Message placed on the engine's event queue by the transport receive loops. Both streams
 * (market data and order acknowledgements) funnel through this one type so the consumer
 * thread sees a single, totally ordered sequence.
 */
public interface EngineEvent {

    /** A market snapshot for one step. */
    record MarketUpdate(MarketSnapshot snapshot) implements EngineEvent {}

    /** An execution for one of our orders, matched by id. */
    record FillReport(Fill fill) implements EngineEvent {}

    /** An ERROR message from the exchange. Logged, never fatal. */
    record ExchangeError(String message) implements EngineEvent {}

    /** The order socket accepted our credentials. */
    record SessionAuthenticated() implements EngineEvent {}

    /** One of the exchange streams closed; the run ends once queued events are processed. */
    record StreamClosed(String stream, String reason) implements EngineEvent {}
}
