package com.regimetrader.oms;

import com.regimetrader.domain.model.OrderRecord;

/**
 * Outbound side of the exchange connection, as seen by the order lifecycle manager.
 *
 * <p>Implementations: {@link com.regimetrader.transport.WebSocketOrderGateway} for live runs;
 * tests use an in-memory paper exchange. Failures surface as
 * {@link com.regimetrader.exception.TransportException}.
 */
public interface OrderGateway {

    /** Sends a new limit order. */
    void sendOrder(OrderRecord order);

    /** Requests cancellation. Fire-and-forget: no acknowledgement is awaited. */
    void cancelOrder(String orderId);

    /** Signals that the engine has finished the current step and the next snapshot may be sent. */
    void completeStep();
}
