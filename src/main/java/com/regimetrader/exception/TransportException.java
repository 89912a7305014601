package com.regimetrader.exception;

/**
 * Wraps connection and send failures on the exchange sockets.
 *
 * <p>Raised from the gateway when an outbound frame cannot be written; the order lifecycle
 * manager treats it as a rejected submission.
 */
public class TransportException extends BaseException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }
}
