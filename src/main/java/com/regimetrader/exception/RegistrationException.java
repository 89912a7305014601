package com.regimetrader.exception;

import java.util.Map;

/**
 * Thrown when the exchange registration handshake fails or returns no session credentials.
 * Fatal: the run aborts before any socket is opened.
 */
public class RegistrationException extends BaseException {

    public RegistrationException(String message) {
        super(ErrorCode.REGISTRATION_FAILED, message);
    }

    public RegistrationException(String message, Map<String, Object> details) {
        super(ErrorCode.REGISTRATION_FAILED, message, details);
    }

    public RegistrationException(String message, Throwable cause) {
        super(ErrorCode.REGISTRATION_FAILED, message, cause);
    }
}
