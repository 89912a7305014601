package com.regimetrader.exception;

import java.util.Map;

/** An inbound exchange message that could not be parsed. Logged and skipped, never fatal. */
public class MalformedMessageException extends BaseException {

    public MalformedMessageException(String message, String payload) {
        super(ErrorCode.MALFORMED_MESSAGE, message, Map.of("payload", payload != null ? payload : ""));
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_MESSAGE, message, cause);
    }
}
