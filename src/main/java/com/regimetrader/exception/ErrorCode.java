package com.regimetrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    MALFORMED_MESSAGE("MALFORMED_MESSAGE"),
    REGISTRATION_FAILED("REGISTRATION_FAILED"),
    TRANSPORT_ERROR("TRANSPORT_ERROR"),
    REPORT_ERROR("REPORT_ERROR");

    private final String code;
}
