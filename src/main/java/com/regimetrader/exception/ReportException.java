package com.regimetrader.exception;

/** Failure reading recorded runs or writing a report file. */
public class ReportException extends BaseException {

    public ReportException(String message) {
        super(ErrorCode.REPORT_ERROR, message);
    }

    public ReportException(String message, Throwable cause) {
        super(ErrorCode.REPORT_ERROR, message, cause);
    }
}
