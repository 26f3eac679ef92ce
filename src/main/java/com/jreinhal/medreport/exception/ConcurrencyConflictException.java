package com.jreinhal.medreport.exception;

/**
 * The report or its ledger changed between read and write. Callers re-read and retry.
 */
public class ConcurrencyConflictException extends ReportException {

    public ConcurrencyConflictException(String reportId, String message) {
        super(ErrorCode.CONCURRENCY_CONFLICT, reportId, message);
    }

    public ConcurrencyConflictException(String reportId, String message, Throwable cause) {
        super(ErrorCode.CONCURRENCY_CONFLICT, reportId, message, cause);
    }
}
