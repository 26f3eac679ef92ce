package com.jreinhal.medreport.exception;

/**
 * Base type for every failure the report lifecycle core reports to its callers.
 */
public abstract class ReportException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String reportId;

    protected ReportException(ErrorCode errorCode, String reportId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.reportId = reportId;
    }

    protected ReportException(ErrorCode errorCode, String reportId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.reportId = reportId;
    }

    public ErrorCode getErrorCode() {
        return this.errorCode;
    }

    public String getReportId() {
        return this.reportId;
    }

    public boolean isRetryable() {
        return this.errorCode.retryable;
    }

    public enum ErrorCode {
        NOT_FOUND(false),
        INVALID_PATIENT_ID(false),
        EDIT_NOT_ALLOWED(false),
        INVALID_TRANSITION(false),
        INCOMPLETE_CONTENT(false),
        CONCURRENCY_CONFLICT(true),
        STORE_UNAVAILABLE(true);

        private final boolean retryable;

        ErrorCode(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return this.retryable;
        }
    }
}
