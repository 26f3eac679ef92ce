package com.jreinhal.medreport.exception;

public class StoreUnavailableException extends ReportException {
    private final String operation;

    public StoreUnavailableException(String operation, String reportId, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, reportId, "Report store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return this.operation;
    }
}
