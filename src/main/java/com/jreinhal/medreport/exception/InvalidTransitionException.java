package com.jreinhal.medreport.exception;

import com.jreinhal.medreport.report.ReportStatus;

public class InvalidTransitionException extends ReportException {
    private final ReportStatus from;
    private final ReportStatus to;

    public InvalidTransitionException(String reportId, ReportStatus from, ReportStatus to) {
        super(ErrorCode.INVALID_TRANSITION, reportId, "Invalid status transition " + from + " -> " + to + " for report " + reportId);
        this.from = from;
        this.to = to;
    }

    public ReportStatus getFrom() {
        return this.from;
    }

    public ReportStatus getTo() {
        return this.to;
    }
}
