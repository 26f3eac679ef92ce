package com.jreinhal.medreport.exception;

import com.jreinhal.medreport.report.ReportStatus;

public class EditNotAllowedException extends ReportException {
    private final ReportStatus status;

    public EditNotAllowedException(String reportId, ReportStatus status) {
        super(ErrorCode.EDIT_NOT_ALLOWED, reportId, "Report " + reportId + " can only be modified in DRAFT status (current: " + status + ")");
        this.status = status;
    }

    public ReportStatus getStatus() {
        return this.status;
    }
}
