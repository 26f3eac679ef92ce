package com.jreinhal.medreport.exception;

import com.jreinhal.medreport.report.content.ValidationOutcome;

public class IncompleteContentException extends ReportException {
    private final ValidationOutcome outcome;

    public IncompleteContentException(String reportId, ValidationOutcome outcome) {
        super(ErrorCode.INCOMPLETE_CONTENT, reportId,
            "Report " + reportId + " is incomplete (" + outcome.violations().size() + " violation(s))");
        this.outcome = outcome;
    }

    public ValidationOutcome getOutcome() {
        return this.outcome;
    }
}
