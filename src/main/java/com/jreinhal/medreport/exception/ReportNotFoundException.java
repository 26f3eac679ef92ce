package com.jreinhal.medreport.exception;

public class ReportNotFoundException extends ReportException {
    private final Integer versionNumber;

    public ReportNotFoundException(String reportId) {
        super(ErrorCode.NOT_FOUND, reportId, "Report not found: " + reportId);
        this.versionNumber = null;
    }

    public ReportNotFoundException(String reportId, int versionNumber) {
        super(ErrorCode.NOT_FOUND, reportId, "Version " + versionNumber + " not found for report " + reportId);
        this.versionNumber = versionNumber;
    }

    /**
     * The missing version, or null when the report itself is missing.
     */
    public Integer getVersionNumber() {
        return this.versionNumber;
    }
}
