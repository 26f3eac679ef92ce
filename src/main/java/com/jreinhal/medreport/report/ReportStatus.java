package com.jreinhal.medreport.report;

public enum ReportStatus {
    DRAFT,
    IN_REVIEW,
    APPROVED,
    SIGNED,
    CANCELLED
}
