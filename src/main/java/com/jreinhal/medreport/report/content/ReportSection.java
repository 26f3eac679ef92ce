package com.jreinhal.medreport.report.content;

/**
 * One independently structured part of a discharge report.
 *
 * <p>Sections without mandatory fields exist for data capture only and always
 * validate successfully.</p>
 */
public interface ReportSection {

    SectionType type();

    ValidationOutcome validate();
}
