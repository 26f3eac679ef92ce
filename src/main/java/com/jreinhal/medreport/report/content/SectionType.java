package com.jreinhal.medreport.report.content;

public enum SectionType {
    PATIENT_DATA,
    ANAMNESIS,
    EXAMINATION,
    LAB_RESULTS,
    DIAGNOSIS,
    TREATMENT,
    RECOMMENDATIONS
}
