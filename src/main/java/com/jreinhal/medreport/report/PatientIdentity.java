package com.jreinhal.medreport.report;

import com.jreinhal.medreport.util.LogSanitizer;

/**
 * Patient identifiers supplied when a report is created. All three values are sensitive.
 */
public record PatientIdentity(String nationalId, String firstName, String lastName) {

    @Override
    public String toString() {
        return "PatientIdentity[nationalId=" + LogSanitizer.maskNationalId(nationalId) + "]";
    }
}
