package com.jreinhal.medreport.report.content;

import com.jreinhal.medreport.report.content.ValidationOutcome.Violation;
import com.jreinhal.medreport.report.content.ValidationOutcome.ViolationCode;
import java.util.List;

public record AnamnesisSection(
    String chiefComplaint,
    String historyOfPresentIllness,
    String pastMedicalHistory,
    String allergies,
    String socialHistory
) implements ReportSection {

    public static AnamnesisSection empty() {
        return new AnamnesisSection("", "", "", "", "");
    }

    @Override
    public SectionType type() {
        return SectionType.ANAMNESIS;
    }

    @Override
    public ValidationOutcome validate() {
        if (chiefComplaint == null || chiefComplaint.isBlank()) {
            return ValidationOutcome.of(List.of(new Violation(SectionType.ANAMNESIS, "chiefComplaint",
                    ViolationCode.EMPTY_FIELD, "Chief complaint is required")));
        }
        return ValidationOutcome.valid();
    }
}
