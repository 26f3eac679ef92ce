package com.jreinhal.medreport.report.content;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record TreatmentSection(
    List<Medication> medications,
    List<Procedure> procedures
) implements ReportSection {

    public TreatmentSection {
        medications = medications == null ? List.of() : List.copyOf(medications);
        procedures = procedures == null ? List.of() : List.copyOf(procedures);
    }

    public static TreatmentSection empty() {
        return new TreatmentSection(List.of(), List.of());
    }

    @Override
    public SectionType type() {
        return SectionType.TREATMENT;
    }

    @Override
    public ValidationOutcome validate() {
        return ValidationOutcome.valid();
    }

    /**
     * A prescribed medication. {@code endDate} is null while the medication is ongoing.
     */
    public record Medication(
        String name,
        String dosage,
        String frequency,
        String route,
        LocalDate startDate,
        LocalDate endDate
    ) {}

    public record Procedure(
        String name,
        String description,
        Instant performedAt
    ) {}
}
