package com.jreinhal.medreport.report.content;

import java.time.LocalDate;
import java.util.List;

public record LabResultsSection(
    List<LabTest> laboratoryTests,
    List<Imaging> imagingStudies
) implements ReportSection {

    public LabResultsSection {
        laboratoryTests = laboratoryTests == null ? List.of() : List.copyOf(laboratoryTests);
        imagingStudies = imagingStudies == null ? List.of() : List.copyOf(imagingStudies);
    }

    public static LabResultsSection empty() {
        return new LabResultsSection(List.of(), List.of());
    }

    @Override
    public SectionType type() {
        return SectionType.LAB_RESULTS;
    }

    @Override
    public ValidationOutcome validate() {
        return ValidationOutcome.valid();
    }

    public record LabTest(
        String name,
        String result,
        String unit,
        LocalDate date
    ) {}

    public record Imaging(
        String type,
        String description,
        LocalDate date
    ) {}
}
