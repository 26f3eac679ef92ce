package com.jreinhal.medreport.report.content;

public record ExaminationSection(
    String generalCondition,
    String consciousness,
    VitalSigns vitalSigns,
    String systemsReview
) implements ReportSection {

    public ExaminationSection {
        if (vitalSigns == null) {
            vitalSigns = VitalSigns.unrecorded();
        }
    }

    public static ExaminationSection empty() {
        return new ExaminationSection("", "", VitalSigns.unrecorded(), "");
    }

    @Override
    public SectionType type() {
        return SectionType.EXAMINATION;
    }

    @Override
    public ValidationOutcome validate() {
        return ValidationOutcome.valid();
    }

    public record VitalSigns(
        String bloodPressure,
        int heartRate,
        double temperature,
        int respiratoryRate,
        int oxygenSaturation
    ) {
        public static VitalSigns unrecorded() {
            return new VitalSigns("", 0, 0.0, 0, 0);
        }
    }
}
