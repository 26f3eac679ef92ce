package com.jreinhal.medreport.report.content;

import java.util.List;

/**
 * Full clinical content of a discharge report. Every saved snapshot of this document becomes one ledger version.
 *
 * <p>Only patient data, anamnesis and diagnosis gate the workflow; {@link #isComplete()} is the single
 * completeness predicate used before a draft can go to review.</p>
 */
public record ReportContent(
    PatientDataSection patientData,
    AnamnesisSection anamnesis,
    ExaminationSection examination,
    LabResultsSection labResults,
    DiagnosisSection diagnosis,
    TreatmentSection treatment,
    RecommendationsSection recommendations
) {
    public ReportContent {
        if (patientData == null) {
            patientData = PatientDataSection.empty();
        }
        if (anamnesis == null) {
            anamnesis = AnamnesisSection.empty();
        }
        if (examination == null) {
            examination = ExaminationSection.empty();
        }
        if (labResults == null) {
            labResults = LabResultsSection.empty();
        }
        if (diagnosis == null) {
            diagnosis = DiagnosisSection.empty();
        }
        if (treatment == null) {
            treatment = TreatmentSection.empty();
        }
        if (recommendations == null) {
            recommendations = RecommendationsSection.empty();
        }
    }

    public static ReportContent empty() {
        return new ReportContent(null, null, null, null, null, null, null);
    }

    public List<ReportSection> sections() {
        return List.of(patientData, anamnesis, examination, labResults, diagnosis, treatment, recommendations);
    }

    public List<ReportSection> gatingSections() {
        return List.of(patientData, anamnesis, diagnosis);
    }

    /**
     * Validates the sections that gate the review workflow.
     */
    public ValidationOutcome validate() {
        return merge(gatingSections());
    }

    public ValidationOutcome validateAll() {
        return merge(sections());
    }

    public boolean isComplete() {
        return validate().isValid();
    }

    public ReportContent withPatientData(PatientDataSection section) {
        return new ReportContent(section, anamnesis, examination, labResults, diagnosis, treatment, recommendations);
    }

    public ReportContent withAnamnesis(AnamnesisSection section) {
        return new ReportContent(patientData, section, examination, labResults, diagnosis, treatment, recommendations);
    }

    public ReportContent withDiagnosis(DiagnosisSection section) {
        return new ReportContent(patientData, anamnesis, examination, labResults, section, treatment, recommendations);
    }

    public ReportContent withTreatment(TreatmentSection section) {
        return new ReportContent(patientData, anamnesis, examination, labResults, diagnosis, section, recommendations);
    }

    public ReportContent withRecommendations(RecommendationsSection section) {
        return new ReportContent(patientData, anamnesis, examination, labResults, diagnosis, treatment, section);
    }

    private static ValidationOutcome merge(List<ReportSection> sections) {
        ValidationOutcome outcome = ValidationOutcome.valid();
        for (ReportSection section : sections) {
            outcome = outcome.merge(section.validate());
        }
        return outcome;
    }
}
