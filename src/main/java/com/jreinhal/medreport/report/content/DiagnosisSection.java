package com.jreinhal.medreport.report.content;

import com.jreinhal.medreport.report.content.ValidationOutcome.Violation;
import com.jreinhal.medreport.report.content.ValidationOutcome.ViolationCode;
import java.util.List;

public record DiagnosisSection(
    Icd10Code primaryDiagnosis,
    List<Icd10Code> secondaryDiagnoses,
    String clinicalObservations
) implements ReportSection {

    public DiagnosisSection {
        if (primaryDiagnosis == null) {
            primaryDiagnosis = Icd10Code.unset();
        }
        secondaryDiagnoses = secondaryDiagnoses == null ? List.of() : List.copyOf(secondaryDiagnoses);
    }

    public static DiagnosisSection empty() {
        return new DiagnosisSection(Icd10Code.unset(), List.of(), "");
    }

    @Override
    public SectionType type() {
        return SectionType.DIAGNOSIS;
    }

    @Override
    public ValidationOutcome validate() {
        String code = primaryDiagnosis.code();
        if (code == null || code.isBlank()) {
            return ValidationOutcome.of(List.of(new Violation(SectionType.DIAGNOSIS, "primaryDiagnosis.code",
                    ViolationCode.INVALID_DIAGNOSIS, "Primary diagnosis code is required")));
        }
        return ValidationOutcome.valid();
    }

    public record Icd10Code(String code, String description) {
        public static Icd10Code unset() {
            return new Icd10Code("", "");
        }
    }
}
