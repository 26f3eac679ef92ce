package com.jreinhal.medreport.report.content;

import com.jreinhal.medreport.report.content.ValidationOutcome.Violation;
import com.jreinhal.medreport.report.content.ValidationOutcome.ViolationCode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record PatientDataSection(
    String firstName,
    String lastName,
    String nationalId,
    LocalDate birthDate,
    String department,
    String ward,
    String bed,
    LocalDate admissionDate,
    LocalDate dischargeDate
) implements ReportSection {
    public static final int NATIONAL_ID_LENGTH = 13;

    public static PatientDataSection empty() {
        return new PatientDataSection("", "", "", null, "", "", "", null, null);
    }

    public static boolean isValidNationalId(String nationalId) {
        return nationalId != null && nationalId.length() == NATIONAL_ID_LENGTH;
    }

    @Override
    public SectionType type() {
        return SectionType.PATIENT_DATA;
    }

    @Override
    public ValidationOutcome validate() {
        List<Violation> violations = new ArrayList<>();
        if (isBlank(firstName)) {
            violations.add(new Violation(SectionType.PATIENT_DATA, "firstName", ViolationCode.EMPTY_FIELD, "Patient first name is required"));
        }
        if (isBlank(lastName)) {
            violations.add(new Violation(SectionType.PATIENT_DATA, "lastName", ViolationCode.EMPTY_FIELD, "Patient last name is required"));
        }
        if (!isValidNationalId(nationalId)) {
            violations.add(new Violation(SectionType.PATIENT_DATA, "nationalId", ViolationCode.INVALID_NATIONAL_ID,
                    "National id must be exactly " + NATIONAL_ID_LENGTH + " characters"));
        }
        // Either date may still be unknown while drafting.
        if (admissionDate != null && dischargeDate != null && dischargeDate.isBefore(admissionDate)) {
            violations.add(new Violation(SectionType.PATIENT_DATA, "dischargeDate", ViolationCode.INVALID_DATE,
                    "Discharge date cannot be before admission date"));
        }
        return ValidationOutcome.of(violations);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
