package com.jreinhal.medreport.report.content;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of validating a section or a whole content document. An empty violation list means valid.
 */
public record ValidationOutcome(List<Violation> violations) {
    private static final ValidationOutcome VALID = new ValidationOutcome(List.of());

    public ValidationOutcome {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationOutcome valid() {
        return VALID;
    }

    public static ValidationOutcome of(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            return VALID;
        }
        return new ValidationOutcome(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public boolean hasViolation(ViolationCode code) {
        return violations.stream().anyMatch(violation -> violation.code() == code);
    }

    public boolean hasViolation(SectionType section, String field) {
        return violations.stream().anyMatch(violation -> violation.section() == section && violation.field().equals(field));
    }

    public ValidationOutcome merge(ValidationOutcome other) {
        if (other == null || other.isValid()) {
            return this;
        }
        if (this.isValid()) {
            return other;
        }
        List<Violation> merged = new ArrayList<>(this.violations);
        merged.addAll(other.violations);
        return new ValidationOutcome(merged);
    }

    public enum ViolationCode {
        EMPTY_FIELD,
        INVALID_NATIONAL_ID,
        INVALID_DATE,
        INVALID_DIAGNOSIS
    }

    public record Violation(
        SectionType section,
        String field,
        ViolationCode code,
        String message
    ) {}
}
