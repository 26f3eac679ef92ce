package com.jreinhal.medreport.report.content;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.medreport.e2e.ReportFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReportContentTest {

    @Nested
    @DisplayName("isComplete()")
    class CompletenessTest {
        @Test
        @DisplayName("Should be complete when every gating section validates")
        void shouldBeCompleteWhenGatingSectionsValidate() {
            assertTrue(ReportFixtures.completeContent().isComplete());
        }

        @Test
        @DisplayName("Should be incomplete without a chief complaint")
        void shouldRequireChiefComplaint() {
            ReportContent content = ReportFixtures.completeContent().withAnamnesis(AnamnesisSection.empty());

            assertFalse(content.isComplete());
            assertTrue(content.validate().hasViolation(SectionType.ANAMNESIS, "chiefComplaint"));
        }

        @Test
        @DisplayName("Should be incomplete without a primary diagnosis code")
        void shouldRequirePrimaryDiagnosis() {
            ReportContent content = ReportFixtures.completeContent().withDiagnosis(
                    new DiagnosisSection(new DiagnosisSection.Icd10Code(" ", "Pneumonia"), List.of(), ""));

            assertFalse(content.isComplete());
            assertTrue(content.validate().hasViolation(ValidationOutcome.ViolationCode.INVALID_DIAGNOSIS));
        }

        @Test
        @DisplayName("Should ignore empty data-capture sections")
        void shouldIgnoreNonGatingSections() {
            ReportContent content = ReportFixtures.completeContent()
                    .withTreatment(TreatmentSection.empty())
                    .withRecommendations(RecommendationsSection.empty());

            assertTrue(content.isComplete());
            assertTrue(content.validateAll().isValid());
        }

        @Test
        @DisplayName("Should collect violations from all gating sections")
        void shouldMergeViolations() {
            ValidationOutcome outcome = ReportContent.empty().validate();

            assertEquals(5, outcome.violations().size());
            assertFalse(ReportContent.empty().isComplete());
        }
    }

    @Test
    void missingSectionsDefaultToEmpty() {
        ReportContent content = new ReportContent(null, null, null, null, null, null, null);

        assertEquals(ReportContent.empty(), content);
        assertEquals(7, content.sections().size());
        assertEquals(List.of(SectionType.PATIENT_DATA, SectionType.ANAMNESIS, SectionType.DIAGNOSIS),
                content.gatingSections().stream().map(ReportSection::type).toList());
    }

    @Test
    void dataCaptureSectionsAlwaysValidate() {
        assertSame(ValidationOutcome.valid(), ExaminationSection.empty().validate());
        assertSame(ValidationOutcome.valid(), LabResultsSection.empty().validate());
        assertSame(ValidationOutcome.valid(), TreatmentSection.empty().validate());
        assertSame(ValidationOutcome.valid(), RecommendationsSection.empty().validate());
    }
}
