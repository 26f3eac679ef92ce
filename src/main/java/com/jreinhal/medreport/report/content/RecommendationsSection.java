package com.jreinhal.medreport.report.content;

public record RecommendationsSection(
    String dischargePlan,
    String medications,
    String followUp,
    String dietRestrictions,
    String activityRestrictions
) implements ReportSection {

    public static RecommendationsSection empty() {
        return new RecommendationsSection("", "", "", "", "");
    }

    @Override
    public SectionType type() {
        return SectionType.RECOMMENDATIONS;
    }

    @Override
    public ValidationOutcome validate() {
        return ValidationOutcome.valid();
    }
}
