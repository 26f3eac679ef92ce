package com.jreinhal.medreport.workflow;

import com.jreinhal.medreport.report.ReportStatus;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Status transition table for discharge reports.
 *
 * <p>Pure lookups over an immutable table. Self-transitions are not in the table and are therefore rejected,
 * so a retried status change is reported as invalid instead of silently succeeding. Content completeness is
 * not checked here.</p>
 */
public final class ReportWorkflow {
    private static final Map<ReportStatus, Set<ReportStatus>> TRANSITIONS;

    static {
        EnumMap<ReportStatus, Set<ReportStatus>> table = new EnumMap<>(ReportStatus.class);
        table.put(ReportStatus.DRAFT, Collections.unmodifiableSet(EnumSet.of(ReportStatus.IN_REVIEW, ReportStatus.CANCELLED)));
        table.put(ReportStatus.IN_REVIEW, Collections.unmodifiableSet(EnumSet.of(ReportStatus.DRAFT, ReportStatus.APPROVED, ReportStatus.CANCELLED)));
        table.put(ReportStatus.APPROVED, Collections.unmodifiableSet(EnumSet.of(ReportStatus.SIGNED, ReportStatus.DRAFT)));
        table.put(ReportStatus.SIGNED, Collections.unmodifiableSet(EnumSet.noneOf(ReportStatus.class)));
        table.put(ReportStatus.CANCELLED, Collections.unmodifiableSet(EnumSet.noneOf(ReportStatus.class)));
        TRANSITIONS = Collections.unmodifiableMap(table);
    }

    private ReportWorkflow() {
    }

    public static boolean canTransition(ReportStatus current, ReportStatus target) {
        if (current == null || target == null) {
            return false;
        }
        return TRANSITIONS.get(current).contains(target);
    }

    public static Set<ReportStatus> allowedTargets(ReportStatus current) {
        if (current == null) {
            return Set.of();
        }
        return TRANSITIONS.get(current);
    }

    public static boolean isTerminal(ReportStatus status) {
        return status != null && TRANSITIONS.get(status).isEmpty();
    }

    /**
     * Statuses that carry a {@code finalizedAt} timestamp.
     */
    public static boolean isFinalizing(ReportStatus status) {
        return status == ReportStatus.APPROVED || status == ReportStatus.SIGNED;
    }

    public static boolean isEditable(ReportStatus status) {
        return status == ReportStatus.DRAFT;
    }

    /**
     * Transitions that require {@code ReportContent#isComplete()} before they are taken.
     */
    public static boolean requiresCompleteContent(ReportStatus current, ReportStatus target) {
        return current == ReportStatus.DRAFT && target == ReportStatus.IN_REVIEW;
    }
}
