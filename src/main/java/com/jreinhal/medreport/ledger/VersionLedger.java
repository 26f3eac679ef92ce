package com.jreinhal.medreport.ledger;

import com.jreinhal.medreport.report.ReportVersion;
import com.jreinhal.medreport.report.content.ReportContent;
import java.util.List;

/**
 * Append-only store of immutable report content snapshots, keyed by report id and version number.
 *
 * <p>Version numbers of a report form the contiguous sequence 1..N. No entry is changed after {@code append}
 * returns; {@link #deleteAll(String)} exists only for the draft-only hard delete.</p>
 */
public interface VersionLedger {

    /**
     * Appends {@code content} under the next free version number. Concurrent appends for the same report never
     * receive the same number.
     */
    ReportVersion append(String reportId, ReportContent content, String authorId, String comment);

    /**
     * Inserts {@code version} at its own version number, failing with {@code ConcurrencyConflictException} if
     * that number is already taken.
     */
    ReportVersion append(ReportVersion version);

    /**
     * All versions of a report, newest first.
     */
    List<ReportVersion> listVersions(String reportId);

    ReportVersion getVersion(String reportId, int versionNumber);

    ReportVersion latest(String reportId);

    /**
     * Highest recorded version number, or 0 when the report has no versions.
     */
    int latestVersionNumber(String reportId);

    long deleteAll(String reportId);
}
