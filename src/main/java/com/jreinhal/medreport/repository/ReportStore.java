package com.jreinhal.medreport.repository;

import com.jreinhal.medreport.report.Report;
import com.jreinhal.medreport.report.ReportStatus;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for report rows.
 *
 * <p>Writes are conditional on the revision the caller read. Implementations raise
 * {@code ConcurrencyConflictException} when the stored revision moved, {@code ReportNotFoundException} when the
 * row is gone and {@code StoreUnavailableException} for any persistence failure.</p>
 */
public interface ReportStore {

    void insert(Report report);

    Optional<Report> findById(String reportId);

    /**
     * Replaces the stored row with {@code updated} if its revision still equals {@code expectedRevision}.
     */
    Report update(Report updated, long expectedRevision);

    void delete(String reportId, long expectedRevision);

    /**
     * Reports created by {@code authorId}, most recently modified first. A null status matches every status.
     */
    List<Report> findByAuthor(String authorId, ReportStatus status, int limit, int offset);
}
