package com.jreinhal.medreport.report;

import com.jreinhal.medreport.report.content.ReportContent;
import com.jreinhal.medreport.util.LogSanitizer;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Discharge report aggregate.
 *
 * <p>{@code content} is the materialized content of ledger version {@code currentVersion}. {@code revision}
 * is the optimistic concurrency token: every accepted write produces a copy with {@code revision + 1} and is
 * only persisted if the stored revision is still the one that was read.</p>
 */
@Document(collection="reports")
public record Report(
    @Id String id,
    String hospitalId,
    String createdBy,
    String patientNationalId,
    String patientFirstName,
    String patientLastName,
    Specialty specialty,
    ReportType reportType,
    ReportStatus status,
    ReportContent content,
    int currentVersion,
    Instant createdAt,
    Instant lastModified,
    String lastModifiedBy,
    Instant finalizedAt,
    long revision
) {
    public static final int INITIAL_VERSION = 1;

    public Report {
        if (content == null) {
            content = ReportContent.empty();
        }
    }

    public static Report newDraft(String hospitalId, PatientIdentity patient, Specialty specialty, ReportType reportType,
                                  String authorId, Instant now) {
        return new Report(
            UUID.randomUUID().toString(),
            hospitalId,
            authorId,
            patient.nationalId(),
            patient.firstName(),
            patient.lastName(),
            specialty,
            reportType,
            ReportStatus.DRAFT,
            ReportContent.empty(),
            INITIAL_VERSION,
            now,
            now,
            authorId,
            null,
            0L
        );
    }

    public Report withContent(ReportContent newContent, int versionNumber, String editorId, Instant now) {
        return new Report(id, hospitalId, createdBy, patientNationalId, patientFirstName, patientLastName,
            specialty, reportType, status, newContent, versionNumber, createdAt, now, editorId, finalizedAt,
            revision + 1);
    }

    public Report withStatus(ReportStatus newStatus, Instant newFinalizedAt, Instant now) {
        return new Report(id, hospitalId, createdBy, patientNationalId, patientFirstName, patientLastName,
            specialty, reportType, newStatus, content, currentVersion, createdAt, now, lastModifiedBy,
            newFinalizedAt, revision + 1);
    }

    public boolean isDraft() {
        return status == ReportStatus.DRAFT;
    }

    @Override
    public String toString() {
        return "Report[id=" + id + ", status=" + status + ", currentVersion=" + currentVersion
            + ", revision=" + revision + ", patient=" + LogSanitizer.maskNationalId(patientNationalId) + "]";
    }

    public enum Specialty {
        INTERNAL_MEDICINE,
        CARDIOLOGY,
        NEUROLOGY,
        PEDIATRICS,
        SURGERY
    }

    public enum ReportType {
        DISCHARGE_SUMMARY,
        TRANSFER_SUMMARY,
        OPERATIVE_NOTE
    }
}
