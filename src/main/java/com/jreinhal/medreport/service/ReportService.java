package com.jreinhal.medreport.service;

import com.jreinhal.medreport.exception.ConcurrencyConflictException;
import com.jreinhal.medreport.exception.EditNotAllowedException;
import com.jreinhal.medreport.exception.IncompleteContentException;
import com.jreinhal.medreport.exception.InvalidPatientIdException;
import com.jreinhal.medreport.exception.InvalidTransitionException;
import com.jreinhal.medreport.exception.ReportException;
import com.jreinhal.medreport.exception.ReportNotFoundException;
import com.jreinhal.medreport.ledger.VersionLedger;
import com.jreinhal.medreport.report.PatientIdentity;
import com.jreinhal.medreport.report.Report;
import com.jreinhal.medreport.report.ReportStatus;
import com.jreinhal.medreport.report.ReportVersion;
import com.jreinhal.medreport.report.content.PatientDataSection;
import com.jreinhal.medreport.report.content.ReportContent;
import com.jreinhal.medreport.report.content.ValidationOutcome;
import com.jreinhal.medreport.repository.ReportStore;
import com.jreinhal.medreport.util.LogSanitizer;
import com.jreinhal.medreport.util.StoreRetry;
import com.jreinhal.medreport.workflow.ReportWorkflow;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * The only component that mutates reports. Drives the report store, the version ledger and the workflow table
 * together.
 *
 * <p>Content mutations claim version {@code n+1} on the report row with a revision-conditioned write and then
 * append ledger entry {@code n+1}. The conditional write serialises writers of one report; the ledger's unique
 * {@code (reportId, versionNumber)} key makes duplicate numbers impossible even if that were bypassed. No
 * mutation starts while the ledger lags behind the row, so the materialized content always belongs to the
 * highest recorded version once a mutation returns.</p>
 *
 * <p>With {@code medreport.audit.fail-closed=true} every mutation may end in
 * {@link ReportAuditService.AuditFailureException}. The mutation has been persisted by then; callers must
 * re-read the report instead of repeating the call, which would record the content a second time.</p>
 */
@Service
public class ReportService {
    private static final Logger log = LoggerFactory.getLogger(ReportService.class);
    static final String INITIAL_VERSION_COMMENT = "Initial version";
    static final String AUTO_SAVE_COMMENT = "Auto-save";
    static final String RECOVERED_COMMENT = "Recovered unconfirmed save";
    private static final String SYSTEM_ACTOR = "system";
    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final ReportStore reportStore;
    private final VersionLedger versionLedger;
    private final ReportAuditService auditService;
    private final StoreRetry storeRetry;

    @Value("${medreport.ledger.stale-claim-timeout:PT30S}")
    private Duration staleClaimTimeout = Duration.ofSeconds(30);

    public ReportService(ReportStore reportStore, VersionLedger versionLedger, ReportAuditService auditService,
                         StoreRetry storeRetry) {
        this.reportStore = reportStore;
        this.versionLedger = versionLedger;
        this.auditService = auditService;
        this.storeRetry = storeRetry;
    }

    public Report create(String hospitalId, PatientIdentity patient, Report.Specialty specialty,
                         Report.ReportType reportType, String authorId) {
        requireText(hospitalId, "Hospital id");
        requireText(authorId, "Author id");
        if (patient == null) {
            throw new IllegalArgumentException("Patient identity is required");
        }
        if (!PatientDataSection.isValidNationalId(patient.nationalId())) {
            throw new InvalidPatientIdException(PatientDataSection.NATIONAL_ID_LENGTH,
                    patient.nationalId() == null ? 0 : patient.nationalId().length());
        }

        Instant now = Instant.now();
        Report report = Report.newDraft(hospitalId, patient, specialty, reportType, authorId, now);
        insertReport(report);

        ReportVersion initial = ReportVersion.create(report.id(), Report.INITIAL_VERSION, report.content(), authorId,
                INITIAL_VERSION_COMMENT, now);
        try {
            recordVersion(initial);
        } catch (ReportException e) {
            log.warn("Initial version of report {} could not be recorded, removing the report", report.id());
            discardUnrecordedReport(report, e);
            throw e;
        }

        this.auditService.logCreated(report, initial);
        log.info("Report {} created by {} for patient {}", report.id(), LogSanitizer.sanitize(authorId),
                LogSanitizer.maskNationalId(patient.nationalId()));
        return report;
    }

    public Report getReport(String reportId) {
        requireText(reportId, "Report id");
        return this.storeRetry.execute("report.find", () -> this.reportStore.findById(reportId))
                .orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    public ReportVersion updateContent(String reportId, ReportContent content, String editorId) {
        return updateContent(reportId, content, editorId, AUTO_SAVE_COMMENT);
    }

    /**
     * Saves {@code content} as the next version of a draft. Completeness is not checked on save.
     */
    public ReportVersion updateContent(String reportId, ReportContent content, String editorId, String comment) {
        requireText(editorId, "Editor id");
        if (content == null) {
            throw new IllegalArgumentException("Report content is required");
        }
        Report current = getReport(reportId);
        requireDraft(current);

        ReportVersion version = appendContent(current, content, editorId,
                comment == null || comment.isBlank() ? AUTO_SAVE_COMMENT : comment);
        this.auditService.logContentSaved(version);
        log.info("Report {} saved as version {} by {}", reportId, version.versionNumber(), LogSanitizer.sanitize(editorId));
        return version;
    }

    /**
     * Appends a new version carrying the content of {@code versionNumber}. History is never rewritten.
     */
    public ReportVersion restoreVersion(String reportId, int versionNumber, String editorId) {
        requireText(editorId, "Editor id");
        Report current = getReport(reportId);
        requireDraft(current);
        ReportVersion source = this.storeRetry.execute("ledger.get",
                () -> this.versionLedger.getVersion(reportId, versionNumber));

        ReportVersion restored = appendContent(current, source.content(), editorId, "Restored from version " + versionNumber);
        this.auditService.logVersionRestored(restored, versionNumber);
        log.info("Report {} restored from version {} as version {} by {}", reportId, versionNumber,
                restored.versionNumber(), LogSanitizer.sanitize(editorId));
        return restored;
    }

    public Report changeStatus(String reportId, ReportStatus target) {
        return changeStatus(reportId, target, null);
    }

    public Report changeStatus(String reportId, ReportStatus target, String actorId) {
        if (target == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        Report current = getReport(reportId);
        if (!ReportWorkflow.canTransition(current.status(), target)) {
            throw new InvalidTransitionException(reportId, current.status(), target);
        }
        Report settled = ensureLedgerSettled(current);
        if (ReportWorkflow.requiresCompleteContent(settled.status(), target)) {
            ValidationOutcome outcome = settled.content().validate();
            if (!outcome.isValid()) {
                throw new IncompleteContentException(reportId, outcome);
            }
        }

        Instant now = Instant.now();
        Report updated = settled.withStatus(target, resolveFinalizedAt(settled, target, now), now);
        Report saved = this.storeRetry.execute("report.update", () -> this.reportStore.update(updated, settled.revision()));

        this.auditService.logStatusChanged(saved, current.status(), actorId != null ? actorId : SYSTEM_ACTOR);
        log.info("Report {} moved {} -> {}", reportId, current.status(), target);
        return saved;
    }

    public void delete(String reportId) {
        delete(reportId, null);
    }

    /**
     * Hard-deletes a draft report together with its versions. Reports that ever left DRAFT keep their full
     * history. A save still being recorded makes the delete fail with a conflict.
     */
    public void delete(String reportId, String actorId) {
        Report current = ensureLedgerSettled(requireDraft(getReport(reportId)));

        this.storeRetry.run("report.delete", () -> this.reportStore.delete(reportId, current.revision()));
        long removed;
        try {
            removed = this.storeRetry.execute("ledger.deleteAll", () -> this.versionLedger.deleteAll(reportId));
        } catch (ReportException e) {
            log.error("Report {} deleted but its versions could not be removed; orphaned versions need cleanup", reportId);
            throw e;
        }

        this.auditService.logDeleted(current, removed, actorId != null ? actorId : SYSTEM_ACTOR);
        log.info("Draft report {} deleted with {} version(s)", reportId, removed);
    }

    public List<ReportVersion> listVersions(String reportId) {
        getReport(reportId);
        return this.storeRetry.execute("ledger.list", () -> this.versionLedger.listVersions(reportId));
    }

    public ReportVersion getVersion(String reportId, int versionNumber) {
        getReport(reportId);
        return this.storeRetry.execute("ledger.get", () -> this.versionLedger.getVersion(reportId, versionNumber));
    }

    public List<Report> listReports(String authorId, ReportStatus status, int limit, int offset) {
        requireText(authorId, "Author id");
        int pageSize = limit <= 0 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);
        int skip = Math.max(0, offset);
        return this.storeRetry.execute("report.list", () -> this.reportStore.findByAuthor(authorId, status, pageSize, skip));
    }

    private ReportVersion appendContent(Report read, ReportContent content, String editorId, String comment) {
        Report current = ensureLedgerSettled(read);

        Instant now = Instant.now();
        int next = current.currentVersion() + 1;
        Report claimed = current.withContent(content, next, editorId, now);
        Report saved = this.storeRetry.execute("report.update", () -> this.reportStore.update(claimed, current.revision()));

        ReportVersion version = ReportVersion.create(current.id(), next, content, editorId, comment, now);
        try {
            return recordVersion(version);
        } catch (ReportException e) {
            ReportVersion landed = findLandedClaim(version, e);
            if (landed != null) {
                return landed;
            }
            revertClaim(saved, current, e);
            throw e;
        }
    }

    /**
     * Looks for an entry under the claimed number after a failed append. It exists when the append landed
     * without being acknowledged or when a stale-claim recovery recorded the claimed content first; either way
     * the claim is recorded and must not be reverted.
     */
    private ReportVersion findLandedClaim(ReportVersion version, ReportException cause) {
        try {
            ReportVersion existing = findRecorded(version.reportId(), version.versionNumber());
            if (existing != null) {
                log.warn("Version {} of report {} is recorded despite a failed append ({})", version.versionNumber(),
                        version.reportId(), cause.getErrorCode());
            }
            return existing;
        } catch (ReportException lookupFailure) {
            cause.addSuppressed(lookupFailure);
            throw cause;
        }
    }

    /**
     * Appends {@code version}; a duplicate key caused by an earlier attempt of this same append counts as success.
     */
    private ReportVersion recordVersion(ReportVersion version) {
        try {
            return this.storeRetry.execute("ledger.append", () -> this.versionLedger.append(version));
        } catch (ConcurrencyConflictException e) {
            ReportVersion existing = findRecorded(version.reportId(), version.versionNumber());
            if (existing != null && existing.id().equals(version.id())) {
                log.debug("Version {} of report {} was recorded by an earlier attempt", version.versionNumber(), version.reportId());
                return existing;
            }
            throw e;
        }
    }

    private ReportVersion findRecorded(String reportId, int versionNumber) {
        try {
            return this.storeRetry.execute("ledger.get", () -> this.versionLedger.getVersion(reportId, versionNumber));
        } catch (ReportNotFoundException e) {
            return null;
        }
    }

    /**
     * Makes sure the ledger holds the version the row points at and returns the report to build on.
     *
     * <p>A claim older than the stale-claim timeout is taken as abandoned and its materialized content is
     * recorded. A row one version behind the ledger is brought up to the ledger head with a conditional write;
     * if the row changed since it was read that write fails with a conflict, which is the ordinary outcome of
     * reading just before another writer finished.</p>
     */
    private Report ensureLedgerSettled(Report report) {
        int head = this.storeRetry.execute("ledger.latest", () -> this.versionLedger.latestVersionNumber(report.id()));
        int claimed = report.currentVersion();
        if (head == claimed) {
            return report;
        }
        if (head == claimed + 1) {
            return rematerializeHead(report, head);
        }
        if (head < claimed - 1 || head > claimed) {
            log.error("Ledger of report {} is at version {} but the report points at version {}", report.id(), head, claimed);
            throw new ConcurrencyConflictException(report.id(),
                    "Ledger of report " + report.id() + " is out of step with the report");
        }
        if (report.lastModified().plus(this.staleClaimTimeout).isAfter(Instant.now())) {
            throw new ConcurrencyConflictException(report.id(),
                    "Version " + claimed + " of report " + report.id() + " is still being recorded");
        }

        log.warn("Recovering unconfirmed version {} of report {} claimed at {}", claimed, report.id(), report.lastModified());
        ReportVersion recovered = ReportVersion.create(report.id(), claimed, report.content(),
                report.lastModifiedBy(), RECOVERED_COMMENT, Instant.now());
        try {
            recordVersion(recovered);
        } catch (ConcurrencyConflictException e) {
            // The original writer may have landed it after all.
            int current = this.storeRetry.execute("ledger.latest", () -> this.versionLedger.latestVersionNumber(report.id()));
            if (current != claimed) {
                throw e;
            }
        }
        return report;
    }

    private Report rematerializeHead(Report report, int head) {
        ReportVersion latest = this.storeRetry.execute("ledger.get", () -> this.versionLedger.getVersion(report.id(), head));
        Report repaired = report.withContent(latest.content(), head, latest.savedBy(), latest.savedAt());
        Report saved = this.storeRetry.execute("report.update", () -> this.reportStore.update(repaired, report.revision()));
        log.warn("Report {} was behind its ledger; content of version {} materialized again", report.id(), head);
        return saved;
    }

    private void revertClaim(Report claimed, Report previous, ReportException cause) {
        Report reverted = claimed.withContent(previous.content(), previous.currentVersion(), previous.lastModifiedBy(),
                previous.lastModified());
        try {
            this.storeRetry.execute("report.revert", () -> this.reportStore.update(reverted, claimed.revision()));
            log.warn("Reverted claim of version {} on report {} after the ledger append failed",
                    claimed.currentVersion(), claimed.id());
        } catch (ReportException revertFailure) {
            cause.addSuppressed(revertFailure);
            log.error("Report {} claims version {} which is not in the ledger; it is recovered after {}",
                    claimed.id(), claimed.currentVersion(), this.staleClaimTimeout);
        }
    }

    private void insertReport(Report report) {
        try {
            this.storeRetry.run("report.insert", () -> this.reportStore.insert(report));
        } catch (ConcurrencyConflictException e) {
            // Ids are random; a duplicate can only be our own insert acknowledged late.
            if (this.storeRetry.execute("report.find", () -> this.reportStore.findById(report.id())).isEmpty()) {
                throw e;
            }
        }
    }

    private void discardUnrecordedReport(Report report, ReportException cause) {
        try {
            this.storeRetry.run("report.delete", () -> this.reportStore.delete(report.id(), report.revision()));
        } catch (ReportException cleanupFailure) {
            cause.addSuppressed(cleanupFailure);
            log.error("Report {} has no initial version and could not be removed", report.id());
        }
    }

    private static Instant resolveFinalizedAt(Report current, ReportStatus target, Instant now) {
        if (!ReportWorkflow.isFinalizing(target)) {
            return null;
        }
        return current.finalizedAt() != null ? current.finalizedAt() : now;
    }

    private static Report requireDraft(Report report) {
        if (!ReportWorkflow.isEditable(report.status())) {
            throw new EditNotAllowedException(report.id(), report.status());
        }
        return report;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
