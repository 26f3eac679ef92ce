package com.jreinhal.medreport.service;

import com.jreinhal.medreport.model.ReportAuditEvent;
import com.jreinhal.medreport.report.Report;
import com.jreinhal.medreport.report.ReportStatus;
import com.jreinhal.medreport.report.ReportVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

@Service
public class ReportAuditService {
    private static final Logger log = LoggerFactory.getLogger(ReportAuditService.class);
    static final String COLLECTION = "report_audit_log";

    private final MongoTemplate mongoTemplate;

    @Value("${medreport.audit.enabled:true}")
    private boolean enabled = true;

    @Value("${medreport.audit.fail-closed:false}")
    private boolean failClosed;

    public ReportAuditService(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void log(ReportAuditEvent event) {
        if (!this.enabled) {
            return;
        }
        try {
            this.mongoTemplate.save(event, COLLECTION);
            log.debug("Audit event logged: {} - {} - {}", event.getEventType(), event.getReportId(), event.getUserId());
        } catch (Exception e) {
            log.error("CRITICAL: Failed to persist audit event: {} - {}", event.getEventType(), e.getMessage());
            if (this.failClosed) {
                throw new AuditFailureException("Audit logging failed for a persisted change - operation halted for compliance. Event: "
                        + event.getEventType() + ", Report: " + event.getReportId() + ", Error: " + e.getMessage(), e);
            }
        }
    }

    public void logCreated(Report report, ReportVersion initialVersion) {
        log(ReportAuditEvent.create(ReportAuditEvent.EventType.REPORT_CREATED, report.id(), report.createdBy(), "Report created")
                .withMetadata("hospitalId", report.hospitalId())
                .withMetadata("specialty", report.specialty() != null ? report.specialty().name() : null)
                .withMetadata("reportType", report.reportType() != null ? report.reportType().name() : null)
                .withMetadata("versionNumber", initialVersion.versionNumber()));
    }

    public void logContentSaved(ReportVersion version) {
        log(ReportAuditEvent.create(ReportAuditEvent.EventType.CONTENT_SAVED, version.reportId(), version.savedBy(), "Content saved")
                .withMetadata("versionNumber", version.versionNumber())
                .withMetadata("versionId", version.id()));
    }

    public void logVersionRestored(ReportVersion restored, int sourceVersion) {
        log(ReportAuditEvent.create(ReportAuditEvent.EventType.VERSION_RESTORED, restored.reportId(), restored.savedBy(),
                "Restored from version " + sourceVersion)
                .withMetadata("versionNumber", restored.versionNumber())
                .withMetadata("sourceVersion", sourceVersion));
    }

    public void logStatusChanged(Report updated, ReportStatus from, String actorId) {
        log(ReportAuditEvent.create(ReportAuditEvent.EventType.STATUS_CHANGED, updated.id(), actorId,
                "Status changed " + from + " -> " + updated.status())
                .withMetadata("from", from.name())
                .withMetadata("to", updated.status().name())
                .withMetadata("finalizedAt", updated.finalizedAt() != null ? updated.finalizedAt().toString() : null));
    }

    public void logDeleted(Report report, long versionsRemoved, String actorId) {
        log(ReportAuditEvent.create(ReportAuditEvent.EventType.REPORT_DELETED, report.id(), actorId, "Draft report deleted")
                .withMetadata("currentVersion", report.currentVersion())
                .withMetadata("versionsRemoved", versionsRemoved));
    }

    /**
     * Raised in fail-closed mode. The audited change is already stored; callers re-read instead of retrying.
     */
    public static class AuditFailureException extends RuntimeException {
        public AuditFailureException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
