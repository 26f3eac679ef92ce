package com.jreinhal.medreport.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Audit record of one accepted report lifecycle mutation. Never carries patient identifiers or content.
 */
@Document(collection="report_audit_log")
public class ReportAuditEvent {
    @Id
    private String id;
    @Indexed
    private Instant timestamp;
    @Indexed
    private EventType eventType;
    @Indexed
    private String reportId;
    @Indexed
    private String userId;
    private String action;
    private Map<String, Object> metadata = new HashMap<String, Object>();

    public ReportAuditEvent() {
        this.timestamp = Instant.now();
    }

    public static ReportAuditEvent create(EventType type, String reportId, String userId, String action) {
        ReportAuditEvent event = new ReportAuditEvent();
        event.eventType = type;
        event.reportId = reportId;
        event.userId = userId;
        event.action = action;
        return event;
    }

    public ReportAuditEvent withMetadata(String key, Object value) {
        if (value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public String getId() {
        return this.id;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public EventType getEventType() {
        return this.eventType;
    }

    public String getReportId() {
        return this.reportId;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getAction() {
        return this.action;
    }

    public Map<String, Object> getMetadata() {
        return this.metadata;
    }

    public enum EventType {
        REPORT_CREATED,
        CONTENT_SAVED,
        VERSION_RESTORED,
        STATUS_CHANGED,
        REPORT_DELETED
    }
}
