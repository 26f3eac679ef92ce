package com.jreinhal.medreport.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.jreinhal.medreport.e2e.ReportFixtures;
import com.jreinhal.medreport.model.ReportAuditEvent;
import com.jreinhal.medreport.report.Report;
import com.jreinhal.medreport.report.ReportStatus;
import com.jreinhal.medreport.report.ReportVersion;
import com.jreinhal.medreport.report.content.ReportContent;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.util.ReflectionTestUtils;

class ReportAuditServiceTest {

    private MongoTemplate mongoTemplate;
    private ReportAuditService auditService;
    private Report report;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        auditService = new ReportAuditService(mongoTemplate);
        report = Report.newDraft(ReportFixtures.HOSPITAL, ReportFixtures.patient(), Report.Specialty.CARDIOLOGY,
                Report.ReportType.DISCHARGE_SUMMARY, ReportFixtures.AUTHOR, Instant.now());
    }

    @Test
    void logCreatedRecordsEventWithoutPatientIdentifiers() {
        ReportVersion initial = ReportVersion.create(report.id(), 1, ReportContent.empty(), ReportFixtures.AUTHOR, "Initial version", Instant.now());

        auditService.logCreated(report, initial);

        ArgumentCaptor<ReportAuditEvent> captor = ArgumentCaptor.forClass(ReportAuditEvent.class);
        verify(mongoTemplate).save(captor.capture(), eq("report_audit_log"));
        ReportAuditEvent event = captor.getValue();
        assertEquals(ReportAuditEvent.EventType.REPORT_CREATED, event.getEventType());
        assertEquals(report.id(), event.getReportId());
        assertEquals(ReportFixtures.AUTHOR, event.getUserId());
        assertEquals(1, event.getMetadata().get("versionNumber"));
        assertFalse(event.getMetadata().toString().contains(ReportFixtures.NATIONAL_ID));
    }

    @Test
    void logStatusChangedRecordsBothStatuses() {
        Report approved = report.withStatus(ReportStatus.APPROVED, Instant.now(), Instant.now());

        auditService.logStatusChanged(approved, ReportStatus.IN_REVIEW, "dr.chief");

        ArgumentCaptor<ReportAuditEvent> captor = ArgumentCaptor.forClass(ReportAuditEvent.class);
        verify(mongoTemplate).save(captor.capture(), eq("report_audit_log"));
        assertEquals("IN_REVIEW", captor.getValue().getMetadata().get("from"));
        assertEquals("APPROVED", captor.getValue().getMetadata().get("to"));
        assertEquals("dr.chief", captor.getValue().getUserId());
    }

    @Test
    void persistenceFailureIsLoggedWhenFailOpen() {
        doThrow(new DataAccessResourceFailureException("down")).when(mongoTemplate).save(any(ReportAuditEvent.class), eq("report_audit_log"));

        auditService.logDeleted(report, 1L, "dr.admin");

        verify(mongoTemplate).save(any(ReportAuditEvent.class), eq("report_audit_log"));
    }

    @Test
    void persistenceFailureHaltsWhenFailClosed() {
        ReflectionTestUtils.setField(auditService, "failClosed", true);
        doThrow(new DataAccessResourceFailureException("down")).when(mongoTemplate).save(any(ReportAuditEvent.class), eq("report_audit_log"));

        assertThrows(ReportAuditService.AuditFailureException.class, () -> auditService.logDeleted(report, 1L, "dr.admin"));
    }

    @Test
    void disabledAuditWritesNothing() {
        ReflectionTestUtils.setField(auditService, "enabled", false);

        auditService.logDeleted(report, 1L, "dr.admin");

        verify(mongoTemplate, never()).save(any(ReportAuditEvent.class), any(String.class));
    }
}
