package com.jreinhal.medreport.report;

import com.jreinhal.medreport.report.content.ReportContent;
import java.time.Instant;
import java.util.UUID;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Immutable snapshot of a report's full content at the moment it was saved.
 */
@Document(collection="report_versions")
@CompoundIndex(name="report_version_unique", def="{'reportId': 1, 'versionNumber': -1}", unique=true)
public record ReportVersion(
    @Id String id,
    String reportId,
    int versionNumber,
    ReportContent content,
    Instant savedAt,
    String savedBy,
    String comment
) {
    public static ReportVersion create(String reportId, int versionNumber, ReportContent content, String savedBy,
                                       String comment, Instant savedAt) {
        if (versionNumber < 1) {
            throw new IllegalArgumentException("Version numbers start at 1");
        }
        return new ReportVersion(UUID.randomUUID().toString(), reportId, versionNumber,
            content != null ? content : ReportContent.empty(), savedAt, savedBy, comment != null ? comment : "");
    }
}
