package com.jreinhal.medreport.ledger;

import com.jreinhal.medreport.exception.ConcurrencyConflictException;
import com.jreinhal.medreport.exception.ReportNotFoundException;
import com.jreinhal.medreport.exception.StoreUnavailableException;
import com.jreinhal.medreport.report.ReportVersion;
import com.jreinhal.medreport.report.content.ReportContent;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

/**
 * Version ledger on the {@code report_versions} collection.
 *
 * <p>Uniqueness of {@code (reportId, versionNumber)} is enforced by a unique compound index, so an insert is
 * a conditional write: of two appends racing for the same number exactly one lands and the other gets a
 * duplicate key error.</p>
 */
@Repository
public class MongoVersionLedger implements VersionLedger {
    private static final Logger log = LoggerFactory.getLogger(MongoVersionLedger.class);
    static final String COLLECTION = "report_versions";
    static final String UNIQUE_INDEX = "report_version_unique";

    private final MongoTemplate mongoTemplate;

    @Value("${medreport.store.operation-timeout:PT5S}")
    private Duration operationTimeout = Duration.ofSeconds(5);

    @Value("${medreport.ledger.max-append-attempts:5}")
    private int maxAppendAttempts = 5;

    public MongoVersionLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        try {
            this.mongoTemplate.indexOps(COLLECTION).ensureIndex(new Index()
                    .on("reportId", Sort.Direction.ASC)
                    .on("versionNumber", Sort.Direction.DESC)
                    .unique()
                    .named(UNIQUE_INDEX));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ledger.ensureIndexes", null, e);
        }
        log.info("Ledger index '{}' ensured on {}", UNIQUE_INDEX, COLLECTION);
    }

    @Override
    public ReportVersion append(String reportId, ReportContent content, String authorId, String comment) {
        int attempts = Math.max(1, this.maxAppendAttempts);
        for (int attempt = 1; attempt <= attempts; attempt++) {
            int next = latestVersionNumber(reportId) + 1;
            try {
                return append(ReportVersion.create(reportId, next, content, authorId, comment, Instant.now()));
            } catch (ConcurrencyConflictException e) {
                log.debug("Version {} of report {} taken by a concurrent append (attempt {}/{})", next, reportId, attempt, attempts);
            }
        }
        throw new ConcurrencyConflictException(reportId,
                "Could not allocate a version number for report " + reportId + " after " + attempts + " attempts");
    }

    @Override
    public ReportVersion append(ReportVersion version) {
        try {
            return this.mongoTemplate.insert(version, COLLECTION);
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(version.reportId(),
                    "Version " + version.versionNumber() + " of report " + version.reportId() + " already recorded", e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ledger.append", version.reportId(), e);
        }
    }

    @Override
    public List<ReportVersion> listVersions(String reportId) {
        Query query = byReport(reportId).with(Sort.by(Sort.Direction.DESC, "versionNumber"));
        try {
            return this.mongoTemplate.find(query, ReportVersion.class, COLLECTION);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ledger.list", reportId, e);
        }
    }

    @Override
    public ReportVersion getVersion(String reportId, int versionNumber) {
        Query query = new Query(Criteria.where("reportId").is(reportId).and("versionNumber").is(versionNumber))
                .maxTime(this.operationTimeout);
        ReportVersion version;
        try {
            version = this.mongoTemplate.findOne(query, ReportVersion.class, COLLECTION);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ledger.get", reportId, e);
        }
        if (version == null) {
            throw new ReportNotFoundException(reportId, versionNumber);
        }
        return version;
    }

    @Override
    public ReportVersion latest(String reportId) {
        ReportVersion head = findHead(reportId);
        if (head == null) {
            throw new ReportNotFoundException(reportId);
        }
        return head;
    }

    @Override
    public int latestVersionNumber(String reportId) {
        ReportVersion head = findHead(reportId);
        return head == null ? 0 : head.versionNumber();
    }

    @Override
    public long deleteAll(String reportId) {
        try {
            return this.mongoTemplate.remove(byReport(reportId), COLLECTION).getDeletedCount();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ledger.deleteAll", reportId, e);
        }
    }

    private ReportVersion findHead(String reportId) {
        Query query = byReport(reportId).with(Sort.by(Sort.Direction.DESC, "versionNumber")).limit(1);
        try {
            return this.mongoTemplate.findOne(query, ReportVersion.class, COLLECTION);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("ledger.latest", reportId, e);
        }
    }

    private Query byReport(String reportId) {
        return new Query(Criteria.where("reportId").is(reportId)).maxTime(this.operationTimeout);
    }
}
