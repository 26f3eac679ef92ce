package com.jreinhal.medreport.repository;

import com.jreinhal.medreport.exception.ConcurrencyConflictException;
import com.jreinhal.medreport.exception.ReportException;
import com.jreinhal.medreport.exception.ReportNotFoundException;
import com.jreinhal.medreport.exception.StoreUnavailableException;
import com.jreinhal.medreport.report.Report;
import com.jreinhal.medreport.report.ReportStatus;
import com.mongodb.client.result.DeleteResult;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

@Repository
public class MongoReportStore implements ReportStore {
    private static final Logger log = LoggerFactory.getLogger(MongoReportStore.class);
    static final String COLLECTION = "reports";
    static final String AUTHOR_INDEX = "report_author_status";

    private final MongoTemplate mongoTemplate;

    @Value("${medreport.store.operation-timeout:PT5S}")
    private Duration operationTimeout = Duration.ofSeconds(5);

    public MongoReportStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Index backing {@link #findByAuthor}: author, then status, newest first.
     */
    public void ensureIndexes() {
        try {
            this.mongoTemplate.indexOps(COLLECTION).ensureIndex(new Index()
                    .on("createdBy", Sort.Direction.ASC)
                    .on("status", Sort.Direction.ASC)
                    .on("lastModified", Sort.Direction.DESC)
                    .named(AUTHOR_INDEX));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("report.ensureIndexes", null, e);
        }
        log.info("Report index '{}' ensured on {}", AUTHOR_INDEX, COLLECTION);
    }

    @Override
    public void insert(Report report) {
        try {
            this.mongoTemplate.insert(report, COLLECTION);
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(report.id(), "Report " + report.id() + " already exists", e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("report.insert", report.id(), e);
        }
    }

    @Override
    public Optional<Report> findById(String reportId) {
        try {
            return Optional.ofNullable(this.mongoTemplate.findOne(byId(reportId), Report.class, COLLECTION));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("report.find", reportId, e);
        }
    }

    @Override
    public Report update(Report updated, long expectedRevision) {
        Query query = byIdAndRevision(updated.id(), expectedRevision);
        Report replaced;
        try {
            replaced = this.mongoTemplate.findAndReplace(query, updated, FindAndReplaceOptions.options().returnNew(),
                    Report.class, COLLECTION);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("report.update", updated.id(), e);
        }
        if (replaced == null) {
            throw mismatch(updated.id(), expectedRevision);
        }
        return replaced;
    }

    @Override
    public void delete(String reportId, long expectedRevision) {
        DeleteResult result;
        try {
            result = this.mongoTemplate.remove(byIdAndRevision(reportId, expectedRevision), COLLECTION);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("report.delete", reportId, e);
        }
        if (result.getDeletedCount() == 0L) {
            throw mismatch(reportId, expectedRevision);
        }
    }

    @Override
    public List<Report> findByAuthor(String authorId, ReportStatus status, int limit, int offset) {
        Criteria criteria = Criteria.where("createdBy").is(authorId);
        if (status != null) {
            criteria = criteria.and("status").is(status);
        }
        Query query = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "lastModified"))
                .skip(Math.max(0, offset))
                .limit(limit)
                .maxTime(this.operationTimeout);
        try {
            return this.mongoTemplate.find(query, Report.class, COLLECTION);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("report.list", null, e);
        }
    }

    private ReportException mismatch(String reportId, long expectedRevision) {
        boolean exists;
        try {
            exists = this.mongoTemplate.exists(byId(reportId), COLLECTION);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("report.exists", reportId, e);
        }
        if (!exists) {
            return new ReportNotFoundException(reportId);
        }
        log.debug("Revision mismatch for report {} (expected {})", reportId, expectedRevision);
        return new ConcurrencyConflictException(reportId,
                "Report " + reportId + " was modified concurrently (expected revision " + expectedRevision + ")");
    }

    private Query byId(String reportId) {
        return new Query(Criteria.where("_id").is(reportId)).maxTime(this.operationTimeout);
    }

    private Query byIdAndRevision(String reportId, long revision) {
        return new Query(Criteria.where("_id").is(reportId).and("revision").is(revision)).maxTime(this.operationTimeout);
    }
}
