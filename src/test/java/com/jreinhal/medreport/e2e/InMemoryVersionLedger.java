package com.jreinhal.medreport.e2e;

import com.jreinhal.medreport.exception.ConcurrencyConflictException;
import com.jreinhal.medreport.exception.ReportNotFoundException;
import com.jreinhal.medreport.exception.StoreUnavailableException;
import com.jreinhal.medreport.ledger.VersionLedger;
import com.jreinhal.medreport.report.ReportVersion;
import com.jreinhal.medreport.report.content.ReportContent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Version ledger keyed by (reportId, versionNumber); a taken number is a conflict, like the unique index.
 */
public class InMemoryVersionLedger implements VersionLedger {
    private final Map<String, NavigableMap<Integer, ReportVersion>> versions = new HashMap<>();
    private final AtomicInteger failingAppends = new AtomicInteger();
    private final AtomicInteger lostAcknowledgements = new AtomicInteger();
    private final AtomicReference<Runnable> beforeNextAppend = new AtomicReference<>();

    /**
     * The next {@code count} appends fail without writing.
     */
    public void failNextAppends(int count) {
        failingAppends.set(count);
    }

    /**
     * The next {@code count} appends write and then report the store as unavailable.
     */
    public void loseNextAcknowledgements(int count) {
        lostAcknowledgements.set(count);
    }

    /**
     * Runs {@code action} once, at the start of the next append and before it writes. The action may call back
     * into the service; the ledger monitor is reentrant.
     */
    public void beforeNextAppend(Runnable action) {
        beforeNextAppend.set(action);
    }

    @Override
    public ReportVersion append(String reportId, ReportContent content, String authorId, String comment) {
        synchronized (this) {
            return append(ReportVersion.create(reportId, latestVersionNumber(reportId) + 1, content, authorId, comment,
                    Instant.now()));
        }
    }

    @Override
    public synchronized ReportVersion append(ReportVersion version) {
        Runnable action = beforeNextAppend.getAndSet(null);
        if (action != null) {
            action.run();
        }
        if (failingAppends.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StoreUnavailableException("ledger.append", version.reportId(), new IllegalStateException("injected"));
        }
        NavigableMap<Integer, ReportVersion> history = versions.computeIfAbsent(version.reportId(), id -> new TreeMap<>());
        if (history.containsKey(version.versionNumber())) {
            throw new ConcurrencyConflictException(version.reportId(),
                    "Version " + version.versionNumber() + " of report " + version.reportId() + " already recorded");
        }
        history.put(version.versionNumber(), version);
        if (lostAcknowledgements.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StoreUnavailableException("ledger.append", version.reportId(), new IllegalStateException("ack lost"));
        }
        return version;
    }

    @Override
    public synchronized List<ReportVersion> listVersions(String reportId) {
        NavigableMap<Integer, ReportVersion> history = versions.get(reportId);
        if (history == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(history.descendingMap().values()));
    }

    @Override
    public synchronized ReportVersion getVersion(String reportId, int versionNumber) {
        NavigableMap<Integer, ReportVersion> history = versions.get(reportId);
        ReportVersion version = history == null ? null : history.get(versionNumber);
        if (version == null) {
            throw new ReportNotFoundException(reportId, versionNumber);
        }
        return version;
    }

    @Override
    public synchronized ReportVersion latest(String reportId) {
        NavigableMap<Integer, ReportVersion> history = versions.get(reportId);
        if (history == null || history.isEmpty()) {
            throw new ReportNotFoundException(reportId);
        }
        return history.lastEntry().getValue();
    }

    @Override
    public synchronized int latestVersionNumber(String reportId) {
        NavigableMap<Integer, ReportVersion> history = versions.get(reportId);
        return history == null || history.isEmpty() ? 0 : history.lastKey();
    }

    @Override
    public synchronized long deleteAll(String reportId) {
        NavigableMap<Integer, ReportVersion> removed = versions.remove(reportId);
        return removed == null ? 0L : removed.size();
    }
}
