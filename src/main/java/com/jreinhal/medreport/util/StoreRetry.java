package com.jreinhal.medreport.util;

import com.jreinhal.medreport.exception.StoreUnavailableException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Bounded retry with exponential backoff for store calls that failed with {@link StoreUnavailableException}.
 *
 * <p>Any other exception passes through on the first attempt. When the attempts are used up the last
 * failure is rethrown and becomes fatal for the current request.</p>
 */
@Component
public class StoreRetry {
    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);
    private static final long MAX_BACKOFF_MS = 2_000L;

    private final int maxAttempts;
    private final Duration initialBackoff;

    public StoreRetry(@Value("${medreport.store.max-attempts:3}") int maxAttempts,
                      @Value("${medreport.store.retry-backoff:PT0.05S}") Duration initialBackoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        StoreUnavailableException last = null;
        for (int attempt = 1; attempt <= this.maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                last = e;
                if (attempt == this.maxAttempts) {
                    break;
                }
                long delayMs = backoffMillis(attempt);
                log.warn("Store unavailable during {} (attempt {}/{}), retrying in {}ms",
                        operation, attempt, this.maxAttempts, delayMs);
                if (!pause(delayMs)) {
                    log.warn("Retry of {} interrupted after attempt {}", operation, attempt);
                    throw e;
                }
            }
        }
        log.error("Store unavailable during {} after {} attempts: {}", operation, this.maxAttempts,
                last.getCause() != null ? last.getCause().getMessage() : last.getMessage());
        throw last;
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return this.maxAttempts;
    }

    long backoffMillis(int attempt) {
        long base = this.initialBackoff.toMillis();
        if (base <= 0L) {
            return 0L;
        }
        long delay = base << Math.min(attempt - 1, 16);
        return Math.min(delay, MAX_BACKOFF_MS);
    }

    private static boolean pause(long delayMs) {
        if (delayMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
