package com.jreinhal.medreport.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.medreport.exception.ConcurrencyConflictException;
import com.jreinhal.medreport.exception.StoreUnavailableException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class StoreRetryTest {

    private static StoreUnavailableException unavailable() {
        return new StoreUnavailableException("report.find", "r-1", new IllegalStateException("down"));
    }

    @Test
    void returnsFirstSuccess() {
        StoreRetry retry = new StoreRetry(3, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        String result = retry.execute("report.find", () -> {
            if (calls.incrementAndGet() < 3) {
                throw unavailable();
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void rethrowsLastFailureWhenAttemptsAreUsedUp() {
        StoreRetry retry = new StoreRetry(2, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();
        StoreUnavailableException last = unavailable();

        StoreUnavailableException thrown = assertThrows(StoreUnavailableException.class, () -> retry.run("report.find", () -> {
            if (calls.incrementAndGet() == 2) {
                throw last;
            }
            throw unavailable();
        }));

        assertSame(last, thrown);
        assertEquals(2, calls.get());
    }

    @Test
    void doesNotRetryOtherFailures() {
        StoreRetry retry = new StoreRetry(5, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ConcurrencyConflictException.class, () -> retry.run("report.update", () -> {
            calls.incrementAndGet();
            throw new ConcurrencyConflictException("r-1", "conflict");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void backoffDoublesAndIsCapped() {
        StoreRetry retry = new StoreRetry(10, Duration.ofMillis(50));

        assertEquals(50L, retry.backoffMillis(1));
        assertEquals(100L, retry.backoffMillis(2));
        assertEquals(200L, retry.backoffMillis(3));
        assertEquals(2000L, retry.backoffMillis(10));
        assertEquals(0L, new StoreRetry(3, Duration.ZERO).backoffMillis(4));
    }

    @Test
    void stopsRetryingWhenInterrupted() {
        StoreRetry retry = new StoreRetry(5, Duration.ofMillis(50));
        AtomicInteger calls = new AtomicInteger();

        try {
            Thread.currentThread().interrupt();
            assertThrows(StoreUnavailableException.class, () -> retry.run("ledger.append", () -> {
                calls.incrementAndGet();
                throw unavailable();
            }));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals(1, calls.get());
    }

    @Test
    void alwaysMakesAtLeastOneAttempt() {
        assertEquals(1, new StoreRetry(0, null).getMaxAttempts());
    }
}
