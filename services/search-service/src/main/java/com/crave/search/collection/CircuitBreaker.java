package com.crave.search.collection;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consecutive-failure breaker guarding calls to the collection service. After {@code failureThreshold}
 * failures in a row it rejects calls for {@code openMs}, then lets the next call through as a trial.
 */
public class CircuitBreaker {
    private final int failureThreshold;
    private final long openMs;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong rejectUntilMs = new AtomicLong();

    public CircuitBreaker(int failureThreshold, long openMs) {
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openMs = Math.max(1L, openMs);
    }

    public boolean tryAcquire(long nowMs) {
        return nowMs >= rejectUntilMs.get();
    }

    public boolean tryAcquire() {
        return tryAcquire(System.currentTimeMillis());
    }

    public void onSuccess() {
        consecutiveFailures.set(0);
        rejectUntilMs.set(0L);
    }

    public void onFailure(long nowMs) {
        if (consecutiveFailures.incrementAndGet() >= failureThreshold) {
            consecutiveFailures.set(0);
            rejectUntilMs.set(nowMs + openMs);
        }
    }

    public void onFailure() {
        onFailure(System.currentTimeMillis());
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
