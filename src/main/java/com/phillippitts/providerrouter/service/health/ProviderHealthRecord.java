package com.phillippitts.providerrouter.service.health;

import com.phillippitts.providerrouter.domain.CircuitState;
import com.phillippitts.providerrouter.domain.ProviderHealth;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable health of one provider. Every read and write goes through this record's own lock,
 * so updates to unrelated providers never contend.
 */
final class ProviderHealthRecord {

    /** Outcome of a failure update, evaluated under the lock. */
    enum FailureTransition { NONE, OPENED, REOPENED }

    private final String providerName;
    private final ReentrantLock lock = new ReentrantLock();

    private int consecutiveFailures;
    private Instant lastSuccess;
    private Instant lastFailure;
    private boolean healthy = true;
    private long totalRequests;
    private long totalFailures;
    private double avgLatencyMillis;
    private Instant trialStartedAt;

    ProviderHealthRecord(String providerName) {
        this.providerName = providerName;
    }

    String providerName() {
        return providerName;
    }

    /**
     * @return true if the provider was unhealthy before this success
     */
    boolean recordSuccess(Instant now, double latencyMillis, double smoothing) {
        lock.lock();
        try {
            boolean wasUnhealthy = !healthy;
            trialStartedAt = null;
            consecutiveFailures = 0;
            healthy = true;
            lastSuccess = now;
            totalRequests++;
            if (latencyMillis >= 0) {
                avgLatencyMillis = avgLatencyMillis == 0.0
                        ? latencyMillis
                        : avgLatencyMillis * (1.0 - smoothing) + latencyMillis * smoothing;
            }
            return wasUnhealthy;
        } finally {
            lock.unlock();
        }
    }

    FailureTransition recordFailure(Instant now, int threshold, boolean keepHealthy) {
        lock.lock();
        try {
            boolean wasHealthy = healthy;
            trialStartedAt = null;
            consecutiveFailures++;
            totalFailures++;
            totalRequests++;
            lastFailure = now;
            if (consecutiveFailures >= threshold && !keepHealthy) {
                healthy = false;
                return wasHealthy ? FailureTransition.OPENED : FailureTransition.REOPENED;
            }
            return FailureTransition.NONE;
        } finally {
            lock.unlock();
        }
    }

    CircuitState state(Instant now, Duration cooldown) {
        lock.lock();
        try {
            return stateUnlocked(now, cooldown);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admits a caller. A CLOSED circuit admits everyone. A HALF_OPEN circuit hands out a single
     * trial until its outcome is recorded or released; a trial older than the cooldown is
     * considered lost and handed out again.
     */
    HealthTracker.Admission admit(Instant now, Duration cooldown) {
        lock.lock();
        try {
            CircuitState state = stateUnlocked(now, cooldown);
            if (state == CircuitState.CLOSED) {
                return HealthTracker.Admission.ALLOWED;
            }
            if (state == CircuitState.HALF_OPEN
                    && (trialStartedAt == null || !now.isBefore(trialStartedAt.plus(cooldown)))) {
                trialStartedAt = now;
                return HealthTracker.Admission.TRIAL;
            }
            return HealthTracker.Admission.REJECTED;
        } finally {
            lock.unlock();
        }
    }

    /** Gives back a trial whose call ended without an outcome, e.g. on cancellation. */
    void releaseTrial() {
        lock.lock();
        try {
            trialStartedAt = null;
        } finally {
            lock.unlock();
        }
    }

    void reset() {
        lock.lock();
        try {
            trialStartedAt = null;
            consecutiveFailures = 0;
            healthy = true;
        } finally {
            lock.unlock();
        }
    }

    int consecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    ProviderHealth snapshot(Instant now, Duration cooldown) {
        lock.lock();
        try {
            CircuitState state = stateUnlocked(now, cooldown);
            return ProviderHealth.of(providerName, consecutiveFailures, lastSuccess, lastFailure,
                    state != CircuitState.OPEN, state, totalRequests, totalFailures, avgLatencyMillis);
        } finally {
            lock.unlock();
        }
    }

    private CircuitState stateUnlocked(Instant now, Duration cooldown) {
        if (healthy) {
            return CircuitState.CLOSED;
        }
        if (lastFailure == null || !now.isBefore(lastFailure.plus(cooldown))) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.OPEN;
    }
}
