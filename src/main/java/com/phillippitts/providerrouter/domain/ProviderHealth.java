package com.phillippitts.providerrouter.domain;

import java.time.Instant;

/**
 * Point-in-time copy of a provider's health record, for monitoring.
 *
 * @param providerName        provider family name
 * @param consecutiveFailures failures since the last success
 * @param lastSuccess         time of the last success, null if none
 * @param lastFailure         time of the last failure, null if none
 * @param healthy             true unless the circuit is OPEN; agrees with {@code HealthTracker.isHealthy}
 * @param circuitState        state derived from the breaker flag and the cooldown
 * @param totalRequests       every recorded attempt
 * @param totalFailures       every recorded failure
 * @param avgLatencyMillis    exponential moving average of successful call latency
 * @param failureRate         failures divided by requests, 0 when nothing was recorded
 */
public record ProviderHealth(
        String providerName,
        int consecutiveFailures,
        Instant lastSuccess,
        Instant lastFailure,
        boolean healthy,
        CircuitState circuitState,
        long totalRequests,
        long totalFailures,
        double avgLatencyMillis,
        double failureRate
) {

    static double failureRate(long totalRequests, long totalFailures) {
        return totalRequests == 0 ? 0.0 : (double) totalFailures / totalRequests;
    }

    public static ProviderHealth of(String providerName, int consecutiveFailures, Instant lastSuccess,
                                    Instant lastFailure, boolean healthy, CircuitState circuitState,
                                    long totalRequests, long totalFailures, double avgLatencyMillis) {
        return new ProviderHealth(providerName, consecutiveFailures, lastSuccess, lastFailure, healthy,
                circuitState, totalRequests, totalFailures, avgLatencyMillis,
                failureRate(totalRequests, totalFailures));
    }
}
