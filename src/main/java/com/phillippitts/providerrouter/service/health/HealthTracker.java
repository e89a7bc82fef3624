package com.phillippitts.providerrouter.service.health;

import com.phillippitts.providerrouter.config.properties.HealthProperties;
import com.phillippitts.providerrouter.domain.CircuitState;
import com.phillippitts.providerrouter.domain.ProviderHealth;
import com.phillippitts.providerrouter.service.health.event.ProviderCircuitOpenedEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderQuotaExhaustedEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderRecoveredEvent;
import com.phillippitts.providerrouter.util.LogSanitizer;
import com.phillippitts.providerrouter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-provider circuit breaker shared by all concurrent dispatches.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED → OPEN after {@code failure-threshold} consecutive failures</li>
 *   <li>OPEN → HALF_OPEN once {@code cooldown} has elapsed since the last failure;
 *       {@link #isHealthy(String)} is true again so one more attempt may go through</li>
 *   <li>HALF_OPEN → CLOSED on success, → OPEN on failure (cooldown restarts)</li>
 * </ul>
 *
 * <p>While HALF_OPEN, {@link #admit(String)} hands out a single trial attempt at a time; other
 * callers are rejected until the trial's outcome is recorded or the trial is released.
 *
 * <p>Failures whose text matches a quota pattern (credit, quota, billing) still count, but never
 * open the circuit while {@code quota-errors-keep-healthy} is set: the provider is treated as
 * temporarily out of credit, not broken.
 *
 * <p><b>Thread Safety:</b> one {@link java.util.concurrent.locks.ReentrantLock} per provider record,
 * never a global lock. Selection reads may be slightly stale relative to concurrent updates.
 */
public class HealthTracker {

    private static final Logger LOG = LogManager.getLogger(HealthTracker.class);

    private final ConcurrentMap<String, ProviderHealthRecord> records = new ConcurrentHashMap<>();
    private final HealthProperties props;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final QuotaErrorClassifier quotaClassifier;

    public HealthTracker(HealthProperties props, Clock clock, ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.quotaClassifier = new QuotaErrorClassifier(props.getQuotaPatterns());
    }

    /**
     * Creates healthy records for the given providers so they show up in snapshots before first use.
     */
    public void register(Collection<String> providerNames) {
        providerNames.forEach(this::recordFor);
        LOG.info("Health tracking initialized for providers={}", records.keySet());
    }

    /**
     * @return true when the circuit is CLOSED or HALF_OPEN
     */
    public boolean isHealthy(String provider) {
        return state(provider) != CircuitState.OPEN;
    }

    /**
     * Asks to attempt a provider now. Callers that receive {@link Admission#TRIAL} must end it with
     * {@link #recordSuccess}, {@link #recordFailure} or {@link #releaseTrial}.
     */
    public Admission admit(String provider) {
        Admission admission = recordFor(provider).admit(clock.instant(), props.getCooldown());
        if (admission == Admission.TRIAL) {
            LOG.info("Provider {} half-open; admitting one trial attempt", provider);
        }
        return admission;
    }

    /** Ends a trial that produced no outcome, so the next caller may try. */
    public void releaseTrial(String provider) {
        recordFor(provider).releaseTrial();
    }

    public CircuitState state(String provider) {
        return recordFor(provider).state(clock.instant(), props.getCooldown());
    }

    /**
     * Records a successful call: resets consecutive failures, closes the circuit and feeds the
     * latency moving average.
     */
    public void recordSuccess(String provider, Duration latency) {
        Instant now = clock.instant();
        double millis = latency == null ? -1 : TimeUtils.toMillis(latency);
        boolean recovered = recordFor(provider).recordSuccess(now, millis, props.getLatencySmoothing());
        if (recovered) {
            LOG.info("Provider {} recovered; circuit closed", provider);
            publisher.publishEvent(new ProviderRecoveredEvent(provider, now));
        }
    }

    /**
     * Records a failed call and opens the circuit once the failure threshold is reached,
     * unless the error is a quota error and the quota policy keeps the provider healthy.
     */
    public void recordFailure(String provider, Throwable error) {
        Instant now = clock.instant();
        boolean quota = error != null && quotaClassifier.isQuotaError(error);
        boolean keepHealthy = quota && props.isQuotaErrorsKeepHealthy();
        ProviderHealthRecord record = recordFor(provider);
        ProviderHealthRecord.FailureTransition transition =
                record.recordFailure(now, props.getFailureThreshold(), keepHealthy);

        if (quota) {
            String msg = LogSanitizer.describe(error);
            LOG.warn("Provider {} reports credit/quota/billing issue: {}", provider, msg);
            publisher.publishEvent(new ProviderQuotaExhaustedEvent(provider, msg, now));
        }
        if (transition != ProviderHealthRecord.FailureTransition.NONE) {
            int failures = record.consecutiveFailures();
            Instant retryAfter = now.plus(props.getCooldown());
            LOG.warn("Marking provider {} unhealthy after {} consecutive failures; retry after {}",
                    provider, failures, retryAfter);
            publisher.publishEvent(new ProviderCircuitOpenedEvent(provider, failures, retryAfter, now));
        } else {
            LOG.debug("Provider {} failure recorded: {}", provider, LogSanitizer.describe(error));
        }
    }

    /**
     * Clears every provider's consecutive failures and closes every circuit.
     * Only the selector's last-resort step calls this.
     */
    public void resetAll() {
        records.values().forEach(ProviderHealthRecord::reset);
        LOG.warn("Health of all {} providers reset", records.size());
    }

    /** @return snapshot of every known provider, sorted by name */
    public Map<String, ProviderHealth> snapshot() {
        Instant now = clock.instant();
        Map<String, ProviderHealth> result = new TreeMap<>();
        records.forEach((name, record) -> result.put(name, record.snapshot(now, props.getCooldown())));
        return result;
    }

    public Optional<ProviderHealth> snapshot(String provider) {
        ProviderHealthRecord record = records.get(provider);
        return record == null
                ? Optional.empty()
                : Optional.of(record.snapshot(clock.instant(), props.getCooldown()));
    }

    /** Result of {@link #admit(String)}. */
    public enum Admission {
        /** Circuit closed; attempt freely. */
        ALLOWED,
        /** Circuit half-open; this caller holds the single trial. */
        TRIAL,
        /** Circuit open, or another caller holds the trial. */
        REJECTED
    }

    private ProviderHealthRecord recordFor(String provider) {
        Objects.requireNonNull(provider, "provider");
        return records.computeIfAbsent(provider, ProviderHealthRecord::new);
    }
}
