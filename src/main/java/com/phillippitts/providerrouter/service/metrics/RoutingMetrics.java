package com.phillippitts.providerrouter.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer instrumentation for dispatches.
 *
 * <p>Meters (all under {@code providerrouter.dispatch}):
 * <ul>
 *   <li>{@code latency} timer per capability and provider, successful calls only</li>
 *   <li>{@code success} / {@code failure} counters per capability and provider</li>
 *   <li>{@code exhausted}, {@code fallback} and {@code over-budget} counters per capability</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class RoutingMetrics {

    private static final String METRIC_PREFIX = "providerrouter.dispatch";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a successful provider call and its latency.
     */
    public void recordSuccess(String capability, String provider, Duration latency) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Latency of successful provider calls")
                .tag("capability", capability)
                .tag("provider", provider)
                .register(registry)
                .record(latency);
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful provider calls")
                .tag("capability", capability)
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * @param reason simple class name of the error
     */
    public void recordFailure(String capability, String provider, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed provider calls")
                .tag("capability", capability)
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordExhausted(String capability) {
        increment(".exhausted", "Dispatches where every candidate failed", capability);
    }

    public void recordFallback(String capability) {
        increment(".fallback", "Dispatches that succeeded on a later candidate", capability);
    }

    public void recordOverBudget(String capability) {
        increment(".over-budget", "Dispatches served by a candidate above budget", capability);
    }

    private void increment(String suffix, String description, String capability) {
        Counter.builder(METRIC_PREFIX + suffix)
                .description(description)
                .tag("capability", capability)
                .register(registry)
                .increment();
    }
}
