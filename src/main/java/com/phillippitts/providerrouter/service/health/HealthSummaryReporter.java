package com.phillippitts.providerrouter.service.health;

import com.phillippitts.providerrouter.domain.ProviderHealth;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;

/**
 * Logs a one-line health summary of every provider at a fixed rate.
 */
@Component
public class HealthSummaryReporter {

    private static final Logger LOG = LogManager.getLogger(HealthSummaryReporter.class);

    private final HealthTracker healthTracker;

    public HealthSummaryReporter(HealthTracker healthTracker) {
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
    }

    @Scheduled(fixedRateString = "${router.health.summary-interval-ms:60000}")
    void logHealthSummary() {
        String summary = summarize(healthTracker.snapshot());
        if (!summary.isEmpty()) {
            LOG.info("Provider states: {}", summary);
        }
    }

    /** Visible for tests */
    static String summarize(Map<String, ProviderHealth> snapshot) {
        StringBuilder sb = new StringBuilder();
        snapshot.forEach((name, h) -> sb.append(name).append('=').append(h.circuitState())
                .append("(fail=").append(h.consecutiveFailures())
                .append(", req=").append(h.totalRequests()).append(") "));
        return sb.toString().trim();
    }
}
