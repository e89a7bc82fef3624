package com.phillippitts.providerrouter.service.events;

import com.phillippitts.providerrouter.service.dispatch.event.AllProvidersFailedEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderCircuitOpenedEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderQuotaExhaustedEvent;
import com.phillippitts.providerrouter.service.health.event.ProviderRecoveredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log lines for routing events. Throttled per key to avoid log spam while a
 * provider keeps failing.
 */
@Component
class RoutingEventsListener {
    private static final Logger LOG = LogManager.getLogger(RoutingEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onCircuitOpened(ProviderCircuitOpenedEvent e) {
        if (shouldLog("circuit-" + e.provider())) {
            LOG.warn("Provider {} taken out of rotation after {} failures; next try after {}",
                    e.provider(), e.consecutiveFailures(), e.retryAfter());
        }
    }

    @EventListener
    void onQuotaExhausted(ProviderQuotaExhaustedEvent e) {
        if (shouldLog("quota-" + e.provider())) {
            LOG.warn("Provider {} is out of credit or quota. Top up the account or disable it in router.catalog.*",
                    e.provider());
        }
    }

    @EventListener
    void onRecovered(ProviderRecoveredEvent e) {
        lastLog.remove("circuit-" + e.provider());
        LOG.info("Provider {} back in rotation", e.provider());
    }

    @EventListener
    void onAllFailed(AllProvidersFailedEvent e) {
        if (shouldLog("exhausted-" + e.capability())) {
            LOG.error("No provider could serve {} (tried {}). Check API keys and provider status.",
                    e.capability(), e.attempted());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
