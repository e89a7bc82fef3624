package com.phillippitts.providerrouter.service.health;

import com.phillippitts.providerrouter.domain.CircuitState;
import com.phillippitts.providerrouter.domain.ProviderHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the routed providers.
 *
 * <ul>
 *   <li>UP: no provider circuit is open</li>
 *   <li>DEGRADED: some providers open, at least one routable</li>
 *   <li>DOWN: every known provider open</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code providerRouter}.
 */
@Component
public class ProviderRouterHealthIndicator implements HealthIndicator {

    private final HealthTracker healthTracker;

    public ProviderRouterHealthIndicator(HealthTracker healthTracker) {
        this.healthTracker = healthTracker;
    }

    @Override
    public Health health() {
        Map<String, ProviderHealth> snapshot = healthTracker.snapshot();
        long open = snapshot.values().stream().filter(h -> h.circuitState() == CircuitState.OPEN).count();

        Health.Builder builder = new Health.Builder();
        if (snapshot.isEmpty()) {
            builder.unknown().withDetail("status", "No providers tracked yet");
            return builder.build();
        }
        if (open == 0) {
            builder.up().withDetail("status", "All providers routable");
        } else if (open < snapshot.size()) {
            builder.status("DEGRADED").withDetail("status", "Some provider circuits open");
        } else {
            builder.down().withDetail("status", "All provider circuits open");
        }
        snapshot.forEach((name, h) -> builder.withDetail(name, describe(h)));
        return builder.build();
    }

    private String describe(ProviderHealth h) {
        return switch (h.circuitState()) {
            case CLOSED -> "closed";
            case HALF_OPEN -> "half-open";
            case OPEN -> "open";
        };
    }
}
