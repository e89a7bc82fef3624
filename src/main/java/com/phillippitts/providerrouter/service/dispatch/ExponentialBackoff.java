package com.phillippitts.providerrouter.service.dispatch;

import com.phillippitts.providerrouter.config.properties.DispatchProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * {@code initial * multiplier^(retry-1)}, capped at {@code max}. Defaults: 2 s, x2, 10 s.
 */
public final class ExponentialBackoff implements BackoffStrategy {

    private final Duration initial;
    private final Duration max;
    private final double multiplier;

    public ExponentialBackoff(Duration initial, Duration max, double multiplier) {
        this.initial = Objects.requireNonNull(initial, "initial");
        this.max = Objects.requireNonNull(max, "max");
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be >= 1.0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    public static ExponentialBackoff from(DispatchProperties.Retry retry) {
        return new ExponentialBackoff(retry.getInitialBackoff(), retry.getMaxBackoff(), retry.getMultiplier());
    }

    @Override
    public Duration delayBefore(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double millis = initial.toMillis() * Math.pow(multiplier, retry - 1);
        if (millis >= max.toMillis()) {
            return max;
        }
        return Duration.ofMillis((long) millis);
    }
}
