package com.phillippitts.providerrouter.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dispatch defaults: attempt limits, fallback switch, per-capability budgets and per-candidate retry.
 */
@Validated
@ConfigurationProperties(prefix = "router.dispatch")
public class DispatchProperties {

    /** Candidates tried per dispatch when the caller does not say otherwise. */
    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 5;

    /** When false every dispatch stops after its first candidate. */
    private boolean fallbackEnabled = true;

    /** Default USD budget per capability name, applied when a request carries none. */
    private Map<String, Double> defaultBudgets = new LinkedHashMap<>();

    @Valid
    private Retry retry = new Retry();

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    public void setFallbackEnabled(boolean fallbackEnabled) {
        this.fallbackEnabled = fallbackEnabled;
    }

    public Map<String, Double> getDefaultBudgets() {
        return defaultBudgets;
    }

    public void setDefaultBudgets(Map<String, Double> defaultBudgets) {
        this.defaultBudgets = defaultBudgets;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /**
     * Bounded retry of a single candidate before it counts as failed. One attempt means no retry.
     */
    public static class Retry {

        @Positive
        private int attemptsPerCandidate = 1;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(2);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(10);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        public int getAttemptsPerCandidate() {
            return attemptsPerCandidate;
        }

        public void setAttemptsPerCandidate(int attemptsPerCandidate) {
            this.attemptsPerCandidate = attemptsPerCandidate;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }
}
