package com.phillippitts.providerrouter.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Circuit-breaker tuning for the provider health tracker.
 */
@ConfigurationProperties(prefix = "router.health")
@Validated
public class HealthProperties {

    /** Consecutive failures that open a provider's circuit. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 3;

    /** Time after the last failure before an open circuit allows one more attempt. */
    @NotNull
    private Duration cooldown = Duration.ofSeconds(300);

    /** Weight of the newest sample in the latency moving average. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double latencySmoothing = 0.2;

    /** Keep a provider healthy when its error text looks like credit/quota/billing exhaustion. */
    private boolean quotaErrorsKeepHealthy = true;

    /** Case-insensitive substrings identifying quota exhaustion errors. */
    private List<String> quotaPatterns = new ArrayList<>(List.of("credit", "quota", "billing"));

    /** Interval of the health summary log line, in milliseconds. */
    @Positive
    private long summaryIntervalMs = 60_000;

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public void setCooldown(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public double getLatencySmoothing() {
        return latencySmoothing;
    }

    public void setLatencySmoothing(double latencySmoothing) {
        this.latencySmoothing = latencySmoothing;
    }

    public boolean isQuotaErrorsKeepHealthy() {
        return quotaErrorsKeepHealthy;
    }

    public void setQuotaErrorsKeepHealthy(boolean quotaErrorsKeepHealthy) {
        this.quotaErrorsKeepHealthy = quotaErrorsKeepHealthy;
    }

    public List<String> getQuotaPatterns() {
        return quotaPatterns;
    }

    public void setQuotaPatterns(List<String> quotaPatterns) {
        this.quotaPatterns = quotaPatterns;
    }

    public long getSummaryIntervalMs() {
        return summaryIntervalMs;
    }

    public void setSummaryIntervalMs(long summaryIntervalMs) {
        this.summaryIntervalMs = summaryIntervalMs;
    }
}
