/**
 * Per-provider circuit breaker and its monitoring hooks.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.phillippitts.providerrouter.service.health.HealthTracker HealthTracker} -
 *       failure counting, cooldown and reset per provider</li>
 *   <li>{@link com.phillippitts.providerrouter.service.health.QuotaErrorClassifier QuotaErrorClassifier} -
 *       recognizes credit/quota/billing exhaustion in error text</li>
 *   <li>{@link com.phillippitts.providerrouter.service.health.HealthSummaryReporter HealthSummaryReporter} -
 *       periodic one-line state summary</li>
 *   <li>{@link com.phillippitts.providerrouter.service.health.ProviderRouterHealthIndicator ProviderRouterHealthIndicator} -
 *       actuator view of the circuits</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * <p>Prefix {@code router.health}:</p>
 * <ul>
 *   <li>{@code failure-threshold} - consecutive failures that open a circuit (default: 3)</li>
 *   <li>{@code cooldown} - time before an open circuit allows another attempt (default: 300s)</li>
 *   <li>{@code latency-smoothing} - weight of the newest latency sample (default: 0.2)</li>
 *   <li>{@code quota-errors-keep-healthy} - quota errors never open a circuit (default: true)</li>
 *   <li>{@code quota-patterns} - substrings marking quota errors (default: credit, quota, billing)</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <p>With defaults:</p>
 * <ul>
 *   <li><strong>T+0s:</strong> third consecutive failure → OPEN, skipped by selection</li>
 *   <li><strong>T+300s:</strong> cooldown elapsed → HALF_OPEN, routable again</li>
 *   <li><strong>T+301s:</strong> failure → OPEN until T+601s; success → CLOSED</li>
 * </ul>
 *
 * <p>Health is process-local and starts cold after a restart.
 *
 * @since 1.0
 */
package com.phillippitts.providerrouter.service.health;
