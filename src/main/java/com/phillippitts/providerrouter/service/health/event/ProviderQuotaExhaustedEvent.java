package com.phillippitts.providerrouter.service.health.event;

import java.time.Instant;

/**
 * Published when a provider failure looks like credit, quota or billing exhaustion.
 *
 * <p>The message is already truncated for logging; it never carries request payloads.
 */
public record ProviderQuotaExhaustedEvent(String provider, String message, Instant at) { }
