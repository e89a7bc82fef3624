package com.phillippitts.providerrouter.service.health.event;

import java.time.Instant;

/** Published when a provider reaches the failure threshold and its circuit opens (or reopens). */
public record ProviderCircuitOpenedEvent(String provider, int consecutiveFailures, Instant retryAfter, Instant at) { }
