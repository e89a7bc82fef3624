package com.phillippitts.providerrouter.service.health.event;

import java.time.Instant;

/** Published when a provider whose circuit was open succeeds again. */
public record ProviderRecoveredEvent(String provider, Instant at) { }
