package com.phillippitts.providerrouter.service.dispatch.event;

import java.time.Instant;

/**
 * One candidate failed within a dispatch; the dispatcher moves on to the next one if any.
 *
 * @param capability   capability being dispatched
 * @param providerName failed provider
 * @param modelName    failed model
 * @param attempt      1-based position of the candidate in the attempt list
 * @param error        sanitized error summary
 * @param at           when the failure was recorded
 */
public record ProviderAttemptFailedEvent(
        String capability,
        String providerName,
        String modelName,
        int attempt,
        String error,
        Instant at
) {}
