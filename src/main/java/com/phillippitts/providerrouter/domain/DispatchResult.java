package com.phillippitts.providerrouter.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful dispatch.
 *
 * @param outcome       value produced by the adapter
 * @param providerUsed  candidate whose call succeeded
 * @param latency       duration of the successful call, retries of that candidate included
 * @param estimatedCost estimated USD cost of the successful call
 * @param overBudget    true when no candidate fit the budget and the cheapest one was used anyway
 * @param attempts      number of candidates attempted, the successful one included
 * @param failures      failed candidates that preceded the success, in attempt order
 * @param <R> adapter result type
 */
public record DispatchResult<R>(
        R outcome,
        ProviderCandidate providerUsed,
        Duration latency,
        double estimatedCost,
        boolean overBudget,
        int attempts,
        List<AttemptFailure> failures
) {

    public DispatchResult {
        Objects.requireNonNull(providerUsed, "providerUsed");
        Objects.requireNonNull(latency, "latency");
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean usedFallback() {
        return !failures.isEmpty();
    }
}
