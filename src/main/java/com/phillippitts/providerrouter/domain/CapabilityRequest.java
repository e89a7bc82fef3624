package com.phillippitts.providerrouter.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Per-call routing input. The payload is opaque to the router and handed to the call adapter.
 *
 * @param capability          requested capability
 * @param estimatedInputSize  estimated input units (tokens), used for cost and context checks
 * @param estimatedOutputSize estimated output units
 * @param budgetUsd           optional cost ceiling for this call; null means none
 * @param requiredTags        tags every candidate must carry (e.g. "rag" for grounded generation)
 * @param payload             caller data for the adapter (prompt, image, texts to embed)
 * @param <P> payload type
 */
public record CapabilityRequest<P>(
        Capability capability,
        long estimatedInputSize,
        long estimatedOutputSize,
        Double budgetUsd,
        Set<String> requiredTags,
        P payload
) {

    public CapabilityRequest {
        Objects.requireNonNull(capability, "Capability must not be null");
        if (estimatedInputSize < 0 || estimatedOutputSize < 0) {
            throw new IllegalArgumentException("Estimated sizes must not be negative");
        }
        if (budgetUsd != null && budgetUsd < 0) {
            throw new IllegalArgumentException("Budget must not be negative, got: " + budgetUsd);
        }
        requiredTags = requiredTags == null ? Set.of() : Set.copyOf(requiredTags);
    }

    /** Request without sizes or payload, used for read-only candidate listing. */
    public static CapabilityRequest<Void> of(Capability capability) {
        return new CapabilityRequest<>(capability, 0, 0, null, Set.of(), null);
    }

    public static <P> CapabilityRequest<P> of(Capability capability, long inputSize, long outputSize, P payload) {
        return new CapabilityRequest<>(capability, inputSize, outputSize, null, Set.of(), payload);
    }

    public CapabilityRequest<P> withBudget(Double budget) {
        return new CapabilityRequest<>(capability, estimatedInputSize, estimatedOutputSize, budget, requiredTags, payload);
    }

    public CapabilityRequest<P> withRequiredTags(Set<String> tags) {
        return new CapabilityRequest<>(capability, estimatedInputSize, estimatedOutputSize, budgetUsd, tags, payload);
    }

    public long estimatedTotalSize() {
        return estimatedInputSize + estimatedOutputSize;
    }
}
