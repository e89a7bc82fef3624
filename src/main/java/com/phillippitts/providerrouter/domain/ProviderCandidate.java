package com.phillippitts.providerrouter.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable (provider, model) pair able to satisfy a capability, loaded once from configuration.
 *
 * @param providerName     provider family, also the key of its health record (e.g. "openai")
 * @param modelName        concrete model (e.g. "gpt-4o-mini")
 * @param billingMode      token billed or flat per operation
 * @param costPerUnitIn    USD per input unit (TOKEN billing)
 * @param costPerUnitOut   USD per output unit (TOKEN billing)
 * @param costPerOperation USD per call (PER_OPERATION billing)
 * @param contextLimit     maximum input+output units; 0 means unknown / unlimited
 * @param capabilityTags   free-form tags such as "fast", "rag", "premium"
 * @param priorityWeight   tie breaker, higher wins among equally priced candidates
 */
public record ProviderCandidate(
        String providerName,
        String modelName,
        BillingMode billingMode,
        double costPerUnitIn,
        double costPerUnitOut,
        double costPerOperation,
        long contextLimit,
        Set<String> capabilityTags,
        int priorityWeight
) {

    public ProviderCandidate {
        Objects.requireNonNull(providerName, "Provider name must not be null");
        Objects.requireNonNull(modelName, "Model name must not be null");
        Objects.requireNonNull(billingMode, "Billing mode must not be null");
        if (costPerUnitIn < 0 || costPerUnitOut < 0 || costPerOperation < 0) {
            throw new IllegalArgumentException("Costs must not be negative for " + providerName + ":" + modelName);
        }
        if (contextLimit < 0) {
            throw new IllegalArgumentException("Context limit must not be negative for " + providerName + ":" + modelName);
        }
        capabilityTags = capabilityTags == null ? Set.of() : Set.copyOf(capabilityTags);
    }

    /** Token billed candidate. */
    public static ProviderCandidate tokenBilled(String providerName, String modelName,
                                                double costPerUnitIn, double costPerUnitOut,
                                                long contextLimit, Set<String> tags, int priorityWeight) {
        return new ProviderCandidate(providerName, modelName, BillingMode.TOKEN,
                costPerUnitIn, costPerUnitOut, 0.0, contextLimit, tags, priorityWeight);
    }

    /** Flat per-operation candidate, e.g. image generation. */
    public static ProviderCandidate perOperation(String providerName, String modelName,
                                                 double costPerOperation, Set<String> tags, int priorityWeight) {
        return new ProviderCandidate(providerName, modelName, BillingMode.PER_OPERATION,
                0.0, 0.0, costPerOperation, 0, tags, priorityWeight);
    }

    /**
     * Catalog ordering key: sum of both unit rates for token billing, the flat rate otherwise.
     */
    public double unitCost() {
        return billingMode == BillingMode.PER_OPERATION ? costPerOperation : costPerUnitIn + costPerUnitOut;
    }

    public boolean hasTags(Set<String> required) {
        return required == null || capabilityTags.containsAll(required);
    }

    /** @return "provider:model", used in logs and error traces */
    public String label() {
        return providerName + ":" + modelName;
    }
}
