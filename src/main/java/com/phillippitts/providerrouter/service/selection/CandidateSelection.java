package com.phillippitts.providerrouter.service.selection;

import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.ProviderCandidate;

import java.util.List;
import java.util.Objects;

/**
 * Ordered attempt list produced by {@link CandidateSelector}.
 *
 * @param capability the capability selected for
 * @param candidates non-empty, cost-sorted candidates to attempt in order
 * @param overBudget true when nothing fit the budget and the cheapest candidate was kept anyway
 */
public record CandidateSelection(Capability capability, List<ProviderCandidate> candidates, boolean overBudget) {

    public CandidateSelection {
        Objects.requireNonNull(capability, "capability");
        candidates = List.copyOf(candidates);
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Selection must not be empty");
        }
    }

    public int size() {
        return candidates.size();
    }
}
