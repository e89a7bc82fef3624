package com.phillippitts.providerrouter.service.catalog;

import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.ProviderCandidate;
import com.phillippitts.providerrouter.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of provider candidates per capability.
 *
 * <p>Candidates are kept sorted ascending by {@link ProviderCandidate#unitCost()}; equally
 * priced candidates are ordered by descending {@code priorityWeight}, then by label so the
 * order never depends on configuration order.
 *
 * <p><b>Thread Safety:</b> immutable after construction.
 */
public final class ProviderCatalog {

    static final Comparator<ProviderCandidate> COST_ORDER = Comparator
            .comparingDouble(ProviderCandidate::unitCost)
            .thenComparing(Comparator.comparingInt(ProviderCandidate::priorityWeight).reversed())
            .thenComparing(ProviderCandidate::providerName)
            .thenComparing(ProviderCandidate::modelName);

    private final Map<Capability, List<ProviderCandidate>> candidates;

    /**
     * @param candidatesByCapability candidates per capability, in any order
     * @throws ConfigurationException if a (provider, model) pair is registered twice for one capability
     */
    public ProviderCatalog(Map<Capability, List<ProviderCandidate>> candidatesByCapability) {
        Objects.requireNonNull(candidatesByCapability, "candidatesByCapability");
        Map<Capability, List<ProviderCandidate>> sorted = new LinkedHashMap<>();
        candidatesByCapability.forEach((capability, list) -> {
            Set<String> seen = new HashSet<>();
            for (ProviderCandidate c : list) {
                if (!seen.add(c.label())) {
                    throw new ConfigurationException(capability.name(),
                            "Duplicate candidate " + c.label());
                }
            }
            List<ProviderCandidate> copy = new ArrayList<>(list);
            copy.sort(COST_ORDER);
            sorted.put(capability, List.copyOf(copy));
        });
        this.candidates = Map.copyOf(sorted);
    }

    /**
     * Returns the cost-sorted candidates of a capability.
     *
     * @param capability requested capability
     * @return non-empty, immutable, cost-sorted list
     * @throws ConfigurationException if the capability is unknown or has no candidates
     */
    public List<ProviderCandidate> candidatesFor(Capability capability) {
        List<ProviderCandidate> list = candidates.get(capability);
        if (list == null || list.isEmpty()) {
            throw new ConfigurationException(capability.name(), "No provider candidates configured");
        }
        return list;
    }

    /** @return capabilities that have at least one candidate */
    public Set<Capability> capabilities() {
        Set<Capability> result = new LinkedHashSet<>();
        candidates.forEach((capability, list) -> {
            if (!list.isEmpty()) {
                result.add(capability);
            }
        });
        return result;
    }

    /** @return every provider name referenced by any candidate */
    public Set<String> providerNames() {
        Set<String> names = new LinkedHashSet<>();
        candidates.values().forEach(list -> list.forEach(c -> names.add(c.providerName())));
        return names;
    }

    public boolean isEmpty() {
        return capabilities().isEmpty();
    }
}
