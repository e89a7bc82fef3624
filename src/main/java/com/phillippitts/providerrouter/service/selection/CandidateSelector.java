package com.phillippitts.providerrouter.service.selection;

import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.ProviderCandidate;
import com.phillippitts.providerrouter.exception.ConfigurationException;
import com.phillippitts.providerrouter.exception.NoProviderAvailableException;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.service.cost.CostEstimator;
import com.phillippitts.providerrouter.service.health.HealthTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns the catalog, provider health and cost estimates into an ordered attempt list.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Cost-sorted candidates from the catalog ({@link ConfigurationException} if none)</li>
 *   <li>Drop candidates missing a required tag or whose context limit is too small</li>
 *   <li>Keep candidates whose provider is healthy; if none, reset health once and retry,
 *       then fail with {@link NoProviderAvailableException}</li>
 *   <li>With a budget, keep candidates whose estimate fits; if none fits, keep only the cheapest
 *       healthy candidate and flag the selection over budget</li>
 *   <li>Truncate to {@code maxAttempts}, preserving cost order</li>
 * </ol>
 *
 * <p>Only health reads happen here, except the single last-resort reset, which only
 * {@link #select} performs. {@link #preview} never changes provider health.
 */
public class CandidateSelector {

    private static final Logger LOG = LogManager.getLogger(CandidateSelector.class);

    private final ProviderCatalog catalog;
    private final HealthTracker healthTracker;
    private final CostEstimator costEstimator;

    public CandidateSelector(ProviderCatalog catalog, HealthTracker healthTracker, CostEstimator costEstimator) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.costEstimator = Objects.requireNonNull(costEstimator, "costEstimator");
    }

    /**
     * @param request    capability, sizes and required tags
     * @param budgetUsd  optional ceiling; null disables budget filtering
     * @param maxAttempts maximum candidates returned, at least 1
     * @return non-empty selection
     * @throws ConfigurationException       if the capability has no configured candidates
     * @throws NoProviderAvailableException if every candidate is filtered out or unhealthy
     */
    public CandidateSelection select(CapabilityRequest<?> request, Double budgetUsd, int maxAttempts) {
        return select(request, budgetUsd, maxAttempts, true);
    }

    /**
     * Same as {@link #select} but read-only: when every candidate is unhealthy it fails with
     * {@link NoProviderAvailableException} instead of resetting provider health.
     */
    public CandidateSelection preview(CapabilityRequest<?> request, Double budgetUsd, int maxAttempts) {
        return select(request, budgetUsd, maxAttempts, false);
    }

    private CandidateSelection select(CapabilityRequest<?> request, Double budgetUsd, int maxAttempts,
                                      boolean allowReset) {
        Objects.requireNonNull(request, "request");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        Capability capability = request.capability();
        List<ProviderCandidate> all = catalog.candidatesFor(capability);

        List<ProviderCandidate> eligible = all.stream()
                .filter(c -> c.hasTags(request.requiredTags()))
                .filter(c -> fitsContext(c, request))
                .toList();
        if (eligible.isEmpty()) {
            throw new NoProviderAvailableException(capability.name(), labels(all),
                    "no candidate has tags " + request.requiredTags()
                            + " and a context limit of at least " + request.estimatedTotalSize());
        }

        List<ProviderCandidate> healthy = healthyOf(eligible);
        if (healthy.isEmpty() && !allowReset) {
            throw new NoProviderAvailableException(capability.name(), labels(eligible),
                    "every candidate unhealthy");
        }
        if (healthy.isEmpty()) {
            LOG.warn("All {} candidates for {} unhealthy; resetting provider health", eligible.size(), capability);
            healthTracker.resetAll();
            healthy = healthyOf(eligible);
            if (healthy.isEmpty()) {
                throw new NoProviderAvailableException(capability.name(), labels(eligible),
                        "every candidate unhealthy after reset");
            }
        }

        boolean overBudget = false;
        List<ProviderCandidate> affordable = healthy;
        if (budgetUsd != null) {
            affordable = healthy.stream()
                    .filter(c -> costEstimator.estimate(c, request) <= budgetUsd)
                    .toList();
            if (affordable.isEmpty()) {
                ProviderCandidate cheapest = healthy.stream()
                        .min(Comparator.comparingDouble(c -> costEstimator.estimate(c, request)))
                        .orElseThrow();
                LOG.warn("No candidate for {} within budget ${}; using cheapest {} (${})",
                        capability, budgetUsd, cheapest.label(), costEstimator.estimate(cheapest, request));
                affordable = List.of(cheapest);
                overBudget = true;
            }
        }

        List<ProviderCandidate> result = affordable.size() > maxAttempts
                ? affordable.subList(0, maxAttempts)
                : affordable;
        LOG.debug("Selected for {}: {}", capability, labels(result));
        return new CandidateSelection(capability, result, overBudget);
    }

    private List<ProviderCandidate> healthyOf(List<ProviderCandidate> candidates) {
        return candidates.stream()
                .filter(c -> healthTracker.isHealthy(c.providerName()))
                .toList();
    }

    private static boolean fitsContext(ProviderCandidate candidate, CapabilityRequest<?> request) {
        return candidate.contextLimit() <= 0 || candidate.contextLimit() >= request.estimatedTotalSize();
    }

    private static List<String> labels(List<ProviderCandidate> candidates) {
        return candidates.stream().map(ProviderCandidate::label).toList();
    }
}
