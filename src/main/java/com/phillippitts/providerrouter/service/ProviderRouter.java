package com.phillippitts.providerrouter.service;

import com.phillippitts.providerrouter.config.properties.DispatchProperties;
import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.DispatchResult;
import com.phillippitts.providerrouter.domain.ProviderHealth;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.service.dispatch.CallAdapter;
import com.phillippitts.providerrouter.service.dispatch.Dispatcher;
import com.phillippitts.providerrouter.service.health.HealthTracker;
import com.phillippitts.providerrouter.service.selection.CandidateSelection;
import com.phillippitts.providerrouter.service.selection.CandidateSelector;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers: candidate listing, dispatch with fallback, and manual health
 * reporting for calls made outside {@link #dispatch}.
 */
public class ProviderRouter {

    private final ProviderCatalog catalog;
    private final CandidateSelector selector;
    private final Dispatcher dispatcher;
    private final HealthTracker healthTracker;
    private final DispatchProperties dispatchProperties;

    public ProviderRouter(ProviderCatalog catalog, CandidateSelector selector, Dispatcher dispatcher,
                          HealthTracker healthTracker, DispatchProperties dispatchProperties) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.dispatchProperties = Objects.requireNonNull(dispatchProperties, "dispatchProperties");
    }

    /**
     * Healthy candidates for a capability in attempt order, without calling any provider.
     * Read-only: fails with {@code NoProviderAvailableException} rather than resetting health
     * when every candidate is unhealthy.
     *
     * @param budgetUsd optional ceiling, null for none
     */
    public CandidateSelection selectCandidates(Capability capability, Double budgetUsd) {
        return selectCandidates(CapabilityRequest.of(capability).withBudget(budgetUsd));
    }

    /**
     * Same as {@link #selectCandidates(Capability, Double)} with request sizes and tags taken into account.
     */
    public CandidateSelection selectCandidates(CapabilityRequest<?> request) {
        return selector.preview(request, request.budgetUsd(), dispatchProperties.getMaxAttempts());
    }

    public <P, R> CompletableFuture<DispatchResult<R>> dispatch(CapabilityRequest<P> request,
                                                                CallAdapter<P, R> adapter) {
        return dispatcher.dispatch(request, adapter);
    }

    public <P, R> CompletableFuture<DispatchResult<R>> dispatch(CapabilityRequest<P> request,
                                                                CallAdapter<P, R> adapter,
                                                                int maxAttempts) {
        return dispatcher.dispatch(request, adapter, maxAttempts);
    }

    public void reportSuccess(String provider, Duration latency) {
        healthTracker.recordSuccess(provider, latency);
    }

    public void reportFailure(String provider, Throwable error) {
        healthTracker.recordFailure(provider, error);
    }

    public Map<String, ProviderHealth> healthSnapshot() {
        return healthTracker.snapshot();
    }

    public Set<Capability> capabilities() {
        return catalog.capabilities();
    }
}
