package com.phillippitts.providerrouter.service.dispatch;

import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.ProviderCandidate;
import com.phillippitts.providerrouter.exception.ConfigurationException;
import com.phillippitts.providerrouter.exception.TransientProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes each call to the adapter registered for {@code candidate.providerName()}.
 *
 * <p>A candidate whose provider has no adapter fails with {@link TransientProviderException},
 * so the dispatcher falls through to the next candidate instead of aborting the dispatch.
 *
 * @param <P> request payload type
 * @param <R> result type
 */
public class ProviderAdapterRegistry<P, R> implements CallAdapter<P, R> {

    private static final Logger LOG = LogManager.getLogger(ProviderAdapterRegistry.class);

    private final Map<String, ProviderAdapter<P, R>> adapters = new ConcurrentHashMap<>();

    public ProviderAdapterRegistry() {
    }

    public ProviderAdapterRegistry(Collection<? extends ProviderAdapter<P, R>> initial) {
        initial.forEach(this::register);
    }

    /**
     * @throws ConfigurationException if an adapter is already registered for the same provider
     */
    public ProviderAdapterRegistry<P, R> register(ProviderAdapter<P, R> adapter) {
        Objects.requireNonNull(adapter, "adapter");
        String name = Objects.requireNonNull(adapter.providerName(), "providerName");
        ProviderAdapter<P, R> existing = adapters.putIfAbsent(name, adapter);
        if (existing != null) {
            throw new ConfigurationException("Adapter already registered for provider " + name);
        }
        LOG.debug("Registered adapter for provider {}", name);
        return this;
    }

    public boolean supports(String providerName) {
        return adapters.containsKey(providerName);
    }

    public Set<String> providerNames() {
        return new TreeSet<>(adapters.keySet());
    }

    @Override
    public CompletableFuture<R> invoke(ProviderCandidate candidate, CapabilityRequest<P> request) {
        ProviderAdapter<P, R> adapter = adapters.get(candidate.providerName());
        if (adapter == null) {
            return CompletableFuture.failedFuture(new TransientProviderException(
                    candidate.providerName(), "No adapter registered for " + candidate.label()));
        }
        return adapter.invoke(candidate, request);
    }
}
