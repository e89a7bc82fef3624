package com.phillippitts.providerrouter.config;

import com.phillippitts.providerrouter.config.properties.CatalogProperties;
import com.phillippitts.providerrouter.config.properties.DispatchProperties;
import com.phillippitts.providerrouter.config.properties.HealthProperties;
import com.phillippitts.providerrouter.service.ProviderRouter;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalogLoader;
import com.phillippitts.providerrouter.service.cost.CostEstimator;
import com.phillippitts.providerrouter.service.dispatch.BackoffStrategy;
import com.phillippitts.providerrouter.service.dispatch.Dispatcher;
import com.phillippitts.providerrouter.service.dispatch.ExponentialBackoff;
import com.phillippitts.providerrouter.service.health.HealthTracker;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;
import com.phillippitts.providerrouter.service.selection.CandidateSelector;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the routing components. The catalog is loaded and validated once at startup, so a
 * malformed catalog fails the context.
 */
@Configuration
public class RouterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProviderCatalog providerCatalog(CatalogProperties properties, Environment environment) {
        return new ProviderCatalogLoader(properties, environment).load();
    }

    @Bean
    public CostEstimator costEstimator() {
        return new CostEstimator();
    }

    @Bean
    public HealthTracker healthTracker(HealthProperties properties, Clock clock,
                                       ApplicationEventPublisher publisher, ProviderCatalog catalog) {
        HealthTracker tracker = new HealthTracker(properties, clock, publisher);
        tracker.register(catalog.providerNames());
        return tracker;
    }

    @Bean
    public CandidateSelector candidateSelector(ProviderCatalog catalog, HealthTracker healthTracker,
                                               CostEstimator costEstimator) {
        return new CandidateSelector(catalog, healthTracker, costEstimator);
    }

    @Bean
    public BackoffStrategy backoffStrategy(DispatchProperties properties) {
        return ExponentialBackoff.from(properties.getRetry());
    }

    @Bean
    public Dispatcher dispatcher(CandidateSelector selector, HealthTracker healthTracker,
                                 CostEstimator costEstimator, DispatchProperties properties,
                                 BackoffStrategy backoffStrategy,
                                 @Qualifier("adapterExecutor") Executor adapterExecutor,
                                 RoutingMetrics metrics, ApplicationEventPublisher publisher,
                                 Clock clock) {
        return new Dispatcher(selector, healthTracker, costEstimator, properties, backoffStrategy,
                adapterExecutor, metrics, publisher, clock);
    }

    @Bean
    public ProviderRouter providerRouter(ProviderCatalog catalog, CandidateSelector selector,
                                         Dispatcher dispatcher, HealthTracker healthTracker,
                                         DispatchProperties properties) {
        return new ProviderRouter(catalog, selector, dispatcher, healthTracker, properties);
    }
}
