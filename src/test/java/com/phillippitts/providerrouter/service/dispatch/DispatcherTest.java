package com.phillippitts.providerrouter.service.dispatch;

import com.phillippitts.providerrouter.config.properties.DispatchProperties;
import com.phillippitts.providerrouter.config.properties.HealthProperties;
import com.phillippitts.providerrouter.domain.AttemptFailure;
import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.CircuitState;
import com.phillippitts.providerrouter.domain.DispatchResult;
import com.phillippitts.providerrouter.exception.AllProvidersFailedException;
import com.phillippitts.providerrouter.exception.ConfigurationException;
import com.phillippitts.providerrouter.exception.NoProviderAvailableException;
import com.phillippitts.providerrouter.exception.TransientProviderException;
import com.phillippitts.providerrouter.service.cost.CostEstimator;
import com.phillippitts.providerrouter.service.dispatch.event.AllProvidersFailedEvent;
import com.phillippitts.providerrouter.service.dispatch.event.ProviderAttemptFailedEvent;
import com.phillippitts.providerrouter.service.health.HealthTracker;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;
import com.phillippitts.providerrouter.service.selection.CandidateSelector;
import com.phillippitts.providerrouter.testutil.Candidates;
import com.phillippitts.providerrouter.testutil.MutableClock;
import com.phillippitts.providerrouter.testutil.ScriptedAdapter;
import com.phillippitts.providerrouter.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

class DispatcherTest {

    private static final CapabilityRequest<String> REQUEST =
            CapabilityRequest.of(Capability.FAST_TEXT, 1000, 1000, "Write a tagline");

    private final List<Object> events = new CopyOnWriteArrayList<>();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private DispatchProperties props;
    private HealthTracker health;
    private ScriptedAdapter adapter;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        props = new DispatchProperties();
        clock = new MutableClock();
        health = new HealthTracker(new HealthProperties(), clock, events::add);
        adapter = new ScriptedAdapter();
    }

    private Dispatcher dispatcher(BackoffStrategy backoff) {
        CandidateSelector selector =
                new CandidateSelector(Candidates.threeProviderCatalog(), health, new CostEstimator());
        return new Dispatcher(selector, health, new CostEstimator(), props, backoff,
                new SyncExecutor(), new RoutingMetrics(registry), events::add, clock);
    }

    private Dispatcher dispatcher() {
        return dispatcher(BackoffStrategy.NONE);
    }

    private static RuntimeException http500(String provider) {
        return new TransientProviderException(provider, "HTTP 500 upstream error");
    }

    private double count(String name, String provider) {
        return registry.find(name).tag("provider", provider).counter().count();
    }

    @Test
    void cheapestCandidateServesRequest() throws Exception {
        DispatchResult<String> result = dispatcher().dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo("groq-ok");
        assertThat(result.providerUsed().providerName()).isEqualTo("groq");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.usedFallback()).isFalse();
        assertThat(result.overBudget()).isFalse();
        assertThat(result.estimatedCost()).isCloseTo(0.002, within(1e-9));
        assertThat(adapter.calls()).containsExactly("groq:groq-model");
        assertThat(health.snapshot("groq").orElseThrow().totalRequests()).isEqualTo(1);
        assertThat(count("providerrouter.dispatch.success", "groq")).isEqualTo(1.0);
    }

    @Test
    void fallsBackInCostOrderUntilSuccess() throws Exception {
        adapter.fail("groq", http500("groq")).fail("deepseek", http500("deepseek"));

        DispatchResult<String> result = dispatcher().dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo("openai-ok");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.failures()).extracting(AttemptFailure::providerName).containsExactly("groq", "deepseek");
        assertThat(adapter.calls()).containsExactly("groq:groq-model", "deepseek:deepseek-model", "openai:openai-model");
        assertThat(health.snapshot("groq").orElseThrow().consecutiveFailures()).isEqualTo(1);
        assertThat(health.snapshot("openai").orElseThrow().consecutiveFailures()).isZero();
        assertThat(events).filteredOn(e -> e instanceof ProviderAttemptFailedEvent)
                .extracting(e -> ((ProviderAttemptFailedEvent) e).attempt())
                .containsExactly(1, 2);
        assertThat(registry.find("providerrouter.dispatch.fallback").counter().count()).isEqualTo(1.0);
    }

    @Test
    void failsWithFullTraceWhenEveryCandidateFails() {
        adapter.alwaysFail("groq").alwaysFail("deepseek").alwaysFail("openai");

        CompletableFuture<DispatchResult<String>> future = dispatcher().dispatch(REQUEST, adapter);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(AllProvidersFailedException.class);
        AllProvidersFailedException ex = (AllProvidersFailedException) future.handle((r, t) -> t).join();
        assertThat(ex).hasMessageContaining("groq:groq-model").hasMessageContaining("openai:openai-model");
        assertThat(ex.getTrace()).hasSize(3);
        assertThat(ex.getCapability()).isEqualTo("fast-text");
        assertThat(events).filteredOn(e -> e instanceof AllProvidersFailedEvent).hasSize(1);
        assertThat(registry.find("providerrouter.dispatch.exhausted").counter().count()).isEqualTo(1.0);
    }

    @Test
    void traceSizeEqualsCandidatesAttempted() {
        adapter.alwaysFail("groq").alwaysFail("deepseek").alwaysFail("openai");

        CompletableFuture<DispatchResult<String>> future = dispatcher().dispatch(REQUEST, adapter, 2);

        Throwable error = future.handle((r, t) -> t).join();
        assertThat(error).isInstanceOf(AllProvidersFailedException.class);
        assertThat(((AllProvidersFailedException) error).getTrace()).hasSize(2);
        assertThat(adapter.calls()).doesNotContain("openai:openai-model");
    }

    @Test
    void fallbackDisabledTriesOnlyFirstCandidate() {
        props.setFallbackEnabled(false);
        adapter.alwaysFail("groq");

        Throwable error = dispatcher().dispatch(REQUEST, adapter).handle((r, t) -> t).join();

        assertThat(error).isInstanceOf(AllProvidersFailedException.class);
        assertThat(((AllProvidersFailedException) error).getTrace()).hasSize(1);
        assertThat(adapter.calls()).containsExactly("groq:groq-model");
    }

    @Test
    void adapterThrowingSynchronouslyCountsAsFailure() throws Exception {
        CallAdapter<String, String> throwing = (candidate, request) -> {
            if (candidate.providerName().equals("groq")) {
                throw new IllegalStateException("client not initialized");
            }
            return CompletableFuture.completedFuture("served by " + candidate.providerName());
        };

        DispatchResult<String> result = dispatcher().dispatch(REQUEST, throwing).get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo("served by deepseek");
        assertThat(result.failures().get(0).error()).isInstanceOf(IllegalStateException.class);
        assertThat(health.snapshot("groq").orElseThrow().totalFailures()).isEqualTo(1);
    }

    @Test
    void adapterReturningNullCountsAsFailure() throws Exception {
        CallAdapter<String, String> nullForGroq = (candidate, request) -> candidate.providerName().equals("groq")
                ? null
                : CompletableFuture.completedFuture("ok");

        DispatchResult<String> result = dispatcher().dispatch(REQUEST, nullForGroq).get(5, TimeUnit.SECONDS);

        assertThat(result.providerUsed().providerName()).isEqualTo("deepseek");
        assertThat(result.failures().get(0).error()).isInstanceOf(TransientProviderException.class);
    }

    @Test
    void retriesSameCandidateAndRecordsHealthOnce() throws Exception {
        props.getRetry().setAttemptsPerCandidate(3);
        List<Integer> retries = new ArrayList<>();
        BackoffStrategy recording = retry -> {
            retries.add(retry);
            return Duration.ZERO;
        };
        adapter.fail("groq", http500("groq")).fail("groq", http500("groq"));

        DispatchResult<String> result = dispatcher(recording).dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo("groq-ok");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(adapter.calls()).hasSize(3).allMatch(c -> c.startsWith("groq:"));
        assertThat(retries).containsExactly(1, 2);
        assertThat(health.snapshot("groq").orElseThrow().totalRequests()).isEqualTo(1);
        assertThat(health.snapshot("groq").orElseThrow().totalFailures()).isZero();
    }

    @Test
    void exhaustedRetriesMoveToNextCandidate() throws Exception {
        props.getRetry().setAttemptsPerCandidate(2);
        adapter.alwaysFail("groq");

        DispatchResult<String> result = dispatcher().dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);

        assertThat(result.providerUsed().providerName()).isEqualTo("deepseek");
        assertThat(adapter.calls()).containsExactly("groq:groq-model", "groq:groq-model", "deepseek:deepseek-model");
        assertThat(health.snapshot("groq").orElseThrow().totalFailures()).isEqualTo(1);
    }

    @Test
    void waitsForBackoffBetweenRetries() throws Exception {
        props.getRetry().setAttemptsPerCandidate(2);
        adapter.fail("groq", http500("groq"));

        DispatchResult<String> result = dispatcher(retry -> Duration.ofMillis(50))
                .dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);

        assertThat(result.outcome()).isEqualTo("groq-ok");
        assertThat(result.latency()).isGreaterThanOrEqualTo(Duration.ofMillis(50));
    }

    @Test
    void backoffIsScheduledNotSlept() {
        props.getRetry().setAttemptsPerCandidate(2);
        adapter.fail("groq", http500("groq"));

        CompletableFuture<DispatchResult<String>> future =
                dispatcher(retry -> Duration.ofMillis(200)).dispatch(REQUEST, adapter);

        assertThat(future).isNotDone();
        await().atMost(5, TimeUnit.SECONDS).until(future::isDone);
        assertThat(future.join().outcome()).isEqualTo("groq-ok");
        assertThat(adapter.calls()).hasSize(2);
    }

    @Test
    void selectionErrorFailsFutureWithoutCallingAdapter() {
        CompletableFuture<DispatchResult<String>> future =
                dispatcher().dispatch(CapabilityRequest.of(Capability.VIDEO_GENERATION, 0, 0, "clip"), adapter);

        assertThat(future).isCompletedExceptionally();
        assertThat(future.handle((r, t) -> t).join()).isInstanceOf(ConfigurationException.class);
        assertThat(adapter.calls()).isEmpty();
    }

    @Test
    void invalidMaxAttemptsFailsFuture() {
        Throwable error = dispatcher().dispatch(REQUEST, adapter, 0).handle((r, t) -> t).join();

        assertThat(error).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void appliesDefaultBudgetOfCapability() throws Exception {
        props.getDefaultBudgets().put("fast-text", 0.0001);

        DispatchResult<String> result = dispatcher().dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);

        assertThat(result.overBudget()).isTrue();
        assertThat(result.providerUsed().providerName()).isEqualTo("groq");
        assertThat(registry.find("providerrouter.dispatch.over-budget").counter().count()).isEqualTo(1.0);
    }

    @Test
    void requestBudgetOverridesDefault() throws Exception {
        props.getDefaultBudgets().put("fast-text", 0.0001);
        adapter.alwaysFail("groq");

        DispatchResult<String> result = dispatcher().dispatch(REQUEST.withBudget(0.01), adapter)
                .get(5, TimeUnit.SECONDS);

        assertThat(result.overBudget()).isFalse();
        assertThat(result.providerUsed().providerName()).isEqualTo("deepseek");
    }

    @Test
    void cancellingResultCancelsInFlightCallAndStopsFallback() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        adapter.respond("groq", () -> pending);

        CompletableFuture<DispatchResult<String>> future = dispatcher().dispatch(REQUEST, adapter);
        future.cancel(true);

        assertThat(pending).isCancelled();
        assertThat(adapter.calls()).containsExactly("groq:groq-model");
        assertThat(health.snapshot("groq").orElseThrow().totalRequests()).isZero();
    }

    @Test
    void quotaErrorFallsThroughButKeepsProviderHealthy() throws Exception {
        adapter.alwaysFail("groq", new TransientProviderException("groq", "Your credit balance is too low"));

        for (int i = 0; i < 4; i++) {
            DispatchResult<String> result = dispatcher().dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);
            assertThat(result.providerUsed().providerName()).isEqualTo("deepseek");
        }

        assertThat(health.isHealthy("groq")).isTrue();
    }

    @Test
    void repeatedFailuresTakeProviderOutOfRotation() throws Exception {
        adapter.alwaysFail("groq");
        Dispatcher dispatcher = dispatcher();
        for (int i = 0; i < 3; i++) {
            dispatcher.dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);
        }

        DispatchResult<String> result = dispatcher.dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS);

        assertThat(health.isHealthy("groq")).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.providerUsed().providerName()).isEqualTo("deepseek");
        assertThat(count("providerrouter.dispatch.failure", "groq")).isEqualTo(3.0);
    }

    private void openCircuit(String provider) {
        for (int i = 0; i < 3; i++) {
            health.recordFailure(provider, http500(provider));
        }
    }

    @Test
    void halfOpenProviderGetsSingleTrialWhileOthersFallBack() throws Exception {
        openCircuit("groq");
        clock.advance(Duration.ofSeconds(301));
        assertThat(health.state("groq")).isEqualTo(CircuitState.HALF_OPEN);
        CompletableFuture<String> trial = new CompletableFuture<>();
        adapter.respond("groq", () -> trial);
        Dispatcher dispatcher = dispatcher();

        List<CompletableFuture<DispatchResult<String>>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            futures.add(dispatcher.dispatch(REQUEST, adapter));
        }

        assertThat(adapter.calls()).filteredOn(c -> c.startsWith("groq")).hasSize(1);
        for (CompletableFuture<DispatchResult<String>> f : futures.subList(1, 10)) {
            DispatchResult<String> result = f.get(5, TimeUnit.SECONDS);
            assertThat(result.providerUsed().providerName()).isEqualTo("deepseek");
            assertThat(result.failures()).isEmpty();
        }
        assertThat(futures.get(0)).isNotDone();

        trial.complete("groq-recovered");

        assertThat(futures.get(0).get(5, TimeUnit.SECONDS).outcome()).isEqualTo("groq-recovered");
        assertThat(health.state("groq")).isEqualTo(CircuitState.CLOSED);
        assertThat(dispatcher.dispatch(REQUEST, adapter).get(5, TimeUnit.SECONDS).providerUsed().providerName())
                .isEqualTo("groq");
    }

    @Test
    void failsWithNoProviderWhenEveryTrialIsTaken() {
        openCircuit("groq");
        openCircuit("deepseek");
        openCircuit("openai");
        clock.advance(Duration.ofSeconds(300));
        health.admit("groq");
        health.admit("deepseek");
        health.admit("openai");

        CompletableFuture<DispatchResult<String>> future = dispatcher().dispatch(REQUEST, adapter);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(NoProviderAvailableException.class);
        assertThat(adapter.calls()).isEmpty();
        assertThat(events).noneMatch(e -> e instanceof AllProvidersFailedEvent);
    }

    @Test
    void cancellingTrialCallReleasesIt() {
        openCircuit("groq");
        clock.advance(Duration.ofSeconds(300));
        adapter.respond("groq", CompletableFuture::new);

        CompletableFuture<DispatchResult<String>> future = dispatcher().dispatch(REQUEST, adapter);
        future.cancel(true);

        assertThat(health.admit("groq")).isEqualTo(HealthTracker.Admission.TRIAL);
    }

    @Test
    void eventsAreStampedWithInjectedClock() {
        clock.advance(Duration.ofHours(2));
        adapter.alwaysFail("groq").alwaysFail("deepseek").alwaysFail("openai");

        dispatcher().dispatch(REQUEST, adapter);

        assertThat(events).filteredOn(e -> e instanceof ProviderAttemptFailedEvent)
                .extracting(e -> ((ProviderAttemptFailedEvent) e).at())
                .containsOnly(clock.instant());
        assertThat(events).filteredOn(e -> e instanceof AllProvidersFailedEvent)
                .extracting(e -> ((AllProvidersFailedEvent) e).at())
                .containsExactly(clock.instant());
    }
}
