package com.phillippitts.providerrouter.service.dispatch;

import com.phillippitts.providerrouter.config.properties.DispatchProperties;
import com.phillippitts.providerrouter.domain.AttemptFailure;
import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.DispatchResult;
import com.phillippitts.providerrouter.domain.ProviderCandidate;
import com.phillippitts.providerrouter.exception.AllProvidersFailedException;
import com.phillippitts.providerrouter.exception.NoProviderAvailableException;
import com.phillippitts.providerrouter.exception.TransientProviderException;
import com.phillippitts.providerrouter.service.cost.CostEstimator;
import com.phillippitts.providerrouter.service.dispatch.event.AllProvidersFailedEvent;
import com.phillippitts.providerrouter.service.dispatch.event.ProviderAttemptFailedEvent;
import com.phillippitts.providerrouter.service.health.HealthTracker;
import com.phillippitts.providerrouter.service.metrics.RoutingMetrics;
import com.phillippitts.providerrouter.service.selection.CandidateSelection;
import com.phillippitts.providerrouter.service.selection.CandidateSelector;
import com.phillippitts.providerrouter.util.LogSanitizer;
import com.phillippitts.providerrouter.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tries the selected candidates in cost order until one succeeds.
 *
 * <p>For each candidate the adapter is invoked, optionally retried with backoff, and the final
 * outcome is recorded against the provider's health exactly once. A failed candidate is added
 * to the trace, announced with a {@link ProviderAttemptFailedEvent}, and the next candidate is
 * tried. When none is left the returned future fails with {@link AllProvidersFailedException}.
 *
 * <p>Selection errors ({@code NoProviderAvailableException}, {@code ConfigurationException},
 * invalid attempt limits) fail the returned future without any provider being called.
 *
 * <p>Before a candidate's first try the health tracker must admit it. A half-open provider admits
 * one trial at a time; a candidate that is not admitted is skipped without being called or
 * recorded. If every candidate is skipped the future fails with {@code NoProviderAvailableException}.
 *
 * <p>Cancelling the returned future cancels the in-flight adapter future and stops fallback.
 * A cancelled call is not recorded against provider health; a trial it held is released.
 *
 * <p><b>Thread Safety:</b> stateless apart from collaborators; each dispatch keeps its own state.
 */
public class Dispatcher {

    private static final Logger LOG = LogManager.getLogger(Dispatcher.class);

    private final CandidateSelector selector;
    private final HealthTracker healthTracker;
    private final CostEstimator costEstimator;
    private final DispatchProperties props;
    private final BackoffStrategy backoff;
    private final Executor executor;
    private final RoutingMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public Dispatcher(CandidateSelector selector,
                      HealthTracker healthTracker,
                      CostEstimator costEstimator,
                      DispatchProperties props,
                      BackoffStrategy backoff,
                      Executor executor,
                      RoutingMetrics metrics,
                      ApplicationEventPublisher publisher,
                      Clock clock) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.costEstimator = Objects.requireNonNull(costEstimator, "costEstimator");
        this.props = Objects.requireNonNull(props, "props");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Dispatches with the configured {@code router.dispatch.max-attempts}.
     */
    public <P, R> CompletableFuture<DispatchResult<R>> dispatch(CapabilityRequest<P> request,
                                                                CallAdapter<P, R> adapter) {
        return dispatch(request, adapter, props.getMaxAttempts());
    }

    /**
     * @param request     capability, sizes, optional budget and payload
     * @param adapter     performs the provider call for a candidate
     * @param maxAttempts maximum number of candidates to try, at least 1
     * @return future completing with the first successful result
     */
    public <P, R> CompletableFuture<DispatchResult<R>> dispatch(CapabilityRequest<P> request,
                                                                CallAdapter<P, R> adapter,
                                                                int maxAttempts) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(adapter, "adapter");
        String capability = request.capability().name();
        try (CloseableThreadContext.Instance ctx = CloseableThreadContext.put("capability", capability)) {
            int limit = props.isFallbackEnabled() ? maxAttempts : Math.min(maxAttempts, 1);
            CandidateSelection selection;
            try {
                selection = selector.select(request, budgetFor(request), limit);
            } catch (RuntimeException e) {
                LOG.warn("Selection failed for {}: {}", capability, LogSanitizer.describe(e));
                return CompletableFuture.failedFuture(e);
            }
            LOG.debug("Dispatching {} over {} candidate(s), overBudget={}",
                    capability, selection.size(), selection.overBudget());
            Run<P, R> run = new Run<>(request, adapter, selection);
            attempt(run, 0, 1, System.nanoTime());
            return run.result;
        }
    }

    private Double budgetFor(CapabilityRequest<?> request) {
        if (request.budgetUsd() != null) {
            return request.budgetUsd();
        }
        return props.getDefaultBudgets().get(request.capability().name());
    }

    private <P, R> void attempt(Run<P, R> run, int index, int tryNumber, long candidateStart) {
        ProviderCandidate candidate = run.selection.candidates().get(index);
        if (run.result.isDone()) {
            releaseTrial(run, candidate);
            return;
        }
        if (tryNumber == 1) {
            HealthTracker.Admission admission = healthTracker.admit(candidate.providerName());
            if (admission == HealthTracker.Admission.REJECTED) {
                LOG.debug("Skipping {}: circuit open or half-open trial in flight", candidate.label());
                run.skipped.add(candidate.label());
                next(run, index);
                return;
            }
            run.trialHeld = admission == HealthTracker.Admission.TRIAL;
        }
        CompletableFuture<R> call;
        try {
            call = run.adapter.invoke(candidate, run.request);
            if (call == null) {
                call = CompletableFuture.failedFuture(new TransientProviderException(
                        candidate.providerName(), "Adapter returned no future for " + candidate.label()));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        run.inFlight.set(call);
        if (run.result.isCancelled()) {
            call.cancel(true);
            releaseTrial(run, candidate);
            return;
        }
        call.whenComplete((value, error) -> {
            if (run.result.isDone()) {
                releaseTrial(run, candidate);
                return;
            }
            if (error == null) {
                succeed(run, index, candidate, value, candidateStart);
            } else {
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException && run.result.isCancelled()) {
                    releaseTrial(run, candidate);
                    return;
                }
                retryOrFail(run, index, tryNumber, candidate, cause, candidateStart);
            }
        });
    }

    private void releaseTrial(Run<?, ?> run, ProviderCandidate candidate) {
        if (run.trialHeld) {
            run.trialHeld = false;
            healthTracker.releaseTrial(candidate.providerName());
        }
    }

    private <P, R> void retryOrFail(Run<P, R> run, int index, int tryNumber, ProviderCandidate candidate,
                                    Throwable cause, long candidateStart) {
        int perCandidate = props.getRetry().getAttemptsPerCandidate();
        if (tryNumber < perCandidate) {
            Duration delay = backoff.delayBefore(tryNumber);
            LOG.debug("Retrying {} in {} ms (try {}/{}): {}", candidate.label(), delay.toMillis(),
                    tryNumber + 1, perCandidate, LogSanitizer.describe(cause));
            Executor delayed = delay.isZero()
                    ? executor
                    : CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
            delayed.execute(() -> attempt(run, index, tryNumber + 1, candidateStart));
            return;
        }

        String capability = run.selection.capability().name();
        healthTracker.recordFailure(candidate.providerName(), cause);
        run.trialHeld = false;
        metrics.recordFailure(capability, candidate.providerName(), cause.getClass().getSimpleName());
        AttemptFailure failure = new AttemptFailure(candidate, cause);
        run.failures.add(failure);
        LOG.warn("Provider {} failed for {} (attempt {}/{}): {}", candidate.label(), capability,
                index + 1, run.selection.size(), LogSanitizer.describe(cause));
        publisher.publishEvent(new ProviderAttemptFailedEvent(capability, candidate.providerName(),
                candidate.modelName(), index + 1, LogSanitizer.describe(cause), clock.instant()));
        next(run, index);
    }

    private <P, R> void next(Run<P, R> run, int index) {
        if (index + 1 < run.selection.size()) {
            attempt(run, index + 1, 1, System.nanoTime());
            return;
        }

        String capability = run.selection.capability().name();
        List<AttemptFailure> trace = run.trace();
        if (trace.isEmpty()) {
            LOG.warn("No candidate for {} admitted: {}", capability, run.skipped);
            run.result.completeExceptionally(new NoProviderAvailableException(capability,
                    List.copyOf(run.skipped), "every candidate's circuit is open or busy with a half-open trial"));
            return;
        }
        List<String> attempted = trace.stream().map(f -> f.candidate().label()).toList();
        LOG.error("All {} providers failed for {}: {}", trace.size(), capability, attempted);
        metrics.recordExhausted(capability);
        publisher.publishEvent(new AllProvidersFailedEvent(capability, attempted, clock.instant()));
        run.result.completeExceptionally(new AllProvidersFailedException(capability, trace));
    }

    private <P, R> void succeed(Run<P, R> run, int index, ProviderCandidate candidate, R value,
                                long candidateStart) {
        Duration latency = TimeUtils.elapsedSince(candidateStart);
        String capability = run.selection.capability().name();
        healthTracker.recordSuccess(candidate.providerName(), latency);
        run.trialHeld = false;
        metrics.recordSuccess(capability, candidate.providerName(), latency);
        if (index > 0) {
            metrics.recordFallback(capability);
        }
        if (run.selection.overBudget()) {
            metrics.recordOverBudget(capability);
        }
        double cost = costEstimator.estimate(candidate, run.request);
        LOG.info("Dispatched {} via {} in {} ms (attempt {}, est. ${})", capability, candidate.label(),
                latency.toMillis(), index + 1, cost);
        run.result.complete(new DispatchResult<>(value, candidate, latency, cost,
                run.selection.overBudget(), index + 1, run.trace()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** Mutable state of one dispatch. Steps run one after another, never concurrently. */
    private static final class Run<P, R> {
        final CapabilityRequest<P> request;
        final CallAdapter<P, R> adapter;
        final CandidateSelection selection;
        final CompletableFuture<DispatchResult<R>> result = new CompletableFuture<>();
        final AtomicReference<CompletableFuture<R>> inFlight = new AtomicReference<>();
        final List<AttemptFailure> failures = Collections.synchronizedList(new ArrayList<>());
        final List<String> skipped = Collections.synchronizedList(new ArrayList<>());
        volatile boolean trialHeld;

        Run(CapabilityRequest<P> request, CallAdapter<P, R> adapter, CandidateSelection selection) {
            this.request = request;
            this.adapter = adapter;
            this.selection = selection;
            result.whenComplete((r, t) -> {
                if (result.isCancelled()) {
                    CompletableFuture<R> current = inFlight.get();
                    if (current != null) {
                        current.cancel(true);
                    }
                }
            });
        }

        List<AttemptFailure> trace() {
            synchronized (failures) {
                return List.copyOf(failures);
            }
        }
    }
}
