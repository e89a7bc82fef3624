package com.phillippitts.providerrouter.service.dispatch;

import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.ProviderCandidate;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Performs the actual provider call for one candidate.
 *
 * <p>The returned future is the dispatcher's only suspension point. Failing it, or throwing
 * from {@link #invoke}, counts as a failure of that candidate.
 *
 * @param <P> request payload type
 * @param <R> result type
 */
@FunctionalInterface
public interface CallAdapter<P, R> {

    CompletableFuture<R> invoke(ProviderCandidate candidate, CapabilityRequest<P> request);

    /**
     * Adapts a blocking SDK call by running it on the given executor.
     */
    static <P, R> CallAdapter<P, R> blocking(BlockingCall<P, R> call, Executor executor) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(executor, "executor");
        return (candidate, request) -> CompletableFuture.supplyAsync(() -> {
            try {
                return call.call(candidate, request);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /** Blocking provider call, typically a vendor SDK client. */
    @FunctionalInterface
    interface BlockingCall<P, R> {
        R call(ProviderCandidate candidate, CapabilityRequest<P> request) throws Exception;
    }
}
