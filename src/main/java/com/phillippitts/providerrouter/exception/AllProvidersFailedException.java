package com.phillippitts.providerrouter.exception;

import com.phillippitts.providerrouter.domain.AttemptFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when every selected candidate was attempted and every call failed.
 * Carries the full per-candidate trace in attempt order.
 */
public class AllProvidersFailedException extends ProviderRouterException {

    private final String capability;
    private final List<AttemptFailure> trace;

    public AllProvidersFailedException(String capability, List<AttemptFailure> trace) {
        super(buildMessage(capability, trace), trace.isEmpty() ? null : trace.get(trace.size() - 1).error());
        this.capability = capability;
        this.trace = List.copyOf(trace);
    }

    public String getCapability() {
        return capability;
    }

    public List<AttemptFailure> getTrace() {
        return trace;
    }

    private static String buildMessage(String capability, List<AttemptFailure> trace) {
        String tried = trace.stream()
                .map(f -> f.candidate().label() + " -> " + f.errorSummary())
                .collect(Collectors.joining("; "));
        return "All " + trace.size() + " providers failed for capability '" + capability + "'. Tried: " + tried;
    }
}
