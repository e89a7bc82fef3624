package com.phillippitts.providerrouter.exception;

import java.util.List;

/**
 * Thrown when no candidate of a capability may be attempted, even after the
 * health tracker was reset once. Recoverable by the caller (typically mapped to HTTP 503).
 */
public class NoProviderAvailableException extends ProviderRouterException {

    private final String capability;
    private final List<String> consideredCandidates;
    private final String reason;

    public NoProviderAvailableException(String capability, List<String> consideredCandidates, String reason) {
        super("No provider available for capability '" + capability + "': " + reason
                + " (considered: " + String.join(", ", consideredCandidates) + ")");
        this.capability = capability;
        this.consideredCandidates = List.copyOf(consideredCandidates);
        this.reason = reason;
    }

    public String getCapability() {
        return capability;
    }

    /** @return "provider:model" labels of every candidate that was considered */
    public List<String> getConsideredCandidates() {
        return consideredCandidates;
    }

    public String getReason() {
        return reason;
    }
}
