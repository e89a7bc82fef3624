package com.phillippitts.providerrouter.domain;

import java.util.Objects;

/**
 * One failed candidate within a dispatch.
 *
 * @param candidate the candidate that was attempted
 * @param error     the last error raised for it
 */
public record AttemptFailure(ProviderCandidate candidate, Throwable error) {

    public AttemptFailure {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(error, "error");
    }

    public String providerName() {
        return candidate.providerName();
    }

    /** Class name plus message, no stack trace. */
    public String errorSummary() {
        String msg = error.getMessage();
        return msg == null ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + msg;
    }
}
