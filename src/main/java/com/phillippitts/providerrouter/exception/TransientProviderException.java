package com.phillippitts.providerrouter.exception;

/**
 * A single provider call failed. Never escapes a dispatch: the dispatcher records it
 * against the provider's health and moves on to the next candidate.
 */
public class TransientProviderException extends ProviderRouterException {

    private final String providerName;

    public TransientProviderException(String providerName, String message) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public TransientProviderException(String providerName, String message, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
