package com.phillippitts.providerrouter.exception;

/**
 * Thrown when the provider catalog is empty or malformed for a capability.
 * This is a fatal error when raised during startup.
 */
public class ConfigurationException extends ProviderRouterException {

    private final String capability;

    public ConfigurationException(String message) {
        super(message);
        this.capability = null;
    }

    public ConfigurationException(String capability, String message) {
        super(message + " (capability: " + capability + ")");
        this.capability = capability;
    }

    /** @return the capability the error refers to, or null when it is not capability specific */
    public String getCapability() {
        return capability;
    }
}
