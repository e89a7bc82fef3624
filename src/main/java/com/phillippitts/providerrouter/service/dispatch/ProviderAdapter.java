package com.phillippitts.providerrouter.service.dispatch;

/**
 * Call adapter bound to one provider family, registered in a {@link ProviderAdapterRegistry}.
 */
public interface ProviderAdapter<P, R> extends CallAdapter<P, R> {

    /** @return provider name as used in the catalog, e.g. "openai" */
    String providerName();
}
