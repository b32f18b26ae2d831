package com.hybridai.gateway.provider;

import com.hybridai.gateway.model.ProviderId;

/**
 * Builds the concrete adapter for a provider once a credential is known.
 *
 * <p>May throw if the underlying client cannot be constructed; the
 * {@link ProviderRegistry} records such a provider as unavailable.
 */
@FunctionalInterface
public interface ProviderAdapterFactory {

    ProviderAdapter create(ProviderId provider, String apiKey);
}
