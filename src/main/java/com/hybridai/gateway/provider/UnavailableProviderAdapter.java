package com.hybridai.gateway.provider;

import com.hybridai.gateway.model.CallParameters;
import com.hybridai.gateway.model.ChatMessage;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;

import java.util.List;

/**
 * Stand-in for a provider that could not be initialised.
 * Always answers {@code UNAVAILABLE} without touching the network.
 */
public final class UnavailableProviderAdapter implements ProviderAdapter {

    private final ProviderId provider;
    private final String     reason;

    public UnavailableProviderAdapter(final ProviderId provider, final String reason) {
        this.provider = provider;
        this.reason   = reason == null || reason.isBlank() ? "provider is not configured" : reason;
    }

    @Override public ProviderId providerId()  { return provider; }
    @Override public boolean    isConfigured() { return false; }

    public String getReason() { return reason; }

    @Override
    public ProviderResult invoke(final List<ChatMessage> messages, final CallParameters parameters) {
        return ProviderResult.builder(provider).unavailable(reason).build();
    }

    @Override
    public void close() { }
}
