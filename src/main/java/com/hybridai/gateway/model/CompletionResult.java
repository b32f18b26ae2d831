package com.hybridai.gateway.model;

import java.util.List;

/**
 * Successful outcome of a dispatch: the response text and the provider that produced it.
 *
 * <p>{@code failedAttempts} lists, in order, the providers ahead of the winner
 * that did not answer, including unavailable ones that were skipped without a
 * call. It is empty when the primary succeeded.
 */
public final class CompletionResult {

    private final String     text;
    private final ProviderId provider;
    private final String     model;
    private final List<ProviderResult> failedAttempts;

    public CompletionResult(
            final String text,
            final ProviderId provider,
            final String model,
            final List<ProviderResult> failedAttempts) {
        this.text           = text;
        this.provider       = provider;
        this.model          = model;
        this.failedAttempts = List.copyOf(failedAttempts);
    }

    public String     getText()     { return text; }
    public ProviderId getProvider() { return provider; }
    public String     getModel()    { return model; }
    public List<ProviderResult> getFailedAttempts() { return failedAttempts; }

    /** Returns true if a provider other than the primary answered. */
    public boolean isFailover() {
        return !failedAttempts.isEmpty();
    }

    @Override
    public String toString() {
        return "CompletionResult{provider=" + provider
             + (model != null ? ", model=" + model : "")
             + ", length=" + (text != null ? text.length() : 0)
             + ", failedAttempts=" + failedAttempts.size() + "}";
    }
}
