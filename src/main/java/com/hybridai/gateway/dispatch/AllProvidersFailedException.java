package com.hybridai.gateway.dispatch;

import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when no provider returned a usable response for a call.
 *
 * <p>Carries one {@link ProviderResult} per provider in attempt order,
 * including providers that were skipped because they were unavailable.
 */
public class AllProvidersFailedException extends RuntimeException {

    private final List<ProviderResult> failures;

    public AllProvidersFailedException(final List<ProviderResult> failures) {
        super(buildMessage(failures));
        this.failures = List.copyOf(failures);
    }

    /** Per-provider outcomes in attempt order. */
    public List<ProviderResult> getFailures() {
        return failures;
    }

    /** Every provider considered for the call, in attempt order. */
    public List<ProviderId> getProviders() {
        return failures.stream().map(ProviderResult::getProvider).collect(Collectors.toList());
    }

    public Map<ProviderId, FailureClass> getFailureClasses() {
        final Map<ProviderId, FailureClass> classes = new LinkedHashMap<>();
        failures.forEach(f -> classes.put(f.getProvider(), f.getFailureClass()));
        return classes;
    }

    private static String buildMessage(final List<ProviderResult> failures) {
        if (failures.isEmpty()) {
            return "All LLM providers failed: no providers configured";
        }
        return failures.stream()
                .map(f -> f.getProvider() + "=" + f.getFailureClass())
                .collect(Collectors.joining(", ", "All LLM providers failed: ", ""));
    }
}
