package com.hybridai.gateway.provider;

import com.hybridai.gateway.config.GatewayConfig;
import com.hybridai.gateway.model.ProviderId;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Supplies the API key for a provider.
 *
 * <p>Sources compose with {@link #orElse}: explicit keys first, then the
 * config file, then the process environment, matching how the gateway is
 * wired in {@link com.hybridai.gateway.HybridAiGatewayApp}. Blank keys count
 * as absent.
 */
@FunctionalInterface
public interface CredentialSource {

    /**
     * @return the API key for {@code provider}, or empty if none is known
     */
    Optional<String> apiKey(ProviderId provider);

    /** Consult {@code fallback} when this source has no key for a provider. */
    default CredentialSource orElse(final CredentialSource fallback) {
        return provider -> {
            final Optional<String> key = apiKey(provider);
            return key.isPresent() ? key : fallback.apiKey(provider);
        };
    }

    static CredentialSource none() {
        return provider -> Optional.empty();
    }

    /** Keys passed in directly, e.g. by an embedding application. */
    static CredentialSource explicit(final Map<ProviderId, String> keys) {
        final Map<ProviderId, String> copy = keys.isEmpty()
                ? new EnumMap<>(ProviderId.class)
                : new EnumMap<>(keys);
        return provider -> nonBlank(copy.get(provider));
    }

    /** Keys from {@code gateway.providers[].api-key}. */
    static CredentialSource fromConfig(final GatewayConfig config) {
        return config::getConfiguredApiKey;
    }

    /** Keys from the process environment ({@link ProviderId#apiKeyEnvVar()}). */
    static CredentialSource environment() {
        return environment(System::getenv);
    }

    static CredentialSource environment(final Function<String, String> lookup) {
        return provider -> nonBlank(lookup.apply(provider.apiKeyEnvVar()));
    }

    private static Optional<String> nonBlank(final String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
