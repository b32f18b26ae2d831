package com.hybridai.gateway.config;

import com.hybridai.gateway.model.ProviderId;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed configuration for the Hybrid AI Gateway, loaded from
 * {@code application.conf} via Typesafe Config.
 *
 * <p>API keys are read from environment variables via Typesafe Config
 * substitution (e.g. {@code ${?ANTHROPIC_API_KEY}}). This class never logs
 * secret values; callers only check their presence.
 */
public final class GatewayConfig {

    private final Config raw;

    private GatewayConfig(final Config config) {
        this.raw = config;
    }

    public static GatewayConfig load() {
        return new GatewayConfig(ConfigFactory.load().resolve());
    }

    /** Wrap an already-built config, falling back to the bundled defaults for missing keys. */
    public static GatewayConfig from(final Config config) {
        return new GatewayConfig(config
                .withFallback(ConfigFactory.parseResources("application.conf"))
                .resolve());
    }

    // ── Providers ─────────────────────────────────────────────────────────────

    public ProviderId getPrimaryProvider() {
        return ProviderId.fromConfigName(raw.getString("gateway.primary-provider"));
    }

    public List<? extends Config> getProviders() {
        return raw.getConfigList("gateway.providers");
    }

    /** Provider ids in the order they are declared under {@code gateway.providers}. */
    public List<ProviderId> getDeclaredProviderOrder() {
        final List<ProviderId> order = new ArrayList<>();
        for (final Config provider : getProviders()) {
            final ProviderId id = ProviderId.fromConfigName(provider.getString("name"));
            if (!order.contains(id)) {
                order.add(id);
            }
        }
        return order;
    }

    /** Returns the first provider block whose {@code name} matches {@code id}, if any. */
    public Optional<Config> getProviderConfig(final ProviderId id) {
        return getProviders().stream()
                .filter(c -> ProviderId.fromConfigName(c.getString("name")) == id)
                .map(Config.class::cast)
                .findFirst();
    }

    public boolean isProviderEnabled(final ProviderId id) {
        return getProviderConfig(id)
                .map(c -> !c.hasPath("enabled") || c.getBoolean("enabled"))
                .orElse(false);
    }

    /** API key configured for {@code id}, if present and non-blank. */
    public Optional<String> getConfiguredApiKey(final ProviderId id) {
        return getProviderConfig(id)
                .filter(c -> c.hasPath("api-key"))
                .map(c -> c.getString("api-key"))
                .filter(key -> !key.isBlank());
    }

    // ── Request defaults ──────────────────────────────────────────────────────

    public int getDefaultMaxTokens() {
        return raw.getInt("gateway.defaults.max-tokens");
    }

    public double getDefaultTemperature() {
        return raw.getDouble("gateway.defaults.temperature");
    }

    // ── Retry ─────────────────────────────────────────────────────────────────

    /** Attempts per provider before moving on. 1 means pure failover. */
    public int getRetryMaxAttempts() {
        return raw.getInt("retry.max-attempts");
    }

    public long getRetryInitialDelayMs() {
        return raw.getLong("retry.initial-delay-ms");
    }

    public double getRetryBackoffFactor() {
        return raw.getDouble("retry.backoff-factor");
    }

    public long getRetryMaxDelayMs() {
        return raw.getLong("retry.max-delay-ms");
    }

    // ── Status server ─────────────────────────────────────────────────────────

    public boolean isStatusServerEnabled() {
        return raw.getBoolean("status.enabled");
    }

    public int getStatusPort() {
        return raw.getInt("status.port");
    }
}
