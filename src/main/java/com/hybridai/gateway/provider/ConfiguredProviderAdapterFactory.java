package com.hybridai.gateway.provider;

import com.hybridai.gateway.config.GatewayConfig;
import com.hybridai.gateway.model.ProviderId;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Builds {@link ProviderAdapter}s from the {@code gateway.providers} blocks
 * in {@code application.conf}.
 *
 * <p>Missing keys fall back to each adapter's built-in defaults, so a
 * provider block may be as small as {@code { name = "openai" }}.
 */
public final class ConfiguredProviderAdapterFactory implements ProviderAdapterFactory {

    private final GatewayConfig config;

    public ConfiguredProviderAdapterFactory(final GatewayConfig config) {
        this.config = config;
    }

    @Override
    public ProviderAdapter create(final ProviderId provider, final String apiKey) {
        final Config cfg = config.getProviderConfig(provider).orElse(ConfigFactory.empty());
        final int    maxTokens   = config.getDefaultMaxTokens();
        final double temperature = config.getDefaultTemperature();

        return switch (provider) {
            case ANTHROPIC -> new AnthropicProviderAdapter(
                    apiKey,
                    cfgStr(cfg, "base-url", AnthropicProviderAdapter.DEFAULT_BASE_URL),
                    cfgStr(cfg, "model", AnthropicProviderAdapter.DEFAULT_MODEL),
                    maxTokens,
                    temperature,
                    cfgStr(cfg, "api-version", AnthropicProviderAdapter.DEFAULT_API_VERSION),
                    cfgLong(cfg, "connect-timeout-ms", 10_000L),
                    cfgLong(cfg, "read-timeout-ms", 60_000L));

            case OPENAI -> new OpenAiProviderAdapter(
                    apiKey,
                    cfgStr(cfg, "base-url", OpenAiProviderAdapter.DEFAULT_BASE_URL),
                    cfgStr(cfg, "model", OpenAiProviderAdapter.DEFAULT_MODEL),
                    maxTokens,
                    temperature,
                    cfgLong(cfg, "connect-timeout-ms", 10_000L),
                    cfgLong(cfg, "read-timeout-ms", 60_000L));
        };
    }

    private static String cfgStr(final Config cfg, final String key, final String fallback) {
        return cfg.hasPath(key) ? cfg.getString(key) : fallback;
    }

    private static long cfgLong(final Config cfg, final String key, final long fallback) {
        return cfg.hasPath(key) ? cfg.getLong(key) : fallback;
    }
}
