package com.hybridai.gateway.model;

/**
 * Identity of a supported LLM provider.
 *
 * <p>The config name is the key used in {@code application.conf} and in the
 * status map; the environment variable is where an API key is looked up when
 * none is configured explicitly.
 */
public enum ProviderId {

    ANTHROPIC("anthropic", "ANTHROPIC_API_KEY"),
    OPENAI("openai", "OPENAI_API_KEY");

    private final String configName;
    private final String apiKeyEnvVar;

    ProviderId(final String configName, final String apiKeyEnvVar) {
        this.configName   = configName;
        this.apiKeyEnvVar = apiKeyEnvVar;
    }

    public String configName()   { return configName; }
    public String apiKeyEnvVar() { return apiKeyEnvVar; }

    /**
     * Resolve a provider from its config name (case-insensitive). Also accepts
     * {@code "claude"} as an alias for {@link #ANTHROPIC}.
     *
     * @throws IllegalArgumentException if the name matches no provider
     */
    public static ProviderId fromConfigName(final String name) {
        if (name == null) {
            throw new IllegalArgumentException("Provider name must not be null");
        }
        final String normalised = name.trim().toLowerCase();
        if ("claude".equals(normalised)) {
            return ANTHROPIC;
        }
        for (final ProviderId id : values()) {
            if (id.configName.equals(normalised)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown LLM provider: " + name);
    }

    @Override
    public String toString() {
        return configName;
    }
}
