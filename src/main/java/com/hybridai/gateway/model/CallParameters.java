package com.hybridai.gateway.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable per-call options forwarded uniformly to whichever provider is attempted.
 *
 * <p>Every option is optional. When one is unset the provider adapter falls
 * back to its own configured default (model name, max tokens, temperature).
 * {@code options} are merged verbatim into the vendor request body.
 */
public final class CallParameters {

    private static final CallParameters DEFAULTS = builder().build();

    private final Map<ProviderId, String> models;
    private final Integer  maxTokens;
    private final Double   temperature;
    private final Map<String, Object> options;
    private final Duration timeout;

    private CallParameters(final Builder b) {
        this.models      = Collections.unmodifiableMap(new EnumMap<>(b.models));
        this.maxTokens   = b.maxTokens;
        this.temperature = b.temperature;
        this.options     = Collections.unmodifiableMap(new LinkedHashMap<>(b.options));
        this.timeout     = b.timeout;
    }

    /** Parameters with nothing overridden. */
    public static CallParameters defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<ProviderId, String> models = new EnumMap<>(ProviderId.class);
        private final Map<String, Object> options = new LinkedHashMap<>();
        private Integer  maxTokens;
        private Double   temperature;
        private Duration timeout;

        private Builder() {}

        /** Override the model for one provider, e.g. {@code model(OPENAI, "gpt-4o")}. */
        public Builder model(final ProviderId provider, final String model) {
            if (model != null && !model.isBlank()) {
                models.put(provider, model);
            }
            return this;
        }

        public Builder maxTokens(final int maxTokens) {
            if (maxTokens <= 0) {
                throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
            }
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(final double temperature) {
            if (temperature < 0.0) {
                throw new IllegalArgumentException("temperature must not be negative: " + temperature);
            }
            this.temperature = temperature;
            return this;
        }

        /** Provider-specific pass-through field, added to the request body as-is. */
        public Builder option(final String key, final Object value) {
            options.put(key, value);
            return this;
        }

        public Builder options(final Map<String, ?> values) {
            options.putAll(values);
            return this;
        }

        /** Deadline for a single provider attempt. */
        public Builder timeout(final Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public CallParameters build() { return new CallParameters(this); }
    }

    public Optional<String>   getModel(final ProviderId provider) { return Optional.ofNullable(models.get(provider)); }
    public Optional<Integer>  getMaxTokens()   { return Optional.ofNullable(maxTokens); }
    public Optional<Double>   getTemperature() { return Optional.ofNullable(temperature); }
    public Map<String, Object> getOptions()    { return options; }
    public Optional<Duration> getTimeout()     { return Optional.ofNullable(timeout); }

    @Override
    public String toString() {
        return "CallParameters{models=" + models
             + (maxTokens != null ? ", maxTokens=" + maxTokens : "")
             + (temperature != null ? ", temperature=" + temperature : "")
             + (options.isEmpty() ? "" : ", options=" + options.keySet())
             + (timeout != null ? ", timeout=" + timeout : "")
             + "}";
    }
}
