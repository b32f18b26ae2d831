package com.hybridai.gateway.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hybridai.gateway.model.CallParameters;
import com.hybridai.gateway.model.ChatMessage;
import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Provider adapter backed by the OpenAI Chat Completions API.
 *
 * <p>API reference: <a href="https://platform.openai.com/docs/api-reference/chat/create">
 * OpenAI Chat Completions</a>
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code OPENAI_API_KEY}: an OpenAI secret key</li>
 * </ul>
 *
 * <p>Any OpenAI-compatible endpoint works by pointing {@code base-url} at it.
 */
public class OpenAiProviderAdapter implements ProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(OpenAiProviderAdapter.class);

    public static final String DEFAULT_BASE_URL    = "https://api.openai.com";
    public static final String DEFAULT_MODEL       = "gpt-4o-mini";
    public static final int    DEFAULT_MAX_TOKENS  = 1024;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String  apiKey;
    private final HttpUrl endpoint;
    private final String  defaultModel;
    private final int     defaultMaxTokens;
    private final double  defaultTemperature;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiProviderAdapter(final String apiKey) {
        this(apiKey, DEFAULT_BASE_URL, DEFAULT_MODEL, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE);
    }

    public OpenAiProviderAdapter(
            final String apiKey,
            final String baseUrl,
            final String defaultModel,
            final int defaultMaxTokens,
            final double defaultTemperature) {
        this(apiKey, baseUrl, defaultModel, defaultMaxTokens, defaultTemperature, 10_000L, 60_000L);
    }

    /**
     * @throws IllegalArgumentException if {@code baseUrl} is not a valid http(s) URL
     */
    public OpenAiProviderAdapter(
            final String apiKey,
            final String baseUrl,
            final String defaultModel,
            final int defaultMaxTokens,
            final double defaultTemperature,
            final long connectTimeoutMs,
            final long readTimeoutMs) {
        this.apiKey             = apiKey;
        this.endpoint           = HttpUrl.get(baseUrl).newBuilder().addPathSegments("v1/chat/completions").build();
        this.defaultModel       = defaultModel != null && !defaultModel.isBlank() ? defaultModel : DEFAULT_MODEL;
        this.defaultMaxTokens   = defaultMaxTokens;
        this.defaultTemperature = defaultTemperature;
        this.http = new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .build();
    }

    @Override public ProviderId providerId() { return ProviderId.OPENAI; }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ProviderResult invoke(final List<ChatMessage> messages, final CallParameters parameters) {
        final String model = parameters.getModel(providerId()).orElse(defaultModel);
        if (!isConfigured()) {
            return ProviderResult.builder(providerId()).model(model).unavailable("OPENAI_API_KEY not set").build();
        }
        if (messages == null || messages.isEmpty()) {
            return ProviderResult.builder(providerId()).model(model)
                    .failure(FailureClass.OTHER, "No messages to send", 0)
                    .build();
        }

        final String payload;
        try {
            payload = buildPayload(messages, parameters, model);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.error("✗ OpenAI request could not be serialised: {}", e.getMessage());
            return ProviderResult.builder(providerId()).model(model)
                    .failure(FailureClass.OTHER, "Invalid request: " + e.getMessage(), 0)
                    .build();
        }

        final Request request = new Request.Builder()
                .url(endpoint)
                .addHeader("Authorization", "Bearer " + apiKey)
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(payload, JSON))
                .build();

        final Call call = http.newCall(request);
        parameters.getTimeout().ifPresent(t -> call.timeout().timeout(t.toMillis(), TimeUnit.MILLISECONDS));

        LOG.info("Trying OpenAI ({})", model);
        try (Response response = call.execute()) {
            final int    code     = response.code();
            final String respBody = response.body() != null ? response.body().string() : "";

            if (response.isSuccessful()) {
                final String text;
                try {
                    text = extractText(respBody);
                } catch (JsonProcessingException e) {
                    LOG.error("✗ OpenAI returned a malformed body: http={} error={}", code, e.getOriginalMessage());
                    return ProviderResult.builder(providerId()).model(model)
                            .failure(FailureClass.OTHER, "Malformed response: " + e.getOriginalMessage(), code)
                            .build();
                }
                LOG.info("✓ OpenAI succeeded ({})", model);
                return ProviderResult.builder(providerId()).model(model).success(text, code).build();
            } else {
                final String detail = "HTTP " + code + ": " + (respBody.isBlank() ? "(empty)" : respBody);
                final FailureClass failureClass = FailureClassifier.classify(code, respBody);
                logFailure(failureClass, detail);
                return ProviderResult.builder(providerId()).model(model)
                        .failure(failureClass, detail, code).build();
            }
        } catch (IOException e) {
            final FailureClass failureClass = FailureClassifier.classify(e);
            logFailure(failureClass, e.toString());
            return ProviderResult.builder(providerId()).model(model)
                    .failure(failureClass, e.toString(), 0).build();
        }
    }

    private void logFailure(final FailureClass failureClass, final String detail) {
        if (failureClass == FailureClass.RATE_LIMITED) {
            LOG.warn("⚠ OpenAI rate limit: {}", detail);
        } else {
            LOG.error("✗ OpenAI failed: {}", detail);
        }
    }

    private String buildPayload(
            final List<ChatMessage> messages,
            final CallParameters parameters,
            final String model) throws JsonProcessingException {
        final ObjectNode root = mapper.createObjectNode();
        root.put("model",       model);
        root.put("max_tokens",  parameters.getMaxTokens().orElse(defaultMaxTokens));
        root.put("temperature", parameters.getTemperature().orElse(defaultTemperature));

        final ArrayNode turns = root.putArray("messages");
        for (final ChatMessage message : messages) {
            final ObjectNode turn = turns.addObject();
            turn.put("role",    message.getRole().wireName());
            turn.put("content", message.getContent());
        }

        for (final Map.Entry<String, Object> option : parameters.getOptions().entrySet()) {
            root.set(option.getKey(), mapper.valueToTree(option.getValue()));
        }
        return mapper.writeValueAsString(root);
    }

    private String extractText(final String body) throws JsonProcessingException {
        // choices[0].message.content; null content (e.g. tool calls only) reads as empty
        final JsonNode content = mapper.readTree(body).path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : "";
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
