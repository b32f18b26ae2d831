package com.hybridai.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridai.gateway.model.CallParameters;
import com.hybridai.gateway.model.ChatMessage;
import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OpenAiProviderAdapterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private MockWebServer server;
    private OpenAiProviderAdapter adapter;

    @BeforeEach
    void setup() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = new OpenAiProviderAdapter("sk-test", server.url("/").toString(), "gpt-test", 512, 0.5);
    }

    @AfterEach
    void teardown() throws Exception {
        adapter.close();
        server.shutdown();
    }

    @Test
    void invoke_returnsContent_on200Response() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(completion("Hello")));

        final ProviderResult result = adapter.invoke(List.of(
                ChatMessage.system("Be friendly."),
                ChatMessage.user("Say hello")), CallParameters.defaults());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getText()).isEqualTo("Hello");
        assertThat(result.getProvider()).isEqualTo(ProviderId.OPENAI);

        final RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");

        final JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-test");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(512);
        assertThat(body.path("messages")).hasSize(2);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
    }

    @Test
    void invoke_usesPerCallModel_andPassThroughOptions() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(completion("ok")));
        final var params = CallParameters.builder()
                .model(ProviderId.OPENAI, "gpt-4o")
                .option("presence_penalty", 0.5)
                .option("user", "tenant-42")
                .build();

        adapter.invoke(List.of(ChatMessage.user("Hi")), params);

        final JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("presence_penalty").asDouble()).isEqualTo(0.5);
        assertThat(body.path("user").asText()).isEqualTo("tenant-42");
    }

    @Test
    void invoke_classifiesRateLimited_fromErrorCode() {
        // Some gateways report throttling with a 400 and an error code rather than 429
        server.enqueue(new MockResponse().setResponseCode(400).setBody(
                "{\"error\":{\"message\":\"Slow down\",\"type\":\"requests\",\"code\":\"rate_limit_exceeded\"}}"));

        final ProviderResult result = adapter.invoke(List.of(ChatMessage.user("Hi")), CallParameters.defaults());

        assertThat(result.getFailureClass()).isEqualTo(FailureClass.RATE_LIMITED);
    }

    @Test
    void invoke_classifiesOther_onServerError() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody(""));

        final ProviderResult result = adapter.invoke(List.of(ChatMessage.user("Hi")), CallParameters.defaults());

        assertThat(result.getFailureClass()).isEqualTo(FailureClass.OTHER);
        assertThat(result.getErrorMessage()).isEqualTo("HTTP 500: (empty)");
    }

    @Test
    void invoke_returnsEmptySuccess_whenContentIsNull() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(
                "{\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":null}}]}"));

        final ProviderResult result = adapter.invoke(List.of(ChatMessage.user("Hi")), CallParameters.defaults());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.hasText()).isFalse();
    }

    @Test
    void invoke_returnsOther_forEmptyConversation() {
        final ProviderResult result = adapter.invoke(List.of(), CallParameters.defaults());

        assertThat(result.getFailureClass()).isEqualTo(FailureClass.OTHER);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void providerId_isOpenAi() {
        assertThat(adapter.providerId()).isEqualTo(ProviderId.OPENAI);
    }

    private static String completion(final String content) {
        return "{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\",\"choices\":[{\"index\":0,"
             + "\"message\":{\"role\":\"assistant\",\"content\":\"" + content + "\"},"
             + "\"finish_reason\":\"stop\"}]}";
    }
}
