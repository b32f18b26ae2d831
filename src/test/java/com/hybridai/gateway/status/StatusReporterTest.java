package com.hybridai.gateway.status;

import com.hybridai.gateway.dispatch.AllProvidersFailedException;
import com.hybridai.gateway.dispatch.DispatchListener;
import com.hybridai.gateway.dispatch.FailoverDispatcher;
import com.hybridai.gateway.model.ChatMessage;
import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderResult;
import com.hybridai.gateway.provider.ProviderAdapter;
import com.hybridai.gateway.provider.ProviderHandle;
import com.hybridai.gateway.provider.ProviderRegistry;
import com.hybridai.gateway.retry.RetryExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.hybridai.gateway.model.ProviderId.ANTHROPIC;
import static com.hybridai.gateway.model.ProviderId.OPENAI;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatusReporterTest {

    @Mock private ProviderAdapter openai;

    @Test
    void status_reflectsRegistry() {
        final var registry = new ProviderRegistry(ANTHROPIC, List.of(
                ProviderHandle.unavailable(ANTHROPIC, "ANTHROPIC_API_KEY not set"),
                ProviderHandle.available(OPENAI, openai)));

        final GatewayStatus status = new StatusReporter(registry).status();

        assertThat(status.getPrimary()).isEqualTo(ANTHROPIC);
        assertThat(status.isAvailable(ANTHROPIC)).isFalse();
        assertThat(status.isAvailable(OPENAI)).isTrue();
        assertThat(status.getAvailableProviders()).containsExactly(OPENAI);
        assertThat(status.asMap())
                .containsEntry("anthropic_available", false)
                .containsEntry("openai_available", true)
                .containsEntry("primary_provider", "anthropic");
    }

    @Test
    void status_isUnchanged_afterFailedDispatch() {
        when(openai.invoke(anyList(), any())).thenReturn(ProviderResult.builder(OPENAI)
                .failure(FailureClass.RATE_LIMITED, "HTTP 429", 429).build());
        final var registry = new ProviderRegistry(OPENAI, List.of(
                ProviderHandle.available(OPENAI, openai),
                ProviderHandle.unavailable(ANTHROPIC, "ANTHROPIC_API_KEY not set")));
        final var reporter   = new StatusReporter(registry);
        final var dispatcher = new FailoverDispatcher(registry, RetryExecutor.singleAttempt(), DispatchListener.NO_OP);
        final var before     = reporter.status().asMap();

        assertThatThrownBy(() -> dispatcher.dispatch(List.of(ChatMessage.user("Hi"))))
                .isInstanceOf(AllProvidersFailedException.class);

        assertThat(reporter.status().asMap()).isEqualTo(before);
        assertThat(reporter.status().isAvailable(OPENAI)).isTrue();
    }

    @Test
    void status_reportsNothingAvailable_whenNoKeys() {
        final var registry = new ProviderRegistry(ANTHROPIC, List.of(
                ProviderHandle.unavailable(ANTHROPIC, "ANTHROPIC_API_KEY not set"),
                ProviderHandle.unavailable(OPENAI, "OPENAI_API_KEY not set")));

        final GatewayStatus status = new StatusReporter(registry).status();

        assertThat(status.hasAvailableProvider()).isFalse();
        assertThat(status.getAvailableProviders()).isEmpty();
    }
}
