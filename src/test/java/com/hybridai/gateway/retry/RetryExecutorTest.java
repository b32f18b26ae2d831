package com.hybridai.gateway.retry;

import com.hybridai.gateway.config.GatewayConfig;
import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryExecutorTest {

    private static final ProviderId PROVIDER = ProviderId.ANTHROPIC;

    @Mock private GatewayConfig config;

    private RetryExecutor executor;

    @BeforeEach
    void setup() {
        when(config.getRetryMaxAttempts()).thenReturn(3);
        when(config.getRetryInitialDelayMs()).thenReturn(10L);  // fast for tests
        when(config.getRetryBackoffFactor()).thenReturn(2.0);
        when(config.getRetryMaxDelayMs()).thenReturn(100L);
        executor = new RetryExecutor(config);
    }

    @Test
    void execute_returnsImmediately_onFirstSuccess() {
        final var counter = new AtomicInteger(0);
        final var result = executor.execute(PROVIDER, () -> {
            counter.incrementAndGet();
            return success();
        }, "anthropic test");

        assertThat(result.isSuccess()).isTrue();
        assertThat(counter.get()).isEqualTo(1);
    }

    @Test
    void execute_retriesRateLimit_andSucceedsOnSecondAttempt() {
        final var counter = new AtomicInteger(0);
        final var result  = executor.execute(PROVIDER, () -> {
            if (counter.incrementAndGet() == 1) return failure(FailureClass.RATE_LIMITED);
            return success();
        }, "anthropic test");

        assertThat(result.isSuccess()).isTrue();
        assertThat(counter.get()).isEqualTo(2);
    }

    @Test
    void execute_exhaustsAllAttemptsAndReturnsLastFailure() {
        final var counter = new AtomicInteger(0);
        final var result  = executor.execute(PROVIDER, () -> {
            counter.incrementAndGet();
            return failure(FailureClass.OTHER);
        }, "anthropic test");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureClass()).isEqualTo(FailureClass.OTHER);
        assertThat(counter.get()).isEqualTo(3); // maxAttempts = 3
    }

    @Test
    void execute_doesNotRetry_onUnavailable() {
        final var counter = new AtomicInteger(0);
        final var result  = executor.execute(PROVIDER, () -> {
            counter.incrementAndGet();
            return ProviderResult.builder(PROVIDER).unavailable("no key").build();
        }, "anthropic test");

        assertThat(result.getFailureClass()).isEqualTo(FailureClass.UNAVAILABLE);
        assertThat(counter.get()).isEqualTo(1); // only one attempt for UNAVAILABLE
    }

    @Test
    void execute_handlesException_andRetries() {
        final var counter = new AtomicInteger(0);
        final var result  = executor.execute(PROVIDER, () -> {
            if (counter.incrementAndGet() < 3) {
                throw new RuntimeException("network timeout");
            }
            return success();
        }, "anthropic test");

        assertThat(result.isSuccess()).isTrue();
        assertThat(counter.get()).isEqualTo(3);
    }

    @Test
    void execute_classifiesRateLimitedException() {
        final var result = executor.execute(PROVIDER, () -> {
            throw new IllegalStateException("Error code: 429 - rate_limit_error");
        }, "anthropic test");

        assertThat(result.getFailureClass()).isEqualTo(FailureClass.RATE_LIMITED);
        assertThat(result.getProvider()).isEqualTo(PROVIDER);
    }

    @Test
    void singleAttempt_neverRetries() {
        final var counter = new AtomicInteger(0);
        final var result  = RetryExecutor.singleAttempt().execute(PROVIDER, () -> {
            counter.incrementAndGet();
            return failure(FailureClass.RATE_LIMITED);
        }, "anthropic test");

        assertThat(result.getFailureClass()).isEqualTo(FailureClass.RATE_LIMITED);
        assertThat(counter.get()).isEqualTo(1);
    }

    @Test
    void backoffDelay_isCappedAtMaxDelay() {
        assertThat(executor.backoffDelay(1)).isBetween(10L, 20L);
        assertThat(executor.backoffDelay(10)).isEqualTo(100L);
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        assertThatThrownBy(() -> new RetryExecutor(0, 10L, 2.0, 100L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private ProviderResult success() {
        return ProviderResult.builder(PROVIDER).success("hello", 200).build();
    }

    private ProviderResult failure(final FailureClass failureClass) {
        return ProviderResult.builder(PROVIDER).failure(failureClass, "server error", 500).build();
    }
}
