package com.hybridai.gateway.retry;

import com.hybridai.gateway.config.GatewayConfig;
import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;
import com.hybridai.gateway.provider.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Runs one provider attempt, optionally repeating it with exponential back-off
 * and jitter before the dispatcher falls through to the next provider.
 *
 * <p>With {@code max-attempts = 1} (the default) every provider is called
 * exactly once and failover is the only recovery. Larger values retry
 * {@link FailureClass#RATE_LIMITED} and {@link FailureClass#OTHER} failures.
 * {@link FailureClass#UNAVAILABLE} is permanent and never retried.
 *
 * <p>An exception escaping the operation is converted into a failed
 * {@link ProviderResult} and never propagated.
 *
 * <h2>Back-off formula</h2>
 * <pre>
 *   delay(attempt) = min(initialDelay × factor^(attempt-1) + jitter, maxDelay)
 *   jitter         = random(0, initialDelay)
 * </pre>
 */
public class RetryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);
    private static final Random RNG = new Random();

    private final int    maxAttempts;
    private final long   initialDelayMs;
    private final double backoffFactor;
    private final long   maxDelayMs;

    public RetryExecutor(final GatewayConfig config) {
        this(config.getRetryMaxAttempts(),
             config.getRetryInitialDelayMs(),
             config.getRetryBackoffFactor(),
             config.getRetryMaxDelayMs());
    }

    public RetryExecutor(
            final int maxAttempts,
            final long initialDelayMs,
            final double backoffFactor,
            final long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("retry.max-attempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts    = maxAttempts;
        this.initialDelayMs = Math.max(0L, initialDelayMs);
        this.backoffFactor  = backoffFactor;
        this.maxDelayMs     = Math.max(0L, maxDelayMs);
    }

    /** One attempt per provider. */
    public static RetryExecutor singleAttempt() {
        return new RetryExecutor(1, 0L, 1.0, 0L);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Execute {@code operation} with automatic retry on retryable failures.
     *
     * @param provider    the provider being called, used for synthesised failures
     * @param operation   the provider call to attempt
     * @param description human-readable description for log messages
     * @return the first successful {@link ProviderResult}, or the last failure
     *         after all attempts are exhausted; never null
     */
    public ProviderResult execute(
            final ProviderId provider,
            final Callable<ProviderResult> operation,
            final String description) {

        ProviderResult lastResult = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                lastResult = operation.call();
                if (lastResult == null) {
                    lastResult = ProviderResult.builder(provider)
                            .failure(FailureClass.OTHER, "Provider returned no result", 0)
                            .build();
                }

                if (lastResult.isSuccess()) {
                    if (attempt > 1) {
                        LOG.info("Retry succeeded: {} on attempt {}/{}", description, attempt, maxAttempts);
                    }
                    return lastResult;
                }

                // UNAVAILABLE is permanent, do not retry
                if (lastResult.getFailureClass() == FailureClass.UNAVAILABLE) {
                    return lastResult;
                }

                if (maxAttempts > 1) {
                    LOG.warn("Attempt failed ({}/{}): {} [{}] {}",
                            attempt, maxAttempts, description,
                            lastResult.getFailureClass(), lastResult.getErrorMessage());
                }
            } catch (Exception e) {
                LOG.error("Unexpected exception from provider (attempt {}/{}): {} - {}",
                        attempt, maxAttempts, description, e.toString());
                lastResult = ProviderResult.builder(provider)
                        .failure(FailureClassifier.classify(e), "Exception: " + e, 0)
                        .build();
            }

            if (attempt < maxAttempts && !sleep(backoffDelay(attempt))) {
                LOG.warn("Interrupted while backing off, giving up on {}", description);
                return lastResult;
            }
        }

        if (maxAttempts > 1) {
            LOG.error("All {} attempts exhausted for: {}", maxAttempts, description);
        }
        return lastResult;
    }

    long backoffDelay(final int attempt) {
        final long base   = (long) (initialDelayMs * Math.pow(backoffFactor, attempt - 1));
        final long jitter = (long) (RNG.nextDouble() * initialDelayMs);
        return Math.min(base + jitter, maxDelayMs);
    }

    /** @return false if the thread was interrupted */
    private boolean sleep(final long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
