package com.hybridai.gateway.dispatch;

import com.hybridai.gateway.model.CallParameters;
import com.hybridai.gateway.model.ChatMessage;
import com.hybridai.gateway.model.CompletionResult;
import com.hybridai.gateway.model.FailureClass;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;
import com.hybridai.gateway.provider.ProviderAdapter;
import com.hybridai.gateway.provider.ProviderHandle;
import com.hybridai.gateway.provider.ProviderRegistry;
import com.hybridai.gateway.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Sends a conversation to the first provider that answers.
 *
 * <h2>Dispatch logic</h2>
 * <ol>
 *   <li>Take the registry's fixed attempt order: primary first, then every
 *       other provider in declared order.</li>
 *   <li>Skip providers that never initialised; they are recorded as
 *       {@code UNAVAILABLE} without being invoked.</li>
 *   <li>Invoke each available provider in turn through the
 *       {@link RetryExecutor}. The first one that returns non-blank text wins
 *       and later providers are <em>not</em> called.</li>
 *   <li>A blank response counts as an {@code OTHER} failure and falls through,
 *       the same as an error.</li>
 *   <li>If nothing answered, throw {@link AllProvidersFailedException} naming
 *       every provider and how it failed.</li>
 * </ol>
 *
 * <p>Attempts are strictly sequential. The dispatcher keeps no state between
 * calls, so one instance may serve many threads.
 */
public class FailoverDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FailoverDispatcher.class);

    private final ProviderRegistry registry;
    private final RetryExecutor    retry;
    private final DispatchListener listener;

    public FailoverDispatcher(final ProviderRegistry registry) {
        this(registry, RetryExecutor.singleAttempt(), new LoggingDispatchListener());
    }

    public FailoverDispatcher(
            final ProviderRegistry registry,
            final RetryExecutor retry,
            final DispatchListener listener) {
        this.registry = registry;
        this.retry    = retry;
        this.listener = listener != null ? listener : DispatchListener.NO_OP;
    }

    public CompletionResult dispatch(final List<ChatMessage> messages) {
        return dispatch(messages, CallParameters.defaults());
    }

    /**
     * Send {@code messages} to the first provider that answers.
     *
     * @return the response text and the provider that produced it
     * @throws IllegalArgumentException     if {@code messages} is null or empty
     * @throws AllProvidersFailedException  if no provider returned usable text
     */
    public CompletionResult dispatch(final List<ChatMessage> messages, final CallParameters parameters) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must contain at least one message");
        }
        final List<ChatMessage> conversation = List.copyOf(messages);
        final CallParameters    params       = parameters != null ? parameters : CallParameters.defaults();
        final List<ProviderHandle> order     = registry.getAttemptOrder();

        listener.onDispatchStarted(registry.getAttemptOrderIds(), conversation.size());

        final List<ProviderResult> failures = new ArrayList<>();

        for (int i = 0; i < order.size(); i++) {
            final ProviderHandle handle = order.get(i);
            final ProviderId     id     = handle.getId();

            if (!handle.isAvailable()) {
                listener.onProviderSkipped(id, handle.getReason());
                failures.add(ProviderResult.builder(id).unavailable(handle.getReason()).build());
                continue;
            }

            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Dispatch interrupted before provider={}, not attempting remaining providers", id);
                recordNotAttempted(order.subList(i, order.size()), failures);
                break;
            }

            listener.onAttemptStarted(id);
            final ProviderAdapter adapter = handle.getAdapter();
            final ProviderResult  result  = retry.execute(
                    id,
                    () -> requireText(id, adapter.invoke(conversation, params)),
                    id + " (" + conversation.size() + " messages)");

            if (result.hasText()) {
                final CompletionResult completion =
                        new CompletionResult(result.getText(), id, result.getModel(), failures);
                listener.onSucceeded(completion);
                return completion;
            }

            failures.add(result);
            listener.onAttemptFailed(result);
        }

        final AllProvidersFailedException failure = new AllProvidersFailedException(failures);
        listener.onAllFailed(failure);
        throw failure;
    }

    /**
     * Run {@link #dispatch(List, CallParameters)} on {@code executor}.
     * Providers are still attempted one at a time.
     */
    public CompletableFuture<CompletionResult> dispatchAsync(
            final List<ChatMessage> messages,
            final CallParameters parameters,
            final Executor executor) {
        return CompletableFuture.supplyAsync(() -> dispatch(messages, parameters), executor);
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    /** Close the listener and every provider adapter. */
    @Override
    public void close() {
        try {
            listener.close();
        } finally {
            registry.close();
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    /** A success without text is not a usable answer; turn it into a failure so it falls through. */
    private static ProviderResult requireText(final ProviderId id, final ProviderResult result) {
        if (result == null) {
            return ProviderResult.builder(id)
                    .failure(FailureClass.OTHER, "Provider returned no result", 0)
                    .build();
        }
        if (result.isSuccess() && !result.hasText()) {
            return ProviderResult.builder(id).model(result.getModel())
                    .failure(FailureClass.OTHER, "Empty response", result.getHttpStatusCode())
                    .build();
        }
        return result;
    }

    private static void recordNotAttempted(final List<ProviderHandle> remaining, final List<ProviderResult> failures) {
        for (final ProviderHandle handle : remaining) {
            failures.add(handle.isAvailable()
                    ? ProviderResult.builder(handle.getId())
                            .failure(FailureClass.OTHER, "Not attempted: dispatch interrupted", 0).build()
                    : ProviderResult.builder(handle.getId()).unavailable(handle.getReason()).build());
        }
    }
}
