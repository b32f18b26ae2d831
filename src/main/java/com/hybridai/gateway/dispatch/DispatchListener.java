package com.hybridai.gateway.dispatch;

import com.hybridai.gateway.model.CompletionResult;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;

import java.util.List;

/**
 * Receives the events of each dispatch, in order.
 *
 * <p>Injected into the {@link FailoverDispatcher} so operators can see which
 * provider failed and how ({@code RATE_LIMITED} versus {@code OTHER}), and so
 * tests can capture events without scraping logs. All methods default to
 * no-ops. Implementations must be thread-safe when the dispatcher is shared.
 */
public interface DispatchListener extends AutoCloseable {

    DispatchListener NO_OP = new DispatchListener() { };

    /** A call started; {@code order} is the full attempt order, available or not. */
    default void onDispatchStarted(final List<ProviderId> order, final int messageCount) { }

    /** {@code provider} was not invoked because it never initialised. */
    default void onProviderSkipped(final ProviderId provider, final String reason) { }

    /** About to invoke {@code provider}. */
    default void onAttemptStarted(final ProviderId provider) { }

    /** {@code provider} answered without usable text; the dispatcher moves on. */
    default void onAttemptFailed(final ProviderResult result) { }

    /** The call produced a result; no further providers will be attempted. */
    default void onSucceeded(final CompletionResult result) { }

    /** Every provider failed; the dispatcher is about to throw. */
    default void onAllFailed(final AllProvidersFailedException failure) { }

    /** Release anything the listener holds. Called when the dispatcher is closed. */
    @Override
    default void close() { }
}
