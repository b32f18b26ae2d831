package com.hybridai.gateway.provider;

import com.hybridai.gateway.model.CallParameters;
import com.hybridai.gateway.model.ChatMessage;
import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.model.ProviderResult;

import java.util.List;

/**
 * Pluggable LLM provider adapter.
 *
 * <p>Each concrete implementation wraps a single vendor API (Anthropic,
 * OpenAI, ...) and translates a list of {@link ChatMessage}s into that
 * vendor's wire format.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; a single instance is shared
 *       across all in-flight calls.</li>
 *   <li>Implementations must <em>never</em> throw unchecked exceptions from
 *       {@link #invoke}. Every error is captured in a {@link ProviderResult}
 *       carrying a {@link com.hybridai.gateway.model.FailureClass}. Failover
 *       is applied by the {@link com.hybridai.gateway.dispatch.FailoverDispatcher}
 *       above this layer.</li>
 *   <li>Options missing from {@link CallParameters} are filled with the
 *       adapter's own defaults.</li>
 *   <li>Implementations must close their HTTP clients when {@link #close()} is called.</li>
 * </ul>
 */
public interface ProviderAdapter extends AutoCloseable {

    /** Which provider this adapter talks to. */
    ProviderId providerId();

    /**
     * Send {@code messages} to the vendor and return its reply.
     *
     * @param messages   non-empty conversation, forwarded in order
     * @param parameters per-call overrides; never null
     * @return the outcome of the call; never null
     */
    ProviderResult invoke(List<ChatMessage> messages, CallParameters parameters);

    /**
     * Returns {@code true} if this adapter has the credentials required to
     * operate. Checked once by the registry at startup.
     */
    boolean isConfigured();

    @Override
    void close();
}
