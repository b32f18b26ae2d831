package com.hybridai.gateway.provider;

import com.hybridai.gateway.model.ProviderId;

import java.util.Objects;

/**
 * The registry's immutable record of one provider: its identity, whether it
 * initialised, and the adapter to invoke.
 *
 * <p>An unavailable handle carries an {@link UnavailableProviderAdapter} and
 * the reason initialisation did not succeed.
 */
public final class ProviderHandle {

    private final ProviderId      id;
    private final boolean         available;
    private final ProviderAdapter adapter;
    private final String          reason;   // null when available

    private ProviderHandle(
            final ProviderId id,
            final boolean available,
            final ProviderAdapter adapter,
            final String reason) {
        this.id        = Objects.requireNonNull(id, "id");
        this.available = available;
        this.adapter   = Objects.requireNonNull(adapter, "adapter");
        this.reason    = reason;
    }

    public static ProviderHandle available(final ProviderId id, final ProviderAdapter adapter) {
        return new ProviderHandle(id, true, adapter, null);
    }

    public static ProviderHandle unavailable(final ProviderId id, final String reason) {
        final UnavailableProviderAdapter placeholder = new UnavailableProviderAdapter(id, reason);
        return new ProviderHandle(id, false, placeholder, placeholder.getReason());
    }

    public ProviderId      getId()      { return id; }
    public boolean         isAvailable() { return available; }
    public ProviderAdapter getAdapter() { return adapter; }
    public String          getReason()  { return reason; }

    @Override
    public String toString() {
        return "ProviderHandle{id=" + id
             + ", available=" + available
             + (reason != null ? ", reason=" + reason : "")
             + "}";
    }
}
