package com.hybridai.gateway.provider;

import com.hybridai.gateway.config.GatewayConfig;
import com.hybridai.gateway.model.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable set of {@link ProviderHandle}s plus the declared primary provider.
 *
 * <p>Built once at startup. Every known {@link ProviderId} gets a handle:
 * <ul>
 *   <li>disabled in config, or no API key: unavailable, no client is built;</li>
 *   <li>API key present: the {@link ProviderAdapterFactory} builds the adapter.
 *       If that throws, or the adapter reports itself unconfigured, the provider
 *       is recorded as unavailable instead of aborting the whole registry.</li>
 * </ul>
 * A registry with zero available providers is valid; the failure only
 * surfaces when a call is dispatched.
 *
 * <p>The attempt order is fixed here: primary first, then the other providers
 * in declared order. It never changes between calls, so the registry is safe
 * for concurrent reads.
 */
public final class ProviderRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final ProviderId                   primary;
    private final Map<ProviderId, ProviderHandle> handles;
    private final List<ProviderHandle>         attemptOrder;

    /**
     * @param primary provider to attempt first; must have a handle
     * @param handles one handle per provider, in declared fallback order
     */
    public ProviderRegistry(final ProviderId primary, final List<ProviderHandle> handles) {
        final Map<ProviderId, ProviderHandle> byId = new LinkedHashMap<>();
        for (final ProviderHandle handle : handles) {
            if (byId.putIfAbsent(handle.getId(), handle) != null) {
                throw new IllegalArgumentException("Duplicate handle for provider " + handle.getId());
            }
        }
        if (primary == null || !byId.containsKey(primary)) {
            throw new IllegalArgumentException("Primary provider " + primary + " has no handle");
        }

        final List<ProviderHandle> order = new ArrayList<>();
        order.add(byId.get(primary));
        for (final ProviderHandle handle : byId.values()) {
            if (handle.getId() != primary) {
                order.add(handle);
            }
        }

        this.primary      = primary;
        this.handles      = Collections.unmodifiableMap(byId);
        this.attemptOrder = List.copyOf(order);
    }

    /**
     * Build a registry from {@code application.conf}. Declared provider order
     * and the {@code enabled} flags come from config; keys come from
     * {@code credentials}.
     */
    public static ProviderRegistry fromConfig(final GatewayConfig config, final CredentialSource credentials) {
        return build(
                config.getPrimaryProvider(),
                config.getDeclaredProviderOrder(),
                config::isProviderEnabled,
                credentials,
                new ConfiguredProviderAdapterFactory(config));
    }

    /** Build a registry covering every known provider, all enabled, in enum order. */
    public static ProviderRegistry build(
            final ProviderId primary,
            final CredentialSource credentials,
            final ProviderAdapterFactory factory) {
        return build(primary, List.of(ProviderId.values()), id -> true, credentials, factory);
    }

    public static ProviderRegistry build(
            final ProviderId primary,
            final List<ProviderId> declaredOrder,
            final Predicate<ProviderId> enabled,
            final CredentialSource credentials,
            final ProviderAdapterFactory factory) {

        // Declared providers first, then any known provider config did not mention
        final List<ProviderId> ids = new ArrayList<>(declaredOrder);
        Arrays.stream(ProviderId.values())
                .filter(id -> !ids.contains(id))
                .forEach(ids::add);

        final List<ProviderHandle> handles = new ArrayList<>();
        for (final ProviderId id : ids) {
            handles.add(initialise(id, enabled.test(id), credentials, factory));
        }

        final ProviderRegistry registry = new ProviderRegistry(primary, handles);
        if (!registry.hasAvailableProvider()) {
            LOG.warn("No LLM providers are configured and operational. Every call will fail until a key is set.");
        }
        LOG.info("Provider registry built: primary={} attemptOrder={}", primary, registry.getAttemptOrderIds());
        return registry;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public ProviderId getPrimary() {
        return primary;
    }

    /** All handles in declared order, available or not. */
    public Map<ProviderId, ProviderHandle> getHandles() {
        return handles;
    }

    public Optional<ProviderHandle> getHandle(final ProviderId id) {
        return Optional.ofNullable(handles.get(id));
    }

    /** Every handle, primary first, then the rest in declared order. */
    public List<ProviderHandle> getAttemptOrder() {
        return attemptOrder;
    }

    public List<ProviderId> getAttemptOrderIds() {
        final List<ProviderId> ids = new ArrayList<>(attemptOrder.size());
        attemptOrder.forEach(h -> ids.add(h.getId()));
        return ids;
    }

    public boolean isAvailable(final ProviderId id) {
        return getHandle(id).map(ProviderHandle::isAvailable).orElse(false);
    }

    public boolean hasAvailableProvider() {
        return handles.values().stream().anyMatch(ProviderHandle::isAvailable);
    }

    @Override
    public void close() {
        for (final ProviderHandle handle : handles.values()) {
            try {
                handle.getAdapter().close();
            } catch (RuntimeException e) {
                LOG.warn("Failed to close adapter for provider={}: {}", handle.getId(), e.getMessage());
            }
        }
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private static ProviderHandle initialise(
            final ProviderId id,
            final boolean enabled,
            final CredentialSource credentials,
            final ProviderAdapterFactory factory) {

        if (!enabled) {
            LOG.warn("⚠ Provider '{}' is disabled in config", id);
            return ProviderHandle.unavailable(id, "disabled in config");
        }

        final Optional<String> apiKey = credentials.apiKey(id);
        if (apiKey.isEmpty()) {
            LOG.warn("⚠ {} not set, provider '{}' unavailable", id.apiKeyEnvVar(), id);
            return ProviderHandle.unavailable(id, id.apiKeyEnvVar() + " not set");
        }

        final ProviderAdapter adapter;
        try {
            adapter = factory.create(id, apiKey.get());
        } catch (Exception e) {
            LOG.error("✗ Failed to initialise provider '{}': {}", id, e.getMessage());
            return ProviderHandle.unavailable(id, "initialisation failed: " + e.getMessage());
        }

        if (adapter == null || !adapter.isConfigured()) {
            LOG.warn("⚠ Provider '{}' has a key but its adapter is not configured, skipping", id);
            if (adapter != null) {
                adapter.close();
            }
            return ProviderHandle.unavailable(id, "adapter not configured");
        }

        LOG.info("✓ Provider '{}' initialised", id);
        return ProviderHandle.available(id, adapter);
    }
}
