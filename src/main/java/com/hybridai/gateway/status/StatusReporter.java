package com.hybridai.gateway.status;

import com.hybridai.gateway.model.ProviderId;
import com.hybridai.gateway.provider.ProviderHandle;
import com.hybridai.gateway.provider.ProviderRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of provider availability.
 *
 * <p>Reflects the registry as it was built at startup. It never calls a
 * vendor and is unaffected by the outcome of earlier dispatches.
 */
public class StatusReporter {

    private final ProviderRegistry registry;

    public StatusReporter(final ProviderRegistry registry) {
        this.registry = registry;
    }

    public GatewayStatus status() {
        final Map<ProviderId, Boolean> availability = new LinkedHashMap<>();
        for (final ProviderHandle handle : registry.getHandles().values()) {
            availability.put(handle.getId(), handle.isAvailable());
        }
        return new GatewayStatus(availability, registry.getPrimary());
    }
}
