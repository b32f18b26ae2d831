package com.hybridai.gateway.status;

import com.hybridai.gateway.model.ProviderId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of which providers are usable and which one is primary.
 */
public final class GatewayStatus {

    private final Map<ProviderId, Boolean> availability;
    private final ProviderId primary;

    public GatewayStatus(final Map<ProviderId, Boolean> availability, final ProviderId primary) {
        this.availability = Collections.unmodifiableMap(new LinkedHashMap<>(availability));
        this.primary      = primary;
    }

    public Map<ProviderId, Boolean> getAvailability() { return availability; }
    public ProviderId getPrimary() { return primary; }

    public boolean isAvailable(final ProviderId provider) {
        return availability.getOrDefault(provider, false);
    }

    public List<ProviderId> getAvailableProviders() {
        final List<ProviderId> available = new ArrayList<>();
        availability.forEach((id, up) -> { if (up) available.add(id); });
        return available;
    }

    public boolean hasAvailableProvider() {
        return availability.containsValue(true);
    }

    /**
     * Flat view for JSON and diagnostics, e.g.
     * {@code {"anthropic_available": false, "openai_available": true, "primary_provider": "anthropic"}}.
     */
    public Map<String, Object> asMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        availability.forEach((id, up) -> map.put(id.configName() + "_available", up));
        map.put("primary_provider", primary.configName());
        return map;
    }

    @Override
    public String toString() {
        return "GatewayStatus" + asMap();
    }
}
