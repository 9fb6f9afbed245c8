package io.netloom.topology.resolved;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective kernel parameters of a node: topology defaults overlaid with node entries.
 */
public record Sysctl(boolean ipForwarding, Map<String, Object> entries) {
    public Sysctl {
        entries = entries == null || entries.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Sysctl merge(boolean ipForwarding, Map<String, Object> defaults, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (defaults != null) {
            merged.putAll(defaults);
        }
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new Sysctl(ipForwarding, merged);
    }
}
