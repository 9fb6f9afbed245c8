package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Topology-wide settings inherited by every node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Defaults(@JsonProperty("ip_forwarding") boolean ipForwarding,
                       Map<String, Object> sysctl,
                       VBoxDeclaration vbox) {
    public Defaults {
        sysctl = sysctl == null || sysctl.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(sysctl));
    }
}
