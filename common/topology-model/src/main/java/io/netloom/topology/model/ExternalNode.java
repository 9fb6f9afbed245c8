package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalNode(String name,
                           String role,
                           Map<String, Object> sysctl,
                           List<InterfaceDeclaration> interfaces,
                           List<VlanDeclaration> vlans,
                           List<TunnelDeclaration> tunnels,
                           BridgeDeclaration bridge,
                           RoutingDeclaration routing,
                           ServicesDeclaration services,
                           List<String> commands) {
    public ExternalNode {
        sysctl = sysctl == null || sysctl.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(sysctl));
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        vlans = vlans == null ? List.of() : List.copyOf(vlans);
        tunnels = tunnels == null ? List.of() : List.copyOf(tunnels);
        commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public static ExternalNode named(String name, String role, List<InterfaceDeclaration> interfaces) {
        return new ExternalNode(name, role, null, interfaces, null, null, null, null, null, null);
    }
}
