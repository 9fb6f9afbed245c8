package io.netloom.topology.resolved;

import io.netloom.topology.model.NodeRole;
import io.netloom.topology.model.ServicesDeclaration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A fully resolved node. Owns its interfaces, VLANs, tunnels, bridge and routing block.
 */
public record InternalNode(String name,
                           NodeRole role,
                           List<InternalInterface> interfaces,
                           List<InternalVlan> vlans,
                           List<InternalTunnel> tunnels,
                           InternalBridge bridge,
                           Sysctl sysctl,
                           InternalRouting routing,
                           ServicesDeclaration services,
                           List<String> commands) {
    public InternalNode {
        Objects.requireNonNull(name, "name");
        role = Objects.requireNonNullElse(role, NodeRole.DEFAULT);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        vlans = vlans == null ? List.of() : List.copyOf(vlans);
        tunnels = tunnels == null ? List.of() : List.copyOf(tunnels);
        sysctl = Objects.requireNonNullElse(sysctl, new Sysctl(false, null));
        commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public Optional<InternalInterface> interfaceNamed(String interfaceName) {
        return interfaces.stream().filter(i -> i.name().equals(interfaceName)).findFirst();
    }

    public boolean hasInterfaceOrVlan(String interfaceName) {
        return interfaceNamed(interfaceName).isPresent()
            || vlans.stream().anyMatch(v -> v.name().equals(interfaceName));
    }

    public List<InternalVlan> vlansOf(String parent) {
        return vlans.stream().filter(v -> v.parent().equals(parent)).collect(Collectors.toList());
    }

    public boolean isVlanParent(String interfaceName) {
        return vlans.stream().anyMatch(v -> v.parent().equals(interfaceName));
    }

    /**
     * Bridge that should produce artifacts: declared, configured and on a switch.
     */
    public boolean bridgeActive() {
        return bridge != null && bridge.configured() && role == NodeRole.SWITCH;
    }

    public boolean routingActive() {
        return routing != null && routing.configured();
    }

    public boolean hasFirewall() {
        return services != null && services.firewall() != null;
    }

    public boolean hasWireguard() {
        return services != null && services.wireguard() != null;
    }

    public InterfaceRef ref(String interfaceName) {
        return new InterfaceRef(name, interfaceName);
    }
}
