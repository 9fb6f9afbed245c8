package io.netloom.templates;

import java.util.Map;
import java.util.Objects;

/**
 * Maps template ids to relative output paths. systemd-networkd reads its directory in lexical order,
 * so the numeric prefixes follow dependency order: bridge, bridge ports, VLAN parents, interfaces,
 * VLANs, tunnels.
 */
public final class OutputPathMapper {

    static final String NETWORK_DIR = "etc/systemd/network/";

    private static final Map<String, OutputPath> KNOWN = Map.ofEntries(
        Map.entry("hostname", new OutputPath("etc/hostname", Expansion.NODE)),
        Map.entry("sysctl.conf", new OutputPath("etc/sysctl.d/99-netloom.conf", Expansion.NODE)),
        Map.entry("bridge.netdev", new OutputPath(NETWORK_DIR + "05-{bridge}.netdev", Expansion.BRIDGE)),
        Map.entry("bridge.network", new OutputPath(NETWORK_DIR + "06-{bridge}.network", Expansion.BRIDGE)),
        Map.entry("bridge-port.network", new OutputPath(NETWORK_DIR + "07-{iface}-bridge.network", Expansion.BRIDGE_PORT)),
        Map.entry("vlan-parent.network", new OutputPath(NETWORK_DIR + "09-{iface}-vlan.network", Expansion.VLAN_PARENT)),
        Map.entry("interface.link", new OutputPath(NETWORK_DIR + "10-{iface}.link", Expansion.INTERFACE)),
        Map.entry("interface.network", new OutputPath(NETWORK_DIR + "10-{iface}.network", Expansion.INTERFACE)),
        Map.entry("vlan.netdev", new OutputPath(NETWORK_DIR + "11-{vlan}.netdev", Expansion.VLAN)),
        Map.entry("vlan.network", new OutputPath(NETWORK_DIR + "11-{vlan}.network", Expansion.VLAN)),
        Map.entry("tunnel.netdev", new OutputPath(NETWORK_DIR + "25-{tunnel}.netdev", Expansion.TUNNEL)),
        Map.entry("tunnel.network", new OutputPath(NETWORK_DIR + "25-{tunnel}.network", Expansion.TUNNEL)),
        Map.entry("wg0.conf", new OutputPath("etc/wireguard/wg0.conf", Expansion.NODE)),
        Map.entry("services.list", new OutputPath("services.list", Expansion.NODE))
    );

    public OutputPath mapPath(TemplateId id) {
        Objects.requireNonNull(id, "id");
        String name = id.name();
        if (TemplateSetSelector.BIRD.equals(id.set()) && name.endsWith(".conf")) {
            return "bird.conf".equals(name)
                ? new OutputPath("etc/bird/bird.conf", Expansion.ROUTING)
                : new OutputPath("etc/bird/conf.d/" + name, Expansion.ROUTING);
        }
        if (TemplateSetSelector.FRR.equals(id.set())) {
            return new OutputPath("etc/frr/" + name, Expansion.ROUTING);
        }
        OutputPath known = KNOWN.get(name);
        if (known != null) {
            return known;
        }
        if (name.endsWith(".network") || name.endsWith(".netdev")) {
            return new OutputPath(NETWORK_DIR + name, Expansion.NODE);
        }
        if (name.endsWith(".conf")) {
            return new OutputPath("etc/" + name, Expansion.NODE);
        }
        return new OutputPath(name, Expansion.NODE);
    }
}
