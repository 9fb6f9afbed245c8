package io.netloom.topology.load;

import io.netloom.topology.model.BridgeDeclaration;
import io.netloom.topology.model.ExternalNode;
import io.netloom.topology.model.ExternalTopology;
import io.netloom.topology.model.FirewallDeclaration;
import io.netloom.topology.model.FirewallRuleDeclaration;
import io.netloom.topology.model.InterfaceDeclaration;
import io.netloom.topology.model.Ipv4;
import io.netloom.topology.model.LinkDeclaration;
import io.netloom.topology.model.Meta;
import io.netloom.topology.model.NodeRole;
import io.netloom.topology.model.OspfAreaDeclaration;
import io.netloom.topology.model.RipDeclaration;
import io.netloom.topology.model.RoutingDeclaration;
import io.netloom.topology.model.RoutingEngine;
import io.netloom.topology.model.ServicesDeclaration;
import io.netloom.topology.model.TunnelDeclaration;
import io.netloom.topology.model.TunnelType;
import io.netloom.topology.model.VBoxDeclaration;
import io.netloom.topology.model.VlanDeclaration;
import io.netloom.topology.model.WireguardDeclaration;
import io.netloom.topology.model.WireguardPeerDeclaration;
import io.netloom.topology.resolved.StaticRoute;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Field-level checks on a bound topology document. All violations are collected before anything is
 * reported so a user can fix the document in one pass.
 */
public final class TopologyValidator {

    private static final Pattern NODE_NAME = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Set<String> PARAVIRT_PROVIDERS = Set.of("default", "legacy", "minimal", "hyperv", "kvm", "none");
    private static final Set<String> CHIPSETS = Set.of("piix3", "ich9");
    private static final Set<String> FIREWALL_IMPLS = Set.of("nftables");
    private static final Set<String> FIREWALL_ACTIONS = Set.of("accept", "drop", "reject");
    private static final Set<String> FIREWALL_PROTOCOLS = Set.of("tcp", "udp", "icmp");
    private static final Set<String> PORT_PROTOCOLS = Set.of("tcp", "udp");
    private static final int MIN_VLAN_ID = 1;
    private static final int MAX_VLAN_ID = 4094;

    /**
     * Returns every violation found, in document order. An empty list means the document is valid.
     */
    public List<Violation> validate(ExternalTopology topology) {
        if (topology == null) {
            throw new IllegalArgumentException("topology must not be null");
        }
        List<Violation> violations = new ArrayList<>();
        validateMeta(topology.meta(), violations);
        if (topology.defaults() != null) {
            validateVbox(topology.defaults().vbox(), violations);
        }
        Set<String> declared = validateNodeNames(topology.nodes(), violations);
        validateLinks(topology.links(), declared, violations);
        for (int i = 0; i < topology.nodes().size(); i++) {
            validateNode("nodes[" + i + "]", topology.nodes().get(i), violations);
        }
        return List.copyOf(violations);
    }

    /**
     * Throws {@link ValidationException} carrying all violations when there is at least one.
     */
    public void requireValid(ExternalTopology topology) {
        List<Violation> violations = validate(topology);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private void validateMeta(Meta meta, List<Violation> violations) {
        if (meta == null) {
            violations.add(new Violation("meta", "is required"));
            return;
        }
        if (isBlank(meta.id())) {
            violations.add(new Violation("meta.id", "is required"));
        }
        if (isBlank(meta.name())) {
            violations.add(new Violation("meta.name", "is required"));
        }
    }

    private void validateVbox(VBoxDeclaration vbox, List<Violation> violations) {
        if (vbox == null) {
            return;
        }
        if (vbox.paravirtProvider() != null && !PARAVIRT_PROVIDERS.contains(vbox.paravirtProvider())) {
            violations.add(new Violation("defaults.vbox.paravirt_provider",
                "must be one of " + sorted(PARAVIRT_PROVIDERS) + ", got '" + vbox.paravirtProvider() + "'"));
        }
        if (vbox.chipset() != null && !CHIPSETS.contains(vbox.chipset())) {
            violations.add(new Violation("defaults.vbox.chipset",
                "must be one of " + sorted(CHIPSETS) + ", got '" + vbox.chipset() + "'"));
        }
    }

    private Set<String> validateNodeNames(List<ExternalNode> nodes, List<Violation> violations) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            String name = nodes.get(i).name();
            String path = "nodes[" + i + "].name";
            if (isBlank(name)) {
                violations.add(new Violation(path, "is required"));
                continue;
            }
            if (!NODE_NAME.matcher(name).matches()) {
                violations.add(new Violation(path, "'" + name + "' may only contain letters, digits, '_' and '-'"));
            }
            if (!seen.add(name)) {
                violations.add(new Violation(path, "duplicate node name '" + name + "'"));
            }
        }
        return seen;
    }

    private void validateLinks(List<LinkDeclaration> links, Set<String> declared, List<Violation> violations) {
        for (int i = 0; i < links.size(); i++) {
            String path = "links[" + i + "].endpoints";
            List<String> endpoints = links.get(i).endpoints();
            if (endpoints.size() != 2) {
                violations.add(new Violation(path, "must name exactly 2 nodes, got " + endpoints.size()));
                continue;
            }
            boolean complete = true;
            for (int e = 0; e < 2; e++) {
                String endpoint = endpoints.get(e);
                if (isBlank(endpoint)) {
                    violations.add(new Violation(path + "[" + e + "]", "is required"));
                    complete = false;
                } else if (!declared.contains(endpoint)) {
                    violations.add(new Violation(path + "[" + e + "]", "unknown node '" + endpoint + "'"));
                }
            }
            if (complete && endpoints.get(0).equals(endpoints.get(1))) {
                violations.add(new Violation(path, "endpoints must differ, both are '" + endpoints.get(0) + "'"));
            }
        }
    }

    private void validateNode(String path, ExternalNode node, List<Violation> violations) {
        if (node.role() != null && NodeRole.fromValue(node.role()).isEmpty()) {
            violations.add(new Violation(path + ".role",
                "must be one of [host, router, switch], got '" + node.role() + "'"));
        }
        for (int i = 0; i < node.interfaces().size(); i++) {
            InterfaceDeclaration iface = node.interfaces().get(i);
            String ifacePath = path + ".interfaces[" + i + "]";
            requireCidr(ifacePath + ".ip", iface.ip(), violations);
            requireAddress(ifacePath + ".gateway", iface.gateway(), violations);
        }
        for (int i = 0; i < node.vlans().size(); i++) {
            validateVlan(path + ".vlans[" + i + "]", node.vlans().get(i), violations);
        }
        for (int i = 0; i < node.tunnels().size(); i++) {
            validateTunnel(path + ".tunnels[" + i + "]", node.tunnels().get(i), violations);
        }
        validateBridge(path + ".bridge", node.bridge(), violations);
        validateRouting(path + ".routing", node.routing(), subnetsOf(node), violations);
        validateServices(path + ".services", node.services(), violations);
    }

    private void validateVlan(String path, VlanDeclaration vlan, List<Violation> violations) {
        if (vlan.id() == null) {
            violations.add(new Violation(path + ".id", "is required"));
        } else if (vlan.id() < MIN_VLAN_ID || vlan.id() > MAX_VLAN_ID) {
            violations.add(new Violation(path + ".id",
                "must be between " + MIN_VLAN_ID + " and " + MAX_VLAN_ID + ", got " + vlan.id()));
        }
        if (isBlank(vlan.parent())) {
            violations.add(new Violation(path + ".parent", "is required"));
        }
        requireCidr(path + ".ip", vlan.ip(), violations);
        requireAddress(path + ".gateway", vlan.gateway(), violations);
    }

    private void validateTunnel(String path, TunnelDeclaration tunnel, List<Violation> violations) {
        if (tunnel.type() != null && TunnelType.fromValue(tunnel.type()).isEmpty()) {
            violations.add(new Violation(path + ".type",
                "must be one of [gre, ipip, sit], got '" + tunnel.type() + "'"));
        }
        if (tunnel.name() != null && isBlank(tunnel.name())) {
            violations.add(new Violation(path + ".name", "must not be blank"));
        }
        if (isBlank(tunnel.local())) {
            violations.add(new Violation(path + ".local", "is required"));
        } else {
            requireAddress(path + ".local", tunnel.local(), violations);
        }
        if (isBlank(tunnel.remote())) {
            violations.add(new Violation(path + ".remote", "is required"));
        } else {
            requireAddress(path + ".remote", tunnel.remote(), violations);
        }
        requireCidr(path + ".ip", tunnel.ip(), violations);
    }

    private void validateBridge(String path, BridgeDeclaration bridge, List<Violation> violations) {
        if (bridge != null && bridge.name() != null && isBlank(bridge.name())) {
            violations.add(new Violation(path + ".name", "must not be blank"));
        }
    }

    private void validateRouting(String path, RoutingDeclaration routing, List<String> subnets,
                                 List<Violation> violations) {
        if (routing == null) {
            return;
        }
        if (routing.engine() != null && RoutingEngine.fromValue(routing.engine()).isEmpty()) {
            violations.add(new Violation(path + ".engine",
                "must be one of [bird, frr, none], got '" + routing.engine() + "'"));
        }
        requireAddress(path + ".router_id", routing.routerId(), violations);
        for (int i = 0; i < routing.staticRoutes().size(); i++) {
            String route = routing.staticRoutes().get(i);
            String routePath = path + ".static[" + i + "]";
            StaticRoute parsed = StaticRoute.parse(route).orElse(null);
            if (parsed == null) {
                violations.add(new Violation(routePath, "expected '<destination> via <gateway>', got '" + route + "'"));
                continue;
            }
            if (!Ipv4.isCidr(parsed.destination()) && !Ipv4.isAddress(parsed.destination())
                && !"default".equals(parsed.destination())) {
                violations.add(new Violation(routePath, "destination '" + parsed.destination() + "' is not an IPv4 network"));
            }
            if (!Ipv4.isAddress(parsed.gateway())) {
                violations.add(new Violation(routePath, "gateway '" + parsed.gateway() + "' is not an IPv4 address"));
            } else if (!Boolean.FALSE.equals(routing.configured()) && !onAnySubnet(subnets, parsed.gateway())) {
                violations.add(new Violation(routePath,
                    "gateway '" + parsed.gateway() + "' is not on any subnet of the node " + subnets));
            }
        }
        if (routing.ospf() != null) {
            List<OspfAreaDeclaration> areas = routing.ospf().areas();
            for (int i = 0; i < areas.size(); i++) {
                String id = areas.get(i).id();
                if (id != null && !Ipv4.isAddress(id) && !id.trim().matches("\\d+")) {
                    violations.add(new Violation(path + ".ospf.areas[" + i + "].id",
                        "must be a dotted quad or a number, got '" + id + "'"));
                }
                requireNames(path + ".ospf.areas[" + i + "].interfaces", areas.get(i).interfaces(), violations);
            }
        }
        RipDeclaration rip = routing.rip();
        if (rip != null) {
            if (rip.version() != null && rip.version() != 1 && rip.version() != 2) {
                violations.add(new Violation(path + ".rip.version", "must be 1 or 2, got " + rip.version()));
            }
            requireNames(path + ".rip.interfaces", rip.interfaces(), violations);
        }
    }

    private void validateServices(String path, ServicesDeclaration services, List<Violation> violations) {
        if (services == null) {
            return;
        }
        requirePort(path + ".http_server", services.httpServer(), violations);
        WireguardDeclaration wireguard = services.wireguard();
        if (wireguard != null) {
            String wgPath = path + ".wireguard";
            if (isBlank(wireguard.privateKey())) {
                violations.add(new Violation(wgPath + ".private_key", "is required"));
            }
            if (wireguard.listenPort() == null) {
                violations.add(new Violation(wgPath + ".listen_port", "is required"));
            } else {
                requirePort(wgPath + ".listen_port", wireguard.listenPort(), violations);
            }
            if (isBlank(wireguard.address())) {
                violations.add(new Violation(wgPath + ".address", "is required"));
            } else {
                requireCidr(wgPath + ".address", wireguard.address(), violations);
            }
            for (int i = 0; i < wireguard.peers().size(); i++) {
                WireguardPeerDeclaration peer = wireguard.peers().get(i);
                String peerPath = wgPath + ".peers[" + i + "]";
                if (isBlank(peer.publicKey())) {
                    violations.add(new Violation(peerPath + ".public_key", "is required"));
                }
                if (isBlank(peer.allowedIps())) {
                    violations.add(new Violation(peerPath + ".allowed_ips", "is required"));
                }
            }
        }
        FirewallDeclaration firewall = services.firewall();
        if (firewall != null) {
            String fwPath = path + ".firewall";
            if (firewall.impl() != null && !FIREWALL_IMPLS.contains(firewall.impl())) {
                violations.add(new Violation(fwPath + ".impl",
                    "must be one of " + sorted(FIREWALL_IMPLS) + ", got '" + firewall.impl() + "'"));
            }
            for (int i = 0; i < firewall.rules().size(); i++) {
                FirewallRuleDeclaration rule = firewall.rules().get(i);
                String rulePath = fwPath + ".rules[" + i + "]";
                if (isBlank(rule.action())) {
                    violations.add(new Violation(rulePath + ".action", "is required"));
                } else if (!FIREWALL_ACTIONS.contains(rule.action())) {
                    violations.add(new Violation(rulePath + ".action",
                        "must be one of " + sorted(FIREWALL_ACTIONS) + ", got '" + rule.action() + "'"));
                }
                if (rule.proto() != null && !FIREWALL_PROTOCOLS.contains(rule.proto())) {
                    violations.add(new Violation(rulePath + ".proto",
                        "must be one of " + sorted(FIREWALL_PROTOCOLS) + ", got '" + rule.proto() + "'"));
                }
                if (rule.dport() != null && (rule.proto() == null || !PORT_PROTOCOLS.contains(rule.proto()))) {
                    violations.add(new Violation(rulePath + ".dport", "requires proto tcp or udp"));
                } else {
                    requirePort(rulePath + ".dport", rule.dport(), violations);
                }
            }
        }
    }

    /**
     * Every well-formed CIDR the node declares on an interface, VLAN or tunnel. A static route's
     * gateway has to sit on one of them, otherwise no generated file would carry the route.
     */
    private static List<String> subnetsOf(ExternalNode node) {
        List<String> subnets = new ArrayList<>();
        node.interfaces().forEach(iface -> addCidr(subnets, iface.ip()));
        node.vlans().forEach(vlan -> addCidr(subnets, vlan.ip()));
        node.tunnels().forEach(tunnel -> addCidr(subnets, tunnel.ip()));
        return subnets;
    }

    private static void addCidr(List<String> subnets, String value) {
        if (value != null && Ipv4.isCidr(value)) {
            subnets.add(value);
        }
    }

    private static boolean onAnySubnet(List<String> subnets, String address) {
        return subnets.stream().anyMatch(cidr -> Ipv4.contains(cidr, address));
    }

    private static void requireCidr(String path, String value, List<Violation> violations) {
        if (value != null && !Ipv4.isCidr(value)) {
            violations.add(new Violation(path, "'" + value + "' is not an IPv4 CIDR (a.b.c.d/nn)"));
        }
    }

    private static void requireAddress(String path, String value, List<Violation> violations) {
        if (value != null && !Ipv4.isAddress(value)) {
            violations.add(new Violation(path, "'" + value + "' is not an IPv4 address"));
        }
    }

    private static void requirePort(String path, Integer port, List<Violation> violations) {
        if (port != null && (port < 1 || port > 65535)) {
            violations.add(new Violation(path, "must be between 1 and 65535, got " + port));
        }
    }

    private static void requireNames(String path, List<String> names, List<Violation> violations) {
        for (int i = 0; i < names.size(); i++) {
            if (isBlank(names.get(i))) {
                violations.add(new Violation(path + "[" + i + "]", "must not be blank"));
            }
        }
    }

    private static List<String> sorted(Set<String> values) {
        return values.stream().sorted().toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
