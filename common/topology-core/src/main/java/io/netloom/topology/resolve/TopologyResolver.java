package io.netloom.topology.resolve;

import io.netloom.topology.TopologyException;
import io.netloom.topology.model.BridgeDeclaration;
import io.netloom.topology.model.Defaults;
import io.netloom.topology.model.ExternalNode;
import io.netloom.topology.model.ExternalTopology;
import io.netloom.topology.model.InterfaceDeclaration;
import io.netloom.topology.model.LinkDeclaration;
import io.netloom.topology.model.NodeRole;
import io.netloom.topology.model.OspfAreaDeclaration;
import io.netloom.topology.model.RoutingDeclaration;
import io.netloom.topology.model.RoutingEngine;
import io.netloom.topology.model.TunnelDeclaration;
import io.netloom.topology.model.TunnelType;
import io.netloom.topology.model.VBoxDeclaration;
import io.netloom.topology.model.VlanDeclaration;
import io.netloom.topology.resolved.InterfaceRef;
import io.netloom.topology.resolved.InternalBridge;
import io.netloom.topology.resolved.InternalInterface;
import io.netloom.topology.resolved.InternalLink;
import io.netloom.topology.resolved.InternalNode;
import io.netloom.topology.resolved.InternalOspfArea;
import io.netloom.topology.resolved.InternalRip;
import io.netloom.topology.resolved.InternalRouting;
import io.netloom.topology.resolved.InternalTopology;
import io.netloom.topology.resolved.InternalTunnel;
import io.netloom.topology.resolved.InternalVlan;
import io.netloom.topology.resolved.StaticRoute;
import io.netloom.topology.resolved.Sysctl;
import io.netloom.topology.resolved.VirtualBoxSettings;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a validated {@link ExternalTopology} into an immutable {@link InternalTopology}.
 * <p>
 * Interfaces are numbered per node in link-list order: the Nth link touching a node creates
 * {@code eth<N>} and binds the node's Nth declared interface entry. The resolver is pure; the same
 * document always yields an equal topology.
 */
public final class TopologyResolver {

    private static final Logger log = LoggerFactory.getLogger(TopologyResolver.class);

    static final String INTERFACE_PREFIX = "eth";
    static final String DEFAULT_TUNNEL_NAME = "tun0";

    public InternalTopology resolve(ExternalTopology topology) {
        Objects.requireNonNull(topology, "topology");
        if (topology.meta() == null || topology.meta().id() == null || topology.meta().name() == null) {
            throw new TopologyException("Topology meta.id and meta.name are required");
        }
        String topologyId = topology.meta().id();
        Defaults defaults = topology.defaults() != null ? topology.defaults() : new Defaults(false, null, null);

        Map<String, ExternalNode> registry = registry(topology.nodes());
        Map<String, List<Slot>> slots = new HashMap<>();
        List<InternalLink> links = bindLinks(topologyId, topology.links(), registry, slots);

        Map<String, InternalNode> nodes = new LinkedHashMap<>();
        for (ExternalNode declared : registry.values()) {
            InternalNode node = resolveNode(topologyId, declared, slots.getOrDefault(declared.name(), List.of()), defaults);
            nodes.put(node.name(), node);
            log.debug("Resolved node {} ({}) with {} interface(s), {} VLAN(s), {} tunnel(s)", node.name(),
                node.role().value(), node.interfaces().size(), node.vlans().size(), node.tunnels().size());
        }

        InternalTopology resolved = new InternalTopology(topologyId, topology.meta().name(),
            topology.meta().description(), vbox(defaults.vbox()), nodes, links);
        log.info("Resolved topology '{}': {} node(s), {} link(s)", topologyId, nodes.size(), links.size());
        return resolved;
    }

    private static Map<String, ExternalNode> registry(List<ExternalNode> declared) {
        Map<String, ExternalNode> registry = new LinkedHashMap<>();
        for (ExternalNode node : declared) {
            if (node.name() == null || node.name().isBlank()) {
                throw new TopologyException("Node without a name");
            }
            if (registry.putIfAbsent(node.name(), node) != null) {
                throw new TopologyException("Duplicate node name '" + node.name() + "'");
            }
        }
        return registry;
    }

    private static List<InternalLink> bindLinks(String topologyId,
                                                List<LinkDeclaration> declared,
                                                Map<String, ExternalNode> registry,
                                                Map<String, List<Slot>> slots) {
        Map<String, Integer> counters = new HashMap<>();
        Map<String, Integer> segmentUses = new HashMap<>();
        List<InternalLink> links = new ArrayList<>(declared.size());
        for (int i = 0; i < declared.size(); i++) {
            List<String> endpoints = declared.get(i).endpoints();
            if (endpoints.size() != 2) {
                throw new TopologyException("links[" + i + "] must name exactly 2 nodes, got " + endpoints.size());
            }
            String a = endpoints.get(0);
            String b = endpoints.get(1);
            for (String endpoint : endpoints) {
                if (endpoint == null || !registry.containsKey(endpoint)) {
                    throw new UnresolvedPeerException(i, endpoint);
                }
            }
            if (a.equals(b)) {
                throw new TopologyException("links[" + i + "] connects node '" + a + "' to itself");
            }
            int indexA = counters.merge(a, 1, Integer::sum);
            int indexB = counters.merge(b, 1, Integer::sum);
            InterfaceRef refA = new InterfaceRef(a, INTERFACE_PREFIX + indexA);
            InterfaceRef refB = new InterfaceRef(b, INTERFACE_PREFIX + indexB);
            String segment = segmentName(topologyId, a, b, segmentUses);
            links.add(new InternalLink(refA, refB, segment));
            slots.computeIfAbsent(a, k -> new ArrayList<>()).add(new Slot(indexA, refB, segment));
            slots.computeIfAbsent(b, k -> new ArrayList<>()).add(new Slot(indexB, refA, segment));
        }
        return links;
    }

    private static String segmentName(String topologyId, String a, String b, Map<String, Integer> uses) {
        String low = a.compareTo(b) <= 0 ? a : b;
        String high = low.equals(a) ? b : a;
        String base = topologyId + "_" + low + "_" + high;
        int use = uses.merge(base, 1, Integer::sum);
        return use == 1 ? base : base + "_" + use;
    }

    private InternalNode resolveNode(String topologyId, ExternalNode declared, List<Slot> slots, Defaults defaults) {
        String nodeName = declared.name();
        NodeRole role = role(declared);
        Set<String> names = new HashSet<>();

        List<InternalInterface> interfaces = interfaces(topologyId, declared, slots, names);
        Set<String> interfaceNames = interfaces.stream().map(InternalInterface::name).collect(Collectors.toSet());
        List<InternalVlan> vlans = vlans(nodeName, declared.vlans(), interfaceNames, names);
        List<InternalTunnel> tunnels = tunnels(nodeName, declared.tunnels(), names);
        InternalBridge bridge = bridge(declared.bridge(), role, nodeName, interfaces);
        if (bridge != null && bridge.configured() && role == NodeRole.SWITCH && !vlans.isEmpty()) {
            log.warn("Switch {} bridges all of its ports; its {} VLAN(s) produce no configuration",
                nodeName, vlans.size());
        }
        Set<String> routable = new HashSet<>(interfaceNames);
        vlans.forEach(vlan -> routable.add(vlan.name()));
        InternalRouting routing = routing(nodeName, declared.routing(), routable);
        Sysctl sysctl = Sysctl.merge(defaults.ipForwarding() || role == NodeRole.ROUTER,
            defaults.sysctl(), declared.sysctl());

        return new InternalNode(nodeName, role, interfaces, vlans, tunnels, bridge, sysctl, routing,
            declared.services(), declared.commands());
    }

    private static NodeRole role(ExternalNode declared) {
        if (declared.role() == null) {
            return NodeRole.DEFAULT;
        }
        return NodeRole.fromValue(declared.role()).orElseThrow(() ->
            new TopologyException("Node '" + declared.name() + "' has unknown role '" + declared.role() + "'"));
    }

    private static List<InternalInterface> interfaces(String topologyId,
                                                      ExternalNode declared,
                                                      List<Slot> slots,
                                                      Set<String> names) {
        List<InterfaceDeclaration> entries = declared.interfaces();
        if (entries.size() > slots.size()) {
            log.warn("Node {} declares {} interface(s) but only {} link(s) touch it; extra entries are ignored",
                declared.name(), entries.size(), slots.size());
        }
        List<InternalInterface> interfaces = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            String name = INTERFACE_PREFIX + slot.index();
            claim(declared.name(), name, names);
            InterfaceDeclaration entry = slot.index() <= entries.size() ? entries.get(slot.index() - 1) : null;
            String ip = entry == null ? null : entry.ip();
            String gateway = entry == null ? null : entry.gateway();
            boolean configured = entry == null || entry.configured() == null || entry.configured();
            interfaces.add(new InternalInterface(name, slot.index(), ip, gateway, configured,
                MacAddresses.of(topologyId, declared.name(), name),
                slot.peer().node(), slot.peer().iface(), slot.segment()));
        }
        return interfaces;
    }

    private static List<InternalVlan> vlans(String nodeName,
                                            List<VlanDeclaration> declared,
                                            Set<String> interfaceNames,
                                            Set<String> names) {
        List<InternalVlan> vlans = new ArrayList<>(declared.size());
        for (VlanDeclaration vlan : declared) {
            if (vlan.id() == null) {
                throw new TopologyException("VLAN without id on node '" + nodeName + "'");
            }
            if (vlan.id() < 1 || vlan.id() > 4094) {
                throw new TopologyException("VLAN id " + vlan.id() + " on node '" + nodeName + "' is outside 1-4094");
            }
            int id = vlan.id().intValue();
            if (vlan.parent() == null || !interfaceNames.contains(vlan.parent())) {
                throw new VlanParentNotFoundException(nodeName, id, vlan.parent());
            }
            String name = InternalVlan.nameOf(vlan.parent(), id);
            claim(nodeName, name, names);
            vlans.add(new InternalVlan(id, vlan.parent(), name, vlan.ip(), vlan.gateway()));
        }
        return vlans;
    }

    private static List<InternalTunnel> tunnels(String nodeName, List<TunnelDeclaration> declared, Set<String> names) {
        List<InternalTunnel> tunnels = new ArrayList<>(declared.size());
        for (TunnelDeclaration tunnel : declared) {
            String name = tunnel.name() != null ? tunnel.name() : DEFAULT_TUNNEL_NAME;
            claim(nodeName, name, names);
            TunnelType type = tunnel.type() == null
                ? TunnelType.DEFAULT
                : TunnelType.fromValue(tunnel.type()).orElseThrow(() ->
                    new TopologyException("Tunnel '" + name + "' on node '" + nodeName + "' has unknown type '" + tunnel.type() + "'"));
            tunnels.add(new InternalTunnel(name, type, tunnel.local(), tunnel.remote(), tunnel.ip()));
        }
        return tunnels;
    }

    private static InternalBridge bridge(BridgeDeclaration declared,
                                         NodeRole role,
                                         String nodeName,
                                         List<InternalInterface> interfaces) {
        if (declared == null) {
            return null;
        }
        if (role != NodeRole.SWITCH) {
            log.warn("Node {} declares a bridge but has role {}; the bridge is ignored", nodeName, role.value());
        }
        List<String> members = interfaces.stream().map(InternalInterface::name).collect(Collectors.toList());
        return new InternalBridge(
            declared.name() != null ? declared.name() : InternalBridge.DEFAULT_NAME,
            Boolean.TRUE.equals(declared.stp()),
            declared.configured() == null || declared.configured(),
            members);
    }

    private static InternalRouting routing(String nodeName, RoutingDeclaration declared, Set<String> routable) {
        if (declared == null) {
            return null;
        }
        RoutingEngine engine = declared.engine() == null
            ? RoutingEngine.NONE
            : RoutingEngine.fromValue(declared.engine()).orElseThrow(() ->
                new TopologyException("Node '" + nodeName + "' has unknown routing engine '" + declared.engine() + "'"));

        List<StaticRoute> staticRoutes = new ArrayList<>(declared.staticRoutes().size());
        for (String route : declared.staticRoutes()) {
            staticRoutes.add(StaticRoute.parse(route).orElseThrow(() ->
                new TopologyException("Node '" + nodeName + "' has malformed static route '" + route + "'")));
        }

        boolean ospfEnabled = declared.ospf() != null && declared.ospf().enabled();
        List<InternalOspfArea> areas = new ArrayList<>();
        if (declared.ospf() != null) {
            for (OspfAreaDeclaration area : declared.ospf().areas()) {
                String id = area.id() != null ? area.id() : InternalOspfArea.BACKBONE;
                requireKnown(nodeName, area.interfaces(), routable, "OSPF area " + id);
                areas.add(new InternalOspfArea(id, area.interfaces()));
            }
        }

        InternalRip rip = null;
        if (declared.rip() != null) {
            requireKnown(nodeName, declared.rip().interfaces(), routable, "RIP");
            int version = declared.rip().version() != null ? declared.rip().version() : InternalRip.DEFAULT_VERSION;
            rip = new InternalRip(declared.rip().enabled(), version, declared.rip().interfaces());
        }

        return new InternalRouting(engine, declared.routerId(), staticRoutes, ospfEnabled, areas, rip,
            declared.configured() == null || declared.configured());
    }

    private static void requireKnown(String nodeName, List<String> referenced, Set<String> names, String where) {
        for (String name : referenced) {
            if (!names.contains(name)) {
                throw new UnknownInterfaceReferenceException(nodeName, name, where);
            }
        }
    }

    private static void claim(String nodeName, String interfaceName, Set<String> names) {
        if (!names.add(interfaceName)) {
            throw new DuplicateInterfaceAssignmentException(nodeName, interfaceName);
        }
    }

    private static VirtualBoxSettings vbox(VBoxDeclaration declared) {
        if (declared == null) {
            return VirtualBoxSettings.DEFAULTS;
        }
        VirtualBoxSettings defaults = VirtualBoxSettings.DEFAULTS;
        return new VirtualBoxSettings(
            declared.paravirtProvider() != null ? declared.paravirtProvider() : defaults.paravirtProvider(),
            declared.chipset() != null ? declared.chipset() : defaults.chipset(),
            declared.ioapic() != null ? declared.ioapic() : defaults.ioapic(),
            declared.hpet() != null ? declared.hpet() : defaults.hpet());
    }

    /**
     * Interface position reserved on a node by one link, with the other side of that link.
     */
    private record Slot(int index, InterfaceRef peer, String segment) {
    }
}
