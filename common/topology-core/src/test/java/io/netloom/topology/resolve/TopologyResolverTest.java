package io.netloom.topology.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.netloom.topology.TopologyException;
import io.netloom.topology.load.TopologyLoader;
import io.netloom.topology.load.TopologyLoaderFixtures;
import io.netloom.topology.model.BridgeDeclaration;
import io.netloom.topology.model.Defaults;
import io.netloom.topology.model.ExternalNode;
import io.netloom.topology.model.ExternalTopology;
import io.netloom.topology.model.InterfaceDeclaration;
import io.netloom.topology.model.LinkDeclaration;
import io.netloom.topology.model.Meta;
import io.netloom.topology.model.NodeRole;
import io.netloom.topology.model.OspfAreaDeclaration;
import io.netloom.topology.model.OspfDeclaration;
import io.netloom.topology.model.RoutingDeclaration;
import io.netloom.topology.model.RoutingEngine;
import io.netloom.topology.model.TunnelDeclaration;
import io.netloom.topology.model.TunnelType;
import io.netloom.topology.model.VlanDeclaration;
import io.netloom.topology.resolved.InterfaceRef;
import io.netloom.topology.resolved.InternalInterface;
import io.netloom.topology.resolved.InternalNode;
import io.netloom.topology.resolved.InternalTopology;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TopologyResolverTest {

    private final TopologyResolver resolver = new TopologyResolver();

    @Test
    @DisplayName("Interfaces are numbered per node in link order")
    void numbersInterfacesByLinkOrder() {
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("A", "B"), LinkDeclaration.between("B", "C"), LinkDeclaration.between("A", "D")),
            ExternalNode.named("A", null, List.of(InterfaceDeclaration.withIp("10.0.1.1/24"), InterfaceDeclaration.withIp("10.0.3.1/24"))),
            ExternalNode.named("B", null, List.of(InterfaceDeclaration.withIp("10.0.1.2/24"), InterfaceDeclaration.withIp("10.0.2.1/24"))),
            ExternalNode.named("C", null, List.of(InterfaceDeclaration.withIp("10.0.2.2/24"))),
            ExternalNode.named("D", null, List.of()));

        InternalTopology resolved = resolver.resolve(topology);

        assertThat(resolved.peerOf(new InterfaceRef("A", "eth1"))).contains(new InterfaceRef("B", "eth1"));
        assertThat(resolved.peerOf(new InterfaceRef("B", "eth2"))).contains(new InterfaceRef("C", "eth1"));
        assertThat(resolved.peerOf(new InterfaceRef("A", "eth2"))).contains(new InterfaceRef("D", "eth1"));

        InternalNode a = resolved.node("A");
        assertThat(a.interfaces()).extracting(InternalInterface::name).containsExactly("eth1", "eth2");
        assertThat(a.interfaces()).extracting(InternalInterface::ip).containsExactly("10.0.1.1/24", "10.0.3.1/24");
        assertThat(a.interfaceNamed("eth2").orElseThrow().peerNode()).isEqualTo("D");
        assertThat(resolved.node("D").interfaces().get(0).ip()).isNull();
        assertThat(resolved.links()).extracting(l -> l.segment())
            .containsExactly("t_A_B", "t_B_C", "t_A_D");
    }

    @Test
    @DisplayName("Repeated links between the same pair get distinct segments")
    void parallelLinksGetDistinctSegments() {
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("B", "A"), LinkDeclaration.between("A", "B")),
            ExternalNode.named("A", null, List.of()),
            ExternalNode.named("B", null, List.of()));

        InternalTopology resolved = resolver.resolve(topology);

        assertThat(resolved.links()).extracting(l -> l.segment()).containsExactly("t_A_B", "t_A_B_2");
        assertThat(resolved.node("A").interfaces()).extracting(InternalInterface::peerInterface)
            .containsExactly("eth1", "eth2");
    }

    @Test
    @DisplayName("Node sysctl keys override topology defaults")
    void mergesSysctl() {
        Defaults defaults = new Defaults(false, Map.of("x", 1, "y", 2), null);
        ExternalNode node = new ExternalNode("A", "host", Map.of("y", 3, "z", 4), null, null, null, null, null, null, null);
        ExternalTopology topology = new ExternalTopology(new Meta("t", "T", null), defaults, List.of(), List.of(node));

        InternalNode resolved = resolver.resolve(topology).node("A");

        assertThat(resolved.sysctl().entries()).containsOnly(Map.entry("x", 1), Map.entry("y", 3), Map.entry("z", 4));
        assertThat(resolved.sysctl().ipForwarding()).isFalse();
    }

    @Test
    @DisplayName("Routers always forward")
    void routersForward() {
        ExternalTopology topology = topology(List.of(), ExternalNode.named("R", "router", List.of()));

        assertThat(resolver.resolve(topology).node("R").sysctl().ipForwarding()).isTrue();
    }

    @Test
    @DisplayName("A link to an undeclared node is rejected")
    void rejectsDanglingLink() {
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("R1", "R9")),
            ExternalNode.named("R1", null, List.of()));

        assertThatThrownBy(() -> resolver.resolve(topology))
            .isInstanceOf(UnresolvedPeerException.class)
            .satisfies(e -> {
                UnresolvedPeerException ex = (UnresolvedPeerException) e;
                assertThat(ex.nodeName()).isEqualTo("R9");
                assertThat(ex.linkIndex()).isZero();
            });
    }

    @Test
    @DisplayName("A VLAN id outside 1-4094 is refused even when validation was skipped")
    void rejectsVlanIdOutOfRange() {
        ExternalNode node = new ExternalNode("A", null, null, null,
            List.of(new VlanDeclaration(99_999_999_999L, "eth1", null, null)), null, null, null, null, null);
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("A", "B")), node, ExternalNode.named("B", null, List.of()));

        assertThatThrownBy(() -> resolver.resolve(topology))
            .isInstanceOf(TopologyException.class)
            .hasMessageContaining("99999999999")
            .hasMessageContaining("'A'");
    }

    @Test
    @DisplayName("A VLAN parent must be one of the node's interfaces")
    void rejectsUnknownVlanParent() {
        ExternalNode node = new ExternalNode("A", null, null, null,
            List.of(new VlanDeclaration(10L, "eth9", null, null)), null, null, null, null, null);
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("A", "B")), node, ExternalNode.named("B", null, List.of()));

        assertThatThrownBy(() -> resolver.resolve(topology))
            .isInstanceOf(VlanParentNotFoundException.class)
            .satisfies(e -> {
                VlanParentNotFoundException ex = (VlanParentNotFoundException) e;
                assertThat(ex.nodeName()).isEqualTo("A");
                assertThat(ex.vlanId()).isEqualTo(10);
                assertThat(ex.parent()).isEqualTo("eth9");
            });
    }

    @Test
    @DisplayName("Routing may only name interfaces or VLANs the node has")
    void rejectsUnknownRoutingInterface() {
        RoutingDeclaration routing = new RoutingDeclaration("bird", null, null,
            new OspfDeclaration(true, List.of(new OspfAreaDeclaration(null, List.of("eth1", "eth3")))), null, null);
        ExternalNode node = new ExternalNode("A", "router", null, null, null, null, null, routing, null, null);
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("A", "B")), node, ExternalNode.named("B", null, List.of()));

        assertThatThrownBy(() -> resolver.resolve(topology))
            .isInstanceOf(UnknownInterfaceReferenceException.class)
            .hasMessageContaining("eth3")
            .hasMessageContaining("OSPF area 0.0.0.0");
    }

    @Test
    @DisplayName("A tunnel may not reuse an interface name")
    void rejectsDuplicateNames() {
        ExternalNode node = new ExternalNode("A", null, null, null, null,
            List.of(new TunnelDeclaration("eth1", null, "10.0.0.1", "10.0.0.2", null)), null, null, null, null);
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("A", "B")), node, ExternalNode.named("B", null, List.of()));

        assertThatThrownBy(() -> resolver.resolve(topology))
            .isInstanceOf(DuplicateInterfaceAssignmentException.class)
            .satisfies(e -> assertThat(((DuplicateInterfaceAssignmentException) e).interfaceName()).isEqualTo("eth1"));
    }

    @Test
    @DisplayName("Self links are rejected")
    void rejectsSelfLink() {
        ExternalTopology topology = topology(List.of(LinkDeclaration.between("A", "A")), ExternalNode.named("A", null, List.of()));

        assertThatThrownBy(() -> resolver.resolve(topology)).isInstanceOf(TopologyException.class);
    }

    @Test
    @DisplayName("Defaults are applied to tunnels, bridges, routing and vbox")
    void appliesDefaults() throws Exception {
        InternalTopology resolved = resolver.resolve(new TopologyLoader().load(
            TopologyLoaderFixtures.path("full-featured.yaml")));

        assertThat(resolved.vbox().chipset()).isEqualTo("piix3");
        assertThat(resolved.vbox().paravirtProvider()).isEqualTo("kvm");

        InternalNode r1 = resolved.node("R1");
        assertThat(r1.tunnels()).singleElement().satisfies(t -> {
            assertThat(t.name()).isEqualTo("tun0");
            assertThat(t.type()).isEqualTo(TunnelType.GRE);
        });
        assertThat(r1.vlans()).singleElement().satisfies(v -> assertThat(v.name()).isEqualTo("eth1.20"));
        assertThat(r1.routing().engine()).isEqualTo(RoutingEngine.BIRD);
        assertThat(r1.routing().configured()).isTrue();
        assertThat(r1.routing().ospfAreas().get(0).id()).isEqualTo("0.0.0.0");
        assertThat(r1.routing().staticRoutes().get(0).gateway()).isEqualTo("10.0.12.2");
        assertThat(r1.sysctl().entries()).containsEntry("y", 3).containsEntry("x", 1);

        InternalNode sw1 = resolved.node("SW1");
        assertThat(sw1.role()).isEqualTo(NodeRole.SWITCH);
        assertThat(sw1.bridge().name()).isEqualTo("br0");
        assertThat(sw1.bridge().interfaces()).containsExactly("eth1", "eth2");
        assertThat(sw1.bridgeActive()).isTrue();

        assertThat(resolved.node("R2").routing().rip().version()).isEqualTo(2);
        assertThat(resolved.node("H2").interfaces().get(0).configured()).isFalse();
        assertThat(resolved.node("H1").role()).isEqualTo(NodeRole.HOST);
    }

    @Test
    @DisplayName("Unconfigured entities still take part in resolution")
    void unconfiguredInterfaceKeepsPeer() {
        ExternalTopology topology = topology(
            List.of(LinkDeclaration.between("A", "B")),
            ExternalNode.named("A", null, List.of(new InterfaceDeclaration("10.0.0.1/30", null, false))),
            ExternalNode.named("B", null, List.of(InterfaceDeclaration.withIp("10.0.0.2/30"))));

        InternalTopology resolved = resolver.resolve(topology);

        InternalInterface a = resolved.node("A").interfaces().get(0);
        assertThat(a.configured()).isFalse();
        assertThat(a.peer()).isEqualTo(new InterfaceRef("B", "eth1"));
        assertThat(resolved.peerOf(new InterfaceRef("B", "eth1"))).contains(new InterfaceRef("A", "eth1"));
    }

    @Test
    @DisplayName("Extra interface entries and bridges on non-switches are tolerated")
    void toleratesExtraDeclarations() {
        ExternalNode host = new ExternalNode("H", null, null,
            List.of(InterfaceDeclaration.withIp("10.0.0.1/30"), InterfaceDeclaration.withIp("10.0.9.1/30")),
            null, null, new BridgeDeclaration(null, null, null), null, null, null);
        ExternalTopology topology = topology(List.of(LinkDeclaration.between("H", "B")), host, ExternalNode.named("B", null, List.of()));

        InternalNode resolved = resolver.resolve(topology).node("H");

        assertThat(resolved.interfaces()).hasSize(1);
        assertThat(resolved.bridge()).isNotNull();
        assertThat(resolved.bridgeActive()).isFalse();
    }

    @Test
    @DisplayName("Resolution is deterministic")
    void isDeterministic() throws Exception {
        ExternalTopology topology = new TopologyLoader().load(
            TopologyLoaderFixtures.path("full-featured.yaml"));

        InternalTopology first = resolver.resolve(topology);
        InternalTopology second = resolver.resolve(topology);

        assertThat(second.nodes()).isEqualTo(first.nodes());
        assertThat(second.links()).isEqualTo(first.links());
    }

    private static ExternalTopology topology(List<LinkDeclaration> links, ExternalNode... nodes) {
        return new ExternalTopology(new Meta("t", "T", null), null, links, List.of(nodes));
    }
}
