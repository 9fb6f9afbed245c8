package io.netloom.topology.resolved;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.netloom.topology.model.NodeRole;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InternalTopologyTest {

    @Test
    void answersPeerLookupsFromLinks() {
        InternalTopology topology = twoNodes();

        assertThat(topology.peerOf(new InterfaceRef("A", "eth1"))).contains(new InterfaceRef("B", "eth1"));
        assertThat(topology.peerOf(new InterfaceRef("B", "eth1"))).contains(new InterfaceRef("A", "eth1"));
        assertThat(topology.peerOf(new InterfaceRef("A", "eth9"))).isEmpty();
        assertThat(topology.interfaceOf(new InterfaceRef("B", "eth1")))
            .hasValueSatisfying(iface -> assertThat(iface.ip()).isEqualTo("10.0.0.2/30"));
    }

    @Test
    void keepsDeclarationOrderAndRejectsUnknownNodes() {
        InternalTopology topology = twoNodes();

        assertThat(topology.nodes().keySet()).containsExactly("A", "B");
        assertThat(topology.linksOf("B")).hasSize(1);
        assertThat(topology.vbox()).isEqualTo(VirtualBoxSettings.DEFAULTS);
        assertThatThrownBy(() -> topology.node("C")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> topology.nodes().put("C", null)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void sysctlMergeLetsNodeKeysWin() {
        Sysctl merged = Sysctl.merge(false, Map.of("x", 1, "y", 2), Map.of("y", 3, "z", 4));

        assertThat(merged.entries()).containsOnly(
            Map.entry("x", 1), Map.entry("y", 3), Map.entry("z", 4));
    }

    private static InternalTopology twoNodes() {
        InternalInterface a = new InternalInterface("eth1", 1, "10.0.0.1/30", null, true, "02:00:00:00:00:01", "B", "eth1", "t_A_B");
        InternalInterface b = new InternalInterface("eth1", 1, "10.0.0.2/30", null, true, "02:00:00:00:00:02", "A", "eth1", "t_A_B");
        Map<String, InternalNode> nodes = new LinkedHashMap<>();
        nodes.put("A", new InternalNode("A", NodeRole.ROUTER, List.of(a), null, null, null, null, null, null, null));
        nodes.put("B", new InternalNode("B", NodeRole.HOST, List.of(b), null, null, null, null, null, null, null));
        InternalLink link = new InternalLink(new InterfaceRef("A", "eth1"), new InterfaceRef("B", "eth1"), "t_A_B");
        return new InternalTopology("t", "T", null, null, nodes, List.of(link));
    }
}
