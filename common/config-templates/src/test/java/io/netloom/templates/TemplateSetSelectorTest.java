package io.netloom.templates;

import static org.assertj.core.api.Assertions.assertThat;

import io.netloom.topology.resolved.InternalTopology;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class TemplateSetSelectorTest {

    private static InternalTopology campus;

    private final TemplateSetSelector selector = new TemplateSetSelector();

    @BeforeAll
    static void loadTopology() {
        campus = Topologies.fixture("full-featured.yaml");
    }

    @Test
    void hostGetsBaseSetOnly() {
        assertThat(selector.select(campus.node("H1"), "networkd")).containsExactly("networkd");
    }

    @Test
    void birdRouterWithFirewall() {
        assertThat(selector.select(campus.node("R1"), "networkd"))
            .containsExactly("networkd", "bird", "nftables");
    }

    @Test
    void frrRouterWithWireguard() {
        assertThat(selector.select(campus.node("R2"), "custom"))
            .containsExactly("custom", "frr", "wireguard");
    }

    @Test
    void blankBaseFallsBackToDefault() {
        assertThat(selector.select(campus.node("SW1"), " ")).containsExactly(TemplateSetSelector.DEFAULT_BASE_SET);
        assertThat(selector.select(campus.node("SW1"), null)).containsExactly("networkd");
    }
}
