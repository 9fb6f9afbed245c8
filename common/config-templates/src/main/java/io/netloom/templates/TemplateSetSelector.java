package io.netloom.templates;

import io.netloom.topology.model.RoutingEngine;
import io.netloom.topology.resolved.InternalNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decides which template sets apply to a node. Sets are returned in the order they are rendered:
 * base, routing, firewall, wireguard. When two sets produce the same output path the later set wins.
 */
public final class TemplateSetSelector {

    public static final String DEFAULT_BASE_SET = "networkd";
    public static final String BIRD = "bird";
    public static final String FRR = "frr";
    public static final String NFTABLES = "nftables";
    public static final String WIREGUARD = "wireguard";

    public List<String> select(InternalNode node, String requestedBaseSet) {
        Objects.requireNonNull(node, "node");
        List<String> sets = new ArrayList<>(4);
        sets.add(requestedBaseSet == null || requestedBaseSet.isBlank() ? DEFAULT_BASE_SET : requestedBaseSet.trim());
        if (node.routing() != null) {
            RoutingEngine engine = node.routing().engine();
            if (engine == RoutingEngine.BIRD) {
                sets.add(BIRD);
            } else if (engine == RoutingEngine.FRR) {
                sets.add(FRR);
            }
        }
        if (node.hasFirewall()) {
            sets.add(NFTABLES);
        }
        if (node.hasWireguard()) {
            sets.add(WIREGUARD);
        }
        return List.copyOf(sets);
    }
}
