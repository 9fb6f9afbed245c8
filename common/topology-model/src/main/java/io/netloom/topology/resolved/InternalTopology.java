package io.netloom.topology.resolved;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable resolved topology. Nodes keep declaration order; links keep link-list order.
 * <p>
 * Peer relationships are answered from a table keyed by {@link InterfaceRef} that is built from the
 * links, so interfaces never point at each other directly.
 */
public final class InternalTopology {

    private final String id;
    private final String name;
    private final String description;
    private final VirtualBoxSettings vbox;
    private final Map<String, InternalNode> nodes;
    private final List<InternalLink> links;
    private final Map<InterfaceRef, InterfaceRef> peers;

    public InternalTopology(String id,
                            String name,
                            String description,
                            VirtualBoxSettings vbox,
                            Map<String, InternalNode> nodes,
                            List<InternalLink> links) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.vbox = Objects.requireNonNullElse(vbox, VirtualBoxSettings.DEFAULTS);
        this.nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.links = links == null ? List.of() : List.copyOf(links);
        Map<InterfaceRef, InterfaceRef> table = new HashMap<>();
        for (InternalLink link : this.links) {
            table.put(link.a(), link.b());
            table.put(link.b(), link.a());
        }
        this.peers = Map.copyOf(table);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public VirtualBoxSettings vbox() {
        return vbox;
    }

    public Map<String, InternalNode> nodes() {
        return nodes;
    }

    public List<InternalLink> links() {
        return links;
    }

    public InternalNode node(String nodeName) {
        InternalNode node = nodes.get(nodeName);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + nodeName);
        }
        return node;
    }

    public List<InternalLink> linksOf(String nodeName) {
        return links.stream().filter(l -> l.touches(nodeName)).collect(Collectors.toList());
    }

    public Optional<InterfaceRef> peerOf(InterfaceRef ref) {
        return Optional.ofNullable(peers.get(ref));
    }

    public Optional<InternalInterface> interfaceOf(InterfaceRef ref) {
        InternalNode node = nodes.get(ref.node());
        return node == null ? Optional.empty() : node.interfaceNamed(ref.iface());
    }

    @Override
    public String toString() {
        return "InternalTopology[" + id + ", nodes=" + nodes.keySet() + ", links=" + links.size() + "]";
    }
}
