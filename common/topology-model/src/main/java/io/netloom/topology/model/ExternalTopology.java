package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;

/**
 * Topology document exactly as the user declared it. Defaults are not applied here; that is the
 * resolver's job, so a value that is {@code null} was absent from the document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalTopology(Meta meta,
                               Defaults defaults,
                               List<LinkDeclaration> links,
                               List<ExternalNode> nodes) {
    public ExternalTopology {
        links = links == null ? List.of() : List.copyOf(links);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public Optional<ExternalNode> node(String name) {
        return nodes.stream().filter(n -> n.name() != null && n.name().equals(name)).findFirst();
    }
}
