package io.netloom.templates;

import io.netloom.topology.resolved.InternalNode;
import io.netloom.topology.resolved.InternalTopology;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Variables one template evaluation sees: {@code node}, {@code topology} and, for per-entity
 * templates, the entity under its variable name ({@code iface}, {@code vlan} or {@code tunnel}).
 * {@code entityName} is what goes into the output path.
 */
record RenderContext(InternalNode node,
                     InternalTopology topology,
                     String entityVariable,
                     Object entity,
                     String entityName) {

    RenderContext {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(topology, "topology");
    }

    static RenderContext forNode(InternalNode node, InternalTopology topology) {
        return new RenderContext(node, topology, null, null, null);
    }

    static RenderContext forEntity(InternalNode node, InternalTopology topology,
                                   String variable, Object entity, String entityName) {
        return new RenderContext(node, topology, variable, entity, entityName);
    }

    Map<String, Object> toVariables() {
        Map<String, Object> variables = new HashMap<>();
        variables.put("node", node);
        variables.put("topology", topology);
        if (entityVariable != null) {
            variables.put(entityVariable, entity);
        }
        return variables;
    }
}
