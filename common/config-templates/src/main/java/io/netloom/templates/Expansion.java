package io.netloom.templates;

/**
 * What a template is rendered for. Per-entity expansions render the template once per matching
 * entity of the node and substitute the entity name into the output path.
 */
public enum Expansion {
    /** Once per node. */
    NODE,
    /** Once per node whose routing block is configured. */
    ROUTING,
    /** Once per node with an active bridge. */
    BRIDGE,
    /** Each configured interface of a node with an active bridge. */
    BRIDGE_PORT,
    /** Each configured interface carrying at least one VLAN. */
    VLAN_PARENT,
    /** Each configured interface. */
    INTERFACE,
    /** Each VLAN whose parent interface is configured. */
    VLAN,
    /** Each tunnel. */
    TUNNEL
}
