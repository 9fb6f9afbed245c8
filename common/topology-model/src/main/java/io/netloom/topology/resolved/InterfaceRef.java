package io.netloom.topology.resolved;

import java.util.Objects;

/**
 * Key of an interface within a topology. Links and peer lookups refer to interfaces through this
 * key instead of holding the interface objects themselves.
 */
public record InterfaceRef(String node, String iface) {
    public InterfaceRef {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(iface, "iface");
    }

    @Override
    public String toString() {
        return node + "." + iface;
    }
}
