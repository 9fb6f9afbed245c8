package io.netloom.topology.resolved;

import java.util.Objects;

public record InternalLink(InterfaceRef a, InterfaceRef b, String segment) {
    public InternalLink {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        Objects.requireNonNull(segment, "segment");
    }

    public boolean touches(String node) {
        return a.node().equals(node) || b.node().equals(node);
    }

    @Override
    public String toString() {
        return a + " <-> " + b;
    }
}
