package io.netloom.topology.resolved;

import java.util.List;

public record InternalRip(boolean enabled, int version, List<String> interfaces) {
    public static final int DEFAULT_VERSION = 2;

    public InternalRip {
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }
}
