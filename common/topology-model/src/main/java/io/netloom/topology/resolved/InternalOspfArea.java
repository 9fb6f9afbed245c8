package io.netloom.topology.resolved;

import java.util.List;

public record InternalOspfArea(String id, List<String> interfaces) {
    public static final String BACKBONE = "0.0.0.0";

    public InternalOspfArea {
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }
}
