package io.netloom.topology.resolved;

import java.util.List;

/**
 * Bridge of a switch node. {@code interfaces} lists the member ports in interface order.
 */
public record InternalBridge(String name, boolean stp, boolean configured, List<String> interfaces) {
    public static final String DEFAULT_NAME = "br0";

    public InternalBridge {
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }
}
