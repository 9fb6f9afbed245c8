package io.netloom.topology.resolved;

import java.util.Objects;

/**
 * Interface created by a link. {@code peerNode} and {@code peerInterface} are names only; use
 * {@link InternalTopology#peerOf(InterfaceRef)} to reach the peer itself.
 */
public record InternalInterface(String name,
                                int index,
                                String ip,
                                String gateway,
                                boolean configured,
                                String macAddress,
                                String peerNode,
                                String peerInterface,
                                String segment) {
    public InternalInterface {
        Objects.requireNonNull(name, "name");
        if (index < 1) {
            throw new IllegalArgumentException("interface index must be >= 1, got " + index);
        }
    }

    public InterfaceRef peer() {
        return new InterfaceRef(peerNode, peerInterface);
    }

    /**
     * Whether an address is assigned. Not named {@code hasIp}: template engines resolve {@code iface.ip}
     * through {@code has*} accessors.
     */
    public boolean addressed() {
        return ip != null && !ip.isBlank();
    }
}
