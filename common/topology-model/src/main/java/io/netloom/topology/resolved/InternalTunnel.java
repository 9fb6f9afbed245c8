package io.netloom.topology.resolved;

import io.netloom.topology.model.TunnelType;

public record InternalTunnel(String name, TunnelType type, String local, String remote, String ip) {
}
