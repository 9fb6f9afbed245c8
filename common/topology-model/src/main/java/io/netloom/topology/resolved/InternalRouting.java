package io.netloom.topology.resolved;

import io.netloom.topology.model.RoutingEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Routing block of a node with defaults applied. {@code rip} is {@code null} when the document
 * declares no RIP section.
 */
public record InternalRouting(RoutingEngine engine,
                              String routerId,
                              List<StaticRoute> staticRoutes,
                              boolean ospfEnabled,
                              List<InternalOspfArea> ospfAreas,
                              InternalRip rip,
                              boolean configured) {
    public InternalRouting {
        engine = Objects.requireNonNullElse(engine, RoutingEngine.NONE);
        staticRoutes = staticRoutes == null ? List.of() : List.copyOf(staticRoutes);
        ospfAreas = ospfAreas == null ? List.of() : List.copyOf(ospfAreas);
    }

    public boolean ripEnabled() {
        return rip != null && rip.enabled();
    }

    /**
     * Daemon-managed routing: an engine other than {@code none} and not switched off.
     */
    public boolean daemonManaged() {
        return configured && engine != RoutingEngine.NONE;
    }

    /**
     * Every interface name listed in OSPF areas and the RIP section, in declaration order.
     */
    public List<String> referencedInterfaces() {
        List<String> names = new ArrayList<>();
        ospfAreas.forEach(area -> names.addAll(area.interfaces()));
        if (rip != null) {
            names.addAll(rip.interfaces());
        }
        return names;
    }
}
