package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingDeclaration(String engine,
                                 @JsonProperty("router_id") String routerId,
                                 @JsonProperty("static") List<String> staticRoutes,
                                 OspfDeclaration ospf,
                                 RipDeclaration rip,
                                 Boolean configured) {
    public RoutingDeclaration {
        staticRoutes = staticRoutes == null ? List.of() : List.copyOf(staticRoutes);
    }
}
