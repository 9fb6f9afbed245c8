package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OspfDeclaration(boolean enabled, List<OspfAreaDeclaration> areas) {
    public OspfDeclaration {
        areas = areas == null ? List.of() : List.copyOf(areas);
    }
}
