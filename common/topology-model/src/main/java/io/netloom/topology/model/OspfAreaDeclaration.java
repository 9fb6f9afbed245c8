package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OspfAreaDeclaration(String id, List<String> interfaces) {
    public OspfAreaDeclaration {
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }
}
