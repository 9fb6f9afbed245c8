package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RipDeclaration(boolean enabled, Integer version, List<String> interfaces) {
    public RipDeclaration {
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }
}
