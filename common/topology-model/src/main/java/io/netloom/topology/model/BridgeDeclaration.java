package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BridgeDeclaration(String name, Boolean stp, Boolean configured) {
}
