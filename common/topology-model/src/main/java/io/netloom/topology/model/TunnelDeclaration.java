package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TunnelDeclaration(String name, String type, String local, String remote, String ip) {
}
