package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VlanDeclaration(Long id, String parent, String ip, String gateway) {
}
