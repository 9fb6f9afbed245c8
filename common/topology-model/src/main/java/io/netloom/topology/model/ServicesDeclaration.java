package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional per-node services. Passed through resolution untouched; templates read it directly.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServicesDeclaration(@JsonProperty("http_server") Integer httpServer,
                                  WireguardDeclaration wireguard,
                                  FirewallDeclaration firewall) {
}
