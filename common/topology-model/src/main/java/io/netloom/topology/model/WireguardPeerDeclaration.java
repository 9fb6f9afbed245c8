package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WireguardPeerDeclaration(@JsonProperty("public_key") String publicKey,
                                       @JsonProperty("allowed_ips") String allowedIps,
                                       String endpoint) {
}
