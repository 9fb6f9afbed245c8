package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WireguardDeclaration(@JsonProperty("private_key") String privateKey,
                                   @JsonProperty("listen_port") Integer listenPort,
                                   String address,
                                   List<WireguardPeerDeclaration> peers) {
    public WireguardDeclaration {
        peers = peers == null ? List.of() : List.copyOf(peers);
    }
}
