package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Logical settings for the interface a link binds to. Entries carry no name: the resolver pairs
 * them positionally with the links touching the node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InterfaceDeclaration(String ip, String gateway, Boolean configured) {

    public static InterfaceDeclaration withIp(String ip) {
        return new InterfaceDeclaration(ip, null, null);
    }
}
