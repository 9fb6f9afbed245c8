package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FirewallRuleDeclaration(String action,
                                      String src,
                                      String dst,
                                      String proto,
                                      Integer dport) {
}
