package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FirewallDeclaration(String impl, List<FirewallRuleDeclaration> rules) {
    public FirewallDeclaration {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }
}
