package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LinkDeclaration(List<String> endpoints) {
    public LinkDeclaration {
        // null entries are kept so the validator can report them by position
        endpoints = endpoints == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(endpoints));
    }

    public static LinkDeclaration between(String a, String b) {
        return new LinkDeclaration(List.of(a, b));
    }
}
