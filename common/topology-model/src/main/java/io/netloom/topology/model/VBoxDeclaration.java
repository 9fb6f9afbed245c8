package io.netloom.topology.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VBoxDeclaration(@JsonProperty("paravirt_provider") String paravirtProvider,
                              String chipset,
                              Boolean ioapic,
                              Boolean hpet) {
}
