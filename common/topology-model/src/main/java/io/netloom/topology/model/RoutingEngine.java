package io.netloom.topology.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum RoutingEngine {
    BIRD,
    FRR,
    NONE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<RoutingEngine> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values()).filter(e -> e.value().equals(normalized)).findFirst();
    }
}
