package io.netloom.topology.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum NodeRole {
    ROUTER,
    SWITCH,
    HOST;

    public static final NodeRole DEFAULT = HOST;

    /**
     * Lower-case name as written in topology documents.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<NodeRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values()).filter(r -> r.value().equals(normalized)).findFirst();
    }
}
