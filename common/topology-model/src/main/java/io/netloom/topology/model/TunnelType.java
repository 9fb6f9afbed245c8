package io.netloom.topology.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum TunnelType {
    IPIP,
    GRE,
    SIT;

    public static final TunnelType DEFAULT = IPIP;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TunnelType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values()).filter(t -> t.value().equals(normalized)).findFirst();
    }
}
