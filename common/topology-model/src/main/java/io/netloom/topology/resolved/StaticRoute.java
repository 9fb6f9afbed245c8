package io.netloom.topology.resolved;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record StaticRoute(String destination, String gateway) {

    private static final Pattern ROUTE = Pattern.compile("^(\\S+)\\s+via\\s+(\\S+)$");

    /**
     * Parses {@code "<destination> via <gateway>"}, e.g. {@code "10.0.0.0/8 via 192.168.1.1"}.
     */
    public static Optional<StaticRoute> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = ROUTE.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new StaticRoute(matcher.group(1), matcher.group(2)));
    }

    @Override
    public String toString() {
        return destination + " via " + gateway;
    }
}
