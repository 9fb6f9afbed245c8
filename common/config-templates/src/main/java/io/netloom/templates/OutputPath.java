package io.netloom.templates;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relative output path of a template. {@code pattern} may hold one placeholder such as
 * {@code {iface}} which is replaced by the entity name.
 */
public record OutputPath(String pattern, Expansion expansion) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{[a-z]+}");

    public OutputPath {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(expansion, "expansion");
    }

    public boolean perEntity() {
        return PLACEHOLDER.matcher(pattern).find();
    }

    public String resolve(String entity) {
        if (!perEntity()) {
            return pattern;
        }
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("Output path " + pattern + " needs an entity name");
        }
        return PLACEHOLDER.matcher(pattern).replaceAll(Matcher.quoteReplacement(entity));
    }
}
