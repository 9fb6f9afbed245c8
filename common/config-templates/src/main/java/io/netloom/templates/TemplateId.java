package io.netloom.templates;

import java.util.Objects;

/**
 * A template within a template set, e.g. {@code networkd/interface.network}. The name carries no
 * {@code .peb} suffix.
 */
public record TemplateId(String set, String name) {
    public TemplateId {
        Objects.requireNonNull(set, "set");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Name the template loaders resolve: {@code <set>/<name>}.
     */
    public String qualifiedName() {
        return set + "/" + name;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
