package io.netloom.templates;

import java.util.Objects;

/**
 * One generated file, relative to the node's configuration directory.
 */
public record Artifact(String relativePath, String content) {
    public Artifact {
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(content, "content");
        if (relativePath.startsWith("/") || relativePath.contains("..")) {
            throw new IllegalArgumentException("Artifact path must stay relative: " + relativePath);
        }
    }
}
