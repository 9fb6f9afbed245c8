package io.netloom.templates;

import java.util.List;
import java.util.Optional;

/**
 * Artifacts of one node, ordered by relative path.
 */
public record NodeArtifacts(String nodeName, List<String> templateSets, List<Artifact> artifacts) {
    public NodeArtifacts {
        templateSets = templateSets == null ? List.of() : List.copyOf(templateSets);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public Optional<Artifact> artifact(String relativePath) {
        return artifacts.stream().filter(a -> a.relativePath().equals(relativePath)).findFirst();
    }
}
