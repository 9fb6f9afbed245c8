package io.netloom.templates;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Artifacts for every node, in node declaration order, plus the template failures met on the way.
 * Generation is successful only when there were no failures.
 */
public final class GenerationResult {

    private final Map<String, NodeArtifacts> nodes;
    private final List<TemplateException> failures;

    public GenerationResult(List<NodeArtifacts> nodes, List<TemplateException> failures) {
        Map<String, NodeArtifacts> byName = new LinkedHashMap<>();
        for (NodeArtifacts node : nodes) {
            byName.put(node.nodeName(), node);
        }
        this.nodes = Collections.unmodifiableMap(byName);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public Map<String, NodeArtifacts> nodes() {
        return nodes;
    }

    public Optional<NodeArtifacts> node(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName));
    }

    public List<TemplateException> failures() {
        return failures;
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public int artifactCount() {
        return nodes.values().stream().mapToInt(n -> n.artifacts().size()).sum();
    }
}
