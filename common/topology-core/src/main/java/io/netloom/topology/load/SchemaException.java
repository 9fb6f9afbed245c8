package io.netloom.topology.load;

import io.netloom.topology.TopologyException;
import java.util.List;

/**
 * The document could not be turned into a typed topology at all: unparsable YAML, a root that is
 * not a mapping, or values of the wrong JSON type.
 */
public class SchemaException extends TopologyException {

    private final List<String> problems;

    public SchemaException(String message, List<String> problems) {
        super(describe(message, problems));
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public SchemaException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.problems = List.of(String.valueOf(cause.getMessage()));
    }

    public List<String> problems() {
        return problems;
    }

    private static String describe(String message, List<String> problems) {
        if (problems == null || problems.isEmpty()) {
            return message;
        }
        return message + ":\n  - " + String.join("\n  - ", problems);
    }
}
