package io.netloom.topology.load;

import io.netloom.topology.TopologyException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Every structural violation found in a topology document, reported together.
 */
public class ValidationException extends TopologyException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    private static String describe(List<Violation> violations) {
        return violations.size() + " topology violation(s):\n  - "
            + violations.stream().map(Violation::toString).collect(Collectors.joining("\n  - "));
    }
}
