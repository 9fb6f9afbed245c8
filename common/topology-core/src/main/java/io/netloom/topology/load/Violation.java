package io.netloom.topology.load;

/**
 * One field-level problem found in a topology document, e.g. {@code nodes[2].vlans[0].id}.
 */
public record Violation(String path, String message) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
