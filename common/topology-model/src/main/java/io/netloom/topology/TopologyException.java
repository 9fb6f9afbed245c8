package io.netloom.topology;

/**
 * Root of the unchecked exceptions raised while loading or resolving a topology.
 */
public class TopologyException extends RuntimeException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
