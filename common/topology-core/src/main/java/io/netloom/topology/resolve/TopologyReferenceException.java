package io.netloom.topology.resolve;

import io.netloom.topology.TopologyException;

/**
 * A topology passed validation but one of its cross references cannot be resolved.
 */
public abstract class TopologyReferenceException extends TopologyException {

    private final String nodeName;

    protected TopologyReferenceException(String nodeName, String message) {
        super(message);
        this.nodeName = nodeName;
    }

    public String nodeName() {
        return nodeName;
    }
}
