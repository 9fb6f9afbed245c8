package io.netloom.topology.resolve;

/**
 * Two entities of the same node ended up with the same interface name.
 */
public class DuplicateInterfaceAssignmentException extends TopologyReferenceException {

    private final String interfaceName;

    public DuplicateInterfaceAssignmentException(String nodeName, String interfaceName) {
        super(nodeName, "node '" + nodeName + "' assigns interface name '" + interfaceName + "' more than once");
        this.interfaceName = interfaceName;
    }

    public String interfaceName() {
        return interfaceName;
    }
}
