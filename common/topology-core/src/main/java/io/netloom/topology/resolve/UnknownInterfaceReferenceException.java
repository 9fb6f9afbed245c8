package io.netloom.topology.resolve;

/**
 * A routing section names an interface the node does not have.
 */
public class UnknownInterfaceReferenceException extends TopologyReferenceException {

    private final String interfaceName;

    public UnknownInterfaceReferenceException(String nodeName, String interfaceName, String where) {
        super(nodeName, where + " on node '" + nodeName + "' references unknown interface '" + interfaceName + "'");
        this.interfaceName = interfaceName;
    }

    public String interfaceName() {
        return interfaceName;
    }
}
