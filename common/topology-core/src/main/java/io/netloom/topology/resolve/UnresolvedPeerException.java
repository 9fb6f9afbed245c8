package io.netloom.topology.resolve;

/**
 * A link names a node that is not declared.
 */
public class UnresolvedPeerException extends TopologyReferenceException {

    private final int linkIndex;

    public UnresolvedPeerException(int linkIndex, String nodeName) {
        super(nodeName, "links[" + linkIndex + "] references undeclared node '" + nodeName + "'");
        this.linkIndex = linkIndex;
    }

    public int linkIndex() {
        return linkIndex;
    }
}
