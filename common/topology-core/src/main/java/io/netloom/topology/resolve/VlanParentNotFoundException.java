package io.netloom.topology.resolve;

public class VlanParentNotFoundException extends TopologyReferenceException {

    private final int vlanId;
    private final String parent;

    public VlanParentNotFoundException(String nodeName, int vlanId, String parent) {
        super(nodeName, "VLAN " + vlanId + " on node '" + nodeName + "' has parent '" + parent
            + "' which is not one of the node's interfaces");
        this.vlanId = vlanId;
        this.parent = parent;
    }

    public int vlanId() {
        return vlanId;
    }

    public String parent() {
        return parent;
    }
}
