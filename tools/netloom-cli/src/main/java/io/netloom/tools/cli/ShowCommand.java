package io.netloom.tools.cli;

import io.netloom.topology.resolved.InternalInterface;
import io.netloom.topology.resolved.InternalLink;
import io.netloom.topology.resolved.InternalNode;
import io.netloom.topology.resolved.InternalTopology;
import io.netloom.topology.resolved.InternalTunnel;
import io.netloom.topology.resolved.InternalVlan;
import java.io.PrintWriter;
import picocli.CommandLine.Command;

@Command(name = "show", description = "Print the resolved topology: nodes, interfaces and links")
class ShowCommand extends TopologySubcommand {

    @Override
    int execute() {
        InternalTopology topology = root.loadAndResolve(spec.commandLine());
        PrintWriter out = out();
        out.println(topology.name() + " (" + topology.id() + ")");
        if (topology.description() != null) {
            out.println("  " + topology.description());
        }
        out.println();
        for (InternalNode node : topology.nodes().values()) {
            out.println(node.name() + " [" + node.role().value() + "]");
            for (InternalInterface iface : node.interfaces()) {
                out.println("  " + iface.name()
                    + " " + (iface.addressed() ? iface.ip() : "-")
                    + " -> " + iface.peerNode() + "." + iface.peerInterface()
                    + " (" + iface.macAddress() + ")"
                    + (iface.configured() ? "" : " unconfigured"));
            }
            for (InternalVlan vlan : node.vlans()) {
                out.println("  " + vlan.name() + " " + (vlan.ip() == null ? "-" : vlan.ip()) + " vlan " + vlan.id());
            }
            for (InternalTunnel tunnel : node.tunnels()) {
                out.println("  " + tunnel.name() + " " + tunnel.type().value() + " " + tunnel.local() + " -> " + tunnel.remote());
            }
        }
        out.println();
        out.println("Links:");
        for (InternalLink link : topology.links()) {
            out.println("  " + link + " [" + link.segment() + "]");
        }
        return NetloomCommand.EXIT_OK;
    }
}
