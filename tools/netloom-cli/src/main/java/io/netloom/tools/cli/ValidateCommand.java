package io.netloom.tools.cli;

import io.netloom.topology.resolved.InternalTopology;
import picocli.CommandLine.Command;

@Command(name = "validate", description = "Load, validate and resolve the topology without generating anything")
class ValidateCommand extends TopologySubcommand {

    @Override
    int execute() {
        InternalTopology topology = root.loadAndResolve(spec.commandLine());
        out().println("✓ Topology '" + topology.id() + "' is valid");
        out().println("  Nodes: " + topology.nodes().size());
        out().println("  Links: " + topology.links().size());
        return NetloomCommand.EXIT_OK;
    }
}
