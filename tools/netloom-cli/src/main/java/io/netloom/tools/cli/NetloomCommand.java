package io.netloom.tools.cli;

import io.netloom.topology.load.TopologyLoader;
import io.netloom.topology.model.ExternalTopology;
import io.netloom.topology.resolve.TopologyResolver;
import io.netloom.topology.resolved.InternalTopology;
import java.nio.file.Path;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * netloom command line: validates lab topologies and generates per-node configuration.
 */
@Command(
    name = "netloom",
    version = "0.1.0",
    description = "Resolve lab topologies and generate per-node network configuration",
    mixinStandardHelpOptions = true,
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        ShowCommand.class,
        ListTemplatesCommand.class
    },
    headerHeading = "%n@|bold,underline netloom|@%n%n",
    descriptionHeading = "%n@|bold Description:|@%n",
    optionListHeading = "%n@|bold Options:|@%n",
    commandListHeading = "%n@|bold Commands:|@%n",
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  Check a topology:",
        "    netloom --topology lab.yaml validate",
        "",
        "  Generate configuration into .labs_configs/configs/<node>/:",
        "    netloom --topology lab.yaml gen",
        "",
        "  Use your own templates next to the built-in ones:",
        "    netloom --topology lab.yaml gen --template-root ./templates",
        ""
    }
)
public class NetloomCommand implements Runnable {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_TOPOLOGY = 1;
    static final int EXIT_GENERATION_FAILED = 2;
    static final int EXIT_UNEXPECTED = 3;

    @Spec
    CommandSpec spec;

    @Option(
        names = {"-t", "--topology"},
        description = "Topology YAML file"
    )
    Path topology;

    @Option(
        names = {"-w", "--workdir"},
        description = "Working directory for generated files (default: ${DEFAULT-VALUE})",
        defaultValue = ".labs_configs"
    )
    Path workdir;

    @Option(
        names = {"-v", "--verbose"},
        description = "Print stack traces on failure"
    )
    boolean verbose;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command, see --help");
    }

    Path requireTopology(CommandLine caller) {
        if (topology == null) {
            throw new CommandLine.ParameterException(caller, "Missing required option '--topology=<topology>'");
        }
        return topology;
    }

    ExternalTopology load(CommandLine caller) {
        return new TopologyLoader().load(requireTopology(caller));
    }

    InternalTopology loadAndResolve(CommandLine caller) {
        return new TopologyResolver().resolve(load(caller));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new NetloomCommand())
            .setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO));
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
