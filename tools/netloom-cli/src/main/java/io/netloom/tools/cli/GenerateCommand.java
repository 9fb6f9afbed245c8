package io.netloom.tools.cli;

import io.netloom.templates.ConfigGenerator;
import io.netloom.templates.GenerationResult;
import io.netloom.templates.GeneratorOptions;
import io.netloom.templates.TemplateException;
import io.netloom.topology.resolved.InternalTopology;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "gen", description = "Generate per-node configuration into <workdir>/configs/<node>/")
class GenerateCommand extends TopologySubcommand {

    @Option(
        names = {"--templates"},
        description = "Base template set (default: ${DEFAULT-VALUE})",
        defaultValue = GeneratorOptions.DEFAULT_BASE_TEMPLATE_SET
    )
    String baseTemplateSet;

    @Option(
        names = {"--template-root"},
        description = "Extra template root directory, may be repeated; later roots win"
    )
    List<Path> templateRoots = new ArrayList<>();

    @Option(
        names = {"--parallelism"},
        description = "Nodes rendered concurrently (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    int parallelism;

    @Option(
        names = {"--debug"},
        description = "Also write _node.json with the resolved node"
    )
    boolean debug;

    @Override
    int execute() {
        GeneratorOptions options;
        ConfigGenerator generator;
        try {
            options = GeneratorOptions.builder()
                .baseTemplateSet(baseTemplateSet)
                .templateRoots(templateRoots)
                .parallelism(parallelism)
                .debug(debug)
                .build();
            generator = new ConfigGenerator(options);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }

        InternalTopology topology = root.loadAndResolve(spec.commandLine());
        GenerationResult result = generator.generate(topology);
        ArtifactWriter writer = new ArtifactWriter(root.workdir);
        List<Path> written = writer.write(result);

        out().println((result.isSuccessful() ? "✓" : "✗") + " Generated configuration for '" + topology.id() + "'");
        out().println("  Nodes: " + result.nodes().size());
        out().println("  Files written: " + written.size());
        out().println("  Output: " + writer.configsDirectory());
        if (!result.isSuccessful()) {
            err().println("✗ " + result.failures().size() + " template failure(s):");
            for (TemplateException failure : result.failures()) {
                err().println("  - " + failure.getMessage());
            }
            return NetloomCommand.EXIT_GENERATION_FAILED;
        }
        return NetloomCommand.EXIT_OK;
    }
}
