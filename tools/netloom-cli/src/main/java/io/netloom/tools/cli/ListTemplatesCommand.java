package io.netloom.tools.cli;

import io.netloom.templates.TemplateId;
import io.netloom.templates.TemplateSetCatalog;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list-templates", description = "List the template sets and their templates")
class ListTemplatesCommand extends TopologySubcommand {

    @Option(
        names = {"--template-root"},
        description = "Extra template root directory, may be repeated"
    )
    List<Path> templateRoots = new ArrayList<>();

    @Override
    int execute() {
        TemplateSetCatalog catalog = TemplateSetCatalog.load(templateRoots);
        for (String set : catalog.setNames()) {
            String templates = catalog.templates(set).stream()
                .map(TemplateId::name)
                .collect(Collectors.joining(", "));
            out().println(set + ": " + templates);
        }
        return NetloomCommand.EXIT_OK;
    }
}
