package io.netloom.tools.cli;

import io.netloom.templates.TemplateException;
import io.netloom.topology.TopologyException;
import io.netloom.topology.load.SchemaException;
import io.netloom.topology.load.ValidationException;
import io.netloom.topology.load.Violation;
import io.netloom.topology.resolve.TopologyReferenceException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Shared error handling of the subcommands: maps failures to exit codes and prints them.
 */
abstract class TopologySubcommand implements Callable<Integer> {

    @ParentCommand
    NetloomCommand root;

    @Spec
    CommandSpec spec;

    abstract int execute();

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (CommandLine.ParameterException e) {
            throw e;
        } catch (SchemaException e) {
            err().println("✗ Malformed topology: " + e.getMessage());
            return NetloomCommand.EXIT_INVALID_TOPOLOGY;
        } catch (ValidationException e) {
            err().println("✗ Invalid topology (" + e.violations().size() + " problem(s)):");
            for (Violation violation : e.violations()) {
                err().println("  - " + violation);
            }
            return NetloomCommand.EXIT_INVALID_TOPOLOGY;
        } catch (TopologyReferenceException e) {
            err().println("✗ Unresolvable reference: " + e.getMessage());
            return NetloomCommand.EXIT_INVALID_TOPOLOGY;
        } catch (TopologyException e) {
            err().println("✗ Invalid topology: " + e.getMessage());
            return NetloomCommand.EXIT_INVALID_TOPOLOGY;
        } catch (UncheckedIOException e) {
            err().println("✗ Cannot read topology: " + e.getMessage());
            return NetloomCommand.EXIT_INVALID_TOPOLOGY;
        } catch (TemplateException | ArtifactWriteException e) {
            err().println("✗ Generation failed: " + e.getMessage());
            printDetails(e);
            return NetloomCommand.EXIT_GENERATION_FAILED;
        } catch (Exception e) {
            err().println("✗ Unexpected error: " + e.getMessage());
            printDetails(e);
            return NetloomCommand.EXIT_UNEXPECTED;
        }
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    private void printDetails(Exception e) {
        if (root != null && root.verbose) {
            e.printStackTrace(err());
        } else {
            err().println("(Use -v for detailed error information)");
        }
    }
}
