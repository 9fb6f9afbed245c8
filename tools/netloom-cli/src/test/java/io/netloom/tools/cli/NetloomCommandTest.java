package io.netloom.tools.cli;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("netloom command line")
class NetloomCommandTest {

    private static final String TWO_ROUTERS = """
        meta:
          id: lab
          name: Two routers
        links:
          - endpoints: [R1, R2]
        nodes:
          - name: R1
            role: router
            interfaces:
              - ip: 10.0.1.1/24
          - name: R2
            role: router
            interfaces:
              - ip: 10.0.1.2/24
        """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    @DisplayName("gen writes one directory per node")
    void shouldGenerateConfiguration() throws IOException {
        Path topology = write("lab.yaml", TWO_ROUTERS);
        Path workdir = tempDir.resolve("work");

        int exitCode = run("-t", topology.toString(), "-w", workdir.toString(), "gen");

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_OK);
        Path hostname = workdir.resolve("configs/R1/etc/hostname");
        assertThat(hostname).exists();
        assertThat(Files.readString(hostname, StandardCharsets.UTF_8).strip()).isEqualTo("R1");
        assertThat(workdir.resolve("configs/R2/etc/systemd/network/10-eth1.network")).exists();
        assertThat(out.toString()).contains("✓ Generated configuration for 'lab'").contains("Nodes: 2");
    }

    @Test
    @DisplayName("gen --debug adds the resolved node dump")
    void shouldWriteDebugDump() throws IOException {
        Path topology = write("lab.yaml", TWO_ROUTERS);
        Path workdir = tempDir.resolve("work");

        int exitCode = run("-t", topology.toString(), "-w", workdir.toString(), "gen", "--debug", "--parallelism", "2");

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_OK);
        assertThat(workdir.resolve("configs/R2/_node.json")).exists();
    }

    @Test
    @DisplayName("gen reports template failures with exit code 2")
    void shouldFailOnBrokenTemplate() throws IOException {
        Path topology = write("lab.yaml", TWO_ROUTERS);
        Path root = tempDir.resolve("templates");
        Files.createDirectories(root.resolve("networkd"));
        Files.writeString(root.resolve("networkd/hostname.peb"), "{{ node.missing }}\n");

        int exitCode = run("-t", topology.toString(), "-w", tempDir.resolve("work").toString(),
            "gen", "--template-root", root.toString());

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_GENERATION_FAILED);
        assertThat(err.toString()).contains("template failure(s)").contains("networkd/hostname");
    }

    @Test
    @DisplayName("validate lists every violation and exits with 1")
    void shouldRejectInvalidTopology() throws IOException {
        Path topology = write("bad.yaml", """
            meta:
              name: No id
            links:
              - endpoints: [A, Ghost]
            nodes:
              - name: A
                role: gateway
            """);

        int exitCode = run("-t", topology.toString(), "validate");

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_INVALID_TOPOLOGY);
        assertThat(err.toString())
            .contains("✗ Invalid topology")
            .contains("meta.id")
            .contains("links[0].endpoints[1]")
            .contains("nodes[0].role");
    }

    @Test
    @DisplayName("validate summarises a valid topology")
    void shouldValidateTopology() throws IOException {
        Path topology = write("lab.yaml", TWO_ROUTERS);

        int exitCode = run("--topology", topology.toString(), "validate");

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_OK);
        assertThat(out.toString()).contains("✓ Topology 'lab' is valid").contains("Links: 1");
    }

    @Test
    @DisplayName("show prints interfaces and links")
    void shouldShowResolvedTopology() throws IOException {
        Path topology = write("lab.yaml", TWO_ROUTERS);

        int exitCode = run("-t", topology.toString(), "show");

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_OK);
        assertThat(out.toString())
            .contains("R1 [router]")
            .contains("eth1 10.0.1.1/24 -> R2.eth1")
            .contains("[lab_R1_R2]");
    }

    @Test
    @DisplayName("A missing topology file exits with 1")
    void shouldReportMissingFile() {
        int exitCode = run("-t", tempDir.resolve("absent.yaml").toString(), "validate");

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_INVALID_TOPOLOGY);
        assertThat(err.toString()).contains("Cannot read topology");
    }

    @Test
    @DisplayName("Commands that need a topology reject a missing --topology")
    void shouldRequireTopology() {
        int exitCode = run("validate");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--topology");
    }

    @Test
    @DisplayName("list-templates prints the built-in sets")
    void shouldListTemplates() {
        int exitCode = run("list-templates");

        assertThat(exitCode).isEqualTo(NetloomCommand.EXIT_OK);
        assertThat(out.toString())
            .contains("networkd: ")
            .contains("frr: daemons, frr.conf")
            .contains("wireguard: wg0.conf");
    }

    private int run(String... args) {
        CommandLine cmd = NetloomCommand.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
