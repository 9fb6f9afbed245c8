package io.netloom.tools.cli;

import io.netloom.templates.Artifact;
import io.netloom.templates.GenerationResult;
import io.netloom.templates.NodeArtifacts;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes generated artifacts below {@code <workdir>/configs/<node>/}. Existing files at the same paths
 * are replaced; other files in the directory are left alone.
 */
public final class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    static final String CONFIGS_DIR = "configs";

    private final Path workdir;

    public ArtifactWriter(Path workdir) {
        this.workdir = Objects.requireNonNull(workdir, "workdir").toAbsolutePath().normalize();
    }

    public Path configsDirectory() {
        return workdir.resolve(CONFIGS_DIR);
    }

    public Path nodeDirectory(String nodeName) {
        return configsDirectory().resolve(nodeName);
    }

    /**
     * Writes every artifact of the result and returns the written files in write order.
     */
    public List<Path> write(GenerationResult result) {
        List<Path> written = new ArrayList<>(result.artifactCount());
        for (NodeArtifacts node : result.nodes().values()) {
            Path nodeDir = nodeDirectory(node.nodeName());
            for (Artifact artifact : node.artifacts()) {
                Path target = nodeDir.resolve(artifact.relativePath()).normalize();
                if (!target.startsWith(nodeDir)) {
                    throw new ArtifactWriteException("Artifact escapes node directory: " + artifact.relativePath(), null);
                }
                try {
                    Files.createDirectories(target.getParent());
                    Files.writeString(target, artifact.content(), StandardCharsets.UTF_8);
                } catch (IOException ex) {
                    throw new ArtifactWriteException("Failed to write " + target, ex);
                }
                written.add(target);
            }
            log.debug("Wrote {} artifact(s) for node {} to {}", node.artifacts().size(), node.nodeName(), nodeDir);
        }
        return written;
    }
}
