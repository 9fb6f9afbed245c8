package io.netloom.topology.load;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

/**
 * Paths of the topology documents under {@code src/test/resources/topologies}.
 */
public final class TopologyLoaderFixtures {

    private TopologyLoaderFixtures() {
    }

    public static Path path(String name) throws URISyntaxException {
        URL url = TopologyLoaderFixtures.class.getClassLoader().getResource("topologies/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No topology fixture " + name);
        }
        return Path.of(url.toURI());
    }
}
