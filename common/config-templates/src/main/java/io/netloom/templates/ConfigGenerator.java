package io.netloom.templates;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netloom.topology.resolved.InternalNode;
import io.netloom.topology.resolved.InternalTopology;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the artifacts of every node of a resolved topology: select template sets, render them,
 * map each output to its path. Artifacts of a node are ordered by path; when two sets produce the
 * same path the set rendered later wins.
 * <p>
 * With {@code parallelism > 1} nodes are rendered on a fixed pool; results are still collected in
 * node declaration order so the output does not depend on scheduling.
 */
public final class ConfigGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConfigGenerator.class);

    static final String DEBUG_ARTIFACT = "_node.json";

    private final GeneratorOptions options;
    private final TemplateSetSelector selector;
    private final ConfigRenderer renderer;
    private final ObjectMapper jsonMapper;

    public ConfigGenerator(GeneratorOptions options) {
        this(options, new TemplateSetSelector(), TemplateSetCatalog.load(options.templateRoots()), new OutputPathMapper());
    }

    public ConfigGenerator(GeneratorOptions options,
                           TemplateSetSelector selector,
                           TemplateSetCatalog catalog,
                           OutputPathMapper pathMapper) {
        this.options = Objects.requireNonNull(options, "options");
        this.selector = Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(catalog, "catalog");
        if (!catalog.contains(options.baseTemplateSet())) {
            throw new IllegalArgumentException("Unknown template set '" + options.baseTemplateSet()
                + "', known sets: " + catalog.setNames());
        }
        this.renderer = new ConfigRenderer(catalog, pathMapper);
        this.jsonMapper = new ObjectMapper().findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public GenerationResult generate(InternalTopology topology) {
        Objects.requireNonNull(topology, "topology");
        List<Callable<NodeOutcome>> tasks = new ArrayList<>();
        for (InternalNode node : topology.nodes().values()) {
            tasks.add(() -> generateNode(node, topology));
        }
        List<NodeOutcome> outcomes = options.parallelism() > 1 && tasks.size() > 1
            ? runParallel(tasks)
            : runSequential(tasks);

        List<NodeArtifacts> nodes = new ArrayList<>(outcomes.size());
        List<TemplateException> failures = new ArrayList<>();
        for (NodeOutcome outcome : outcomes) {
            nodes.add(outcome.artifacts());
            failures.addAll(outcome.failures());
        }
        GenerationResult result = new GenerationResult(nodes, failures);
        if (result.isSuccessful()) {
            log.info("Generated {} artifact(s) for {} node(s) of topology '{}'",
                result.artifactCount(), nodes.size(), topology.id());
        } else {
            log.warn("Generated {} artifact(s) for {} node(s) of topology '{}' with {} template failure(s)",
                result.artifactCount(), nodes.size(), topology.id(), failures.size());
        }
        return result;
    }

    private NodeOutcome generateNode(InternalNode node, InternalTopology topology) {
        List<String> sets = selector.select(node, options.baseTemplateSet());
        log.debug("Node {} uses template sets {}", node.name(), sets);
        RenderResult rendered = renderer.render(node, topology, sets);

        Map<String, Artifact> byPath = new TreeMap<>();
        Map<String, TemplateId> producedBy = new LinkedHashMap<>();
        for (RenderedTemplate template : rendered.rendered()) {
            String path = template.relativePath();
            TemplateId previous = producedBy.put(path, template.templateId());
            if (previous != null) {
                log.debug("Node {}: {} replaces {} at {}", node.name(), template.templateId(), previous, path);
            }
            byPath.put(path, new Artifact(path, template.content()));
        }
        if (options.debug()) {
            byPath.put(DEBUG_ARTIFACT, new Artifact(DEBUG_ARTIFACT, debugDump(node)));
        }
        return new NodeOutcome(new NodeArtifacts(node.name(), sets, new ArrayList<>(byPath.values())),
            rendered.failures());
    }

    private String debugDump(InternalNode node) {
        Map<String, Object> dump = new LinkedHashMap<>();
        dump.put("name", node.name());
        dump.put("role", node.role().value());
        dump.put("interfaces", node.interfaces());
        dump.put("vlans", node.vlans());
        dump.put("tunnels", node.tunnels());
        try {
            return jsonMapper.writeValueAsString(dump) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialise debug dump for node " + node.name(), ex);
        }
    }

    private static List<NodeOutcome> runSequential(List<Callable<NodeOutcome>> tasks) {
        List<NodeOutcome> outcomes = new ArrayList<>(tasks.size());
        for (Callable<NodeOutcome> task : tasks) {
            try {
                outcomes.add(task.call());
            } catch (RuntimeException ex) {
                throw ex;
            } catch (Exception ex) {
                throw new IllegalStateException("Node generation failed", ex);
            }
        }
        return outcomes;
    }

    private List<NodeOutcome> runParallel(List<Callable<NodeOutcome>> tasks) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.parallelism(), tasks.size()), runnable -> {
            Thread thread = new Thread(runnable, "netloom-render-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<NodeOutcome>> futures = pool.invokeAll(tasks);
            List<NodeOutcome> outcomes = new ArrayList<>(futures.size());
            for (Future<NodeOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while generating configuration", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Node generation failed", ex.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private record NodeOutcome(NodeArtifacts artifacts, List<TemplateException> failures) {
    }
}
