package io.netloom.templates;

import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.loader.ClasspathLoader;
import com.mitchellbosecke.pebble.loader.DelegatingLoader;
import com.mitchellbosecke.pebble.loader.FileLoader;
import com.mitchellbosecke.pebble.loader.Loader;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import io.netloom.topology.resolved.InternalInterface;
import io.netloom.topology.resolved.InternalNode;
import io.netloom.topology.resolved.InternalTopology;
import io.netloom.topology.resolved.InternalVlan;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the templates of the activated sets for one node using Pebble.
 * <p>
 * Templates are looked up as {@code <set>/<name>.peb}, first in the extra template roots (last root
 * first), then on the classpath under {@code netloom/templates}. Undefined variables are errors.
 * A failing template is reported as a {@link TemplateException} in the result and does not stop the
 * remaining templates. Output that is blank produces nothing.
 */
public final class ConfigRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConfigRenderer.class);

    private final PebbleEngine engine;
    private final TemplateSetCatalog catalog;
    private final OutputPathMapper pathMapper;

    public ConfigRenderer(TemplateSetCatalog catalog, OutputPathMapper pathMapper) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.pathMapper = Objects.requireNonNull(pathMapper, "pathMapper");
        this.engine = defaultEngine(catalog.roots());
    }

    public RenderResult render(InternalNode node, InternalTopology topology, List<String> activatedSets) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(topology, "topology");
        List<RenderedTemplate> rendered = new ArrayList<>();
        List<TemplateException> failures = new ArrayList<>();
        for (String set : activatedSets) {
            if (!catalog.contains(set)) {
                failures.add(new TemplateException(node.name(), new TemplateId(set, "*"),
                    "unknown template set '" + set + "'", null));
                continue;
            }
            for (TemplateId id : catalog.templates(set)) {
                OutputPath outputPath = pathMapper.mapPath(id);
                for (RenderContext context : contexts(node, topology, outputPath.expansion())) {
                    try {
                        String content = evaluate(id, context);
                        if (content.isBlank()) {
                            log.debug("Template {} rendered nothing for node {}{}", id, node.name(), describe(context));
                            continue;
                        }
                        rendered.add(new RenderedTemplate(id, outputPath, context.entityName(), content));
                    } catch (IOException | RuntimeException ex) {
                        TemplateException failure = new TemplateException(node.name(), id,
                            ex.getMessage() + describe(context), ex);
                        log.warn(failure.getMessage());
                        failures.add(failure);
                    }
                }
            }
        }
        return new RenderResult(rendered, failures);
    }

    private String evaluate(TemplateId id, RenderContext context) throws IOException {
        PebbleTemplate template = engine.getTemplate(id.qualifiedName());
        try (Writer writer = new StringWriter()) {
            template.evaluate(writer, context.toVariables());
            return writer.toString();
        }
    }

    static List<RenderContext> contexts(InternalNode node, InternalTopology topology, Expansion expansion) {
        List<InternalInterface> configured = node.interfaces().stream()
            .filter(InternalInterface::configured)
            .collect(Collectors.toList());
        return switch (expansion) {
            case NODE -> List.of(RenderContext.forNode(node, topology));
            case ROUTING -> node.routingActive() ? List.of(RenderContext.forNode(node, topology)) : List.of();
            case BRIDGE -> node.bridgeActive()
                ? List.of(RenderContext.forEntity(node, topology, null, null, node.bridge().name()))
                : List.of();
            case BRIDGE_PORT -> node.bridgeActive() ? interfaceContexts(node, topology, configured) : List.of();
            case VLAN_PARENT -> node.bridgeActive() ? List.of() : interfaceContexts(node, topology, configured.stream()
                .filter(iface -> node.isVlanParent(iface.name()))
                .collect(Collectors.toList()));
            case INTERFACE -> interfaceContexts(node, topology, configured);
            case VLAN -> {
                if (node.bridgeActive()) {
                    // every port is enslaved to the bridge, so there is no parent left to tag
                    yield List.of();
                }
                Set<String> configuredNames = configured.stream().map(InternalInterface::name).collect(Collectors.toSet());
                List<RenderContext> vlans = new ArrayList<>();
                for (InternalVlan vlan : node.vlans()) {
                    if (configuredNames.contains(vlan.parent())) {
                        vlans.add(RenderContext.forEntity(node, topology, "vlan", vlan, vlan.name()));
                    }
                }
                yield vlans;
            }
            case TUNNEL -> node.tunnels().stream()
                .map(tunnel -> RenderContext.forEntity(node, topology, "tunnel", tunnel, tunnel.name()))
                .collect(Collectors.toList());
        };
    }

    private static List<RenderContext> interfaceContexts(InternalNode node, InternalTopology topology,
                                                         List<InternalInterface> interfaces) {
        return interfaces.stream()
            .map(iface -> RenderContext.forEntity(node, topology, "iface", iface, iface.name()))
            .collect(Collectors.toList());
    }

    private static String describe(RenderContext context) {
        return context.entityName() == null ? "" : " (" + context.entityName() + ")";
    }

    private static PebbleEngine defaultEngine(List<Path> roots) {
        List<Loader<?>> loaders = new ArrayList<>();
        List<Path> byPriority = new ArrayList<>(roots);
        Collections.reverse(byPriority);
        for (Path root : byPriority) {
            FileLoader fileLoader = new FileLoader();
            fileLoader.setPrefix(root.toAbsolutePath().normalize().toString());
            fileLoader.setSuffix(TemplateSetCatalog.SUFFIX);
            loaders.add(fileLoader);
        }
        ClasspathLoader classpathLoader = new ClasspathLoader(ConfigRenderer.class.getClassLoader());
        classpathLoader.setPrefix(TemplateSetCatalog.CLASSPATH_ROOT);
        classpathLoader.setSuffix(TemplateSetCatalog.SUFFIX);
        loaders.add(classpathLoader);
        return new PebbleEngine.Builder()
            .loader(new DelegatingLoader(loaders))
            .extension(new NetloomTemplateExtension())
            .autoEscaping(false)
            .strictVariables(true)
            .newLineTrimming(false)
            .cacheActive(true)
            .build();
    }
}
