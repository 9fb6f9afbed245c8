package io.netloom.templates;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Known template sets and the templates each one contains.
 * <p>
 * Built-in sets are listed by {@code netloom/templates/index.yaml} on the classpath. Extra template
 * roots are directories whose sub-directories are sets of {@code *.peb} files; a set found in a root
 * replaces the built-in (or earlier root) set of the same name. Directories starting with {@code _}
 * hold shared files and are not sets.
 */
public final class TemplateSetCatalog {

    private static final Logger log = LoggerFactory.getLogger(TemplateSetCatalog.class);

    static final String CLASSPATH_ROOT = "netloom/templates";
    static final String INDEX = CLASSPATH_ROOT + "/index.yaml";
    static final String SUFFIX = ".peb";

    private final Map<String, List<String>> sets;
    private final List<Path> roots;

    private TemplateSetCatalog(Map<String, List<String>> sets, List<Path> roots) {
        this.sets = Collections.unmodifiableMap(new LinkedHashMap<>(sets));
        this.roots = List.copyOf(roots);
    }

    public static TemplateSetCatalog builtIn() {
        return load(List.of());
    }

    /**
     * Built-in sets overlaid with the sets found under {@code roots}, later roots winning.
     */
    public static TemplateSetCatalog load(List<Path> roots) {
        Objects.requireNonNull(roots, "roots");
        Map<String, List<String>> sets = new LinkedHashMap<>(readIndex());
        for (Path root : roots) {
            scanRoot(root).forEach((set, templates) -> {
                if (sets.put(set, templates) != null) {
                    log.debug("Template set {} overridden by {}", set, root);
                }
            });
        }
        return new TemplateSetCatalog(sets, roots);
    }

    public Set<String> setNames() {
        return sets.keySet();
    }

    public boolean contains(String set) {
        return sets.containsKey(set);
    }

    /**
     * Templates of a set in lexical order; empty when the set is unknown.
     */
    public List<TemplateId> templates(String set) {
        return sets.getOrDefault(set, List.of()).stream()
            .map(name -> new TemplateId(set, name))
            .collect(Collectors.toList());
    }

    public List<Path> roots() {
        return roots;
    }

    private static Map<String, List<String>> readIndex() {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
        try (InputStream in = TemplateSetCatalog.class.getClassLoader().getResourceAsStream(INDEX)) {
            if (in == null) {
                throw new IllegalStateException("Template index not found on classpath: " + INDEX);
            }
            Index index = yamlMapper.readValue(in, Index.class);
            Map<String, List<String>> sets = new LinkedHashMap<>();
            index.sets().forEach((set, names) -> sets.put(set, names.stream().sorted().collect(Collectors.toList())));
            return sets;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read template index " + INDEX, ex);
        }
    }

    private static Map<String, List<String>> scanRoot(Path root) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Template root is not a directory: " + root);
        }
        Map<String, List<String>> sets = new LinkedHashMap<>();
        try (Stream<Path> dirs = Files.list(root)) {
            List<Path> setDirs = dirs.filter(Files::isDirectory)
                .filter(dir -> !dir.getFileName().toString().startsWith("_"))
                .sorted()
                .collect(Collectors.toList());
            for (Path dir : setDirs) {
                List<String> templates = templatesIn(dir);
                if (!templates.isEmpty()) {
                    sets.put(dir.getFileName().toString(), templates);
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to scan templates under " + root, ex);
        }
        return sets;
    }

    private static List<String> templatesIn(Path dir) throws IOException {
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .sorted()
                .forEach(names::add);
        }
        return names;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Index(Map<String, List<String>> sets) {
        Index {
            sets = sets == null ? Map.of() : sets;
        }
    }
}
