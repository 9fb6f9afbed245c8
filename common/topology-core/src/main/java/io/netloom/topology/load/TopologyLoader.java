package io.netloom.topology.load;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.netloom.topology.model.ExternalTopology;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a YAML topology document into an {@link ExternalTopology}.
 * <p>
 * Loading runs in three stages: parse and shape check against the bundled JSON schema
 * ({@link SchemaException}), binding to records ({@link SchemaException}), and field validation
 * ({@link ValidationException} with every violation found).
 */
public final class TopologyLoader {

    private static final Logger log = LoggerFactory.getLogger(TopologyLoader.class);

    private final ObjectMapper yamlMapper;
    private final TopologySchemaValidator schemaValidator;
    private final TopologyValidator validator;

    public TopologyLoader() {
        this(new TopologySchemaValidator(), new TopologyValidator());
    }

    public TopologyLoader(TopologySchemaValidator schemaValidator, TopologyValidator validator) {
        this.schemaValidator = Objects.requireNonNull(schemaValidator, "schemaValidator");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.yamlMapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ExternalTopology load(Path file) {
        Objects.requireNonNull(file, "file");
        String document;
        try {
            document = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read topology " + file, e);
        }
        log.debug("Loading topology from {}", file);
        return load(document);
    }

    public ExternalTopology load(String document) {
        if (document == null || document.isBlank()) {
            throw new SchemaException("Topology document is empty", List.of("document has no content"));
        }
        JsonNode tree = parse(document);
        List<String> problems = schemaValidator.validate(tree);
        if (!problems.isEmpty()) {
            throw new SchemaException("Topology document does not match the schema", problems);
        }
        ExternalTopology topology = bind(tree);
        validator.requireValid(topology);
        log.info("Loaded topology '{}' with {} node(s) and {} link(s)",
            topology.meta().id(), topology.nodes().size(), topology.links().size());
        return topology;
    }

    private JsonNode parse(String document) {
        JsonNode tree;
        try {
            tree = yamlMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new SchemaException("Topology document is not valid YAML", List.of(String.valueOf(e.getOriginalMessage())));
        }
        if (tree == null || !tree.isObject()) {
            String found = tree == null ? "nothing" : tree.getNodeType().name().toLowerCase(Locale.ROOT);
            throw new SchemaException("Topology document root must be a mapping", List.of("root is " + found));
        }
        return tree;
    }

    private ExternalTopology bind(JsonNode tree) {
        try {
            return yamlMapper.treeToValue(tree, ExternalTopology.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SchemaException("Topology document could not be bound", e);
        }
    }
}
