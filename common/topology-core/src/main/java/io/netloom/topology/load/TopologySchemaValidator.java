package io.netloom.topology.load;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the JSON shape of a topology document (types of every known field) against the schema
 * bundled with this module before the document is bound to records.
 */
public final class TopologySchemaValidator {

    static final String SCHEMA_CLASSPATH = "netloom/topology-schema.json";

    private final JsonSchema schema;

    public TopologySchemaValidator() {
        try (InputStream in = TopologySchemaValidator.class.getClassLoader().getResourceAsStream(SCHEMA_CLASSPATH)) {
            if (in == null) {
                throw new IllegalStateException("Topology schema not found on classpath: " + SCHEMA_CLASSPATH);
            }
            JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
            this.schema = factory.getSchema(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise topology schema", e);
        }
    }

    /**
     * Validate the document and return its problems, sorted; an empty list means the shape is fine.
     */
    public List<String> validate(JsonNode document) {
        if (document == null) {
            throw new IllegalArgumentException("Topology document must not be null");
        }
        Set<ValidationMessage> messages = schema.validate(document);
        return messages.stream()
            .map(ValidationMessage::getMessage)
            .sorted()
            .collect(Collectors.toList());
    }
}
