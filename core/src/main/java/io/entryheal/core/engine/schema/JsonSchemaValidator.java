package io.entryheal.core.engine.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.entryheal.core.error.ValidationFailedException;
import io.entryheal.core.spi.Validator;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link Validator} that checks entries against a JSON Schema (2020-12). All violations are
 * reported in one {@link ValidationFailedException}, sorted so the reason is deterministic.
 */
public final class JsonSchemaValidator implements Validator {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonNode schemaNode;
    private final JsonSchema schema;

    private JsonSchemaValidator(JsonNode schemaNode, JsonSchema schema) {
        this.schemaNode = schemaNode;
        this.schema = schema;
    }

    /**
     * Compiles a schema.
     *
     * @param schemaNode the JSON Schema document
     * @return the validator
     * @throws IllegalArgumentException if the schema cannot be loaded
     */
    public static JsonSchemaValidator of(JsonNode schemaNode) {
        Objects.requireNonNull(schemaNode, "schemaNode must not be null");
        if (!schemaNode.isObject()) {
            throw new IllegalArgumentException("JSON Schema must be an object, got: " + schemaNode.getNodeType());
        }
        try {
            return new JsonSchemaValidator(schemaNode, SCHEMA_FACTORY.getSchema(schemaNode));
        } catch (JsonSchemaException e) {
            throw new IllegalArgumentException("Invalid JSON Schema: " + e.getMessage(), e);
        }
    }

    @Override
    public void validate(JsonNode entry) {
        Set<ValidationMessage> errors = schema.validate(entry);
        if (!errors.isEmpty()) {
            String reason = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ValidationFailedException("schema violation: " + reason);
        }
    }

    public JsonNode schemaNode() {
        return schemaNode;
    }
}
