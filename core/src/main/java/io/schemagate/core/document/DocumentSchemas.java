package io.schemagate.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Shared YAML reader and bundled JSON Schemas for the documents loaded at startup. */
final class DocumentSchemas {

    static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    static final JsonSchema COMPILED_SCHEMA = load("/schemas/compiled-schema.schema.json");
    static final JsonSchema POLICY = load("/schemas/policy.schema.json");

    private DocumentSchemas() {}

    /** Structural errors of {@code document}, sorted for stable messages; empty if valid. */
    static List<String> violations(JsonSchema schema, JsonNode document) {
        Set<ValidationMessage> errors = schema.validate(document);
        return errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
    }

    private static JsonSchema load(String resource) {
        try (InputStream in = DocumentSchemas.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled schema not found on classpath: " + resource);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled schema " + resource, e);
        }
    }
}
