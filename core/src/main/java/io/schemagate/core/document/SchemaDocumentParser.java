package io.schemagate.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemagate.core.error.SchemaBuildException;
import io.schemagate.core.error.SchemaParseException;
import io.schemagate.core.identity.Identity;
import io.schemagate.core.identity.IdentityRegistry;
import io.schemagate.core.schema.ConstraintTree;
import io.schemagate.core.schema.NodeDefinition;
import io.schemagate.core.schema.NodeKind;
import io.schemagate.core.schema.NumericWidth;
import io.schemagate.core.schema.TypeConstraint;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a compiled-schema document (YAML or JSON) into an {@link IdentityRegistry} and a
 * {@link ConstraintTree}.
 *
 * <p>The document is first checked against the bundled JSON Schema, which rejects unknown keys,
 * unknown node kinds and malformed types. Cross-references (identity bases, list keys, duplicate
 * paths) are then checked while the registry and tree are built.
 *
 * <p>Stateless and thread-safe.
 */
public final class SchemaDocumentParser {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDocumentParser.class);

    /**
     * Parses the document at {@code path}.
     *
     * @throws SchemaParseException   if the file is unreadable or structurally invalid
     * @throws SchemaBuildException   if the declarations are inconsistent
     */
    public CompiledSchema parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = DocumentSchemas.YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse compiled schema: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /** Parses an already-read document; {@code source} is used in error messages only. */
    public CompiledSchema parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SchemaParseException("Compiled schema must be a mapping at the top level", source);
        }
        List<String> violations = DocumentSchemas.violations(DocumentSchemas.COMPILED_SCHEMA, root);
        if (!violations.isEmpty()) {
            throw new SchemaParseException("Compiled schema is structurally invalid: " + violations, source);
        }

        IdentityRegistry.Builder identities = IdentityRegistry.builder().source(source);
        for (JsonNode node : root.path("identities")) {
            Set<String> bases = new LinkedHashSet<>();
            node.path("bases").forEach(base -> bases.add(base.asText()));
            identities.identity(new Identity(
                    node.get("name").asText(), text(node, "module"), bases, text(node, "description")));
        }
        IdentityRegistry registry = identities.build();

        ConstraintTree.Builder tree = ConstraintTree.builder(registry).source(source);
        for (JsonNode module : root.get("modules")) {
            String moduleName = module.get("name").asText();
            List<NodeDefinition> nodes = new ArrayList<>();
            for (JsonNode node : module.get("nodes")) {
                nodes.add(definition(node, "/" + moduleName, source));
            }
            tree.module(moduleName, nodes);
        }
        ConstraintTree built = tree.build();
        LOG.info(
                "schema.loaded source={} modules={} nodes={} identities={}",
                source,
                built.modules().size(),
                built.size(),
                registry.size());
        return new CompiledSchema(registry, built, source);
    }

    private NodeDefinition definition(JsonNode node, String parent, String source) {
        NodeKind kind = NodeKind.fromToken(node.get("kind").asText());
        String name = node.get("name").asText();
        String where = parent + "/" + name;
        NodeDefinition definition = NodeDefinition.of(kind, name)
                .description(text(node, "description"))
                .mandatory(node.path("mandatory").asBoolean(false));

        boolean hasType = node.has("type");
        boolean typed = kind == NodeKind.LEAF || kind == NodeKind.LEAF_LIST;
        if (typed != hasType) {
            throw new SchemaParseException(
                    "'" + where + "': " + kind.token() + (typed ? " requires" : " does not allow") + " 'type'", source);
        }
        if (hasType) {
            definition.type(type(node.get("type"), where, source));
        }
        if (node.has("keys")) {
            if (kind != NodeKind.LIST) {
                throw new SchemaParseException("'" + where + "': only a list may declare 'keys'", source);
            }
            List<String> keys = new ArrayList<>();
            node.get("keys").forEach(key -> keys.add(key.asText()));
            definition.keys(keys);
        } else if (kind == NodeKind.LIST) {
            throw new SchemaParseException("'" + where + "': list requires 'keys'", source);
        }
        if (node.has("min-elements") || node.has("max-elements")) {
            if (kind != NodeKind.LIST && kind != NodeKind.LEAF_LIST) {
                throw new SchemaParseException(
                        "'" + where + "': element bounds are only allowed on list and leaf-list", source);
            }
            definition.minElements(node.path("min-elements").asInt(0));
            definition.maxElements(node.has("max-elements") ? node.get("max-elements").asInt() : null);
        }
        for (JsonNode child : node.path("children")) {
            definition.child(definition(child, where, source));
        }
        return definition;
    }

    private TypeConstraint type(JsonNode type, String where, String source) {
        try {
            if (type.isTextual()) {
                return "boolean".equals(type.asText()) ? TypeConstraint.bool() : TypeConstraint.opaque();
            }
            if (type.has("pattern")) {
                return TypeConstraint.pattern(
                        type.get("pattern").asText(), integer(type, "min-length"), integer(type, "max-length"));
            }
            if (type.has("numeric")) {
                NumericWidth width = NumericWidth.fromToken(type.get("numeric").asText());
                int fractionDigits = type.path("fraction-digits").asInt(0);
                return new TypeConstraint.NumericRange(width, bound(type, "min"), bound(type, "max"), fractionDigits);
            }
            if (type.has("enumeration")) {
                List<String> tokens = new ArrayList<>();
                type.get("enumeration").forEach(token -> tokens.add(token.asText()));
                return TypeConstraint.enumeration(tokens.toArray(String[]::new));
            }
            if (type.has("identityref")) {
                return TypeConstraint.identityRef(type.get("identityref").asText());
            }
            List<TypeConstraint> members = new ArrayList<>();
            for (JsonNode member : type.get("union")) {
                members.add(type(member, where, source));
            }
            return new TypeConstraint.Union(members);
        } catch (SchemaBuildException e) {
            if (e.source() != null) {
                throw e;
            }
            throw new SchemaBuildException("'" + where + "': " + e.getMessage(), e, source);
        }
    }

    private static Integer integer(JsonNode node, String field) {
        return node.has(field) ? node.get(field).asInt() : null;
    }

    private static BigDecimal bound(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            return null;
        }
        if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
            throw new SchemaBuildException("numeric " + field + " bound " + value.asText() + " is not finite");
        }
        try {
            return value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText());
        } catch (NumberFormatException e) {
            throw new SchemaBuildException(
                    "numeric " + field + " bound '" + value.asText() + "' is not a number", e, null);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
