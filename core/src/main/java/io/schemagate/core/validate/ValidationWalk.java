package io.schemagate.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemagate.core.model.RejectionKind;
import io.schemagate.core.model.ValidationOutcome;
import io.schemagate.core.schema.Leaf;
import io.schemagate.core.schema.LeafList;
import io.schemagate.core.schema.ListNode;
import io.schemagate.core.schema.ParentNode;
import io.schemagate.core.schema.SchemaNode;
import io.schemagate.core.schema.SchemaPath;
import io.schemagate.core.schema.TypeConstraint;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one validation pass: the first rejection and the unconstrained leaves seen so far.
 * Every method returns the normalized value, or {@code null} once a rejection is recorded.
 * Not thread-safe; one instance per call.
 */
final class ValidationWalk {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final TypeChecker types;
    private final List<String> unconstrained = new ArrayList<>();
    private ValidationOutcome rejection;

    ValidationWalk(TypeChecker types) {
        this.types = types;
    }

    /** A fresh walk sharing the type checker, used to try union members. */
    ValidationWalk scratch() {
        return new ValidationWalk(types);
    }

    void absorb(ValidationWalk other) {
        unconstrained.addAll(other.unconstrained);
    }

    <T> T reject(RejectionKind kind, String path, String detail) {
        if (rejection == null) {
            rejection = ValidationOutcome.rejected(kind, path, detail);
        }
        return null;
    }

    void unconstrained(String path) {
        unconstrained.add(path);
    }

    ValidationOutcome rejection() {
        return rejection;
    }

    ValidationOutcome outcome(JsonNode normalized) {
        return rejection != null ? rejection : ValidationOutcome.accepted(normalized, unconstrained);
    }

    JsonNode node(SchemaNode schema, JsonNode value, String path) {
        if (schema instanceof Leaf leaf) {
            return leaf(leaf.type(), value, path);
        }
        if (schema instanceof LeafList leafList) {
            return leafList(leafList, value, path);
        }
        if (schema instanceof ListNode list) {
            return list(list, value, path);
        }
        return object((ParentNode) schema, value, path);
    }

    JsonNode leaf(TypeConstraint type, JsonNode value, String path) {
        if (value == null || value.isNull() || value.isContainerNode()) {
            return reject(RejectionKind.TYPE_MISMATCH, path,
                    "expected " + type.describe() + ", got " + describe(value));
        }
        return types.check(type, value, path, this);
    }

    private JsonNode leafList(LeafList schema, JsonNode value, String path) {
        if (value == null || !value.isArray()) {
            return reject(RejectionKind.TYPE_MISMATCH, path, "expected an array, got " + describe(value));
        }
        if (!cardinalityFits(value.size(), schema.minElements(), schema.maxElements(), path)) {
            return null;
        }
        ArrayNode normalized = NODES.arrayNode(value.size());
        Set<JsonNode> seen = new HashSet<>();
        for (int i = 0; i < value.size(); i++) {
            String elementPath = path + "[" + i + "]";
            JsonNode element = leaf(schema.type(), value.get(i), elementPath);
            if (element == null) {
                return null;
            }
            if (!seen.add(element)) {
                return reject(RejectionKind.DUPLICATE_KEY, elementPath, "duplicate value " + element);
            }
            normalized.add(element);
        }
        return normalized;
    }

    private JsonNode list(ListNode schema, JsonNode value, String path) {
        if (value == null || !value.isArray()) {
            return reject(RejectionKind.TYPE_MISMATCH, path, "expected an array of entries, got " + describe(value));
        }
        if (!cardinalityFits(value.size(), schema.minElements(), schema.maxElements(), path)) {
            return null;
        }
        ArrayNode normalized = NODES.arrayNode(value.size());
        Set<List<JsonNode>> seenKeys = new HashSet<>();
        for (int i = 0; i < value.size(); i++) {
            JsonNode entry = value.get(i);
            String positional = path + "[" + i + "]";
            if (!entry.isObject()) {
                return reject(RejectionKind.TYPE_MISMATCH, positional, "expected an object, got " + describe(entry));
            }
            Map<String, String> rawKeys = new LinkedHashMap<>();
            for (String key : schema.keys()) {
                JsonNode keyValue = field(entry, schema, key);
                if (keyValue == null || keyValue.isNull()) {
                    return reject(RejectionKind.MISSING_KEY, positional + "/" + key, "list entry lacks key '" + key + "'");
                }
                rawKeys.put(key, keyValue.asText());
            }
            String entryPath = path + SchemaPath.predicates(rawKeys);
            ObjectNode normalizedEntry = object(schema, entry, entryPath);
            if (normalizedEntry == null) {
                return null;
            }
            List<JsonNode> tuple = new ArrayList<>(schema.keys().size());
            schema.keys().forEach(key -> tuple.add(normalizedEntry.get(key)));
            if (!seenKeys.add(tuple)) {
                return reject(RejectionKind.DUPLICATE_KEY, entryPath, "duplicate list entry for keys " + rawKeys);
            }
            normalized.add(normalizedEntry);
        }
        return normalized;
    }

    /**
     * Validates an object against the children of {@code schema}: unknown members in input order
     * first, then declared children in schema order.
     */
    ObjectNode object(ParentNode schema, JsonNode value, String path) {
        if (value == null || !value.isObject()) {
            return reject(RejectionKind.TYPE_MISMATCH, path, "expected an object, got " + describe(value));
        }
        Map<String, JsonNode> byLocalName = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = value.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            String local = localName(field.getKey(), schema.module());
            Optional<SchemaNode> child = local == null ? Optional.empty() : schema.child(local);
            if (child.isEmpty()) {
                return reject(RejectionKind.UNKNOWN_NODE, path + "/" + field.getKey(),
                        "'" + field.getKey() + "' is not defined in the schema");
            }
            if (byLocalName.putIfAbsent(local, field.getValue()) != null) {
                return reject(RejectionKind.DUPLICATE_KEY, path + "/" + local, "'" + local + "' is given more than once");
            }
        }

        ObjectNode normalized = NODES.objectNode();
        for (SchemaNode child : schema.children()) {
            JsonNode childValue = byLocalName.get(child.name());
            String childPath = path + "/" + child.name();
            if (childValue == null) {
                if (child.isMandatory()) {
                    return reject(RejectionKind.MISSING_MANDATORY, childPath, "mandatory node is missing");
                }
                continue;
            }
            JsonNode normalizedChild = node(child, childValue, childPath);
            if (normalizedChild == null) {
                return null;
            }
            normalized.set(child.name(), normalizedChild);
        }
        return normalized;
    }

    /** Member value by local or module-qualified name. */
    static JsonNode field(JsonNode object, ParentNode schema, String name) {
        JsonNode plain = object.get(name);
        return plain != null ? plain : object.get(schema.module() + ":" + name);
    }

    private boolean cardinalityFits(int size, int min, Integer max, String path) {
        if (size < min) {
            reject(RejectionKind.CARDINALITY_VIOLATION, path, size + " elements, at least " + min + " required");
            return false;
        }
        if (max != null && size > max) {
            reject(RejectionKind.CARDINALITY_VIOLATION, path, size + " elements, at most " + max + " allowed");
            return false;
        }
        return true;
    }

    // A prefix other than the owning module makes the member unknown.
    private static String localName(String member, String module) {
        int colon = member.indexOf(':');
        if (colon < 0) {
            return member;
        }
        return member.substring(0, colon).equals(module) ? member.substring(colon + 1) : null;
    }

    static String describe(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "nothing";
        }
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
