package io.schemagate.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemagate.core.error.PolicyParseException;
import io.schemagate.core.model.AccessPolicy;
import io.schemagate.core.model.Operation;
import io.schemagate.core.model.PolicyEntry;
import io.schemagate.core.schema.ConstraintTree;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads an access policy document:
 *
 * <pre>
 * policy:
 *   - module: ops
 *     principal-class: operator
 *     operations: [read, execute]
 * </pre>
 *
 * <p>The document is checked against the bundled JSON Schema. Entries for a module the tree does
 * not know are kept (the schema may gain the module later) but logged at WARN.
 */
public final class PolicyParser {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyParser.class);

    private final ConstraintTree tree; // nullable

    /** A parser that does not cross-check module names. */
    public PolicyParser() {
        this(null);
    }

    /** A parser that warns about entries naming modules absent from {@code tree}. */
    public PolicyParser(ConstraintTree tree) {
        this.tree = tree;
    }

    /**
     * Parses the policy file at {@code path}.
     *
     * @throws PolicyParseException if the file is unreadable or structurally invalid
     */
    public AccessPolicy parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = DocumentSchemas.YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new PolicyParseException("Failed to read or parse policy: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    public AccessPolicy parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new PolicyParseException("Policy must be a mapping at the top level", source);
        }
        List<String> violations = DocumentSchemas.violations(DocumentSchemas.POLICY, root);
        if (!violations.isEmpty()) {
            throw new PolicyParseException("Policy is structurally invalid: " + violations, source);
        }
        List<PolicyEntry> entries = new ArrayList<>();
        for (JsonNode entry : root.get("policy")) {
            String module = entry.get("module").asText();
            EnumSet<Operation> operations = EnumSet.noneOf(Operation.class);
            entry.get("operations").forEach(op -> operations.add(Operation.fromToken(op.asText())));
            if (tree != null && tree.module(module).isEmpty()) {
                LOG.warn("Policy entry names unknown module '{}' (source={})", module, source);
            }
            entries.add(new PolicyEntry(module, entry.get("principal-class").asText(), operations));
        }
        return AccessPolicy.of(entries);
    }
}
