package io.schemagate.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.schemagate.core.identity.IdentityRegistry;
import io.schemagate.core.model.RejectionKind;
import io.schemagate.core.model.ValidationOutcome;
import io.schemagate.core.schema.ListNode;
import io.schemagate.core.schema.ResolvedPath;
import io.schemagate.core.schema.SchemaNode;
import java.util.Objects;

/**
 * Checks raw values against the constraint tree.
 *
 * <p>Validation is a pure function of the tree, the identity registry and the value. It stops at
 * the first violation, visiting members that the schema does not know in input order, then
 * declared children in schema order, so the same input always yields the same rejection.
 * Offending paths in rejections are absolute instance paths.
 *
 * <p>Thread-safe: holds no per-call state.
 */
public final class Validator {

    private final TypeChecker types;

    public Validator(IdentityRegistry identities) {
        this.types = new TypeChecker(Objects.requireNonNull(identities, "identities must not be null"));
    }

    /** Validates {@code value} against {@code node}; rejection paths start at the node's schema path. */
    public ValidationOutcome validate(SchemaNode node, JsonNode value) {
        ValidationWalk walk = new ValidationWalk(types);
        JsonNode normalized = walk.node(node, value, node.path());
        return walk.outcome(normalized);
    }

    /**
     * Validates {@code value} as the content of a resolved target. Predicate key values along the
     * path are checked first. For a single list entry, the payload is validated as one entry
     * object and its key leaves must equal the predicate values.
     */
    public ValidationOutcome validate(ResolvedPath target, JsonNode value) {
        ValidationWalk walk = new ValidationWalk(types);
        if (!checkPredicates(target, walk)) {
            return walk.rejection();
        }
        if (!target.isListEntry()) {
            return walk.outcome(walk.node(target.node(), value, target.instancePath()));
        }

        ListNode list = (ListNode) target.node();
        String entryPath = target.instancePath();
        if (value != null && value.isObject()) {
            for (String key : list.keys()) {
                JsonNode keyValue = ValidationWalk.field(value, list, key);
                if (keyValue == null || keyValue.isNull()) {
                    return ValidationOutcome.rejected(RejectionKind.MISSING_KEY, entryPath + "/" + key,
                            "list entry lacks key '" + key + "'");
                }
            }
        }
        ObjectNode entry = walk.object(list, value, entryPath);
        if (entry == null) {
            return walk.rejection();
        }
        for (String key : list.keys()) {
            JsonNode expected = types.check(
                    list.keyLeaf(key).type(), TextNode.valueOf(target.entryKeys().get(key)), entryPath, walk.scratch());
            JsonNode actual = entry.get(key);
            if (!actual.equals(expected)) {
                return ValidationOutcome.rejected(RejectionKind.KEY_MISMATCH, entryPath + "/" + key,
                        "key '" + key + "' is " + actual + " but the path names " + expected);
            }
        }
        return walk.outcome(entry);
    }

    /**
     * Checks only the predicate key values of a resolved path against their key leaf types. Used
     * for calls that carry no payload.
     */
    public ValidationOutcome validateKeys(ResolvedPath target) {
        ValidationWalk walk = new ValidationWalk(types);
        return checkPredicates(target, walk) ? walk.outcome(NullNode.getInstance()) : walk.rejection();
    }

    private boolean checkPredicates(ResolvedPath target, ValidationWalk walk) {
        for (ResolvedPath.Step step : target.steps()) {
            if (step.keys().isEmpty()) {
                continue;
            }
            ListNode list = (ListNode) step.node();
            for (String key : list.keys()) {
                JsonNode checked = walk.leaf(list.keyLeaf(key).type(), TextNode.valueOf(step.keys().get(key)),
                        step.instancePath() + "/" + key);
                if (checked == null) {
                    return false;
                }
            }
        }
        return true;
    }
}
