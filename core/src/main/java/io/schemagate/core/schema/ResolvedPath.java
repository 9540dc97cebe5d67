package io.schemagate.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of resolving a caller path against the constraint tree.
 *
 * @param node         the target schema node
 * @param module       owning module name
 * @param instancePath canonical instance path, predicates included and prefixes stripped
 * @param steps        one step per path segment, root first
 */
public record ResolvedPath(SchemaNode node, String module, String instancePath, List<Step> steps) {

    public ResolvedPath {
        Objects.requireNonNull(node, "node must not be null");
        steps = List.copyOf(steps);
    }

    /**
     * One resolved segment.
     *
     * @param node         schema node of the segment
     * @param keys         predicate key values, empty unless the segment addressed a list entry
     * @param instancePath instance path up to and including this segment
     */
    public record Step(SchemaNode node, Map<String, String> keys, String instancePath) {
        public Step {
            keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        }
    }

    /** Canonical schema path of the target (predicates stripped). */
    public String schemaPath() {
        return node.path();
    }

    /** True if the target is a single list entry addressed by key predicates. */
    public boolean isListEntry() {
        return node instanceof ListNode && !entryKeys().isEmpty();
    }

    /** Key values of the target segment, empty if none were given. */
    public Map<String, String> entryKeys() {
        return steps.get(steps.size() - 1).keys();
    }

    /** Name of the top-level node this path descends from. */
    public String topLevelName() {
        return steps.get(0).node().name();
    }
}
