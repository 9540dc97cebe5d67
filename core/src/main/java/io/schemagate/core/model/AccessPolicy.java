package io.schemagate.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the access-control policy: per module, principal class → granted
 * operations. Anything not listed is denied; an empty policy denies everything.
 *
 * <p>Granularity is the module. A grant never cascades to other modules and never implies a
 * different operation: {@code execute} is independent of {@code read} and {@code write}.
 *
 * <p>Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class AccessPolicy {

    private static final AccessPolicy EMPTY = new AccessPolicy(Map.of(), List.of(), 0L);

    private final Map<String, Map<String, Set<Operation>>> grants;
    private final List<PolicyEntry> entries;
    private final long version;

    private AccessPolicy(Map<String, Map<String, Set<Operation>>> grants, List<PolicyEntry> entries, long version) {
        this.grants = grants;
        this.entries = entries;
        this.version = version;
    }

    /** The deny-all policy (version 0). */
    public static AccessPolicy empty() {
        return EMPTY;
    }

    /**
     * Builds a policy from parsed entries. Entries for the same (module, principal class) merge
     * by union.
     */
    public static AccessPolicy of(List<PolicyEntry> entries) {
        Map<String, Map<String, EnumSet<Operation>>> merged = new HashMap<>();
        for (PolicyEntry entry : entries) {
            EnumSet<Operation> ops = merged.computeIfAbsent(entry.module(), m -> new HashMap<>())
                    .computeIfAbsent(entry.principalClass(), c -> EnumSet.noneOf(Operation.class));
            ops.addAll(entry.operations());
        }
        Map<String, Map<String, Set<Operation>>> frozen = new HashMap<>();
        merged.forEach((module, byClass) -> {
            Map<String, Set<Operation>> classes = new HashMap<>();
            byClass.forEach((cls, ops) -> classes.put(cls, Collections.unmodifiableSet(ops)));
            frozen.put(module, Collections.unmodifiableMap(classes));
        });
        return new AccessPolicy(Collections.unmodifiableMap(frozen), List.copyOf(entries), 0L);
    }

    /** Returns a copy of this policy carrying the given version number. */
    public AccessPolicy withVersion(long newVersion) {
        return new AccessPolicy(grants, entries, newVersion);
    }

    /**
     * Returns the operations granted to a principal class on a module, never {@code null}.
     */
    public Set<Operation> grantsFor(String module, String principalClass) {
        Map<String, Set<Operation>> byClass = grants.get(module);
        if (byClass == null) {
            return Set.of();
        }
        Set<Operation> ops = byClass.get(principalClass);
        return ops != null ? ops : Set.of();
    }

    /** True only if an explicit grant covers (module, principal class, operation). */
    public boolean permits(String module, String principalClass, Operation operation) {
        return grantsFor(module, principalClass).contains(operation);
    }

    /** Modules with at least one grant. */
    public Set<String> modules() {
        return grants.keySet();
    }

    /** The entries this policy was built from, in document order. */
    public List<PolicyEntry> entries() {
        return entries;
    }

    /** Monotonic version assigned when the policy was installed; 0 for unpublished policies. */
    public long version() {
        return version;
    }

    @Override
    public String toString() {
        return "AccessPolicy[version=" + version + ", modules=" + grants.keySet() + "]";
    }
}
