package io.schemagate.core.identity;

import io.schemagate.core.error.IdentityCycleException;
import io.schemagate.core.error.SchemaBuildException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable identity DAG with a precomputed transitive closure.
 *
 * <p>Every identity is assigned an ordinal at build time; its closure is a {@link BitSet} holding
 * the ordinals of itself and every identity it transitively derives from. A derivation check is
 * then a single bit test, independent of DAG depth.
 *
 * <p>Thread-safe: built once, never mutated.
 */
public final class IdentityRegistry {

    private static final IdentityRegistry EMPTY = new IdentityRegistry(List.of(), Map.of(), new BitSet[0]);

    private final List<Identity> identities;
    private final Map<String, Integer> ordinals;
    private final BitSet[] closures;

    private IdentityRegistry(List<Identity> identities, Map<String, Integer> ordinals, BitSet[] closures) {
        this.identities = identities;
        this.ordinals = ordinals;
        this.closures = closures;
    }

    /** A registry with no identities. */
    public static IdentityRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * True if {@code candidate} equals {@code base} or transitively derives from it. Both names
     * may be given in {@code module:name} form. Unknown names never derive from anything.
     */
    public boolean isDerivedFrom(String candidate, String base) {
        Integer c = ordinalOf(candidate);
        Integer b = ordinalOf(base);
        return c != null && b != null && closures[c].get(b);
    }

    public boolean contains(String name) {
        return ordinalOf(name) != null;
    }

    /** Looks up an identity by bare or {@code module:name} form. */
    public Optional<Identity> lookup(String name) {
        Integer ordinal = ordinalOf(name);
        return ordinal == null ? Optional.empty() : Optional.of(identities.get(ordinal));
    }

    /** All identities strictly deriving from {@code base}, in declaration order. */
    public List<Identity> derivedFrom(String base) {
        Integer b = ordinalOf(base);
        if (b == null) {
            return List.of();
        }
        List<Identity> result = new ArrayList<>();
        for (int i = 0; i < identities.size(); i++) {
            if (i != b && closures[i].get(b)) {
                result.add(identities.get(i));
            }
        }
        return result;
    }

    /** All identities in declaration order. */
    public List<Identity> identities() {
        return identities;
    }

    public int size() {
        return identities.size();
    }

    private Integer ordinalOf(String name) {
        if (name == null) {
            return null;
        }
        int colon = name.indexOf(':');
        if (colon < 0) {
            return ordinals.get(name);
        }
        Integer ordinal = ordinals.get(name.substring(colon + 1));
        if (ordinal == null) {
            return null;
        }
        String module = identities.get(ordinal).module();
        return name.substring(0, colon).equals(module) ? ordinal : null;
    }

    @Override
    public String toString() {
        return "IdentityRegistry[size=" + identities.size() + "]";
    }

    /** Collects identity declarations and computes the closure on {@link #build()}. */
    public static final class Builder {

        private static final int VISITING = 1;
        private static final int DONE = 2;

        private final Map<String, Identity> declared = new LinkedHashMap<>();
        private String source;

        private Builder() {}

        /** File or resource the declarations came from, reported in build errors. */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder identity(String name, String... bases) {
            return identity(new Identity(name, null, new LinkedHashSet<>(Arrays.asList(bases)), null));
        }

        public Builder identity(Identity identity) {
            Objects.requireNonNull(identity, "identity must not be null");
            if (declared.putIfAbsent(identity.name(), identity) != null) {
                throw new SchemaBuildException("Duplicate identity '" + identity.name() + "'", source);
            }
            return this;
        }

        public Builder identities(Collection<Identity> all) {
            all.forEach(this::identity);
            return this;
        }

        /**
         * Validates the DAG and computes closures.
         *
         * @throws SchemaBuildException   if a base is not declared
         * @throws IdentityCycleException if the base relation has a cycle
         */
        public IdentityRegistry build() {
            if (declared.isEmpty()) {
                return EMPTY;
            }
            for (Identity identity : declared.values()) {
                for (String base : identity.bases()) {
                    if (!declared.containsKey(base)) {
                        throw new SchemaBuildException(
                                "Identity '" + identity.name() + "' names unknown base '" + base + "'", source);
                    }
                }
            }

            List<Identity> ordered = List.copyOf(declared.values());
            Map<String, Integer> ordinals = new HashMap<>();
            for (int i = 0; i < ordered.size(); i++) {
                ordinals.put(ordered.get(i).name(), i);
            }

            BitSet[] closures = new BitSet[ordered.size()];
            int[] state = new int[ordered.size()];
            for (int i = 0; i < ordered.size(); i++) {
                if (state[i] == DONE) continue;
                closeFrom(i, ordered, ordinals, closures, state);
            }
            return new IdentityRegistry(ordered, Collections.unmodifiableMap(ordinals), closures);
        }

        // Iterative post-order DFS; an edge back into a VISITING node is a cycle.
        private void closeFrom(
                int start, List<Identity> ordered, Map<String, Integer> ordinals, BitSet[] closures, int[] state) {
            Deque<Integer> stack = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            stack.push(start);
            pending.push(ordered.get(start).bases().iterator());
            state[start] = VISITING;

            while (!stack.isEmpty()) {
                int current = stack.peek();
                Iterator<String> bases = pending.peek();
                if (bases.hasNext()) {
                    int next = ordinals.get(bases.next());
                    if (state[next] == VISITING) {
                        throw new IdentityCycleException(cyclePath(stack, next, ordered), source);
                    }
                    if (state[next] == 0) {
                        state[next] = VISITING;
                        stack.push(next);
                        pending.push(ordered.get(next).bases().iterator());
                    }
                    continue;
                }
                BitSet closure = new BitSet(ordered.size());
                closure.set(current);
                for (String base : ordered.get(current).bases()) {
                    closure.or(closures[ordinals.get(base)]);
                }
                closures[current] = closure;
                state[current] = DONE;
                stack.pop();
                pending.pop();
            }
        }

        private static List<String> cyclePath(Deque<Integer> stack, int repeated, List<Identity> ordered) {
            List<String> path = new ArrayList<>();
            boolean inCycle = false;
            for (Iterator<Integer> it = stack.descendingIterator(); it.hasNext(); ) {
                int ordinal = it.next();
                if (ordinal == repeated) {
                    inCycle = true;
                }
                if (inCycle) {
                    path.add(ordered.get(ordinal).name());
                }
            }
            path.add(ordered.get(repeated).name());
            return path;
        }
    }
}
