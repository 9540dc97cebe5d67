package io.schemagate.core.identity;

import java.util.Objects;
import java.util.Set;

/**
 * A named identity in the derivation DAG.
 *
 * @param name        canonical (unqualified) name, unique in the registry
 * @param module      owning module, or {@code null} if none was declared
 * @param bases       direct base identities
 * @param description optional description, may be {@code null}
 */
public record Identity(String name, String module, Set<String> bases, String description) {

    public Identity {
        Objects.requireNonNull(name, "name must not be null");
        bases = bases == null ? Set.of() : Set.copyOf(bases);
    }

    /** {@code module:name} when a module is declared, otherwise the bare name. */
    public String qualifiedName() {
        return module != null ? module + ":" + name : name;
    }
}
