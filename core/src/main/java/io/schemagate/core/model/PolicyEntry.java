package io.schemagate.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One parsed policy grant: {@code {module, principal-class, operations}}.
 *
 * @param module         module name the grant applies to
 * @param principalClass principal class receiving the grant
 * @param operations     granted operations (defensively copied, unmodifiable)
 */
public record PolicyEntry(String module, String principalClass, Set<Operation> operations) {

    public PolicyEntry {
        Objects.requireNonNull(module, "module must not be null");
        Objects.requireNonNull(principalClass, "principalClass must not be null");
        Objects.requireNonNull(operations, "operations must not be null");
        operations = operations.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(operations));
    }

    public static PolicyEntry of(String module, String principalClass, Operation... operations) {
        return new PolicyEntry(module, principalClass, Set.of(operations));
    }
}
