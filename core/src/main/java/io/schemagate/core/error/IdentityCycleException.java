package io.schemagate.core.error;

import java.util.List;

/** Thrown when the identity base relation contains a cycle. */
public final class IdentityCycleException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public IdentityCycleException(List<String> cycle, String source) {
        super("Identity base cycle detected: " + String.join(" -> ", cycle), source);
        this.cycle = List.copyOf(cycle);
    }

    /** The identities forming the cycle, first element repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}
