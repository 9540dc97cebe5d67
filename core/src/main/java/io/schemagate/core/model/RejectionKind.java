package io.schemagate.core.model;

/** Machine-distinguishable reason a value was rejected by the validator. */
public enum RejectionKind {
    TYPE_MISMATCH("type-mismatch"),
    PATTERN_MISMATCH("pattern-mismatch"),
    LENGTH_VIOLATION("length-violation"),
    RANGE_VIOLATION("range-violation"),
    ENUM_MISMATCH("enum-mismatch"),
    UNKNOWN_IDENTITY("unknown-identity"),
    IDENTITY_NOT_DERIVED("identity-not-derived"),
    MISSING_MANDATORY("missing-mandatory"),
    UNKNOWN_NODE("unknown-node"),
    CARDINALITY_VIOLATION("cardinality-violation"),
    DUPLICATE_KEY("duplicate-key"),
    MISSING_KEY("missing-key"),
    KEY_MISMATCH("key-mismatch"),
    /** Raised only by the dispatcher when unconstrained values are configured to be rejected. */
    UNCONSTRAINED_VALUE("unconstrained-value");

    private final String token;

    RejectionKind(String token) {
        this.token = token;
    }

    /** Lower-case token used in logs and envelopes. */
    public String token() {
        return token;
    }
}
