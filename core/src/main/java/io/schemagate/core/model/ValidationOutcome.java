package io.schemagate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating a value against a schema node. Exactly one of two states:
 *
 * <ul>
 * <li>{@link Type#ACCEPTED}: {@code value} holds the normalized value; {@code unconstrainedPaths}
 * lists every leaf that was accepted without any real constraint (opaque types).
 * <li>{@link Type#REJECTED}: {@code kind}, {@code path} and {@code detail} describe the first
 * violation found.
 * </ul>
 *
 * <p>Immutable and thread-safe.
 */
public final class ValidationOutcome {

    /** The type of validation outcome. */
    public enum Type {
        ACCEPTED,
        REJECTED
    }

    private final Type type;
    private final JsonNode value;
    private final List<String> unconstrainedPaths;
    private final RejectionKind kind;
    private final String path;
    private final String detail;

    private ValidationOutcome(
            Type type,
            JsonNode value,
            List<String> unconstrainedPaths,
            RejectionKind kind,
            String path,
            String detail) {
        this.type = type;
        this.value = value;
        this.unconstrainedPaths = unconstrainedPaths;
        this.kind = kind;
        this.path = path;
        this.detail = detail;
    }

    /** Creates an ACCEPTED outcome with no unconstrained leaves. */
    public static ValidationOutcome accepted(JsonNode normalized) {
        return accepted(normalized, List.of());
    }

    /** Creates an ACCEPTED outcome flagging the given unconstrained leaf paths. */
    public static ValidationOutcome accepted(JsonNode normalized, List<String> unconstrainedPaths) {
        Objects.requireNonNull(normalized, "normalized must not be null for ACCEPTED");
        return new ValidationOutcome(
                Type.ACCEPTED, normalized, List.copyOf(unconstrainedPaths), null, null, null);
    }

    /** Creates a REJECTED outcome. */
    public static ValidationOutcome rejected(RejectionKind kind, String path, String detail) {
        Objects.requireNonNull(kind, "kind must not be null for REJECTED");
        Objects.requireNonNull(path, "path must not be null for REJECTED");
        return new ValidationOutcome(Type.REJECTED, null, List.of(), kind, path, detail);
    }

    public Type type() {
        return type;
    }

    public boolean isAccepted() {
        return type == Type.ACCEPTED;
    }

    public boolean isRejected() {
        return type == Type.REJECTED;
    }

    /** Normalized value. Only valid when {@code isAccepted()}. */
    public JsonNode value() {
        return value;
    }

    /** True when at least one accepted leaf carried no real constraint. */
    public boolean isUnconstrained() {
        return !unconstrainedPaths.isEmpty();
    }

    /** Instance paths of opaque leaves accepted as-is, in document order. */
    public List<String> unconstrainedPaths() {
        return unconstrainedPaths;
    }

    /** Rejection kind. Only valid when {@code isRejected()}. */
    public RejectionKind kind() {
        return kind;
    }

    /** Offending instance path. Only valid when {@code isRejected()}. */
    public String path() {
        return path;
    }

    /** Human-readable rejection detail. Only valid when {@code isRejected()}. */
    public String detail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationOutcome that)) return false;
        return type == that.type
                && Objects.equals(value, that.value)
                && unconstrainedPaths.equals(that.unconstrainedPaths)
                && kind == that.kind
                && Objects.equals(path, that.path)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, unconstrainedPaths, kind, path, detail);
    }

    @Override
    public String toString() {
        return switch (type) {
            case ACCEPTED -> "ValidationOutcome[ACCEPTED"
                    + (isUnconstrained() ? ", unconstrained=" + unconstrainedPaths : "") + "]";
            case REJECTED -> "ValidationOutcome[REJECTED, kind=" + kind.token() + ", path=" + path + "]";
        };
    }
}
