package io.schemagate.core.error;

/**
 * Abstract base for all schema-gate exceptions. Never thrown directly; use the concrete
 * subclasses under {@link SchemaLoadException} or {@link CallException}.
 */
public abstract class SchemaGateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        CALL
    }

    private final Phase phase;

    protected SchemaGateException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected SchemaGateException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
