package io.schemagate.core.error;

/**
 * Abstract parent for startup-time errors: the compiled schema, the identity DAG or the policy
 * document could not be turned into a consistent in-memory model. These are fatal: the host
 * must refuse to come up rather than run with an inconsistent schema. Carries an additional
 * {@code source} field identifying the file or resource that caused the error.
 */
public abstract class SchemaLoadException extends SchemaGateException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} if built in code. */
    public String source() {
        return source;
    }
}
