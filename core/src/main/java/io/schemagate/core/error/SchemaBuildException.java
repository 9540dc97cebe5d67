package io.schemagate.core.error;

/**
 * Thrown when a constraint tree or identity registry cannot be built: duplicate path, malformed
 * pattern, dangling identity base, undeclared list key, or inconsistent bounds.
 */
public final class SchemaBuildException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaBuildException(String message) {
        super(message, null);
    }

    public SchemaBuildException(String message, String source) {
        super(message, source);
    }

    public SchemaBuildException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
