package io.schemagate.core.error;

/** Thrown when a compiled-schema document is unreadable or structurally invalid. */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String source) {
        super(message, source);
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
