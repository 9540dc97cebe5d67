package io.schemagate.core.error;

/** Thrown when a policy document is unreadable or structurally invalid. */
public final class PolicyParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public PolicyParseException(String message, String source) {
        super(message, source);
    }

    public PolicyParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
