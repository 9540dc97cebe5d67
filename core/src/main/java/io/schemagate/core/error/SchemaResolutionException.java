package io.schemagate.core.error;

/**
 * The target path does not resolve in the constraint tree. Always safe to disclose: it only
 * echoes the caller's own input. URN: {@code urn:schema-gate:error:not-found}
 */
public final class SchemaResolutionException extends CallException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:schema-gate:error:not-found";

    public SchemaResolutionException(String message, String path) {
        super(message, path);
    }

    @Override
    public String kind() {
        return "unknown-path";
    }

    @Override
    public String urn() {
        return URN;
    }
}
