package io.schemagate.core.error;

/**
 * No grant covers the requested operation. The message is for audit logs only; the caller
 * receives a generic denial that does not reveal policy structure.
 * URN: {@code urn:schema-gate:error:access-denied}
 */
public final class AuthorizationException extends CallException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:schema-gate:error:access-denied";

    /** Caller-facing text for every denial. */
    public static final String GENERIC_DETAIL = "access denied";

    public AuthorizationException(String auditReason, String path) {
        super(auditReason, path);
    }

    @Override
    public String kind() {
        return "access-denied";
    }

    @Override
    public String urn() {
        return URN;
    }
}
