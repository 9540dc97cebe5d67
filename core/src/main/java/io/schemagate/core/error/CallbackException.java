package io.schemagate.core.error;

import java.util.Objects;

/**
 * The application callback did not complete successfully: it returned an application error,
 * timed out, was cancelled, threw, or no handler was registered for the path.
 * URN: {@code urn:schema-gate:error:callback-failed}
 */
public final class CallbackException extends CallException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:schema-gate:error:callback-failed";

    /** Why the callback step failed. */
    public enum Reason {
        APPLICATION_ERROR("application-error"),
        TIMEOUT("timeout"),
        CANCELLED("cancelled"),
        HANDLER_FAILURE("handler-failure"),
        NO_HANDLER("no-handler"),
        DATASTORE_BUSY("datastore-busy"),
        SESSION_UNAVAILABLE("session-unavailable");

        private final String token;

        Reason(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }
    }

    private final Reason reason;

    public CallbackException(Reason reason, String message, String path) {
        super(message, path);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public CallbackException(Reason reason, String message, Throwable cause, String path) {
        super(message, cause, path);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public String kind() {
        return reason.token();
    }

    @Override
    public String urn() {
        return URN;
    }
}
