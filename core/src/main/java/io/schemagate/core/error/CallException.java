package io.schemagate.core.error;

/**
 * Abstract parent for per-call errors. Thrown while a single inbound call is being resolved,
 * validated, authorized or invoked. The dispatcher catches these at the call boundary and maps
 * them into a response envelope; they never terminate the session or the process.
 *
 * <p>Every instance carries the offending path and a machine-distinguishable {@link #kind()},
 * even when the caller-facing detail is later suppressed.
 */
public abstract class CallException extends SchemaGateException {

    private static final long serialVersionUID = 1L;

    private final String path;

    protected CallException(String message, String path) {
        super(message, Phase.CALL);
        this.path = path;
    }

    protected CallException(String message, Throwable cause, String path) {
        super(message, cause, Phase.CALL);
        this.path = path;
    }

    /** The offending instance path. */
    public String path() {
        return path;
    }

    /** Stable, lower-case kind token used in logs, audit events and envelopes. */
    public abstract String kind();

    /** URN identifying the error type in rendered envelopes. */
    public abstract String urn();
}
