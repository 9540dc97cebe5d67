package io.schemagate.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one dispatched call as reported back to the transport layer.
 *
 * <p>Caller-facing fields are {@link #status()}, {@link #path()}, {@link #payload()} and
 * {@link #detail()}. The {@code audit*} fields always carry the machine-distinguishable kind and
 * the offending path, even when the caller-facing detail was suppressed (e.g. a validation
 * failure reported as a plain denial). Transports must not forward the audit fields to the caller.
 */
public final class ResponseEnvelope {

    /** Exit status as seen by the caller. */
    public enum Status {
        OK,
        NOT_FOUND,
        VALIDATION_FAILED,
        ACCESS_DENIED,
        CALLBACK_ERROR
    }

    private final Status status;
    private final CallState terminalState;
    private final String callId;
    private final String path;
    private final JsonNode payload;
    private final String detail;
    private final String auditKind;
    private final String auditPath;
    private final String auditDetail;
    private final List<String> unconstrainedPaths;

    private ResponseEnvelope(
            Status status,
            CallState terminalState,
            String callId,
            String path,
            JsonNode payload,
            String detail,
            String auditKind,
            String auditPath,
            String auditDetail,
            List<String> unconstrainedPaths) {
        this.status = status;
        this.terminalState = terminalState;
        this.callId = callId;
        this.path = path;
        this.payload = payload;
        this.detail = detail;
        this.auditKind = auditKind;
        this.auditPath = auditPath;
        this.auditDetail = auditDetail;
        this.unconstrainedPaths = List.copyOf(unconstrainedPaths);
    }

    /** Creates an OK envelope carrying the callback payload (may be {@code null}). */
    public static ResponseEnvelope ok(String callId, String path, JsonNode payload, List<String> unconstrainedPaths) {
        return new ResponseEnvelope(
                Status.OK, CallState.COMPLETED, callId, path, payload, null, null, null, null, unconstrainedPaths);
    }

    /**
     * Creates a failure envelope.
     *
     * @param status      caller-facing status, never {@link Status#OK}
     * @param state       terminal state the call ended in
     * @param callId      call identifier
     * @param path        requested path as supplied by the caller
     * @param detail      caller-facing detail (already suppressed where required)
     * @param auditKind   machine-distinguishable kind
     * @param auditPath   offending path
     * @param auditDetail full detail for logs and audit listeners
     */
    public static ResponseEnvelope failure(
            Status status,
            CallState state,
            String callId,
            String path,
            String detail,
            String auditKind,
            String auditPath,
            String auditDetail) {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.OK) {
            throw new IllegalArgumentException("failure envelope cannot have status OK");
        }
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("state must be terminal, got: " + state);
        }
        Objects.requireNonNull(auditKind, "auditKind must not be null");
        Objects.requireNonNull(auditPath, "auditPath must not be null");
        return new ResponseEnvelope(
                status, state, callId, path, null, detail, auditKind, auditPath, auditDetail, List.of());
    }

    public Status status() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public CallState terminalState() {
        return terminalState;
    }

    public String callId() {
        return callId;
    }

    public String path() {
        return path;
    }

    /** Callback payload. Only set when {@code isOk()}; may still be {@code null}. */
    public JsonNode payload() {
        return payload;
    }

    /** Caller-facing detail, {@code null} for OK. */
    public String detail() {
        return detail;
    }

    public String auditKind() {
        return auditKind;
    }

    public String auditPath() {
        return auditPath;
    }

    public String auditDetail() {
        return auditDetail;
    }

    /** Leaves accepted without real constraint, surfaced for audit. Empty on failures. */
    public List<String> unconstrainedPaths() {
        return unconstrainedPaths;
    }

    @Override
    public String toString() {
        return status == Status.OK
                ? "ResponseEnvelope[OK, callId=" + callId + ", path=" + path + "]"
                : "ResponseEnvelope[" + status + ", callId=" + callId + ", path=" + path + ", kind=" + auditKind + "]";
    }
}
