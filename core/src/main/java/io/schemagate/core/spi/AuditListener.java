package io.schemagate.core.spi;

import io.schemagate.core.model.CallKind;
import java.util.List;

/**
 * SPI for audit hooks. Host integrations bridge these events to an audit trail, metrics or
 * alerting system; the core has no dependency on any of them.
 *
 * <p>All methods receive immutable event records. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught and logged; they never change the
 * outcome of a call or a reload.
 *
 * <p>Rejection events carry the full kind, path and detail even when the caller only saw a
 * generic denial.
 */
public interface AuditListener {

    /** Called when a call reaches COMPLETED. */
    void onCallCompleted(CallCompletedEvent event);

    /** Called when a call ends in any error state. */
    void onCallRejected(CallRejectedEvent event);

    /** Called when a validated value contained leaves accepted without any real constraint. */
    void onUnconstrainedValue(UnconstrainedValueEvent event);

    /** Called after a new access policy has been installed. */
    void onPolicyReloaded(PolicyReloadedEvent event);

    // --- Event records ---

    /** A call that reached its callback and completed. */
    record CallCompletedEvent(
            String sessionId, String callId, String principalClass, CallKind kind, String path, long durationMs) {}

    /**
     * A call that ended in NOT_FOUND, REJECTED, DENIED or CALLBACK_ERROR.
     *
     * @param status caller-facing status name
     * @param kind   machine-distinguishable error kind
     * @param path   offending path
     * @param detail full detail, never shown to callers lacking READ
     */
    record CallRejectedEvent(
            String sessionId,
            String callId,
            String principalClass,
            CallKind callKind,
            String status,
            String kind,
            String path,
            String detail) {}

    /** Unconstrained leaves seen while validating one call. */
    record UnconstrainedValueEvent(String sessionId, String callId, String module, List<String> paths) {}

    /** A policy swap; {@code source} is {@code null} for policies installed in code. */
    record PolicyReloadedEvent(long version, int entryCount, String source) {}
}
