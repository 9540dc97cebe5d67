package io.schemagate.core.dispatch;

/** What the dispatcher does with values accepted only because their leaf declares no constraint. */
public enum UnconstrainedValueMode {
    /** Accept, log at WARN and notify the audit listener. */
    AUDIT,
    /** Reject the call as a validation failure. */
    REJECT
}
