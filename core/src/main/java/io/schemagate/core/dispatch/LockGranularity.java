package io.schemagate.core.dispatch;

/** Scope of a datastore lock. */
public enum LockGranularity {
    /** One lock per module. */
    MODULE,
    /** One lock per top-level node. */
    SUBTREE
}
