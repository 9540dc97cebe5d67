package io.schemagate.core.model;

/**
 * States of a single dispatched call. The happy path is {@code RECEIVED → RESOLVED → VALIDATED →
 * AUTHORIZED → INVOKED → COMPLETED}; every transition except the last has an error exit.
 */
public enum CallState {
    RECEIVED(false),
    RESOLVED(false),
    VALIDATED(false),
    AUTHORIZED(false),
    INVOKED(false),
    COMPLETED(true),
    NOT_FOUND(true),
    REJECTED(true),
    DENIED(true),
    CALLBACK_ERROR(true);

    private final boolean terminal;

    CallState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
