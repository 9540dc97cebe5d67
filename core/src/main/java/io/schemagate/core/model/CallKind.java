package io.schemagate.core.model;

/** Kind of inbound call and the operation it needs granted on the target module. */
public enum CallKind {
    /** Configuration write to a data node; needs {@link Operation#WRITE}. */
    CONFIG_WRITE(Operation.WRITE, true),
    /** Data retrieval from a data node; needs {@link Operation#READ}. Carries no payload. */
    DATA_READ(Operation.READ, false),
    /** RPC invocation; needs {@link Operation#EXECUTE}. */
    RPC(Operation.EXECUTE, true),
    /** Notification delivery to a consumer; needs {@link Operation#READ}. */
    NOTIFICATION(Operation.READ, true);

    private final Operation requiredOperation;
    private final boolean carriesPayload;

    CallKind(Operation requiredOperation, boolean carriesPayload) {
        this.requiredOperation = requiredOperation;
        this.carriesPayload = carriesPayload;
    }

    public Operation requiredOperation() {
        return requiredOperation;
    }

    public boolean carriesPayload() {
        return carriesPayload;
    }
}
