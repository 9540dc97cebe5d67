package io.schemagate.core.dispatch;

import java.util.Objects;

/**
 * Tuning knobs of a {@link Dispatcher}.
 *
 * @param callbackTimeoutMs how long a callback may run before it is cancelled
 * @param lockTimeoutMs     how long to wait for a datastore lock before reporting the datastore busy
 * @param workerThreads     size of the callback worker pool
 * @param lockGranularity   scope of datastore locks
 * @param unconstrained     handling of values accepted without constraint
 */
public record DispatcherConfig(
        long callbackTimeoutMs,
        long lockTimeoutMs,
        int workerThreads,
        LockGranularity lockGranularity,
        UnconstrainedValueMode unconstrained) {

    public static final DispatcherConfig DEFAULT =
            new DispatcherConfig(5_000L, 1_000L, 8, LockGranularity.MODULE, UnconstrainedValueMode.AUDIT);

    public DispatcherConfig {
        if (callbackTimeoutMs <= 0) {
            throw new IllegalArgumentException("callbackTimeoutMs must be positive, got: " + callbackTimeoutMs);
        }
        if (lockTimeoutMs < 0) {
            throw new IllegalArgumentException("lockTimeoutMs must not be negative, got: " + lockTimeoutMs);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1, got: " + workerThreads);
        }
        Objects.requireNonNull(lockGranularity, "lockGranularity must not be null");
        Objects.requireNonNull(unconstrained, "unconstrained must not be null");
    }

    public DispatcherConfig withCallbackTimeoutMs(long value) {
        return new DispatcherConfig(value, lockTimeoutMs, workerThreads, lockGranularity, unconstrained);
    }

    public DispatcherConfig withLockTimeoutMs(long value) {
        return new DispatcherConfig(callbackTimeoutMs, value, workerThreads, lockGranularity, unconstrained);
    }

    public DispatcherConfig withUnconstrained(UnconstrainedValueMode value) {
        return new DispatcherConfig(callbackTimeoutMs, lockTimeoutMs, workerThreads, lockGranularity, value);
    }
}
