package io.schemagate.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-connection caller state. Created when a client connects and closed on disconnect.
 *
 * <p>A session owns no schema data. It records the caller's {@link Principal}, the policy
 * snapshot its most recent authorization used, the datastore locks it currently holds, and the
 * callback currently in flight (so that it can be cancelled).
 *
 * <p>One logical call at a time per session is assumed; the fields are still safe to read from
 * other threads (cancellation, introspection).
 */
public final class Session {

    private final String id;
    private final Principal principal;
    private final Set<String> heldLocks = Collections.synchronizedSet(new LinkedHashSet<>());
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile AccessPolicy activePolicy = AccessPolicy.empty();

    private Session(String id, Principal principal) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.principal = Objects.requireNonNull(principal, "principal must not be null");
    }

    /** Opens a session with a random id. */
    public static Session open(Principal principal) {
        return new Session(UUID.randomUUID().toString(), principal);
    }

    /** Opens a session with a transport-assigned id. */
    public static Session open(String id, Principal principal) {
        return new Session(id, principal);
    }

    public String id() {
        return id;
    }

    public Principal principal() {
        return principal;
    }

    /** The policy snapshot used by this session's most recent authorization. */
    public AccessPolicy activePolicy() {
        return activePolicy;
    }

    public void recordPolicy(AccessPolicy policy) {
        this.activePolicy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /** Keys of the datastore locks currently held, in acquisition order. */
    public Set<String> heldLocks() {
        synchronized (heldLocks) {
            return Set.copyOf(heldLocks);
        }
    }

    public void lockAcquired(String lockKey) {
        heldLocks.add(lockKey);
    }

    public void lockReleased(String lockKey) {
        heldLocks.remove(lockKey);
    }

    /**
     * Registers the callback task currently running for this session.
     *
     * @throws IllegalStateException if the session is closed or already has a call in flight
     */
    public void beginCall(Future<?> task) {
        if (closed.get()) {
            throw new IllegalStateException("session " + id + " is closed");
        }
        if (!inFlight.compareAndSet(null, task)) {
            throw new IllegalStateException("session " + id + " already has a call in flight");
        }
    }

    public void endCall(Future<?> task) {
        inFlight.compareAndSet(task, null);
    }

    /**
     * Cancels the callback currently in flight, if any.
     *
     * @return {@code true} if a running call was cancelled
     */
    public boolean cancelInFlight() {
        Future<?> task = inFlight.get();
        return task != null && task.cancel(true);
    }

    public boolean hasCallInFlight() {
        return inFlight.get() != null;
    }

    /** Closes the session, cancelling any in-flight call. Idempotent. */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            cancelInFlight();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "Session[id=" + id + ", principal=" + principal.name() + "/" + principal.principalClass() + "]";
    }
}
