package io.schemagate.core.access;

import io.schemagate.core.model.AccessPolicy;
import io.schemagate.core.model.PolicyEntry;
import io.schemagate.core.spi.AuditListener;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the active {@link AccessPolicy}. Readers capture an immutable snapshot under the read
 * lock; a reload builds the new policy outside the lock and takes the write lock only for the
 * reference swap. A call that captured its snapshot before a swap keeps deciding against it.
 *
 * <p>Starts out with the deny-all policy. Every installed policy gets the next version number.
 */
public final class PolicyStore {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AuditListener listener;
    private AccessPolicy current = AccessPolicy.empty();

    public PolicyStore() {
        this(null);
    }

    /** @param listener optional audit listener, notified after each reload */
    public PolicyStore(AuditListener listener) {
        this.listener = listener;
    }

    /** The policy in effect right now. */
    public AccessPolicy snapshot() {
        lock.readLock().lock();
        try {
            return current;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Installs a policy built from the given entries. */
    public AccessPolicy reload(List<PolicyEntry> entries) {
        return reload(AccessPolicy.of(entries), null);
    }

    /**
     * Installs {@code policy} under the next version number.
     *
     * @param source file the policy was read from, or {@code null}
     * @return the installed, versioned snapshot
     */
    public AccessPolicy reload(AccessPolicy policy, String source) {
        Objects.requireNonNull(policy, "policy must not be null");
        AccessPolicy installed;
        lock.writeLock().lock();
        try {
            installed = policy.withVersion(current.version() + 1);
            current = installed;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.info(
                "policy.reloaded version={} entries={} modules={} source={}",
                installed.version(),
                installed.entries().size(),
                installed.modules().size(),
                source != null ? source : "inline");
        notifyReloaded(installed, source);
        return installed;
    }

    private void notifyReloaded(AccessPolicy policy, String source) {
        if (listener == null) return;
        try {
            listener.onPolicyReloaded(
                    new AuditListener.PolicyReloadedEvent(policy.version(), policy.entries().size(), source));
        } catch (Exception e) {
            LOG.warn("AuditListener.onPolicyReloaded failed", e);
        }
    }
}
