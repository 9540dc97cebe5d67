package io.schemagate.core.dispatch;

import io.schemagate.core.error.CallbackException;
import io.schemagate.core.model.Session;
import io.schemagate.core.schema.ResolvedPath;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Read-write locks over the datastore, one per module or per top-level subtree. Writers exclude
 * everyone on the same key; readers only exclude writers.
 *
 * <p>A lock must be released by the thread that acquired it; the dispatcher acquires and
 * releases on the calling thread around the whole validate-authorize-invoke sequence.
 */
public final class DatastoreLocks {

    private final ConcurrentHashMap<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();
    private final LockGranularity granularity;

    public DatastoreLocks(LockGranularity granularity) {
        this.granularity = granularity;
    }

    /** Lock key for a target: the module name, or the top-level node path. */
    public String keyFor(ResolvedPath target) {
        return granularity == LockGranularity.MODULE ? target.module() : "/" + target.topLevelName();
    }

    /**
     * Acquires the lock for {@code key} and records it on the session.
     *
     * @throws CallbackException    with reason DATASTORE_BUSY if not acquired within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public Held acquire(Session session, String key, boolean exclusive, long timeoutMs, String path)
            throws InterruptedException {
        ReentrantReadWriteLock rw = locks.computeIfAbsent(key, k -> new ReentrantReadWriteLock(true));
        Lock lock = exclusive ? rw.writeLock() : rw.readLock();
        if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
            throw new CallbackException(CallbackException.Reason.DATASTORE_BUSY,
                    "datastore busy: " + (exclusive ? "write" : "read") + " lock on '" + key + "' not acquired within "
                            + timeoutMs + " ms", path);
        }
        session.lockAcquired(key);
        return new Held(session, key, lock);
    }

    /** True if any thread holds the write lock for {@code key}. */
    public boolean isWriteLocked(String key) {
        ReentrantReadWriteLock rw = locks.get(key);
        return rw != null && rw.isWriteLocked();
    }

    /** A held lock; closing releases it and removes it from the session. */
    public static final class Held implements AutoCloseable {

        private final Session session;
        private final String key;
        private final Lock lock;

        private Held(Session session, String key, Lock lock) {
            this.session = session;
            this.key = key;
            this.lock = lock;
        }

        public String key() {
            return key;
        }

        @Override
        public void close() {
            lock.unlock();
            session.lockReleased(key);
        }
    }
}
