package io.schemagate.standalone.runtime;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a single file for changes and fires a callback after a debounce period.
 *
 * <p>{@link WatchService} only watches directories, so the file's parent is registered and events
 * for other entries are ignored. Rapid successive changes (editors often write a file in several
 * steps) are coalesced into one callback.
 *
 * <p>Lifecycle: {@link #start()} begins watching on a daemon thread, {@link #stop()} closes the
 * watch service and shuts the scheduler down. The callback runs on the scheduler thread;
 * exceptions it throws are logged and do not stop the watcher.
 */
public final class FileWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FileWatcher.class);

    private final Path file;
    private final int debounceMs;
    private final Runnable callback;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private WatchService watchService;
    private Thread watchThread;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;

    /**
     * @param file       file to watch
     * @param debounceMs quiet period before the callback fires
     * @param callback   invoked once per burst of changes
     */
    public FileWatcher(Path file, int debounceMs, Runnable callback) {
        this.file = file.toAbsolutePath().normalize();
        this.debounceMs = debounceMs;
        this.callback = callback;
    }

    /**
     * Starts watching.
     *
     * @throws IOException if the watch service cannot be created or the directory registered
     */
    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            LOG.warn("FileWatcher already running");
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "policy-watcher-debounce");
            t.setDaemon(true);
            return t;
        });
        file.getParent()
                .register(
                        watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);

        watchThread = new Thread(this::pollLoop, "policy-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
        LOG.info("FileWatcher started: file={} debounce_ms={}", file, debounceMs);
    }

    /** Stops watching and releases all resources. Idempotent. */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            if (watchService != null) {
                watchService.close();
            }
        } catch (IOException e) {
            LOG.warn("Error closing WatchService", e);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (watchThread != null) {
            watchThread.interrupt();
        }
        LOG.info("FileWatcher stopped: file={}", file);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void pollLoop() {
        Path name = file.getFileName();
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            boolean relevant = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    // events were lost; reload anyway
                    relevant = true;
                    continue;
                }
                if (name.equals(event.context())) {
                    LOG.debug("File change detected: {} ({})", file, event.kind().name());
                    relevant = true;
                }
            }
            if (!key.reset()) {
                LOG.warn("Watch key no longer valid (directory deleted?): {}", file.getParent());
            }
            if (relevant) {
                scheduleCallback();
            }
        }
    }

    private synchronized void scheduleCallback() {
        if (pending != null && !pending.isDone()) {
            pending.cancel(false);
        }
        pending = scheduler.schedule(
                () -> {
                    try {
                        callback.run();
                    } catch (Exception e) {
                        LOG.error("FileWatcher callback failed for {}", file, e);
                    }
                },
                debounceMs,
                TimeUnit.MILLISECONDS);
    }
}
