package io.schemagate.core.dispatch;

import io.schemagate.core.spi.CallbackHandler;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps canonical schema paths to callback handlers. A lookup walks from the target path towards
 * the root and returns the nearest registered ancestor. Thread-safe; registering a path twice
 * replaces the earlier handler.
 */
public final class HandlerRegistry {

    private final Map<String, CallbackHandler> handlers = new ConcurrentHashMap<>();

    /** A lookup hit: the handler and the path it was registered under. */
    public record Match(String registeredPath, CallbackHandler handler) {}

    /**
     * Registers {@code handler} for {@code schemaPath} and everything below it.
     *
     * @throws IllegalArgumentException if the path is blank, the root, or carries predicates
     */
    public HandlerRegistry register(String schemaPath, CallbackHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.put(canonical(schemaPath), handler);
        return this;
    }

    /** Removes the handler registered exactly at {@code schemaPath}. */
    public boolean unregister(String schemaPath) {
        return handlers.remove(canonical(schemaPath)) != null;
    }

    /** Finds the handler registered at {@code schemaPath} or its nearest ancestor. */
    public Optional<Match> lookup(String schemaPath) {
        String candidate = canonical(schemaPath);
        while (!candidate.isEmpty()) {
            CallbackHandler handler = handlers.get(candidate);
            if (handler != null) {
                return Optional.of(new Match(candidate, handler));
            }
            candidate = candidate.substring(0, candidate.lastIndexOf('/'));
        }
        return Optional.empty();
    }

    public int size() {
        return handlers.size();
    }

    private static String canonical(String schemaPath) {
        if (schemaPath == null || schemaPath.isBlank()) {
            throw new IllegalArgumentException("schema path must not be null or blank");
        }
        if (schemaPath.indexOf('[') >= 0) {
            throw new IllegalArgumentException("schema path must not carry predicates: " + schemaPath);
        }
        String path = schemaPath.startsWith("/") ? schemaPath : "/" + schemaPath;
        path = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        if (path.isEmpty()) {
            throw new IllegalArgumentException("schema path must name a node");
        }
        return path;
    }
}
