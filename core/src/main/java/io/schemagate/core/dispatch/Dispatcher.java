package io.schemagate.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemagate.core.access.AccessControlEnforcer;
import io.schemagate.core.access.AccessDecision;
import io.schemagate.core.access.PolicyStore;
import io.schemagate.core.error.AuthorizationException;
import io.schemagate.core.error.CallException;
import io.schemagate.core.error.CallbackException;
import io.schemagate.core.error.SchemaResolutionException;
import io.schemagate.core.error.ValidationException;
import io.schemagate.core.model.AccessPolicy;
import io.schemagate.core.model.CallKind;
import io.schemagate.core.model.CallState;
import io.schemagate.core.model.InboundCall;
import io.schemagate.core.model.Operation;
import io.schemagate.core.model.RejectionKind;
import io.schemagate.core.model.ResponseEnvelope;
import io.schemagate.core.model.ResponseEnvelope.Status;
import io.schemagate.core.model.Session;
import io.schemagate.core.model.ValidationOutcome;
import io.schemagate.core.schema.ConstraintTree;
import io.schemagate.core.schema.Notification;
import io.schemagate.core.schema.ResolvedPath;
import io.schemagate.core.schema.RpcInput;
import io.schemagate.core.schema.SchemaNode;
import io.schemagate.core.spi.AuditListener;
import io.schemagate.core.spi.CallbackRequest;
import io.schemagate.core.spi.CallbackResult;
import io.schemagate.core.validate.Validator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs every inbound call through resolve, validate, authorize and invoke.
 *
 * <p>A call moves {@code RECEIVED → RESOLVED → VALIDATED → AUTHORIZED → INVOKED → COMPLETED}, or
 * ends early in {@code NOT_FOUND}, {@code REJECTED}, {@code DENIED} or {@code CALLBACK_ERROR}. The
 * callback is never invoked unless validation and authorization both succeeded. Per-call errors
 * are turned into a {@link ResponseEnvelope} here and never escape {@link #dispatch}.
 *
 * <p>Validation detail is disclosed only to callers holding READ on the target module; everyone
 * else gets the same generic denial an authorization failure produces. The envelope's audit
 * fields, the logs and the {@link AuditListener} always carry the real kind and path.
 *
 * <p>Thread-safe. Sessions may dispatch concurrently; each session runs one call at a time.
 */
public final class Dispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    /** MDC key holding the session id for the duration of a dispatch. */
    public static final String MDC_SESSION_ID = "sessionId";
    /** MDC key holding the call id for the duration of a dispatch. */
    public static final String MDC_CALL_ID = "callId";

    private final ConstraintTree tree;
    private final Validator validator;
    private final AccessControlEnforcer enforcer;
    private final HandlerRegistry handlers;
    private final DatastoreLocks locks;
    private final DispatcherConfig config;
    private final AuditListener listener;
    private final ExecutorService workers;
    private final AtomicLong callSequence = new AtomicLong();

    private Dispatcher(Builder builder) {
        this.tree = builder.tree;
        this.validator = new Validator(builder.tree.identities());
        this.enforcer = new AccessControlEnforcer(builder.policies);
        this.handlers = builder.handlers;
        this.config = builder.config;
        this.locks = new DatastoreLocks(builder.config.lockGranularity());
        this.listener = builder.listener; // nullable
        this.workers = Executors.newFixedThreadPool(builder.config.workerThreads(), new WorkerThreadFactory());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Dispatches one call on behalf of {@code session}.
     *
     * @return the envelope to hand back to the transport; never {@code null}
     */
    public ResponseEnvelope dispatch(Session session, InboundCall call) {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(call, "call must not be null");
        String callId = session.id() + "-" + callSequence.incrementAndGet();
        MDC.put(MDC_SESSION_ID, session.id());
        MDC.put(MDC_CALL_ID, callId);
        try {
            return run(new CallTrace(session, call, callId));
        } finally {
            MDC.remove(MDC_SESSION_ID);
            MDC.remove(MDC_CALL_ID);
        }
    }

    /**
     * Cancels the call currently in flight for {@code session}. The cancelled call ends in
     * CALLBACK_ERROR and releases its locks.
     *
     * @return {@code true} if a call was cancelled
     */
    public boolean cancel(Session session) {
        boolean cancelled = session.cancelInFlight();
        if (cancelled) {
            LOG.info("call.cancel session_id={}", session.id());
        }
        return cancelled;
    }

    /** Locks shared by all sessions of this dispatcher. */
    public DatastoreLocks locks() {
        return locks;
    }

    /** Stops accepting callbacks and interrupts those still running. */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.callbackTimeoutMs(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Dispatcher closed");
    }

    // --- State machine ---

    private ResponseEnvelope run(CallTrace trace) {
        DatastoreLocks.Held held = null;
        try {
            ResolvedPath target = resolve(trace);
            trace.state = CallState.RESOLVED;
            trace.target = target;
            trace.snapshot = enforcer.capture(trace.session);

            CallKind kind = trace.call.kind();
            if (kind == CallKind.CONFIG_WRITE || kind == CallKind.DATA_READ) {
                held = locks.acquire(trace.session, locks.keyFor(target), kind == CallKind.CONFIG_WRITE,
                        config.lockTimeoutMs(), target.instancePath());
            }

            ValidationOutcome outcome = validate(trace, target);
            trace.state = CallState.VALIDATED;

            AccessDecision decision =
                    enforcer.authorize(trace.session, target.module(), kind.requiredOperation(), trace.snapshot);
            if (decision.isDenied()) {
                throw new AuthorizationException(decision.reason(), target.instancePath());
            }
            trace.state = CallState.AUTHORIZED;

            JsonNode payload = invoke(trace, target, outcome.value());
            trace.state = CallState.COMPLETED;
            return completed(trace, payload, outcome.unconstrainedPaths());
        } catch (SchemaResolutionException e) {
            return failed(trace, e, CallState.NOT_FOUND, Status.NOT_FOUND, e.detail());
        } catch (ValidationException e) {
            if (callerMayRead(trace)) {
                return failed(trace, e, CallState.REJECTED, Status.VALIDATION_FAILED,
                        e.kind() + " at " + e.path() + ": " + e.detail());
            }
            return failed(trace, e, CallState.REJECTED, Status.ACCESS_DENIED, AuthorizationException.GENERIC_DETAIL);
        } catch (AuthorizationException e) {
            return failed(trace, e, CallState.DENIED, Status.ACCESS_DENIED, AuthorizationException.GENERIC_DETAIL);
        } catch (CallbackException e) {
            return failed(trace, e, CallState.CALLBACK_ERROR, Status.CALLBACK_ERROR, e.detail());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CallbackException cancelled = new CallbackException(
                    CallbackException.Reason.CANCELLED, "cancelled: dispatching thread interrupted", e,
                    trace.call.path());
            return failed(trace, cancelled, CallState.CALLBACK_ERROR, Status.CALLBACK_ERROR, cancelled.detail());
        } finally {
            if (held != null) {
                held.close();
            }
        }
    }

    private ResolvedPath resolve(CallTrace trace) {
        String path = trace.call.path();
        ResolvedPath target = tree.require(path);
        if (!accepts(trace.call.kind(), target.node())) {
            throw new SchemaResolutionException(
                    "Path '" + path + "' is not a valid target for " + trace.call.kind(), path);
        }
        return target;
    }

    private static boolean accepts(CallKind kind, SchemaNode node) {
        return switch (kind) {
            case CONFIG_WRITE, DATA_READ -> node.kind().isDataNode();
            case RPC -> node instanceof RpcInput;
            case NOTIFICATION -> node instanceof Notification;
        };
    }

    private ValidationOutcome validate(CallTrace trace, ResolvedPath target) {
        ValidationOutcome outcome = trace.call.kind().carriesPayload()
                ? validator.validate(target, trace.call.payload())
                : validator.validateKeys(target);
        if (outcome.isRejected()) {
            throw ValidationException.from(outcome);
        }
        if (outcome.isUnconstrained()) {
            if (config.unconstrained() == UnconstrainedValueMode.REJECT) {
                throw new ValidationException(RejectionKind.UNCONSTRAINED_VALUE, outcome.unconstrainedPaths().get(0),
                        "value carries no schema constraint and unconstrained values are rejected");
            }
            LOG.warn(
                    "value.unconstrained session_id={} call_id={} module={} paths={}",
                    trace.session.id(),
                    trace.callId,
                    target.module(),
                    outcome.unconstrainedPaths());
            notifyUnconstrained(trace, target.module(), outcome.unconstrainedPaths());
        }
        return outcome;
    }

    private boolean callerMayRead(CallTrace trace) {
        AccessPolicy snapshot = trace.snapshot;
        return snapshot != null
                && trace.target != null
                && enforcer.authorize(trace.session, trace.target.module(), Operation.READ, snapshot).granted();
    }

    private JsonNode invoke(CallTrace trace, ResolvedPath target, JsonNode value) throws InterruptedException {
        String path = target.instancePath();
        HandlerRegistry.Match match = handlers.lookup(target.schemaPath())
                .orElseThrow(() -> new CallbackException(CallbackException.Reason.NO_HANDLER,
                        "no handler registered for '" + target.schemaPath() + "'", path));
        CallbackRequest request = new CallbackRequest(
                trace.callId,
                path,
                target.schemaPath(),
                target.entryKeys(),
                trace.call.kind().carriesPayload() ? value : null,
                trace.session.principal(),
                trace.call.kind());

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        FutureTask<CallbackResult> task = new FutureTask<>(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return match.handler().handle(request);
            } finally {
                MDC.clear();
            }
        });
        try {
            trace.session.beginCall(task);
        } catch (IllegalStateException e) {
            throw new CallbackException(CallbackException.Reason.SESSION_UNAVAILABLE, e.getMessage(), e, path);
        }
        trace.state = CallState.INVOKED;
        try {
            workers.execute(task);
            CallbackResult result = task.get(config.callbackTimeoutMs(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new CallbackException(CallbackException.Reason.HANDLER_FAILURE,
                        "handler for '" + match.registeredPath() + "' returned no result", path);
            }
            if (!result.isSuccess()) {
                throw new CallbackException(CallbackException.Reason.APPLICATION_ERROR,
                        result.errorCode() + (result.errorMessage() != null ? ": " + result.errorMessage() : ""), path);
            }
            return result.payload();
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new CallbackException(CallbackException.Reason.TIMEOUT,
                    "timeout: callback did not complete within " + config.callbackTimeoutMs() + " ms", e, path);
        } catch (CancellationException e) {
            throw new CallbackException(CallbackException.Reason.CANCELLED, "cancelled", e, path);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CallbackException(CallbackException.Reason.HANDLER_FAILURE,
                    "handler failed: " + cause.getClass().getSimpleName()
                            + (cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause, path);
        } catch (RejectedExecutionException e) {
            throw new CallbackException(CallbackException.Reason.HANDLER_FAILURE,
                    "callback rejected: worker pool is shut down", e, path);
        } catch (InterruptedException e) {
            task.cancel(true);
            throw e;
        } finally {
            trace.session.endCall(task);
        }
    }

    // --- Envelopes, logging and audit ---

    private ResponseEnvelope completed(CallTrace trace, JsonNode payload, List<String> unconstrainedPaths) {
        long durationMs = trace.elapsedMs();
        LOG.info(
                "call.completed session_id={} call_id={} principal={} kind={} path={} status=OK duration_ms={}",
                trace.session.id(),
                trace.callId,
                trace.session.principal().name(),
                trace.call.kind(),
                trace.target.instancePath(),
                durationMs);
        if (listener != null) {
            try {
                listener.onCallCompleted(new AuditListener.CallCompletedEvent(
                        trace.session.id(),
                        trace.callId,
                        trace.session.principal().principalClass(),
                        trace.call.kind(),
                        trace.target.instancePath(),
                        durationMs));
            } catch (Exception e) {
                LOG.warn("AuditListener.onCallCompleted failed", e);
            }
        }
        return ResponseEnvelope.ok(trace.callId, trace.call.path(), payload, unconstrainedPaths);
    }

    private ResponseEnvelope failed(
            CallTrace trace, CallException error, CallState state, Status status, String callerDetail) {
        String auditPath = error.path() != null ? error.path() : trace.call.path();
        String message = "call.rejected session_id={} call_id={} principal={} kind={} path={} reached={} "
                + "status={} error_kind={} error_path={} detail={}";
        Object[] args = {
            trace.session.id(),
            trace.callId,
            trace.session.principal().name(),
            trace.call.kind(),
            trace.call.path(),
            trace.state,
            status,
            error.kind(),
            auditPath,
            error.detail()
        };
        if (state == CallState.CALLBACK_ERROR) {
            LOG.warn(message, args);
        } else {
            LOG.info(message, args);
        }
        if (listener != null) {
            try {
                listener.onCallRejected(new AuditListener.CallRejectedEvent(
                        trace.session.id(),
                        trace.callId,
                        trace.session.principal().principalClass(),
                        trace.call.kind(),
                        status.name(),
                        error.kind(),
                        auditPath,
                        error.detail()));
            } catch (Exception e) {
                LOG.warn("AuditListener.onCallRejected failed", e);
            }
        }
        return ResponseEnvelope.failure(
                status, state, trace.callId, trace.call.path(), callerDetail, error.kind(), auditPath, error.detail());
    }

    private void notifyUnconstrained(CallTrace trace, String module, List<String> paths) {
        if (listener == null) return;
        try {
            listener.onUnconstrainedValue(
                    new AuditListener.UnconstrainedValueEvent(trace.session.id(), trace.callId, module, paths));
        } catch (Exception e) {
            LOG.warn("AuditListener.onUnconstrainedValue failed", e);
        }
    }

    /** Mutable per-call bookkeeping, confined to the dispatching thread. */
    private static final class CallTrace {
        final Session session;
        final InboundCall call;
        final String callId;
        final long startNanos = System.nanoTime();
        CallState state = CallState.RECEIVED;
        ResolvedPath target;
        AccessPolicy snapshot;

        CallTrace(Session session, InboundCall call, String callId) {
            this.session = session;
            this.call = call;
            this.callId = callId;
        }

        long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "schema-gate-callback-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /** Assembles a dispatcher. Tree and policy store are required. */
    public static final class Builder {

        private ConstraintTree tree;
        private PolicyStore policies;
        private HandlerRegistry handlers = new HandlerRegistry();
        private DispatcherConfig config = DispatcherConfig.DEFAULT;
        private AuditListener listener;

        private Builder() {}

        public Builder tree(ConstraintTree tree) {
            this.tree = tree;
            return this;
        }

        public Builder policies(PolicyStore policies) {
            this.policies = policies;
            return this;
        }

        public Builder handlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder config(DispatcherConfig config) {
            this.config = config;
            return this;
        }

        public Builder listener(AuditListener listener) {
            this.listener = listener;
            return this;
        }

        public Dispatcher build() {
            Objects.requireNonNull(tree, "tree must be set");
            Objects.requireNonNull(policies, "policies must be set");
            Objects.requireNonNull(handlers, "handlers must not be null");
            Objects.requireNonNull(config, "config must not be null");
            return new Dispatcher(this);
        }
    }
}
