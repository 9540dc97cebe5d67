package io.schemagate.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.schemagate.core.access.PolicyStore;
import io.schemagate.core.model.InboundCall;
import io.schemagate.core.model.Operation;
import io.schemagate.core.model.PolicyEntry;
import io.schemagate.core.model.Principal;
import io.schemagate.core.model.ResponseEnvelope;
import io.schemagate.core.model.ResponseEnvelope.Status;
import io.schemagate.core.model.Session;
import io.schemagate.core.spi.CallbackResult;
import io.schemagate.core.testkit.TestSchemas;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(30)
class DispatcherConcurrencyTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch entered = new CountDownLatch(1);
    private final AtomicBoolean interrupted = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);

    private PolicyStore policies;
    private HandlerRegistry handlers;
    private Dispatcher dispatcher;
    private ExecutorService callers;
    private Session alice;
    private Session bob;

    @BeforeEach
    void setUp() {
        policies = new PolicyStore();
        policies.reload(List.of(
                PolicyEntry.of("sys", "operator", Operation.READ, Operation.WRITE, Operation.EXECUTE),
                PolicyEntry.of("ifs", "operator", Operation.READ, Operation.WRITE)));
        handlers = new HandlerRegistry();
        // alice blocks until released; everyone else returns at once
        handlers.register("/system", request -> {
            if (!"alice".equals(request.caller().name())) {
                return CallbackResult.success();
            }
            entered.countDown();
            try {
                release.await();
                return CallbackResult.success();
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            } finally {
                finished.countDown();
            }
        });
        handlers.register("/hostname", request -> CallbackResult.success());
        handlers.register("/reboot", request -> CallbackResult.success());
        callers = Executors.newCachedThreadPool();
        alice = Session.open("alice-1", new Principal("alice", "operator"));
        bob = Session.open("bob-1", new Principal("bob", "operator"));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        callers.shutdownNow();
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    private Dispatcher start(DispatcherConfig config) {
        dispatcher = Dispatcher.builder()
                .tree(TestSchemas.tree())
                .policies(policies)
                .handlers(handlers)
                .config(config)
                .build();
        return dispatcher;
    }

    private Future<ResponseEnvelope> dispatchAsync(Session session, InboundCall call) {
        return callers.submit(() -> dispatcher.dispatch(session, call));
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not reached within 10 s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("a callback that overruns its timeout is interrupted and reported")
    void callbackTimeout() throws Exception {
        start(DispatcherConfig.DEFAULT.withCallbackTimeoutMs(200));

        ResponseEnvelope envelope = dispatcher.dispatch(alice, InboundCall.write("/system/load", IntNode.valueOf(5)));

        assertThat(envelope.status()).isEqualTo(Status.CALLBACK_ERROR);
        assertThat(envelope.auditKind()).isEqualTo("timeout");
        assertThat(envelope.detail()).startsWith("timeout:");
        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted).isTrue();
        assertThat(alice.heldLocks()).isEmpty();
        assertThat(dispatcher.locks().isWriteLocked("sys")).isFalse();
    }

    @Test
    @DisplayName("cancelling a session's call ends it in CALLBACK_ERROR and frees its lock")
    void cancel() throws Exception {
        start(DispatcherConfig.DEFAULT);
        Future<ResponseEnvelope> pending = dispatchAsync(alice, InboundCall.write("/system/load", IntNode.valueOf(5)));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        awaitCondition(alice::hasCallInFlight);

        assertThat(dispatcher.cancel(alice)).isTrue();

        ResponseEnvelope envelope = pending.get(10, TimeUnit.SECONDS);
        assertThat(envelope.status()).isEqualTo(Status.CALLBACK_ERROR);
        assertThat(envelope.auditKind()).isEqualTo("cancelled");
        assertThat(alice.hasCallInFlight()).isFalse();
        assertThat(alice.heldLocks()).isEmpty();
        assertThat(dispatcher.locks().isWriteLocked("sys")).isFalse();
    }

    @Test
    void cancelWithoutCallInFlight() {
        start(DispatcherConfig.DEFAULT);

        assertThat(dispatcher.cancel(alice)).isFalse();
    }

    @Test
    @DisplayName("a writer holding the module lock makes other writers report the datastore busy")
    void datastoreBusy() throws Exception {
        start(DispatcherConfig.DEFAULT.withLockTimeoutMs(100));
        Future<ResponseEnvelope> aliceCall = dispatchAsync(alice, InboundCall.write("/system/load", IntNode.valueOf(5)));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(alice.heldLocks()).containsExactly("sys");
        assertThat(dispatcher.locks().isWriteLocked("sys")).isTrue();

        ResponseEnvelope bobWrite = dispatcher.dispatch(bob, InboundCall.write("/system/load", IntNode.valueOf(6)));
        ResponseEnvelope bobRead = dispatcher.dispatch(bob, InboundCall.read("/system/load"));

        assertThat(bobWrite.status()).isEqualTo(Status.CALLBACK_ERROR);
        assertThat(bobWrite.auditKind()).isEqualTo("datastore-busy");
        assertThat(bobRead.auditKind()).isEqualTo("datastore-busy");
        assertThat(bob.heldLocks()).isEmpty();

        release.countDown();
        assertThat(aliceCall.get(10, TimeUnit.SECONDS).isOk()).isTrue();
        assertThat(dispatcher.dispatch(bob, InboundCall.write("/system/load", IntNode.valueOf(6))).isOk()).isTrue();
    }

    @Test
    @DisplayName("module locks do not block writes to other modules")
    void otherModuleNotBlocked() throws Exception {
        start(DispatcherConfig.DEFAULT.withLockTimeoutMs(100));
        Future<ResponseEnvelope> aliceCall = dispatchAsync(alice, InboundCall.write("/system/load", IntNode.valueOf(5)));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        ResponseEnvelope bobWrite =
                dispatcher.dispatch(bob, InboundCall.write("/hostname", TextNode.valueOf("core1")));

        assertThat(bobWrite.isOk()).isTrue();
        release.countDown();
        assertThat(aliceCall.get(10, TimeUnit.SECONDS).isOk()).isTrue();
    }

    @Test
    @DisplayName("readers of the same module run concurrently")
    void concurrentReaders() throws Exception {
        CountDownLatch bothInside = new CountDownLatch(2);
        handlers.register("/system/load", request -> {
            bothInside.countDown();
            return bothInside.await(5, TimeUnit.SECONDS)
                    ? CallbackResult.success()
                    : CallbackResult.error("SERIALIZED", "readers did not overlap");
        });
        start(DispatcherConfig.DEFAULT);
        Session carol = Session.open("carol-1", new Principal("carol", "operator"));

        Future<ResponseEnvelope> first = dispatchAsync(bob, InboundCall.read("/system/load"));
        Future<ResponseEnvelope> second = dispatchAsync(carol, InboundCall.read("/system/load"));

        assertThat(first.get(10, TimeUnit.SECONDS).isOk()).isTrue();
        assertThat(second.get(10, TimeUnit.SECONDS).isOk()).isTrue();
    }

    @Test
    @DisplayName("a session runs one callback at a time")
    void oneCallPerSession() throws Exception {
        start(DispatcherConfig.DEFAULT);
        Future<ResponseEnvelope> aliceCall = dispatchAsync(alice, InboundCall.write("/system/load", IntNode.valueOf(5)));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        awaitCondition(alice::hasCallInFlight);

        ResponseEnvelope second = dispatcher.dispatch(
                alice, InboundCall.rpc("/reboot", JSON.readTree("{\"mode\":\"restart\"}")));

        assertThat(second.status()).isEqualTo(Status.CALLBACK_ERROR);
        assertThat(second.auditKind()).isEqualTo("session-unavailable");
        release.countDown();
        assertThat(aliceCall.get(10, TimeUnit.SECONDS).isOk()).isTrue();
    }

    @Test
    @DisplayName("subtree locks separate top-level nodes of the same module")
    void subtreeGranularity() throws Exception {
        start(new DispatcherConfig(5_000L, 100L, 4, LockGranularity.SUBTREE, UnconstrainedValueMode.AUDIT));
        Future<ResponseEnvelope> aliceCall = dispatchAsync(alice, InboundCall.write("/system/load", IntNode.valueOf(5)));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        assertThat(alice.heldLocks()).containsExactly("/system");
        assertThat(dispatcher.locks().isWriteLocked("sys")).isFalse();
        assertThat(dispatcher.dispatch(bob, InboundCall.write("/system/token", TextNode.valueOf("deadbeef")))
                        .auditKind())
                .isEqualTo("datastore-busy");

        release.countDown();
        assertThat(aliceCall.get(10, TimeUnit.SECONDS).isOk()).isTrue();
    }
}
