package io.schemagate.core.access;

import static org.assertj.core.api.Assertions.assertThat;

import io.schemagate.core.model.AccessPolicy;
import io.schemagate.core.model.Operation;
import io.schemagate.core.model.PolicyEntry;
import io.schemagate.core.model.Principal;
import io.schemagate.core.model.Session;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class AccessControlEnforcerTest {

    private PolicyStore store;
    private AccessControlEnforcer enforcer;
    private Session operator;

    @BeforeEach
    void setUp() {
        store = new PolicyStore();
        enforcer = new AccessControlEnforcer(store);
        operator = Session.open("s1", new Principal("alice", "operator"));
    }

    @ParameterizedTest
    @EnumSource(Operation.class)
    @DisplayName("the initial policy denies every operation")
    void denyByDefault(Operation operation) {
        AccessDecision decision = enforcer.authorize(operator, "sys", operation);

        assertThat(decision.isDenied()).isTrue();
        assertThat(decision.reason()).contains("no grant for principal class 'operator' on module 'sys'");
        assertThat(decision.policyVersion()).isZero();
    }

    @Test
    void explicitGrantPermits() {
        store.reload(List.of(PolicyEntry.of("sys", "operator", Operation.READ, Operation.EXECUTE)));

        assertThat(enforcer.authorize(operator, "sys", Operation.READ).granted()).isTrue();
        assertThat(enforcer.authorize(operator, "sys", Operation.EXECUTE).granted()).isTrue();
    }

    @Test
    @DisplayName("operations are independent: execute implies neither read nor write")
    void noImpliedOperations() {
        store.reload(List.of(PolicyEntry.of("sys", "operator", Operation.EXECUTE)));

        AccessDecision read = enforcer.authorize(operator, "sys", Operation.READ);
        assertThat(read.isDenied()).isTrue();
        assertThat(read.reason()).contains("lacks read on module 'sys'");
        assertThat(enforcer.authorize(operator, "sys", Operation.WRITE).isDenied()).isTrue();
    }

    @Test
    @DisplayName("grants never cascade to other modules")
    void noCascade() {
        store.reload(List.of(PolicyEntry.of("sys", "operator", Operation.READ, Operation.WRITE, Operation.EXECUTE)));

        assertThat(enforcer.authorize(operator, "ifs", Operation.READ).isDenied()).isTrue();
    }

    @Test
    @DisplayName("grants apply to the principal class, not the user name")
    void byPrincipalClass() {
        store.reload(List.of(PolicyEntry.of("sys", "admin", Operation.WRITE)));
        Session otherOperator = Session.open("s2", new Principal("admin", "operator"));

        assertThat(enforcer.authorize(otherOperator, "sys", Operation.WRITE).isDenied()).isTrue();
        assertThat(enforcer.authorize(Session.open(new Principal("bob", "admin")), "sys", Operation.WRITE).granted())
                .isTrue();
    }

    @Test
    @DisplayName("a captured snapshot keeps deciding after a reload")
    void snapshotIsolation() {
        store.reload(List.of(PolicyEntry.of("sys", "operator", Operation.WRITE)));
        AccessPolicy snapshot = enforcer.capture(operator);

        store.reload(List.of());

        assertThat(enforcer.authorize(operator, "sys", Operation.WRITE, snapshot).granted()).isTrue();
        assertThat(enforcer.authorize(operator, "sys", Operation.WRITE).isDenied()).isTrue();
    }

    @Test
    void captureRecordsSnapshotOnSession() {
        AccessPolicy installed = store.reload(List.of(PolicyEntry.of("sys", "operator", Operation.READ)));

        AccessPolicy captured = enforcer.capture(operator);

        assertThat(captured).isSameAs(installed);
        assertThat(operator.activePolicy().version()).isEqualTo(1L);
        assertThat(enforcer.authorize(operator, "sys", Operation.READ).policyVersion()).isEqualTo(1L);
    }

    @Test
    void duplicateEntriesMergeByUnion() {
        store.reload(List.of(
                PolicyEntry.of("sys", "operator", Operation.READ),
                PolicyEntry.of("sys", "operator", Operation.WRITE)));

        assertThat(store.snapshot().grantsFor("sys", "operator")).containsExactlyInAnyOrder(Operation.READ, Operation.WRITE);
    }
}
