package io.schemagate.core.access;

import io.schemagate.core.model.AccessPolicy;
import io.schemagate.core.model.Operation;
import io.schemagate.core.model.Session;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a session may perform an operation on a module. Deny by default: only an
 * explicit grant for the session's principal class on that exact module permits the operation.
 * There is no cascading between modules, no implied operations and no super-user bypass.
 */
public final class AccessControlEnforcer {

    private static final Logger LOG = LoggerFactory.getLogger(AccessControlEnforcer.class);

    private final PolicyStore policies;

    public AccessControlEnforcer(PolicyStore policies) {
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
    }

    /**
     * Captures the current policy snapshot for one call and records it on the session. All
     * decisions of that call are taken against the returned snapshot.
     */
    public AccessPolicy capture(Session session) {
        AccessPolicy snapshot = policies.snapshot();
        session.recordPolicy(snapshot);
        return snapshot;
    }

    /** Authorizes against a freshly captured snapshot. */
    public AccessDecision authorize(Session session, String module, Operation operation) {
        return authorize(session, module, operation, capture(session));
    }

    /** Authorizes against an already captured snapshot. */
    public AccessDecision authorize(Session session, String module, Operation operation, AccessPolicy snapshot) {
        String principalClass = session.principal().principalClass();
        Set<Operation> granted = snapshot.grantsFor(module, principalClass);
        if (granted.contains(operation)) {
            return AccessDecision.granted(snapshot.version());
        }
        String reason = granted.isEmpty()
                ? "no grant for principal class '" + principalClass + "' on module '" + module + "'"
                : "principal class '" + principalClass + "' lacks " + operation.token() + " on module '" + module
                        + "' (granted: " + granted + ")";
        LOG.debug(
                "access.denied session_id={} principal={} module={} operation={} policy_version={}",
                session.id(),
                session.principal().name(),
                module,
                operation.token(),
                snapshot.version());
        return AccessDecision.denied(reason, snapshot.version());
    }
}
