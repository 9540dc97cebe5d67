package io.schemagate.core.access;

import java.util.Objects;

/**
 * Outcome of an authorization check. A denial carries a reason for audit logs only; callers are
 * never shown it.
 *
 * @param granted       whether the operation is permitted
 * @param reason        audit reason, {@code null} when granted
 * @param policyVersion version of the policy snapshot the decision was taken against
 */
public record AccessDecision(boolean granted, String reason, long policyVersion) {

    public static AccessDecision granted(long policyVersion) {
        return new AccessDecision(true, null, policyVersion);
    }

    public static AccessDecision denied(String reason, long policyVersion) {
        return new AccessDecision(false, Objects.requireNonNull(reason, "reason must not be null"), policyVersion);
    }

    public boolean isDenied() {
        return !granted;
    }
}
