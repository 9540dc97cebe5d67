package io.schemagate.core.model;

import java.util.Objects;

/**
 * Authenticated caller identity as handed over by the transport layer.
 *
 * @param name           the caller's user name, used in logs and callback requests
 * @param principalClass the access-control category policies are written against
 */
public record Principal(String name, String principalClass) {

    public Principal {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(principalClass, "principalClass must not be null");
        if (principalClass.isBlank()) {
            throw new IllegalArgumentException("principalClass must not be blank");
        }
    }
}
