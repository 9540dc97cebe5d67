package io.schemagate.core.model;

import java.util.Locale;

/** Operations a policy can grant on a module. Each must be granted independently. */
public enum Operation {
    READ,
    WRITE,
    EXECUTE;

    /** Lower-case token as written in policy documents. */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a policy-document token ({@code read}, {@code write}, {@code execute}).
     *
     * @throws IllegalArgumentException for any other token
     */
    public static Operation fromToken(String token) {
        for (Operation op : values()) {
            if (op.token().equals(token)) {
                return op;
            }
        }
        throw new IllegalArgumentException(
                "Unknown operation '" + token + "', expected one of: read, write, execute");
    }
}
