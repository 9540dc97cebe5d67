package io.schemagate.core.schema;

import java.util.Locale;

/** Kinds of schema node, with the token used in compiled-schema documents. */
public enum NodeKind {
    LEAF,
    LEAF_LIST,
    CONTAINER,
    LIST,
    RPC,
    NOTIFICATION;

    public String token() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Parses a document token ({@code leaf}, {@code leaf-list}, ...).
     *
     * @throws IllegalArgumentException for unknown tokens
     */
    public static NodeKind fromToken(String token) {
        for (NodeKind kind : values()) {
            if (kind.token().equals(token)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind '" + token + "'");
    }

    /** Data nodes may be read and written; RPCs and notifications may not. */
    public boolean isDataNode() {
        return this != RPC && this != NOTIFICATION;
    }
}
