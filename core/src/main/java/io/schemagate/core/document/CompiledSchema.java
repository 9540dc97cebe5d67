package io.schemagate.core.document;

import io.schemagate.core.identity.IdentityRegistry;
import io.schemagate.core.schema.ConstraintTree;
import java.util.Objects;

/**
 * A loaded compiled-schema document.
 *
 * @param identities the identity DAG
 * @param tree       the constraint tree, checked against {@code identities}
 * @param source     file the document was read from, or {@code null}
 */
public record CompiledSchema(IdentityRegistry identities, ConstraintTree tree, String source) {

    public CompiledSchema {
        Objects.requireNonNull(identities, "identities must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
    }
}
