package io.schemagate.core.schema;

import java.util.List;
import java.util.Optional;

/** A schema node with ordered children, validated as a JSON object. */
public sealed interface ParentNode extends SchemaNode permits Container, ListNode, RpcInput, Notification {

    /** Children in declaration order. */
    List<SchemaNode> children();

    /** Looks up a direct child by segment name. */
    Optional<SchemaNode> child(String name);
}
