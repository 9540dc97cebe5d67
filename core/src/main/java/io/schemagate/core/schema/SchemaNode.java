package io.schemagate.core.schema;

/**
 * Compiled schema node. Implementations are a sealed hierarchy: {@link Leaf}, {@link LeafList}
 * and the {@link ParentNode} kinds ({@link Container}, {@link ListNode}, {@link RpcInput},
 * {@link Notification}).
 *
 * <p>Nodes are created only by {@link ConstraintTree.Builder} and are immutable; their
 * {@link #path()} is unique within the tree.
 */
public sealed interface SchemaNode permits Leaf, LeafList, ParentNode {

    /** Path segment name. */
    String name();

    /** Name of the module owning the top-level ancestor of this node. */
    String module();

    /** Canonical schema path, e.g. {@code /interfaces/interface/mtu}. */
    String path();

    NodeKind kind();

    /** Optional description carried over from the schema source, may be {@code null}. */
    String description();

    /** True if a parent object must contain this node. */
    boolean isMandatory();
}
