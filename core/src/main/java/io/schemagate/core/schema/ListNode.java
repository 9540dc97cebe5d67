package io.schemagate.core.schema;

import java.util.List;

/**
 * A sequence of entries identified by key leaves. Each key name refers to a direct child
 * {@link Leaf}; the builder guarantees this.
 */
public final class ListNode extends AbstractParentNode implements ParentNode {

    private final List<String> keys;
    private final int minElements;
    private final Integer maxElements;

    ListNode(
            String name,
            String module,
            String path,
            String description,
            List<String> keys,
            int minElements,
            Integer maxElements,
            List<SchemaNode> children) {
        super(name, module, path, description, children);
        this.keys = List.copyOf(keys);
        this.minElements = minElements;
        this.maxElements = maxElements;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    @Override
    public boolean isMandatory() {
        return minElements > 0;
    }

    /** Key leaf names in declaration order. */
    public List<String> keys() {
        return keys;
    }

    /** The key leaf for the given name. */
    public Leaf keyLeaf(String key) {
        return (Leaf) child(key).orElseThrow(() -> new IllegalArgumentException("'" + key + "' is not a key of " + path()));
    }

    public int minElements() {
        return minElements;
    }

    /** Maximum entry count, or {@code null} if unbounded. */
    public Integer maxElements() {
        return maxElements;
    }
}
