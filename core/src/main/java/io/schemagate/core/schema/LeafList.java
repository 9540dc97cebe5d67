package io.schemagate.core.schema;

import java.util.Objects;

/** An ordered set of typed values; duplicates are not allowed. */
public final class LeafList implements SchemaNode {

    private final String name;
    private final String module;
    private final String path;
    private final String description;
    private final TypeConstraint type;
    private final int minElements;
    private final Integer maxElements;

    LeafList(
            String name,
            String module,
            String path,
            String description,
            TypeConstraint type,
            int minElements,
            Integer maxElements) {
        this.name = name;
        this.module = module;
        this.path = path;
        this.description = description;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.minElements = minElements;
        this.maxElements = maxElements;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String module() {
        return module;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LEAF_LIST;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public boolean isMandatory() {
        return minElements > 0;
    }

    public TypeConstraint type() {
        return type;
    }

    public int minElements() {
        return minElements;
    }

    /** Maximum element count, or {@code null} if unbounded. */
    public Integer maxElements() {
        return maxElements;
    }

    @Override
    public String toString() {
        return "LeafList[" + path + ", " + type.describe() + "]";
    }
}
