package io.schemagate.core.schema;

import java.util.Objects;

/** A node holding a single typed value. */
public final class Leaf implements SchemaNode {

    private final String name;
    private final String module;
    private final String path;
    private final String description;
    private final TypeConstraint type;
    private final boolean mandatory;

    Leaf(String name, String module, String path, String description, TypeConstraint type, boolean mandatory) {
        this.name = name;
        this.module = module;
        this.path = path;
        this.description = description;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.mandatory = mandatory;
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
        return NodeKind.LEAF;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public boolean isMandatory() {
        return mandatory;
    }

    public TypeConstraint type() {
        return type;
    }

    @Override
    public String toString() {
        return "Leaf[" + path + ", " + type.describe() + "]";
    }
}
