package io.schemagate.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable declaration of a schema node, turned into an immutable {@link SchemaNode} by
 * {@link ConstraintTree.Builder#build()}. Consistency checks are deferred to the build so that
 * all declarations can be collected first, whether they come from the builder DSL or from a
 * compiled-schema document.
 */
public final class NodeDefinition {

    private final NodeKind kind;
    private final String name;
    private final List<NodeDefinition> children = new ArrayList<>();
    private TypeConstraint type;
    private boolean mandatory;
    private String description;
    private List<String> keys = List.of();
    private int minElements;
    private Integer maxElements;

    private NodeDefinition(NodeKind kind, String name) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public static NodeDefinition of(NodeKind kind, String name) {
        return new NodeDefinition(kind, name);
    }

    public static NodeDefinition leaf(String name, TypeConstraint type) {
        return new NodeDefinition(NodeKind.LEAF, name).type(type);
    }

    public static NodeDefinition leafList(String name, TypeConstraint type) {
        return new NodeDefinition(NodeKind.LEAF_LIST, name).type(type);
    }

    public static NodeDefinition container(String name) {
        return new NodeDefinition(NodeKind.CONTAINER, name);
    }

    public static NodeDefinition list(String name, String... keys) {
        return new NodeDefinition(NodeKind.LIST, name).keys(List.of(keys));
    }

    public static NodeDefinition rpc(String name) {
        return new NodeDefinition(NodeKind.RPC, name);
    }

    public static NodeDefinition notification(String name) {
        return new NodeDefinition(NodeKind.NOTIFICATION, name);
    }

    public NodeDefinition type(TypeConstraint type) {
        this.type = type;
        return this;
    }

    public NodeDefinition mandatory(boolean mandatory) {
        this.mandatory = mandatory;
        return this;
    }

    public NodeDefinition description(String description) {
        this.description = description;
        return this;
    }

    public NodeDefinition keys(List<String> keys) {
        this.keys = List.copyOf(keys);
        return this;
    }

    public NodeDefinition minElements(int minElements) {
        this.minElements = minElements;
        return this;
    }

    public NodeDefinition maxElements(Integer maxElements) {
        this.maxElements = maxElements;
        return this;
    }

    public NodeDefinition child(NodeDefinition child) {
        children.add(Objects.requireNonNull(child, "child must not be null"));
        return this;
    }

    public NodeKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public TypeConstraint type() {
        return type;
    }

    public boolean mandatory() {
        return mandatory;
    }

    public String description() {
        return description;
    }

    public List<String> keys() {
        return keys;
    }

    public int minElements() {
        return minElements;
    }

    public Integer maxElements() {
        return maxElements;
    }

    public List<NodeDefinition> children() {
        return children;
    }
}
