package io.schemagate.core.schema;

import java.util.List;
import java.util.function.Consumer;

/** Builder DSL for the children of a container, list, RPC or notification. */
public class NodeScope {

    private final List<NodeDefinition> target;

    NodeScope(List<NodeDefinition> target) {
        this.target = target;
    }

    public NodeScope leaf(String name, TypeConstraint type) {
        return node(NodeDefinition.leaf(name, type));
    }

    public NodeScope mandatoryLeaf(String name, TypeConstraint type) {
        return node(NodeDefinition.leaf(name, type).mandatory(true));
    }

    public NodeScope leafList(String name, TypeConstraint type, int minElements, Integer maxElements) {
        return node(NodeDefinition.leafList(name, type).minElements(minElements).maxElements(maxElements));
    }

    public NodeScope container(String name, Consumer<NodeScope> body) {
        return node(withChildren(NodeDefinition.container(name), body));
    }

    public NodeScope list(String name, List<String> keys, Consumer<NodeScope> body) {
        return node(withChildren(NodeDefinition.list(name).keys(keys), body));
    }

    /** Adds a pre-built definition, e.g. one needing bounds or a description. */
    public NodeScope node(NodeDefinition definition) {
        target.add(definition);
        return this;
    }

    static NodeDefinition withChildren(NodeDefinition definition, Consumer<NodeScope> body) {
        body.accept(new NodeScope(definition.children()));
        return definition;
    }
}
