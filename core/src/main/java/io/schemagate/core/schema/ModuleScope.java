package io.schemagate.core.schema;

import java.util.List;
import java.util.function.Consumer;

/** Top-level builder scope of a module. RPCs and notifications may only be declared here. */
public final class ModuleScope extends NodeScope {

    ModuleScope(List<NodeDefinition> target) {
        super(target);
    }

    public ModuleScope rpc(String name, Consumer<NodeScope> input) {
        node(withChildren(NodeDefinition.rpc(name), input));
        return this;
    }

    public ModuleScope notification(String name, Consumer<NodeScope> content) {
        node(withChildren(NodeDefinition.notification(name), content));
        return this;
    }
}
