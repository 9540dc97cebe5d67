package io.schemagate.core.schema;

import java.util.List;

/** Input of a remotely invocable operation. Always top-level. */
public final class RpcInput extends AbstractParentNode implements ParentNode {

    RpcInput(String name, String module, String path, String description, List<SchemaNode> children) {
        super(name, module, path, description, children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RPC;
    }

    @Override
    public boolean isMandatory() {
        return false;
    }
}
