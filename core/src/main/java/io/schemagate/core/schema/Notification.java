package io.schemagate.core.schema;

import java.util.List;

/** Content of an event notification. Always top-level. */
public final class Notification extends AbstractParentNode implements ParentNode {

    Notification(String name, String module, String path, String description, List<SchemaNode> children) {
        super(name, module, path, description, children);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NOTIFICATION;
    }

    @Override
    public boolean isMandatory() {
        return false;
    }
}
