package io.schemagate.core.schema;

import java.util.List;

/** A grouping node without a value of its own. */
public final class Container extends AbstractParentNode implements ParentNode {

    private final boolean mandatory;

    Container(String name, String module, String path, String description, boolean mandatory, List<SchemaNode> children) {
        super(name, module, path, description, children);
        this.mandatory = mandatory;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONTAINER;
    }

    @Override
    public boolean isMandatory() {
        return mandatory;
    }
}
