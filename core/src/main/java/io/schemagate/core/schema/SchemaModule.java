package io.schemagate.core.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named module and its top-level nodes. Modules are the unit of access control.
 *
 * @param name  module name, unique in the tree
 * @param nodes top-level nodes in declaration order
 */
public record SchemaModule(String name, List<SchemaNode> nodes) {

    public SchemaModule {
        Objects.requireNonNull(name, "name must not be null");
        nodes = List.copyOf(nodes);
    }

    public Optional<SchemaNode> node(String nodeName) {
        return nodes.stream().filter(n -> n.name().equals(nodeName)).findFirst();
    }
}
