package io.schemagate.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Shared child bookkeeping for parent nodes. */
abstract class AbstractParentNode {

    private final String name;
    private final String module;
    private final String path;
    private final String description;
    private final List<SchemaNode> children;
    private final Map<String, SchemaNode> childrenByName;

    AbstractParentNode(String name, String module, String path, String description, List<SchemaNode> children) {
        this.name = name;
        this.module = module;
        this.path = path;
        this.description = description;
        this.children = List.copyOf(children);
        Map<String, SchemaNode> byName = new LinkedHashMap<>();
        for (SchemaNode child : children) {
            byName.put(child.name(), child);
        }
        this.childrenByName = Collections.unmodifiableMap(byName);
    }

    public String name() {
        return name;
    }

    public String module() {
        return module;
    }

    public String path() {
        return path;
    }

    public String description() {
        return description;
    }

    public List<SchemaNode> children() {
        return children;
    }

    public Optional<SchemaNode> child(String childName) {
        return Optional.ofNullable(childrenByName.get(childName));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + path + "]";
    }
}
