package io.schemagate.core.schema;

import io.schemagate.core.error.SchemaBuildException;
import io.schemagate.core.error.SchemaResolutionException;
import io.schemagate.core.identity.IdentityRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiled, immutable schema: modules, their node hierarchy and a canonical-path index.
 *
 * <p>All lookups are lock-free reads of structures frozen at build time, so a single tree is
 * shared by every session for the lifetime of the process.
 */
public final class ConstraintTree {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintTree.class);

    private final Map<String, SchemaModule> modules;
    private final Map<String, SchemaNode> topLevel;
    private final Map<String, SchemaNode> index;
    private final IdentityRegistry identities;

    private ConstraintTree(
            Map<String, SchemaModule> modules,
            Map<String, SchemaNode> topLevel,
            Map<String, SchemaNode> index,
            IdentityRegistry identities) {
        this.modules = modules;
        this.topLevel = topLevel;
        this.index = index;
        this.identities = identities;
    }

    /** Starts a tree whose identityref types are checked against {@code identities}. */
    public static Builder builder(IdentityRegistry identities) {
        return new Builder(identities);
    }

    /** Starts a tree without identities; any identityref type fails the build. */
    public static Builder builder() {
        return new Builder(IdentityRegistry.empty());
    }

    /**
     * Resolves a caller path. Returns empty when the path is malformed, names an unknown node,
     * carries a prefix other than the owning module, or uses predicates that do not name exactly
     * the keys of a list. Intermediate list segments must address a single entry.
     */
    public Optional<ResolvedPath> resolve(String path) {
        Optional<SchemaPath> parsed = SchemaPath.parse(path);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        List<SchemaPath.Segment> segments = parsed.get().segments();
        List<ResolvedPath.Step> steps = new ArrayList<>(segments.size());
        StringBuilder instance = new StringBuilder();
        SchemaNode current = null;
        String module = null;

        for (int i = 0; i < segments.size(); i++) {
            SchemaPath.Segment segment = segments.get(i);
            SchemaNode next;
            if (current == null) {
                next = topLevel.get(segment.name());
                if (next == null) {
                    return Optional.empty();
                }
                module = next.module();
            } else if (current instanceof ParentNode parent) {
                next = parent.child(segment.name()).orElse(null);
                if (next == null) {
                    return Optional.empty();
                }
            } else {
                return Optional.empty();
            }
            if (segment.prefix() != null && !segment.prefix().equals(module)) {
                return Optional.empty();
            }
            boolean last = i == segments.size() - 1;
            if (!predicatesFit(next, segment, last)) {
                return Optional.empty();
            }
            Map<String, String> keys = orderedKeys(next, segment);
            instance.append('/').append(next.name()).append(SchemaPath.predicates(keys));
            steps.add(new ResolvedPath.Step(next, keys, instance.toString()));
            current = next;
        }
        return Optional.of(new ResolvedPath(current, module, instance.toString(), steps));
    }

    /**
     * Like {@link #resolve(String)} but throws.
     *
     * @throws SchemaResolutionException if the path does not resolve
     */
    public ResolvedPath require(String path) {
        return resolve(path)
                .orElseThrow(() -> new SchemaResolutionException("Path '" + path + "' does not resolve", path));
    }

    /** Node at a canonical schema path (no predicates, no prefixes). */
    public Optional<SchemaNode> nodeAt(String canonicalPath) {
        return Optional.ofNullable(index.get(canonicalPath));
    }

    public Collection<SchemaModule> modules() {
        return modules.values();
    }

    public Optional<SchemaModule> module(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /** Top-level nodes of all modules, in declaration order. */
    public Collection<SchemaNode> topLevel() {
        return topLevel.values();
    }

    /** Identity registry this tree was checked against. */
    public IdentityRegistry identities() {
        return identities;
    }

    /** Number of nodes in the tree. */
    public int size() {
        return index.size();
    }

    private static boolean predicatesFit(SchemaNode node, SchemaPath.Segment segment, boolean last) {
        if (!(node instanceof ListNode list)) {
            return !segment.hasPredicates();
        }
        if (!segment.hasPredicates()) {
            return last;
        }
        return segment.predicates().keySet().equals(Set.copyOf(list.keys()));
    }

    private static Map<String, String> orderedKeys(SchemaNode node, SchemaPath.Segment segment) {
        if (!segment.hasPredicates()) {
            return Map.of();
        }
        Map<String, String> keys = new LinkedHashMap<>();
        for (String key : ((ListNode) node).keys()) {
            keys.put(key, segment.predicates().get(key));
        }
        return keys;
    }

    @Override
    public String toString() {
        return "ConstraintTree[modules=" + modules.keySet() + ", nodes=" + index.size() + "]";
    }

    /**
     * Collects module declarations. {@link #build()} checks them all and either returns a
     * consistent tree or throws {@link SchemaBuildException}.
     */
    public static final class Builder {

        private final IdentityRegistry identities;
        private final Map<String, List<NodeDefinition>> modules = new LinkedHashMap<>();
        private String source;

        private Builder(IdentityRegistry identities) {
            this.identities = Objects.requireNonNull(identities, "identities must not be null");
        }

        /** File or resource the declarations came from, reported in build errors. */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder module(String name, Consumer<ModuleScope> body) {
            List<NodeDefinition> nodes = new ArrayList<>();
            body.accept(new ModuleScope(nodes));
            return module(name, nodes);
        }

        public Builder module(String name, List<NodeDefinition> nodes) {
            if (!SchemaPath.isValidName(name)) {
                throw new SchemaBuildException("Invalid module name '" + name + "'", source);
            }
            if (modules.putIfAbsent(name, new ArrayList<>(nodes)) != null) {
                throw new SchemaBuildException("Duplicate module '" + name + "'", source);
            }
            return this;
        }

        /**
         * Builds the tree.
         *
         * @throws SchemaBuildException on duplicate paths, invalid names, RPCs or notifications
         *                              below the top level, undeclared list keys, inconsistent
         *                              bounds or identityref bases unknown to the registry
         */
        public ConstraintTree build() {
            Map<String, SchemaModule> builtModules = new LinkedHashMap<>();
            Map<String, SchemaNode> topLevel = new LinkedHashMap<>();
            Map<String, SchemaNode> index = new HashMap<>();

            modules.forEach((moduleName, definitions) -> {
                List<SchemaNode> nodes = new ArrayList<>();
                for (NodeDefinition definition : definitions) {
                    SchemaNode node = buildNode(definition, moduleName, "", true, index);
                    topLevel.put(node.name(), node);
                    nodes.add(node);
                }
                builtModules.put(moduleName, new SchemaModule(moduleName, nodes));
            });

            LOG.debug("Constraint tree built: modules={} nodes={}", builtModules.keySet(), index.size());
            return new ConstraintTree(
                    Collections.unmodifiableMap(builtModules),
                    Collections.unmodifiableMap(topLevel),
                    Collections.unmodifiableMap(index),
                    identities);
        }

        private SchemaNode buildNode(
                NodeDefinition def, String module, String parentPath, boolean topLevel, Map<String, SchemaNode> index) {
            if (!SchemaPath.isValidName(def.name())) {
                throw new SchemaBuildException("Invalid node name '" + def.name() + "' under '"
                        + (parentPath.isEmpty() ? module : parentPath) + "'", source);
            }
            String path = parentPath + "/" + def.name();
            if (index.containsKey(path)) {
                throw new SchemaBuildException("Duplicate schema path '" + path + "'", source);
            }
            if (!topLevel && !def.kind().isDataNode()) {
                throw new SchemaBuildException(def.kind().token() + " '" + path + "' must be declared at the top level", source);
            }
            checkBounds(def, path);

            SchemaNode node = switch (def.kind()) {
                case LEAF -> {
                    requireLeafShape(def, path);
                    yield new Leaf(def.name(), module, path, def.description(), def.type(), def.mandatory());
                }
                case LEAF_LIST -> {
                    requireLeafShape(def, path);
                    yield new LeafList(def.name(), module, path, def.description(), def.type(),
                            def.minElements(), def.maxElements());
                }
                case CONTAINER -> new Container(def.name(), module, path, def.description(), def.mandatory(),
                        buildChildren(def, module, path, index));
                case LIST -> buildList(def, module, path, index);
                case RPC -> new RpcInput(def.name(), module, path, def.description(),
                        buildChildren(def, module, path, index));
                case NOTIFICATION -> new Notification(def.name(), module, path, def.description(),
                        buildChildren(def, module, path, index));
            };
            index.put(path, node);
            return node;
        }

        private List<SchemaNode> buildChildren(
                NodeDefinition def, String module, String path, Map<String, SchemaNode> index) {
            List<SchemaNode> children = new ArrayList<>(def.children().size());
            for (NodeDefinition child : def.children()) {
                children.add(buildNode(child, module, path, false, index));
            }
            return children;
        }

        private ListNode buildList(NodeDefinition def, String module, String path, Map<String, SchemaNode> index) {
            if (def.keys().isEmpty()) {
                throw new SchemaBuildException("List '" + path + "' declares no keys", source);
            }
            if (Set.copyOf(def.keys()).size() != def.keys().size()) {
                throw new SchemaBuildException("List '" + path + "' declares a key twice: " + def.keys(), source);
            }
            List<SchemaNode> children = buildChildren(def, module, path, index);
            for (String key : def.keys()) {
                boolean declared = children.stream().anyMatch(c -> c.name().equals(key) && c instanceof Leaf);
                if (!declared) {
                    throw new SchemaBuildException(
                            "Key '" + key + "' of list '" + path + "' is not declared as a child leaf", source);
                }
            }
            return new ListNode(def.name(), module, path, def.description(), def.keys(),
                    def.minElements(), def.maxElements(), children);
        }

        private void requireLeafShape(NodeDefinition def, String path) {
            if (def.type() == null) {
                throw new SchemaBuildException(def.kind().token() + " '" + path + "' declares no type", source);
            }
            if (!def.children().isEmpty()) {
                throw new SchemaBuildException(def.kind().token() + " '" + path + "' cannot have children", source);
            }
            checkIdentityBases(def.type(), path);
        }

        private void checkIdentityBases(TypeConstraint type, String path) {
            if (type instanceof TypeConstraint.IdentityRef ref && !identities.contains(ref.base())) {
                throw new SchemaBuildException(
                        "Leaf '" + path + "' references unknown identity base '" + ref.base() + "'", source);
            }
            if (type instanceof TypeConstraint.Union union) {
                union.members().forEach(member -> checkIdentityBases(member, path));
            }
        }

        private void checkBounds(NodeDefinition def, String path) {
            if (def.minElements() < 0) {
                throw new SchemaBuildException("min-elements of '" + path + "' must not be negative", source);
            }
            if (def.maxElements() != null && def.maxElements() < def.minElements()) {
                throw new SchemaBuildException("min-elements " + def.minElements() + " of '" + path
                        + "' is greater than max-elements " + def.maxElements(), source);
            }
        }
    }
}
