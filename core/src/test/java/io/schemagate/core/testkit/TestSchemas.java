package io.schemagate.core.testkit;

import io.schemagate.core.identity.Identity;
import io.schemagate.core.identity.IdentityRegistry;
import io.schemagate.core.schema.ConstraintTree;
import io.schemagate.core.schema.NodeDefinition;
import io.schemagate.core.schema.NumericWidth;
import io.schemagate.core.schema.TypeConstraint;
import java.util.List;
import java.util.Set;

/**
 * Shared schema used across core tests.
 *
 * <pre>
 * ifs:
 *   /interfaces/interface[name]   name, type (identityref interface-type), mtu (uint16 68..9000),
 *                                 enabled (boolean), description (opaque), tags (leaf-list, max 3)
 *   /hostname                     pattern [a-z][a-z0-9-]*
 * sys:
 *   /reboot                       rpc: mode (mandatory enum shutdown|restart), delay (uint32)
 *   /link-down                    notification: if-name, severity (enum)
 *   /system                       token (hex8), load (int32 0..100), contact (opaque),
 *                                 timeout (union uint32 0..3600 | "infinite")
 * ops:
 *   /run-command                  rpc: command (mandatory identityref command-type)
 * </pre>
 */
public final class TestSchemas {

    private TestSchemas() {}

    public static IdentityRegistry identities() {
        return IdentityRegistry.builder()
                .identity(new Identity("interface-type", "ifs", Set.of(), "base of all interface types"))
                .identity(new Identity("ethernet", "ifs", Set.of("interface-type"), null))
                .identity(new Identity("fast-ethernet", "ifs", Set.of("ethernet"), null))
                .identity(new Identity("loopback", "ifs", Set.of("interface-type"), null))
                .identity(new Identity("crypto-alg", "sys", Set.of(), null))
                .identity(new Identity("sha256", "sys", Set.of("crypto-alg"), null))
                .identity(new Identity("command-type", "ops", Set.of(), null))
                .identity(new Identity("shutdown", "ops", Set.of("command-type"), null))
                .identity(new Identity("restart", "ops", Set.of("command-type"), null))
                .build();
    }

    public static ConstraintTree tree() {
        return ConstraintTree.builder(identities())
                .module("ifs", m -> m
                        .container("interfaces", c -> c
                                .list("interface", List.of("name"), e -> e
                                        .leaf("name", TypeConstraint.pattern("[a-z]+[0-9]*"))
                                        .leaf("type", TypeConstraint.identityRef("interface-type"))
                                        .leaf("mtu", TypeConstraint.range(NumericWidth.UINT16, 68, 9000))
                                        .leaf("enabled", TypeConstraint.bool())
                                        .leaf("description", TypeConstraint.opaque())
                                        .leafList("tags", TypeConstraint.pattern("[a-z]+"), 0, 3)))
                        .node(NodeDefinition.leaf("hostname", TypeConstraint.pattern("[a-z][a-z0-9-]*", 1, 63))
                                .description("host name of the device")))
                .module("sys", m -> m
                        .rpc("reboot", in -> in
                                .mandatoryLeaf("mode", TypeConstraint.enumeration("shutdown", "restart"))
                                .leaf("delay", TypeConstraint.numeric(NumericWidth.UINT32)))
                        .notification("link-down", n -> n
                                .leaf("if-name", TypeConstraint.pattern("[a-z]+[0-9]*"))
                                .leaf("severity", TypeConstraint.enumeration("minor", "major", "critical")))
                        .container("system", c -> c
                                .leaf("token", TypeConstraint.pattern("[0-9a-f]{8}"))
                                .leaf("load", TypeConstraint.range(NumericWidth.INT32, 0, 100))
                                .leaf("contact", TypeConstraint.opaque())
                                .leaf("timeout", TypeConstraint.union(
                                        TypeConstraint.range(NumericWidth.UINT32, 0, 3600),
                                        TypeConstraint.enumeration("infinite")))))
                .module("ops", m -> m
                        .rpc("run-command", in -> in
                                .mandatoryLeaf("command", TypeConstraint.identityRef("command-type"))))
                .build();
    }
}
