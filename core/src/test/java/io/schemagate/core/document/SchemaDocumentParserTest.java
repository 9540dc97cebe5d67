package io.schemagate.core.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemagate.core.error.IdentityCycleException;
import io.schemagate.core.error.SchemaBuildException;
import io.schemagate.core.error.SchemaLoadException;
import io.schemagate.core.error.SchemaParseException;
import io.schemagate.core.model.RejectionKind;
import io.schemagate.core.schema.Leaf;
import io.schemagate.core.schema.LeafList;
import io.schemagate.core.schema.ListNode;
import io.schemagate.core.schema.TypeConstraint;
import io.schemagate.core.validate.Validator;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaDocumentParserTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private SchemaDocumentParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new SchemaDocumentParser();
    }

    static Path fixture(String name) throws Exception {
        return Path.of(SchemaDocumentParserTest.class.getResource("/fixtures/" + name).toURI());
    }

    private Path write(String yaml) throws Exception {
        Path file = tempDir.resolve("schema.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("valid document")
    class ValidDocument {

        @Test
        void buildsTreeAndIdentities() throws Exception {
            CompiledSchema schema = parser.parse(fixture("network-schema.yaml"));

            assertThat(schema.source()).endsWith("network-schema.yaml");
            assertThat(schema.identities().isDerivedFrom("ethernet", "interface-type")).isTrue();
            assertThat(schema.tree().modules()).hasSize(2);
            assertThat(schema.tree().identities()).isSameAs(schema.identities());

            ListNode list = (ListNode) schema.tree().nodeAt("/interfaces/interface").orElseThrow();
            assertThat(list.keys()).containsExactly("name");
            assertThat(list.maxElements()).isEqualTo(64);

            LeafList addresses = (LeafList) schema.tree().nodeAt("/interfaces/interface/addresses").orElseThrow();
            assertThat(addresses.type()).isInstanceOf(TypeConstraint.Union.class);
            assertThat(addresses.maxElements()).isEqualTo(8);
        }

        @Test
        @DisplayName("'string' and 'opaque' both load as unconstrained types")
        void unconstrainedTypeTokens() throws Exception {
            CompiledSchema schema = parser.parse(fixture("network-schema.yaml"));

            assertThat(schema.tree().nodeAt("/system/contact").orElseThrow())
                    .extracting(n -> ((Leaf) n).type())
                    .isEqualTo(TypeConstraint.opaque());
            assertThat(schema.tree().nodeAt("/link-down/if-name").orElseThrow())
                    .extracting(n -> ((Leaf) n).type())
                    .isEqualTo(TypeConstraint.opaque());
        }

        @Test
        @DisplayName("loaded constraints drive validation")
        void loadedConstraintsValidate() throws Exception {
            CompiledSchema schema = parser.parse(fixture("network-schema.yaml"));
            Validator validator = new Validator(schema.identities());

            assertThat(validator.validate(schema.tree().require("/system/ratio"), JSON.readTree("0.25")).isAccepted())
                    .isTrue();
            assertThat(validator.validate(schema.tree().require("/system/ratio"), JSON.readTree("0.255")).kind())
                    .isEqualTo(RejectionKind.TYPE_MISMATCH);
            assertThat(validator.validate(
                                    schema.tree().require("/interfaces/interface[name='eth0']"),
                                    JSON.readTree("{\"name\":\"eth0\"}"))
                            .kind())
                    .isEqualTo(RejectionKind.MISSING_MANDATORY);
            assertThat(validator.validate(
                                    schema.tree().require("/interfaces/interface[name='eth0']/addresses"),
                                    JSON.readTree("[\"10.0.0.1/24\",\"dhcp\"]"))
                            .isAccepted())
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("invalid documents")
    class InvalidDocuments {

        @Test
        void unknownKeyIsStructurallyInvalid() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: leaf
                            name: x
                            type: boolean
                            default: true
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("structurally invalid")
                    .extracting(e -> ((SchemaLoadException) e).source())
                    .isEqualTo(file.toString());
        }

        @Test
        void unknownNodeKind() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: choice
                            name: x
                    """);

            assertThatThrownBy(() -> parser.parse(file)).isInstanceOf(SchemaParseException.class);
        }

        @Test
        void leafWithoutType() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: leaf
                            name: x
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("'/m/x': leaf requires 'type'");
        }

        @Test
        void listWithoutKeys() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: list
                            name: users
                            children:
                              - kind: leaf
                                name: id
                                type: opaque
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("list requires 'keys'");
        }

        @Test
        void keyNotDeclaredAsLeaf() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: list
                            name: users
                            keys: [id]
                            children:
                              - kind: leaf
                                name: name
                                type: opaque
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("Key 'id' of list '/users'");
        }

        @Test
        void infiniteBoundIsABuildError() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: leaf
                            name: speed
                            type:
                              numeric: int64
                              max: 1.0e+400
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("'/m/speed'")
                    .hasMessageContaining("not finite");
        }

        @Test
        void malformedPatternNamesTheLeaf() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: leaf
                            name: x
                            type:
                              pattern: "[a-"
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("'/m/x': Malformed pattern")
                    .extracting(e -> ((SchemaLoadException) e).source())
                    .isEqualTo(file.toString());
        }

        @Test
        void identityCycle() throws Exception {
            Path file = write("""
                    identities:
                      - name: a
                        bases: [b]
                      - name: b
                        bases: [a]
                    modules: []
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(IdentityCycleException.class)
                    .hasMessageContaining("a -> b -> a");
        }

        @Test
        void unknownIdentityrefBase() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: leaf
                            name: alg
                            type:
                              identityref: crypto-alg
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("unknown identity base 'crypto-alg'");
        }

        @Test
        void malformedYaml() throws Exception {
            Path file = write("modules: [unclosed\n");

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Failed to read or parse");
        }

        @Test
        void missingFile() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(SchemaParseException.class);
        }

        @Test
        void boundsOnContainer() throws Exception {
            Path file = write("""
                    modules:
                      - name: m
                        nodes:
                          - kind: container
                            name: c
                            max-elements: 3
                    """);

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("element bounds are only allowed on list and leaf-list");
        }
    }
}
