package io.schemagate.core.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemagate.core.error.IdentityCycleException;
import io.schemagate.core.error.SchemaBuildException;
import io.schemagate.core.testkit.TestSchemas;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IdentityRegistryTest {

    private final IdentityRegistry registry = TestSchemas.identities();

    @Nested
    @DisplayName("derivation")
    class Derivation {

        @Test
        void transitiveDerivation() {
            assertThat(registry.isDerivedFrom("fast-ethernet", "interface-type")).isTrue();
            assertThat(registry.isDerivedFrom("ethernet", "interface-type")).isTrue();
        }

        @Test
        void identityDerivesFromItself() {
            assertThat(registry.isDerivedFrom("ethernet", "ethernet")).isTrue();
        }

        @Test
        void derivationIsNotSymmetric() {
            assertThat(registry.isDerivedFrom("interface-type", "ethernet")).isFalse();
            assertThat(registry.isDerivedFrom("loopback", "ethernet")).isFalse();
        }

        @Test
        void unrelatedTreesDoNotMix() {
            assertThat(registry.isDerivedFrom("sha256", "interface-type")).isFalse();
        }

        @Test
        void unknownNamesNeverDerive() {
            assertThat(registry.isDerivedFrom("token-ring", "interface-type")).isFalse();
            assertThat(registry.isDerivedFrom("ethernet", "nothing")).isFalse();
            assertThat(registry.isDerivedFrom(null, "ethernet")).isFalse();
        }

        @Test
        void derivedFromExcludesTheBase() {
            assertThat(registry.derivedFrom("interface-type"))
                    .extracting(Identity::name)
                    .containsExactly("ethernet", "fast-ethernet", "loopback");
            assertThat(registry.derivedFrom("unknown")).isEmpty();
        }

        @Test
        @DisplayName("diamond inheritance reaches the shared root through both paths")
        void diamond() {
            IdentityRegistry diamond = IdentityRegistry.builder()
                    .identity("root")
                    .identity("left", "root")
                    .identity("right", "root")
                    .identity("leaf", "left", "right")
                    .build();

            assertThat(diamond.isDerivedFrom("leaf", "root")).isTrue();
            assertThat(diamond.isDerivedFrom("leaf", "left")).isTrue();
            assertThat(diamond.isDerivedFrom("left", "right")).isFalse();
        }

        @Test
        @DisplayName("deep chains are closed without recursion")
        void deepChain() {
            IdentityRegistry.Builder builder = IdentityRegistry.builder().identity("id0");
            for (int i = 1; i <= 5_000; i++) {
                builder.identity("id" + i, "id" + (i - 1));
            }
            IdentityRegistry deep = builder.build();

            assertThat(deep.isDerivedFrom("id5000", "id0")).isTrue();
            assertThat(deep.isDerivedFrom("id0", "id5000")).isFalse();
            assertThat(deep.size()).isEqualTo(5_001);
        }
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        void qualifiedNameMustMatchModule() {
            assertThat(registry.lookup("ifs:ethernet")).get().extracting(Identity::name).isEqualTo("ethernet");
            assertThat(registry.lookup("sys:ethernet")).isEmpty();
            assertThat(registry.isDerivedFrom("ifs:fast-ethernet", "ifs:interface-type")).isTrue();
        }

        @Test
        void qualifiedName() {
            assertThat(registry.lookup("sha256").orElseThrow().qualifiedName()).isEqualTo("sys:sha256");
            assertThat(new Identity("bare", null, null, null).qualifiedName()).isEqualTo("bare");
        }

        @Test
        void emptyRegistry() {
            assertThat(IdentityRegistry.empty().size()).isZero();
            assertThat(IdentityRegistry.empty().contains("anything")).isFalse();
            assertThat(IdentityRegistry.builder().build()).isSameAs(IdentityRegistry.empty());
        }
    }

    @Nested
    @DisplayName("build errors")
    class BuildErrors {

        @Test
        void danglingBase() {
            IdentityRegistry.Builder builder = IdentityRegistry.builder().source("ids.yaml").identity("child", "ghost");

            assertThatThrownBy(builder::build)
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("Identity 'child' names unknown base 'ghost'")
                    .extracting(e -> ((SchemaBuildException) e).source())
                    .isEqualTo("ids.yaml");
        }

        @Test
        void duplicateIdentity() {
            IdentityRegistry.Builder builder = IdentityRegistry.builder().identity("a");

            assertThatThrownBy(() -> builder.identity("a"))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("Duplicate identity 'a'");
        }

        @Test
        @DisplayName("a cycle is reported with the identities forming it")
        void cycle() {
            IdentityRegistry.Builder builder = IdentityRegistry.builder()
                    .identity("a", "b")
                    .identity("b", "c")
                    .identity("c", "a");

            assertThatThrownBy(builder::build)
                    .isInstanceOf(IdentityCycleException.class)
                    .hasMessageContaining("a -> b -> c -> a")
                    .extracting(e -> ((IdentityCycleException) e).cycle())
                    .isEqualTo(List.of("a", "b", "c", "a"));
        }

        @Test
        void selfCycle() {
            IdentityRegistry.Builder builder = IdentityRegistry.builder()
                    .identity(new Identity("self", "m", Set.of("self"), null));

            assertThatThrownBy(builder::build).isInstanceOf(IdentityCycleException.class);
        }
    }
}
