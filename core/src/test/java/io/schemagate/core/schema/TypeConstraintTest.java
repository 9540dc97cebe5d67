package io.schemagate.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.schemagate.core.error.SchemaBuildException;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TypeConstraintTest {

    @Nested
    @DisplayName("pattern")
    class Patterns {

        @Test
        void malformedRegexFailsTheBuild() {
            assertThatThrownBy(() -> TypeConstraint.pattern("[a-"))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("Malformed pattern '[a-'");
        }

        @Test
        void lengthBoundsMustBeOrdered() {
            assertThatThrownBy(() -> TypeConstraint.pattern(".*", 5, 2))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("min-length 5 is greater than max-length 2");
        }

        @Test
        void equalityUsesRegexText() {
            assertThat(TypeConstraint.pattern("[a-z]+", 1, null)).isEqualTo(TypeConstraint.pattern("[a-z]+", 1, null));
            assertThat(TypeConstraint.pattern("[a-z]+")).isNotEqualTo(TypeConstraint.pattern("[a-z]*"));
        }
    }

    @Nested
    @DisplayName("numeric")
    class Numeric {

        @Test
        void missingBoundsDefaultToWidth() {
            TypeConstraint.NumericRange range = TypeConstraint.numeric(NumericWidth.UINT8);

            assertThat(range.min()).isEqualByComparingTo("0");
            assertThat(range.max()).isEqualByComparingTo("255");
            assertThat(range.describe()).isEqualTo("uint8 in [0, 255]");
        }

        @Test
        void boundsOutsideWidthAreRejected() {
            assertThatThrownBy(() -> TypeConstraint.range(NumericWidth.UINT8, 0, 300))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("exceeds the bounds of uint8");
        }

        @Test
        void invertedRangeIsRejected() {
            assertThatThrownBy(() -> TypeConstraint.range(NumericWidth.INT32, 10, 1))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("greater than maximum");
        }

        @Test
        void decimalNeedsFractionDigits() {
            assertThatThrownBy(() -> TypeConstraint.decimal(0, null, null))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("fraction-digits in 1..18");
        }

        @Test
        void integerWidthRejectsFractionDigits() {
            assertThatThrownBy(() -> new TypeConstraint.NumericRange(NumericWidth.INT32, null, null, 2))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("only allowed for decimal64");
        }

        @Test
        void integerWidthRejectsFractionalBounds() {
            assertThatThrownBy(() -> new TypeConstraint.NumericRange(
                            NumericWidth.INT32, new BigDecimal("0.5"), BigDecimal.TEN, 0))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("must be integers");
        }

        @Test
        void decimalBoundsScaleWithFractionDigits() {
            TypeConstraint.NumericRange range = TypeConstraint.decimal(2, null, null);

            assertThat(range.max()).isEqualByComparingTo("92233720368547758.07");
        }

        @Test
        void widthTokens() {
            assertThat(NumericWidth.fromToken("uint64")).isEqualTo(NumericWidth.UINT64);
            assertThatThrownBy(() -> NumericWidth.fromToken("int128")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void emptyEnumerationIsRejected() {
        assertThatThrownBy(() -> TypeConstraint.enumeration())
                .isInstanceOf(SchemaBuildException.class)
                .hasMessageContaining("at least one token");
    }

    @Test
    void emptyUnionIsRejected() {
        assertThatThrownBy(() -> TypeConstraint.union())
                .isInstanceOf(SchemaBuildException.class)
                .hasMessageContaining("at least one member");
    }

    @Test
    void blankIdentityBaseIsRejected() {
        assertThatThrownBy(() -> TypeConstraint.identityRef(" ")).isInstanceOf(SchemaBuildException.class);
    }

    @Test
    void unionDescribesItsMembers() {
        TypeConstraint union = TypeConstraint.union(TypeConstraint.bool(), TypeConstraint.enumeration("auto"));

        assertThat(union.describe()).isEqualTo("union of (boolean | one of [auto])");
    }
}
