package io.schemagate.core.schema;

import io.schemagate.core.error.SchemaBuildException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Declared type of a leaf. A sealed hierarchy; every factory rejects inconsistent declarations
 * with a {@link SchemaBuildException}, so a broken schema never reaches the validator.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface TypeConstraint {

    /** Short human-readable description used in rejection details. */
    String describe();

    // ── Factories ──

    static StringPattern pattern(String regex) {
        return pattern(regex, null, null);
    }

    static StringPattern pattern(String regex, Integer minLength, Integer maxLength) {
        Objects.requireNonNull(regex, "regex must not be null");
        try {
            return new StringPattern(Pattern.compile(regex), minLength, maxLength);
        } catch (PatternSyntaxException e) {
            throw new SchemaBuildException("Malformed pattern '" + regex + "': " + e.getDescription(), e, null);
        }
    }

    static NumericRange numeric(NumericWidth width) {
        return new NumericRange(width, null, null, 0);
    }

    static NumericRange range(NumericWidth width, long min, long max) {
        return new NumericRange(width, BigDecimal.valueOf(min), BigDecimal.valueOf(max), 0);
    }

    static NumericRange decimal(int fractionDigits, BigDecimal min, BigDecimal max) {
        return new NumericRange(NumericWidth.DECIMAL64, min, max, fractionDigits);
    }

    static Enumeration enumeration(String... tokens) {
        return new Enumeration(new LinkedHashSet<>(List.of(tokens)));
    }

    static IdentityRef identityRef(String base) {
        return new IdentityRef(base);
    }

    static BooleanType bool() {
        return BooleanType.INSTANCE;
    }

    static Opaque opaque() {
        return Opaque.INSTANCE;
    }

    static Union union(TypeConstraint... members) {
        return new Union(List.of(members));
    }

    // ── Implementations ──

    /**
     * Textual value that must fully match {@code pattern} (anchored at both ends) and optionally
     * satisfy length bounds counted in code points.
     */
    record StringPattern(Pattern pattern, Integer minLength, Integer maxLength) implements TypeConstraint {
        public StringPattern {
            Objects.requireNonNull(pattern, "pattern must not be null");
            if (minLength != null && minLength < 0) {
                throw new SchemaBuildException("min-length must not be negative, got: " + minLength);
            }
            if (minLength != null && maxLength != null && minLength > maxLength) {
                throw new SchemaBuildException(
                        "min-length " + minLength + " is greater than max-length " + maxLength);
            }
        }

        public String regex() {
            return pattern.pattern();
        }

        @Override
        public String describe() {
            return "string matching '" + pattern.pattern() + "'";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StringPattern that)) return false;
            return pattern.pattern().equals(that.pattern.pattern())
                    && Objects.equals(minLength, that.minLength)
                    && Objects.equals(maxLength, that.maxLength);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pattern.pattern(), minLength, maxLength);
        }
    }

    /**
     * Number of the given width within {@code [min, max]}. Missing bounds default to the width's
     * own bounds; declared bounds must lie inside them.
     */
    record NumericRange(NumericWidth width, BigDecimal min, BigDecimal max, int fractionDigits)
            implements TypeConstraint {
        public NumericRange {
            Objects.requireNonNull(width, "width must not be null");
            if (width.isIntegral() && fractionDigits != 0) {
                throw new SchemaBuildException("fraction-digits is only allowed for decimal64, got " + width.token());
            }
            if (!width.isIntegral() && (fractionDigits < 1 || fractionDigits > 18)) {
                throw new SchemaBuildException("decimal64 requires fraction-digits in 1..18, got: " + fractionDigits);
            }
            BigDecimal lower = width.lowerBound(fractionDigits);
            BigDecimal upper = width.upperBound(fractionDigits);
            min = min != null ? min : lower;
            max = max != null ? max : upper;
            if (min.compareTo(lower) < 0 || max.compareTo(upper) > 0) {
                throw new SchemaBuildException("Range [" + min.toPlainString() + ", " + max.toPlainString()
                        + "] exceeds the bounds of " + width.token());
            }
            if (min.compareTo(max) > 0) {
                throw new SchemaBuildException(
                        "Range minimum " + min.toPlainString() + " is greater than maximum " + max.toPlainString());
            }
            if (width.isIntegral() && (!isIntegral(min) || !isIntegral(max))) {
                throw new SchemaBuildException("Bounds of " + width.token() + " must be integers");
            }
        }

        private static boolean isIntegral(BigDecimal value) {
            return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
        }

        @Override
        public String describe() {
            return width.token() + " in [" + min.toPlainString() + ", " + max.toPlainString() + "]";
        }
    }

    /** Textual value equal to one of the declared tokens (exact comparison). */
    record Enumeration(Set<String> tokens) implements TypeConstraint {
        public Enumeration {
            Objects.requireNonNull(tokens, "tokens must not be null");
            if (tokens.isEmpty()) {
                throw new SchemaBuildException("Enumeration must declare at least one token");
            }
            tokens = Collections.unmodifiableSet(new LinkedHashSet<>(tokens));
        }

        @Override
        public String describe() {
            return "one of " + tokens;
        }
    }

    /** Name of a known identity derived from {@code base}. */
    record IdentityRef(String base) implements TypeConstraint {
        public IdentityRef {
            Objects.requireNonNull(base, "base must not be null");
            if (base.isBlank()) {
                throw new SchemaBuildException("identityref base must not be blank");
            }
        }

        @Override
        public String describe() {
            return "identity derived from '" + base + "'";
        }
    }

    /** JSON boolean, or the exact tokens {@code true} / {@code false}. */
    record BooleanType() implements TypeConstraint {
        static final BooleanType INSTANCE = new BooleanType();

        @Override
        public String describe() {
            return "boolean";
        }
    }

    /** No restriction declared. Accepted as-is and flagged as unconstrained. */
    record Opaque() implements TypeConstraint {
        static final Opaque INSTANCE = new Opaque();

        @Override
        public String describe() {
            return "unconstrained value";
        }
    }

    /** First matching member wins. */
    record Union(List<TypeConstraint> members) implements TypeConstraint {
        public Union {
            Objects.requireNonNull(members, "members must not be null");
            if (members.isEmpty()) {
                throw new SchemaBuildException("Union must declare at least one member type");
            }
            members = List.copyOf(members);
        }

        @Override
        public String describe() {
            return "union of (" + members.stream().map(TypeConstraint::describe).collect(Collectors.joining(" | ")) + ")";
        }
    }
}
