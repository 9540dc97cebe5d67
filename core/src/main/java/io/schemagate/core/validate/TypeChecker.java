package io.schemagate.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.schemagate.core.identity.Identity;
import io.schemagate.core.identity.IdentityRegistry;
import io.schemagate.core.model.RejectionKind;
import io.schemagate.core.schema.TypeConstraint;
import io.schemagate.core.schema.TypeConstraint.BooleanType;
import io.schemagate.core.schema.TypeConstraint.Enumeration;
import io.schemagate.core.schema.TypeConstraint.IdentityRef;
import io.schemagate.core.schema.TypeConstraint.NumericRange;
import io.schemagate.core.schema.TypeConstraint.Opaque;
import io.schemagate.core.schema.TypeConstraint.StringPattern;
import io.schemagate.core.schema.TypeConstraint.Union;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Pattern;

/** Checks one scalar against a {@link TypeConstraint} and produces its normalized form. */
final class TypeChecker {

    private static final Pattern NUMERIC_TEXT = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final IdentityRegistry identities;

    TypeChecker(IdentityRegistry identities) {
        this.identities = identities;
    }

    /** Returns the normalized scalar, or {@code null} after recording a rejection on {@code walk}. */
    JsonNode check(TypeConstraint type, JsonNode value, String path, ValidationWalk walk) {
        if (type instanceof StringPattern pattern) {
            return string(pattern, value, path, walk);
        }
        if (type instanceof NumericRange range) {
            return numeric(range, value, path, walk);
        }
        if (type instanceof Enumeration enumeration) {
            if (!value.isTextual()) {
                return walk.reject(RejectionKind.TYPE_MISMATCH, path, "expected " + type.describe()
                        + ", got " + ValidationWalk.describe(value));
            }
            if (!enumeration.tokens().contains(value.textValue())) {
                return walk.reject(RejectionKind.ENUM_MISMATCH, path,
                        "'" + value.textValue() + "' is not " + type.describe());
            }
            return value;
        }
        if (type instanceof IdentityRef ref) {
            return identity(ref, value, path, walk);
        }
        if (type instanceof BooleanType) {
            if (value.isBoolean()) {
                return value;
            }
            if (value.isTextual() && ("true".equals(value.textValue()) || "false".equals(value.textValue()))) {
                return BooleanNode.valueOf(Boolean.parseBoolean(value.textValue()));
            }
            return walk.reject(RejectionKind.TYPE_MISMATCH, path, "expected boolean, got " + value);
        }
        if (type instanceof Opaque) {
            walk.unconstrained(path);
            return value;
        }
        if (type instanceof Union union) {
            for (TypeConstraint member : union.members()) {
                ValidationWalk attempt = walk.scratch();
                JsonNode normalized = check(member, value, path, attempt);
                if (normalized != null) {
                    walk.absorb(attempt);
                    return normalized;
                }
            }
            return walk.reject(RejectionKind.TYPE_MISMATCH, path, value + " does not match " + union.describe());
        }
        throw new IllegalStateException("Unhandled type constraint: " + type);
    }

    private static JsonNode string(StringPattern type, JsonNode value, String path, ValidationWalk walk) {
        if (!value.isTextual()) {
            return walk.reject(RejectionKind.TYPE_MISMATCH, path, "expected a string, got "
                    + ValidationWalk.describe(value));
        }
        String text = value.textValue();
        int length = text.codePointCount(0, text.length());
        if (type.minLength() != null && length < type.minLength()) {
            return walk.reject(RejectionKind.LENGTH_VIOLATION, path,
                    "length " + length + " is shorter than minimum " + type.minLength());
        }
        if (type.maxLength() != null && length > type.maxLength()) {
            return walk.reject(RejectionKind.LENGTH_VIOLATION, path,
                    "length " + length + " is longer than maximum " + type.maxLength());
        }
        if (!type.pattern().matcher(text).matches()) {
            return walk.reject(RejectionKind.PATTERN_MISMATCH, path,
                    "value does not match pattern '" + type.regex() + "'");
        }
        return value;
    }

    private static JsonNode numeric(NumericRange type, JsonNode value, String path, ValidationWalk walk) {
        BigDecimal number;
        boolean hasFraction;
        if (value.isFloatingPointNumber() && !Double.isFinite(value.doubleValue())) {
            return walk.reject(RejectionKind.RANGE_VIOLATION, path,
                    value.asText() + " is outside the range of " + type.width().token());
        }
        if (value.isNumber()) {
            number = value.decimalValue();
            hasFraction = !value.isIntegralNumber();
        } else if (value.isTextual() && NUMERIC_TEXT.matcher(value.textValue()).matches()) {
            number = new BigDecimal(value.textValue());
            hasFraction = value.textValue().indexOf('.') >= 0;
        } else {
            return walk.reject(RejectionKind.TYPE_MISMATCH, path, "expected " + type.width().token()
                    + ", got " + value);
        }

        if (type.width().isIntegral()) {
            if (hasFraction) {
                return walk.reject(RejectionKind.TYPE_MISMATCH, path,
                        number.toPlainString() + " is not an integer of type " + type.width().token());
            }
        } else if (number.stripTrailingZeros().scale() > type.fractionDigits()) {
            return walk.reject(RejectionKind.TYPE_MISMATCH, path, number.toPlainString() + " has more than "
                    + type.fractionDigits() + " fraction digits");
        }

        BigDecimal widthMin = type.width().lowerBound(type.fractionDigits());
        BigDecimal widthMax = type.width().upperBound(type.fractionDigits());
        if (number.compareTo(widthMin) < 0 || number.compareTo(widthMax) > 0) {
            return walk.reject(RejectionKind.RANGE_VIOLATION, path,
                    number.toPlainString() + " is outside the range of " + type.width().token());
        }
        if (number.compareTo(type.min()) < 0) {
            return walk.reject(RejectionKind.RANGE_VIOLATION, path,
                    number.toPlainString() + " is less than minimum " + type.min().toPlainString());
        }
        if (number.compareTo(type.max()) > 0) {
            return walk.reject(RejectionKind.RANGE_VIOLATION, path,
                    number.toPlainString() + " is greater than maximum " + type.max().toPlainString());
        }
        return normalizeNumber(number, type.width().isIntegral());
    }

    private static JsonNode normalizeNumber(BigDecimal number, boolean integral) {
        if (!integral) {
            return JsonNodeFactory.instance.numberNode(number);
        }
        BigInteger whole = number.toBigIntegerExact();
        if (whole.compareTo(INT_MIN) >= 0 && whole.compareTo(INT_MAX) <= 0) {
            return JsonNodeFactory.instance.numberNode(whole.intValue());
        }
        if (whole.compareTo(LONG_MIN) >= 0 && whole.compareTo(LONG_MAX) <= 0) {
            return JsonNodeFactory.instance.numberNode(whole.longValue());
        }
        return JsonNodeFactory.instance.numberNode(whole);
    }

    private JsonNode identity(IdentityRef type, JsonNode value, String path, ValidationWalk walk) {
        if (!value.isTextual()) {
            return walk.reject(RejectionKind.TYPE_MISMATCH, path, "expected an identity name, got "
                    + ValidationWalk.describe(value));
        }
        Optional<Identity> identity = identities.lookup(value.textValue());
        if (identity.isEmpty()) {
            return walk.reject(RejectionKind.UNKNOWN_IDENTITY, path,
                    "'" + value.textValue() + "' is not a known identity");
        }
        if (!identities.isDerivedFrom(identity.get().name(), type.base())) {
            return walk.reject(RejectionKind.IDENTITY_NOT_DERIVED, path,
                    "'" + value.textValue() + "' is not derived from '" + type.base() + "'");
        }
        return TextNode.valueOf(identity.get().name());
    }
}
