package io.schemagate.core.schema;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Built-in numeric widths. Integer widths carry fixed bounds; {@link #DECIMAL64} bounds depend on
 * the declared number of fraction digits.
 */
public enum NumericWidth {
    INT8("-128", "127"),
    INT16("-32768", "32767"),
    INT32("-2147483648", "2147483647"),
    INT64("-9223372036854775808", "9223372036854775807"),
    UINT8("0", "255"),
    UINT16("0", "65535"),
    UINT32("0", "4294967295"),
    UINT64("0", "18446744073709551615"),
    DECIMAL64(null, null);

    private static final BigDecimal DECIMAL64_UNSCALED_MAX = new BigDecimal("9223372036854775807");
    private static final BigDecimal DECIMAL64_UNSCALED_MIN = new BigDecimal("-9223372036854775808");

    private final BigDecimal lower;
    private final BigDecimal upper;

    NumericWidth(String lower, String upper) {
        this.lower = lower != null ? new BigDecimal(lower) : null;
        this.upper = upper != null ? new BigDecimal(upper) : null;
    }

    public boolean isIntegral() {
        return this != DECIMAL64;
    }

    /** Lower bound of this width; {@code fractionDigits} is only used by {@link #DECIMAL64}. */
    public BigDecimal lowerBound(int fractionDigits) {
        return isIntegral() ? lower : DECIMAL64_UNSCALED_MIN.movePointLeft(fractionDigits);
    }

    /** Upper bound of this width; {@code fractionDigits} is only used by {@link #DECIMAL64}. */
    public BigDecimal upperBound(int fractionDigits) {
        return isIntegral() ? upper : DECIMAL64_UNSCALED_MAX.movePointLeft(fractionDigits);
    }

    /** Lower-case token as written in compiled-schema documents ({@code int32}, {@code decimal64}). */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a compiled-schema token.
     *
     * @throws IllegalArgumentException for unknown tokens
     */
    public static NumericWidth fromToken(String token) {
        for (NumericWidth width : values()) {
            if (width.token().equals(token)) {
                return width;
            }
        }
        throw new IllegalArgumentException("Unknown numeric width '" + token + "'");
    }
}
