package org.datayoinker.service.content;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Types a raw parameter value: float first, then integer, otherwise the string itself.
 */
public final class ValueInference {

    // Decimal literals with a fraction and/or an exponent. No whitespace, hex, NaN or Infinity.
    private static final Pattern FLOAT_LITERAL =
            Pattern.compile("[+-]?(?:\\d+\\.\\d*|\\.\\d+|\\d+(?=[eE]))(?:[eE][+-]?\\d+)?");

    private static final Pattern INTEGER_LITERAL = Pattern.compile("[+-]?\\d+");

    private ValueInference() {
    }

    public static Object infer(String raw) {
        if (raw == null) {
            return null;
        }

        Double floating = parseFloat(raw);
        if (floating != null) {
            return floating;
        }

        Number integer = parseInteger(raw);
        if (integer != null) {
            return integer;
        }

        return raw;
    }

    /**
     * Shortest plain decimal text that reads back as the same double, e.g. {@code 2.5}, {@code 100000.0}.
     * Integral values keep one fractional digit so they are still read as floats.
     */
    public static BigDecimal toPlainDecimal(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        return decimal.scale() < 1 ? decimal.setScale(1) : decimal;
    }

    private static Double parseFloat(String raw) {
        if (!FLOAT_LITERAL.matcher(raw).matches()) {
            return null;
        }
        double value = Double.parseDouble(raw);
        return Double.isFinite(value) ? value : null;
    }

    private static Number parseInteger(String raw) {
        if (!INTEGER_LITERAL.matcher(raw).matches()) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException tooWide) {
            // wider than 64 bits, kept as a float like any other out-of-range number
            double value = Double.parseDouble(raw);
            return Double.isFinite(value) ? value : null;
        }
    }
}
