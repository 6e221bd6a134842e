package com.synthgraph.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

import com.synthgraph.api.SignalRate;

/**
 * Writes node parameters and port defaults as program literals.
 *
 * <p>
 * String-rate ports take quoted strings. Every other rate takes booleans
 * (as 1 or 0), numbers, or a string restricted to digits, letters,
 * underscores, spaces, dots, parentheses and the four arithmetic operators.
 * Anything else is rejected, so a parameter cannot smuggle arbitrary program
 * text into an instrument.
 */
public final class LiteralFormatter {
    private static final Pattern SAFE_EXPRESSION = Pattern.compile("[-+*/(). 0-9a-zA-Z_]+");

    private LiteralFormatter() {
        // Utility class
    }

    /**
     * @throws IllegalArgumentException with the diagnostic text when the value
     *                                  cannot be written for the rate
     */
    public static String format(Object value, SignalRate rate) {
        if (rate == SignalRate.STRING) {
            if (value instanceof String s)
                return "\"" + s.replace("\"", "\\\"") + "\"";
            throw new IllegalArgumentException("String signal inputs require string values.");
        }
        if (value instanceof Boolean b)
            return b ? "1" : "0";
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger)
            return value.toString();
        if (value instanceof BigDecimal bd)
            return bd.toPlainString();
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d))
                throw new IllegalArgumentException("Non-finite number '" + value + "' is not a valid literal.");
            return BigDecimal.valueOf(d).toPlainString();
        }
        if (value instanceof String s) {
            if (SAFE_EXPRESSION.matcher(s).matches())
                return s;
            throw new IllegalArgumentException("Unsafe expression '" + s + "' blocked by compiler.");
        }
        throw new IllegalArgumentException("Unsupported literal value '" + value + "'");
    }
}
