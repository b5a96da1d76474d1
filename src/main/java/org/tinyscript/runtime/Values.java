package org.tinyscript.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Helpers for the dynamically typed runtime values.
 * <p>
 * A value is one of: {@link BigInteger} (int), {@link Double} (float), {@link Boolean} (bool),
 * {@link String} (str) or an unmodifiable {@link List} of values (list). {@code null} is never a value.
 * Booleans take part in arithmetic and comparisons as the integers 0 and 1.
 */
public final class Values {

    private Values() {}

    /**
     * Returns the user-facing type name of a value.
     * @param value The value.
     * @return One of {@code int, float, bool, str, list}.
     */
    public static String typeName(Object value) {
        if (value instanceof Boolean) return "bool";
        if (value instanceof BigInteger) return "int";
        if (value instanceof Double) return "float";
        if (value instanceof String) return "str";
        if (value instanceof List) return "list";
        throw new IllegalArgumentException("Not a runtime value: " + value);
    }

    /**
     * Evaluates a value in a boolean context.
     * {@code False}, zero, the empty string and the empty list are false; everything else is true.
     * @param value The value to test.
     * @return The truth value.
     */
    public static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof BigInteger i) return i.signum() != 0;
        if (value instanceof Double d) return d != 0.0;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof List<?> l) return !l.isEmpty();
        throw new IllegalArgumentException("Not a runtime value: " + value);
    }

    /**
     * @param value The value to test.
     * @return {@code true} for ints, floats and bools.
     */
    public static boolean isNumeric(Object value) {
        return value instanceof BigInteger || value instanceof Double || value instanceof Boolean;
    }

    /**
     * @param value The value to test.
     * @return {@code true} for ints and bools.
     */
    public static boolean isIntegral(Object value) {
        return value instanceof BigInteger || value instanceof Boolean;
    }

    /**
     * Converts an int or bool to a {@link BigInteger}.
     * @param value An integral value.
     * @return The integer value.
     */
    public static BigInteger toBigInteger(Object value) {
        if (value instanceof Boolean b) return b ? BigInteger.ONE : BigInteger.ZERO;
        return (BigInteger) value;
    }

    /**
     * Converts any numeric value to a double.
     * @param value A numeric value.
     * @return The value as a double.
     */
    public static double toDouble(Object value) {
        if (value instanceof Double d) return d;
        return toBigInteger(value).doubleValue();
    }

    /**
     * Equality as used by {@code ==}: numbers by numeric value across int/float/bool,
     * strings by content, lists element-wise. Values of unrelated types are never equal.
     * @param left The left value.
     * @param right The right value.
     * @return {@code true} if equal.
     */
    public static boolean equal(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            if (isNaN(left) || isNaN(right)) return false;
            return compareNumbers(left, right) == 0;
        }
        if (left instanceof String a && right instanceof String b) {
            return a.equals(b);
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!equal(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        return false;
    }

    /**
     * Compares two numbers exactly, without rounding ints to doubles. NaN must be excluded by the caller.
     * @param left A numeric value.
     * @param right A numeric value.
     * @return A negative number, zero or a positive number.
     */
    public static int compareNumbers(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            return toBigInteger(left).compareTo(toBigInteger(right));
        }
        if (left instanceof Double a && right instanceof Double b) {
            // Adding 0.0 folds -0.0 into 0.0.
            return Double.compare(a + 0.0, b + 0.0);
        }
        if (left instanceof Double a) {
            return compareDoubleToInteger(a, toBigInteger(right));
        }
        return -compareDoubleToInteger((Double) right, toBigInteger(left));
    }

    static boolean isNaN(Object value) {
        return value instanceof Double d && d.isNaN();
    }

    private static int compareDoubleToInteger(double d, BigInteger i) {
        if (Double.isInfinite(d)) {
            return d > 0 ? 1 : -1;
        }
        return new BigDecimal(d).compareTo(new BigDecimal(i));
    }

    /**
     * Returns the textual form of a value as produced by {@code print} and {@code str}.
     * Strings are returned unquoted; strings nested in lists are quoted.
     * @param value The value.
     * @return The textual form.
     */
    public static String str(Object value) {
        if (value instanceof String s) return s;
        return repr(value);
    }

    /**
     * Returns the representation of a value: like {@link #str(Object)}, but strings are quoted.
     * @param value The value.
     * @return The representation.
     */
    public static String repr(Object value) {
        if (value instanceof Boolean b) return b ? "True" : "False";
        if (value instanceof BigInteger i) return i.toString();
        if (value instanceof Double d) return formatFloat(d);
        if (value instanceof String s) return quote(s);
        if (value instanceof List<?> l) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < l.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(repr(l.get(i)));
            }
            return sb.append(']').toString();
        }
        throw new IllegalArgumentException("Not a runtime value: " + value);
    }

    /**
     * Formats a float with the shortest digits that round-trip. Scientific notation is used
     * below 1e-4 and from 1e16 on, with a signed exponent of at least two digits ({@code 1e-05}).
     * Integral floats keep a trailing {@code .0}.
     * @param d The number.
     * @return The formatted number.
     */
    public static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0.0) return (1 / d < 0) ? "-0.0" : "0.0";

        BigDecimal shortest = shortestRoundTrip(d);
        int exponent = shortest.precision() - shortest.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = shortest.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }

        String digits = shortest.unscaledValue().abs().toString();
        StringBuilder sb = new StringBuilder();
        if (shortest.signum() < 0) sb.append('-');
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) sb.append('0');
        return sb.append(magnitude).toString();
    }

    private static BigDecimal shortestRoundTrip(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == d) {
                return candidate.stripTrailingZeros();
            }
        }
        // Seventeen significant digits always identify a double.
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    private static String quote(String s) {
        char quote = (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) ? '"' : '\'';
        StringBuilder sb = new StringBuilder().append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c == quote) sb.append('\\');
                    sb.append(c);
                }
            }
        }
        return sb.append(quote).toString();
    }
}
