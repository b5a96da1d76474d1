package org.tinyscript.runtime;

import org.tinyscript.runtime.api.RuntimeErrorKind;
import org.tinyscript.runtime.api.ScriptRuntimeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implements the binary operators on runtime values.
 * Errors are thrown without a line number; the interpreter attaches the line of the operator node.
 */
public final class Operators {

    /** Largest number of characters or items a repetition may produce. */
    static final long MAX_REPEAT_LENGTH = 10_000_000L;

    private Operators() {}

    /**
     * Applies a binary operator.
     * @param operator One of {@code + - * / == != < > <= >=}.
     * @param left The already evaluated left operand.
     * @param right The already evaluated right operand.
     * @return The result value.
     * @throws ScriptRuntimeException on unsupported operand types or division by zero.
     */
    public static Object apply(String operator, Object left, Object right) {
        return switch (operator) {
            case "+" -> add(left, right);
            case "-" -> subtract(left, right);
            case "*" -> multiply(left, right);
            case "/" -> divide(left, right);
            case "==" -> Values.equal(left, right);
            case "!=" -> !Values.equal(left, right);
            case "<", ">", "<=", ">=" -> order(operator, left, right);
            default -> throw new IllegalArgumentException("Unknown operator: " + operator);
        };
    }

    private static Object add(Object left, Object right) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            if (Values.isIntegral(left) && Values.isIntegral(right)) {
                return Values.toBigInteger(left).add(Values.toBigInteger(right));
            }
            return Values.toDouble(left) + Values.toDouble(right);
        }
        if (left instanceof String a && right instanceof String b) {
            return a + b;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            List<Object> joined = new ArrayList<>(a);
            joined.addAll(b);
            return Collections.unmodifiableList(joined);
        }
        throw unsupported("+", left, right);
    }

    private static Object subtract(Object left, Object right) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            if (Values.isIntegral(left) && Values.isIntegral(right)) {
                return Values.toBigInteger(left).subtract(Values.toBigInteger(right));
            }
            return Values.toDouble(left) - Values.toDouble(right);
        }
        throw unsupported("-", left, right);
    }

    private static Object multiply(Object left, Object right) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            if (Values.isIntegral(left) && Values.isIntegral(right)) {
                return Values.toBigInteger(left).multiply(Values.toBigInteger(right));
            }
            return Values.toDouble(left) * Values.toDouble(right);
        }
        if (left instanceof String s && Values.isIntegral(right)) {
            return s.repeat(repeatCount(right, s.length(), "string"));
        }
        if (right instanceof String s && Values.isIntegral(left)) {
            return s.repeat(repeatCount(left, s.length(), "string"));
        }
        if (left instanceof List<?> l && Values.isIntegral(right)) {
            return repeat(l, repeatCount(right, l.size(), "list"));
        }
        if (right instanceof List<?> l && Values.isIntegral(left)) {
            return repeat(l, repeatCount(left, l.size(), "list"));
        }
        throw unsupported("*", left, right);
    }

    private static Object divide(Object left, Object right) {
        if (!Values.isNumeric(left) || !Values.isNumeric(right)) {
            throw unsupported("/", left, right);
        }
        if (isZero(right)) {
            throw new ScriptRuntimeException(RuntimeErrorKind.ZERO_DIVISION_ERROR, "division by zero");
        }
        if (Values.isIntegral(left) && Values.isIntegral(right)) {
            return trueDivide(Values.toBigInteger(left), Values.toBigInteger(right));
        }
        return Values.toDouble(left) / Values.toDouble(right);
    }

    private static double trueDivide(BigInteger dividend, BigInteger divisor) {
        // Doubles hold integers up to 2^53 exactly, so one IEEE division rounds correctly.
        if (dividend.bitLength() <= 53 && divisor.bitLength() <= 53) {
            return dividend.doubleValue() / divisor.doubleValue();
        }
        return new BigDecimal(dividend).divide(new BigDecimal(divisor), MathContext.DECIMAL128).doubleValue();
    }

    private static boolean order(String operator, Object left, Object right) {
        if (Values.isNumeric(left) && Values.isNumeric(right) && (Values.isNaN(left) || Values.isNaN(right))) {
            return false;
        }
        int c = compareOrdered(operator, left, right);
        return switch (operator) {
            case "<" -> c < 0;
            case ">" -> c > 0;
            case "<=" -> c <= 0;
            default -> c >= 0;
        };
    }

    private static int compareOrdered(String operator, Object left, Object right) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            return Values.compareNumbers(left, right);
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            // The first pair of unequal items decides; otherwise the shorter list is smaller.
            int shared = Math.min(a.size(), b.size());
            for (int i = 0; i < shared; i++) {
                if (!Values.equal(a.get(i), b.get(i))) {
                    return compareOrdered(operator, a.get(i), b.get(i));
                }
            }
            return Integer.compare(a.size(), b.size());
        }
        throw new ScriptRuntimeException(RuntimeErrorKind.TYPE_ERROR, String.format(
                "'%s' not supported between instances of '%s' and '%s'",
                operator, Values.typeName(left), Values.typeName(right)));
    }

    private static boolean isZero(Object value) {
        if (value instanceof Double d) return d == 0.0;
        return Values.toBigInteger(value).signum() == 0;
    }

    private static int repeatCount(Object count, int length, String kind) {
        BigInteger n = Values.toBigInteger(count);
        if (n.signum() <= 0) return 0;
        if (n.bitLength() > 31) {
            throw new ScriptRuntimeException(RuntimeErrorKind.TYPE_ERROR, "cannot fit 'int' into an index-sized integer");
        }
        if ((long) length * n.intValue() > MAX_REPEAT_LENGTH) {
            throw new ScriptRuntimeException(RuntimeErrorKind.TYPE_ERROR, "repeated " + kind + " is too long");
        }
        return n.intValue();
    }

    private static List<Object> repeat(List<?> items, int times) {
        if (items.isEmpty()) return List.of();
        List<Object> repeated = new ArrayList<>(items.size() * times);
        for (int i = 0; i < times; i++) {
            repeated.addAll(items);
        }
        return Collections.unmodifiableList(repeated);
    }

    private static ScriptRuntimeException unsupported(String operator, Object left, Object right) {
        return new ScriptRuntimeException(RuntimeErrorKind.TYPE_ERROR, String.format(
                "unsupported operand type(s) for %s: '%s' and '%s'",
                operator, Values.typeName(left), Values.typeName(right)));
    }
}
