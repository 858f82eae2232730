package uk.co.farowl.cfront.types;

/**
 * Constant arithmetic on translation-time {@link Value}s, following the usual arithmetic
 * conversions of C in simplified form: if either operand is {@code float} the arithmetic is done
 * in {@code float}, otherwise in {@code int} (a {@code char} promotes to {@code int}). Comparisons
 * and logical negation produce {@code int} 0 or 1. Any unknown ({@code null}) operand makes the
 * result unknown.
 * <p>
 * The caller is responsible for the checks that produce diagnostics: a zero divisor and a
 * {@code float} operand to {@code %} are not handled here.
 */
public final class Operators {

    private Operators() {} // no instances

    /**
     * The type of the result of a binary operation.
     *
     * @param op operator symbol
     * @param left type of the left operand (or {@code null})
     * @param right type of the right operand (or {@code null})
     * @return type of the result (or {@code null} if unknown)
     */
    public static DataType binaryType(String op, DataType left, DataType right) {
        if (isComparison(op) || op.equals("%")) {
            return DataType.INT;
        }
        return DataType.promote(left, right);
    }

    /**
     * The value of a binary operation, if it can be known.
     *
     * @param op operator symbol
     * @param left operand (or {@code null})
     * @param right operand (or {@code null})
     * @return the value or {@code null} if unknown
     * @throws IllegalArgumentException if the operator is not one we know
     */
    public static Value binary(String op, Value left, Value right)
            throws IllegalArgumentException {
        if (left == null || right == null) {
            return null;
        }

        if (isComparison(op)) {
            double a = left.asDouble(), b = right.asDouble();
            boolean r = switch (op) {
                case "==" -> a == b;
                case "!=" -> a != b;
                case "<" -> a < b;
                case ">" -> a > b;
                case "<=" -> a <= b;
                default -> a >= b;
            };
            return Value.of(r ? 1 : 0);

        } else if (DataType.promote(left.type(), right.type()) == DataType.FLOAT) {
            float a = (float) left.asDouble(), b = (float) right.asDouble();
            return switch (op) {
                case "+" -> Value.of(a + b);
                case "-" -> Value.of(a - b);
                case "*" -> Value.of(a * b);
                case "/" -> Value.of(a / b);
                default -> throw unknownOperator(op);
            };

        } else {
            int a = left.asInt(), b = right.asInt();
            return switch (op) {
                case "+" -> Value.of(a + b);
                case "-" -> Value.of(a - b);
                case "*" -> Value.of(a * b);
                case "/" -> Value.of(a / b);
                case "%" -> Value.of(a % b);
                default -> throw unknownOperator(op);
            };
        }
    }

    /**
     * The type of the result of a unary (prefix or postfix) operation.
     *
     * @param op operator symbol
     * @param operand type of the operand (or {@code null})
     * @return type of the result (or {@code null} if unknown)
     */
    public static DataType unaryType(String op, DataType operand) {
        switch (op) {
            case "!":
            case "~":
                return DataType.INT;
            case "+":
            case "-":
                return operand == DataType.CHAR ? DataType.INT : operand;
            default:
                return operand;
        }
    }

    /**
     * The value of a prefix operation, if it can be known. Increment and decrement give the
     * updated value.
     *
     * @param op operator symbol
     * @param v operand (or {@code null})
     * @return the value or {@code null} if unknown
     * @throws IllegalArgumentException if the operator is not one we know
     */
    public static Value unary(String op, Value v) throws IllegalArgumentException {
        if (v == null) {
            return null;
        }
        boolean isFloat = v.type() == DataType.FLOAT;
        return switch (op) {
            case "+" -> isFloat ? v : Value.of(v.asInt());
            case "-" -> isFloat ? Value.of(-(float) v.asDouble()) : Value.of(-v.asInt());
            case "!" -> Value.of(v.isZero() ? 1 : 0);
            case "~" -> Value.of(~v.asInt());
            case "++" -> step(v, 1);
            case "--" -> step(v, -1);
            default -> throw unknownOperator(op);
        };
    }

    /** Add a small integer to a value, preserving its type. */
    private static Value step(Value v, int delta) {
        return switch (v.type()) {
            case FLOAT -> Value.of((float) v.asDouble() + delta);
            case CHAR -> Value.of((char) (v.asInt() + delta));
            default -> Value.of(v.asInt() + delta);
        };
    }

    /** @return {@code true} iff the operator is one of the six comparisons */
    public static boolean isComparison(String op) {
        switch (op) {
            case "==":
            case "!=":
            case "<":
            case ">":
            case "<=":
            case ">=":
                return true;
            default:
                return false;
        }
    }

    private static IllegalArgumentException unknownOperator(String op) {
        return new IllegalArgumentException("unknown operator: " + op);
    }
}
