package uk.co.farowl.cfront.types;

import java.util.Locale;

/**
 * A value known at translation time: the value of a literal, or one computed from literals and
 * the recorded values of variables. Each value carries its {@link DataType} explicitly. Where a
 * value cannot be known (never assigned, or computed from something unknown) the code uses
 * {@code null} in place of a {@code Value}.
 */
public abstract sealed class Value permits Value.IntValue, Value.FloatValue, Value.CharValue {

    /** The sentinel value that stands in for the result of a division by zero. */
    public static final IntValue DIVISION_BY_ZERO = new IntValue(Integer.MAX_VALUE);

    private Value() {}

    public static IntValue of(int v) {
        return new IntValue(v);
    }

    public static FloatValue of(float v) {
        return new FloatValue(v);
    }

    public static CharValue of(char v) {
        return new CharValue(v);
    }

    /** @return the type of this value */
    public abstract DataType type();

    /** @return the value as an {@code int}, truncating a {@code float} as C does */
    public abstract int asInt();

    /** @return the value as a {@code double} */
    public abstract double asDouble();

    /** @return {@code true} iff the value compares equal to zero */
    public boolean isZero() {
        return asDouble() == 0.0;
    }

    /**
     * Return a value of the target type equivalent (as far as possible) to this one, in the way
     * an implicit conversion in C would.
     *
     * @param target type of the result
     * @return converted value (or {@code this} if already of the target type)
     * @throws IllegalArgumentException if the target is {@code void}
     */
    public Value convertTo(DataType target) throws IllegalArgumentException {
        if (target == type()) {
            return this;
        }
        return switch (target) {
            case INT -> new IntValue(asInt());
            case FLOAT -> new FloatValue((float) asDouble());
            case CHAR -> new CharValue((char) asInt());
            default -> throw new IllegalArgumentException("no value of type " + target);
        };
    }

    /**
     * Format the value as C {@code printf} would with the conversion appropriate to its type:
     * {@code %d}, {@code %f} or {@code %c}.
     */
    @Override
    public abstract String toString();

    /** An {@code int} value. */
    public static final class IntValue extends Value {

        public final int value;

        IntValue(int value) {
            this.value = value;
        }

        @Override
        public DataType type() {
            return DataType.INT;
        }

        @Override
        public int asInt() {
            return value;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntValue other && other.value == value;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(value);
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    /** A {@code float} value. */
    public static final class FloatValue extends Value {

        public final float value;

        FloatValue(float value) {
            this.value = value;
        }

        @Override
        public DataType type() {
            return DataType.FLOAT;
        }

        @Override
        public int asInt() {
            return (int) value;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof FloatValue other
                    && Float.floatToIntBits(other.value) == Float.floatToIntBits(value);
        }

        @Override
        public int hashCode() {
            return Float.hashCode(value);
        }

        @Override
        public String toString() {
            return String.format(Locale.ROOT, "%f", value);
        }
    }

    /** A {@code char} value. */
    public static final class CharValue extends Value {

        public final char value;

        CharValue(char value) {
            this.value = value;
        }

        @Override
        public DataType type() {
            return DataType.CHAR;
        }

        @Override
        public int asInt() {
            return value;
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof CharValue other && other.value == value;
        }

        @Override
        public int hashCode() {
            return Character.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
}
