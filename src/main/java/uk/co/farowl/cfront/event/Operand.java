package uk.co.farowl.cfront.event;

import java.util.Objects;

import uk.co.farowl.cfront.types.Value;

/**
 * A lexical operand carried by a {@link ReductionEvent}: either the name of an identifier or the
 * value of a literal.
 */
public final class Operand {

    private final String name;
    private final Value value;

    private Operand(String name, Value value) {
        this.name = name;
        this.value = value;
    }

    public static Operand identifier(String name) {
        return new Operand(Objects.requireNonNull(name), null);
    }

    public static Operand literal(Value value) {
        return new Operand(null, Objects.requireNonNull(value));
    }

    /** @return {@code true} iff this is an identifier */
    public boolean isIdentifier() {
        return name != null;
    }

    /** @return name of the identifier or {@code null} if a literal */
    public String getName() {
        return name;
    }

    /** @return value of the literal or {@code null} if an identifier */
    public Value getValue() {
        return value;
    }

    @Override
    public String toString() {
        return isIdentifier() ? name : value.type() + " " + value;
    }
}
