package uk.co.farowl.cfront.event;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import uk.co.farowl.cfront.types.Value;

/**
 * Notification that a grammar rule has been matched, in the order a bottom-up parser would reduce
 * it. It carries the kind of construct, the source line, a label (an operator or keyword) where
 * the construct needs one, and any lexical operands.
 */
public final class ReductionEvent {

    public final Construct construct;
    public final int line;
    /** Operator or keyword, or {@code null} if the construct has none. */
    public final String label;
    public final List<Operand> operands;

    public ReductionEvent(Construct construct, int line, String label, List<Operand> operands) {
        this.construct = construct;
        this.line = line;
        this.label = label;
        this.operands = Collections.unmodifiableList(operands);
    }

    /** An event with no label or operands. */
    public static ReductionEvent of(Construct construct, int line) {
        return new ReductionEvent(construct, line, null, List.of());
    }

    /** An event with a label but no operands. */
    public static ReductionEvent labelled(Construct construct, int line, String label) {
        return new ReductionEvent(construct, line, label, List.of());
    }

    /** An event with identifier operands, the first usually the one of interest. */
    public static ReductionEvent named(Construct construct, int line, String... names) {
        Operand[] ops = new Operand[names.length];
        for (int i = 0; i < names.length; i++) {
            ops[i] = Operand.identifier(names[i]);
        }
        return new ReductionEvent(construct, line, null, Arrays.asList(ops));
    }

    /** A literal event. */
    public static ReductionEvent literal(int line, Value value) {
        return new ReductionEvent(Construct.LITERAL, line, null,
                List.of(Operand.literal(value)));
    }

    /**
     * Return the name carried as the first operand.
     *
     * @return the identifier
     * @throws IllegalStateException if the first operand is missing or not an identifier
     */
    public String name() throws IllegalStateException {
        if (operands.isEmpty() || !operands.get(0).isIdentifier()) {
            throw new IllegalStateException(construct + " event carries no identifier");
        }
        return operands.get(0).getName();
    }

    /**
     * Return the value carried as the first operand.
     *
     * @return the literal value
     * @throws IllegalStateException if the first operand is missing or not a literal
     */
    public Value value() throws IllegalStateException {
        if (operands.isEmpty() || operands.get(0).isIdentifier()) {
            throw new IllegalStateException(construct + " event carries no literal");
        }
        return operands.get(0).getValue();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(line).append(':').append(construct);
        if (label != null) {
            sb.append(" '").append(label).append('\'');
        }
        if (!operands.isEmpty()) {
            sb.append(' ').append(operands);
        }
        return sb.toString();
    }
}
