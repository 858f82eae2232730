package uk.co.farowl.cfront.ast;

/**
 * Thrown when the construction of the tree cannot continue because an invariant of the builder
 * is broken, for example when a construct asks for more operands than the stack holds. This
 * means the stream of events does not describe a well-formed program: it is not an error in the
 * source of the kind reported through diagnostics.
 */
public class ConstructionError extends Exception {

    private static final long serialVersionUID = 1L;

    /** The invariant broken. */
    public enum Kind {
        /** Pop or peek beyond the bottom of the stack. */
        UNDERFLOW,
        /** Other than one node left at the end. */
        NOT_SINGLETON,
        /** Block close without a matching open. */
        SCOPE_UNDERFLOW
    }

    public final Kind kind;

    public ConstructionError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    @Override
    public String toString() {
        return String.format("%s: %s", kind, getMessage());
    }
}
