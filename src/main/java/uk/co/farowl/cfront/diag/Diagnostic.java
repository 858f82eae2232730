package uk.co.farowl.cfront.diag;

/**
 * A message about the source being translated, tagged with the line it concerns and its
 * severity. Neither kind stops translation. The printed form is fixed, for example
 * {@code Line:3: error: use of undeclared identifier 'x'}.
 */
public class Diagnostic {

    /** How serious a {@link Diagnostic} is. */
    public enum Severity {
        /** The construct is reported and left untyped or unattached. */
        ERROR("error"),
        /** The construct is processed anyway. */
        WARNING("warning");

        /** Word used in the printed form. */
        public final String word;

        Severity(String word) {
            this.word = word;
        }
    }

    public final Severity severity;
    public final int line;
    public final String message;

    /**
     * Create a diagnostic.
     *
     * @param severity of the condition
     * @param line to which it relates
     * @param message describing the condition
     */
    public Diagnostic(Severity severity, int line, String message) {
        this.severity = severity;
        this.line = line;
        this.message = message;
    }

    /** @return {@code true} iff this is an error */
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return String.format("Line:%d: %s: %s", line, severity.word, message);
    }
}
