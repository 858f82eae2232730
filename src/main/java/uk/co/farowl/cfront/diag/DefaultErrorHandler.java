package uk.co.farowl.cfront.diag;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An error handler for use by anything that processes the source, and which counts, keeps and
 * prints the reported diagnostics. Diagnostics go to <code>System.out</code> unless another stream
 * is given, so that they interleave with the rest of the compiler's output.
 */
public class DefaultErrorHandler implements ErrorHandler {

    /** Counter of errors. */
    protected int errors;
    /** Counter of warnings. */
    protected int warnings;

    private final PrintStream out;
    private final List<Diagnostic> reported = new ArrayList<>();

    public DefaultErrorHandler() {
        this(System.out);
    }

    /**
     * Create a handler printing to the given stream, or silent if that is {@code null}.
     *
     * @param out destination of printed diagnostics (or {@code null})
     */
    public DefaultErrorHandler(PrintStream out) {
        this.out = out;
    }

    @Override
    public void report(Diagnostic d) {
        if (d.isError()) {
            errors += 1;
        } else {
            warnings += 1;
        }
        reported.add(d);
        if (out != null) {
            out.println(d);
        }
    }

    @Override
    public int getNumberOfErrors() {
        return errors;
    }

    @Override
    public int getNumberOfWarnings() {
        return warnings;
    }

    /** @return the diagnostics reported so far, in order */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(reported);
    }
}
