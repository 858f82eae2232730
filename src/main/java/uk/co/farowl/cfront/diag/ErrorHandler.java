package uk.co.farowl.cfront.diag;

/** Error handler as accepted by the symbol table and the semantic actions. */
public interface ErrorHandler {

    /**
     * Report an error or warning.
     *
     * @param d the diagnostic
     */
    void report(Diagnostic d);

    /**
     * Return cumulative total of errors reported.
     *
     * @return cumulative total
     */
    int getNumberOfErrors();

    /**
     * Return cumulative total of warnings reported.
     *
     * @return cumulative total
     */
    int getNumberOfWarnings();
}
