package uk.co.farowl.cfront.diag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.cfront.diag.Diagnostic.Severity;
import uk.co.farowl.cfront.types.DataType;

/**
 * The front through which the symbol table and the semantic actions report conditions in the
 * source. It remembers only the line currently being processed, and formulates each message in
 * the one place, before passing it to an {@link ErrorHandler}.
 */
public class Diagnostics {

    static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    private final ErrorHandler handler;
    private int line;

    public Diagnostics(ErrorHandler handler) {
        this.handler = handler;
    }

    /** Set the line to which subsequent reports relate. */
    public void setLine(int line) {
        this.line = line;
    }

    /** @return the line to which reports currently relate */
    public int getLine() {
        return line;
    }

    /** @return the handler receiving reports */
    public ErrorHandler getHandler() {
        return handler;
    }

    /** Report an error at the current line. */
    public void error(String format, Object... args) {
        report(Severity.ERROR, String.format(format, args));
    }

    /** Report a warning at the current line. */
    public void warning(String format, Object... args) {
        report(Severity.WARNING, String.format(format, args));
    }

    private void report(Severity severity, String message) {
        logger.atDebug().setMessage("{} at line {}: {}").addArgument(severity)
                .addArgument(line).addArgument(message).log();
        handler.report(new Diagnostic(severity, line, message));
    }

    public void undeclaredIdentifier(String name) {
        error("use of undeclared identifier '%s'", name);
    }

    public void redefinition(String name) {
        error("redefinition of '%s'", name);
    }

    public void incompleteType(DataType type) {
        error("variable has incomplete type '%s'", type);
    }

    public void notAssignable() {
        error("expression is not assignable");
    }

    public void invalidOperands(DataType left, DataType right) {
        error("invalid operands to binary expression ('%s' and '%s')", left, right);
    }

    public void implicitConversion(DataType from, DataType to) {
        warning("implicit conversion from '%s' to '%s'", from, to);
    }

    public void divisionByZero() {
        warning("division by zero is undefined");
    }

    public void remainderByZero() {
        warning("remainder by zero is undefined");
    }

    public void typeSpecifierMissing() {
        warning("type specifier missing, defaults to 'int'");
    }
}
