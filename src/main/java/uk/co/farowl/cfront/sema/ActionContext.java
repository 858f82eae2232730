package uk.co.farowl.cfront.sema;

import uk.co.farowl.cfront.ast.AstBuilder;
import uk.co.farowl.cfront.diag.Diagnostics;
import uk.co.farowl.cfront.diag.ErrorHandler;
import uk.co.farowl.cfront.symbol.Symbol;
import uk.co.farowl.cfront.symbol.SymbolTable;
import uk.co.farowl.cfront.types.DataType;

/**
 * The state shared by the semantic actions during one translation, passed explicitly to each of
 * them. Besides the symbol table and the tree under construction, it remembers the type specifier
 * in force for the declaration being processed, and the function whose definition is open.
 */
final class ActionContext {

    final Diagnostics diagnostics;
    final SymbolTable symbols;
    final AstBuilder builder = new AstBuilder();

    /** Type specifier of the current declaration, or {@code null} between declarations. */
    DataType declaredType;

    /** The function being defined, or {@code null} outside a function definition. */
    Symbol function;

    /** The function being defined had no type specifier and was made {@code int}. */
    boolean functionTypeDefaulted;

    ActionContext(ErrorHandler errorHandler) {
        this.diagnostics = new Diagnostics(errorHandler);
        this.symbols = new SymbolTable(diagnostics);
    }

    /** Forget the type specifier and function once a declaration or definition is complete. */
    void endDeclaration() {
        declaredType = null;
    }

    void endFunction() {
        declaredType = null;
        function = null;
        functionTypeDefaulted = false;
    }
}
