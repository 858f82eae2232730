package uk.co.farowl.cfront.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.cfront.diag.Diagnostics;
import uk.co.farowl.cfront.types.DataType;
import uk.co.farowl.cfront.types.Value;

/**
 * A scope-aware symbol table for the whole of one translation. It holds every {@link Symbol}
 * created, in the order of creation, and an index of the live (valid) symbols by scope depth and
 * name. Scopes are opened and closed as blocks are entered and left: closing a scope invalidates
 * its symbols but does not remove them, so the final report shows every declaration made.
 */
public class SymbolTable {

    static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

    /** The name of the function excluded from the report. */
    public static final String MAIN = "main";

    /** The result of a look-up. */
    public static final class Resolution {

        /** The symbol found or created. */
        public final Symbol symbol;
        /** The symbol was found valid at a scope enclosing the current one. */
        public final boolean inherited;

        Resolution(Symbol symbol, boolean inherited) {
            this.symbol = symbol;
            this.inherited = inherited;
        }
    }

    private final Diagnostics diagnostics;

    /** Every symbol in order of creation. */
    private final List<Symbol> symbols = new ArrayList<>();

    /** Live symbols by name, one map per open scope, indexed by depth. */
    private final List<Map<String, Symbol>> live = new ArrayList<>();

    /**
     * Create a table at file scope (depth 0).
     *
     * @param diagnostics through which to report redefinitions
     */
    public SymbolTable(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        live.add(new HashMap<>());
    }

    /** @return the current scope depth (0 is file scope) */
    public int depth() {
        return live.size() - 1;
    }

    /** Enter a nested scope. */
    public void openScope() {
        live.add(new HashMap<>());
        logger.atTrace().setMessage("open scope {}").addArgument(this::depth).log();
    }

    /**
     * Leave the current scope, invalidating every symbol declared in it.
     *
     * @throws IllegalStateException if at file scope
     */
    public void closeScope() throws IllegalStateException {
        if (depth() == 0) {
            throw new IllegalStateException("cannot close file scope");
        }
        Map<String, Symbol> closing = live.remove(depth());
        for (Symbol s : closing.values()) {
            s.invalidate();
        }
        logger.atTrace().setMessage("closed scope {} ({} symbols)").addArgument(depth() + 1)
                .addArgument(closing.size()).log();
    }

    /**
     * Leave the scope of a function body. As well as the symbols of the body scope, the parameters
     * of the function (declared at the enclosing scope) cease to be visible.
     *
     * @throws IllegalStateException if at file scope
     */
    public void closeFunctionScope() throws IllegalStateException {
        closeScope();
        Iterator<Symbol> it = live.get(depth()).values().iterator();
        while (it.hasNext()) {
            Symbol s = it.next();
            if (s.getSymbolClass() == SymbolClass.PARAM) {
                s.invalidate();
                it.remove();
            }
        }
    }

    /**
     * Find the live symbol the name refers to at the current scope, or create an untyped one. The
     * innermost declaration visible wins. If the symbol found belongs to an enclosing scope, the
     * {@link Resolution#inherited} flag is set, and a use of an untyped symbol is not then an
     * error at this level. Symbols of scopes already closed are never found.
     *
     * @param name to resolve
     * @param line at which the name occurs (used if a symbol is created)
     * @return the symbol and how it was found
     */
    public Resolution resolveOrDeclare(String name, int line) {
        int depth = depth();
        Symbol s = live.get(depth).get(name);
        if (s != null) {
            return new Resolution(s, false);
        }
        for (int d = depth - 1; d >= 0; d--) {
            s = live.get(d).get(name);
            if (s != null) {
                return new Resolution(s, true);
            }
        }
        return new Resolution(add(name, line), false);
    }

    /**
     * Find the live symbol by name, innermost first, without creating one.
     *
     * @param name to look up
     * @return Symbol found, or {@code null} if not found
     */
    public Symbol resolveOrNull(String name) {
        for (int d = depth(); d >= 0; d--) {
            Symbol s = live.get(d).get(name);
            if (s != null) {
                return s;
            }
        }
        return null;
    }

    /**
     * Decide which symbol a declaration of a name just resolved should type. A symbol inherited
     * from an enclosing scope is shadowed by a new one in the current scope. An untyped symbol in
     * the current scope is the one to type. A symbol already typed in the current scope cannot be
     * declared again: this is reported and the method returns {@code null}.
     *
     * @param found the symbol to which the name resolved
     * @param line of the declaration
     * @return the symbol to type, or {@code null} if the declaration is a redefinition
     */
    public Symbol declareOrNull(Symbol found, int line) {
        if (found.scope < depth()) {
            return add(found.name, line);
        } else if (found.isTyped()) {
            markRedefinition(found);
            return null;
        } else {
            return found;
        }
    }

    /**
     * Report a declaration targeting a symbol that is already typed and valid.
     *
     * @param s the symbol declared previously
     */
    public void markRedefinition(Symbol s) {
        diagnostics.redefinition(s.name);
    }

    /**
     * Give a symbol its type, class and value unless it already has a type. First typing wins.
     *
     * @param s to type
     * @param symbolClass role of the symbol
     * @param type declared type
     * @param value initial value or {@code null}
     * @return {@code true} iff the symbol was typed by this call
     */
    public boolean typeSymbol(Symbol s, SymbolClass symbolClass, DataType type, Value value) {
        boolean typed = s.typeOrIgnore(symbolClass, type, value);
        if (!typed) {
            logger.atDebug().setMessage("'{}' already typed {}: ignoring {}").addArgument(s.name)
                    .addArgument(s.getType()).addArgument(type).log();
        }
        return typed;
    }

    /** @return every symbol created so far, in order of creation */
    public List<Symbol> symbols() {
        return Collections.unmodifiableList(symbols);
    }

    /**
     * Produce the end-of-program report: the symbols in order of creation, omitting those never
     * typed and the function {@code main}.
     *
     * @return the report
     */
    public SymbolReport finish() {
        List<Symbol> kept = new ArrayList<>();
        for (Symbol s : symbols) {
            if (s.isTyped() && !(s.getSymbolClass() == SymbolClass.FUNCTION
                    && MAIN.equals(s.name))) {
                kept.add(s);
            }
        }
        logger.atInfo().setMessage("symbol table: {} of {} symbols reported")
                .addArgument(kept.size()).addArgument(symbols.size()).log();
        return new SymbolReport(kept);
    }

    /** Create an untyped symbol in the current scope, replacing any live one of that name. */
    private Symbol add(String name, int line) {
        Symbol s = new Symbol(name, depth(), line);
        symbols.add(s);
        live.get(depth()).put(name, s);
        return s;
    }
}
