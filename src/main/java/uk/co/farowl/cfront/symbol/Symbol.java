package uk.co.farowl.cfront.symbol;

import uk.co.farowl.cfront.types.DataType;
import uk.co.farowl.cfront.types.Value;

/**
 * A record in the {@link SymbolTable}. Several records may share a name, across scopes or over
 * time: the scope depth at declaration and the validity flag decide which one a use of the name
 * refers to. A symbol is created untyped, typed at most once, invalidated when its scope closes
 * and never deleted before the final report.
 */
public class Symbol {

    /** Name as given in source. */
    public final String name;
    /** Depth of the scope in which the symbol was declared (0 is file scope). */
    public final int scope;
    /** Line at which the symbol was first seen. */
    public final int line;

    private SymbolClass symbolClass = SymbolClass.IDENTIFIER;
    private DataType type;
    private Value value;
    private boolean valid = true;

    Symbol(String name, int scope, int line) {
        this.name = name;
        this.scope = scope;
        this.line = line;
    }

    /**
     * Give this symbol its type, class and initial value, if it does not have a type already.
     * Once typed, a symbol is immutable in these respects and the call has no effect.
     *
     * @param symbolClass the role of the symbol
     * @param type the declared type
     * @param value the initial value (or {@code null})
     * @return {@code true} iff the symbol was typed by this call
     */
    boolean typeOrIgnore(SymbolClass symbolClass, DataType type, Value value) {
        if (this.type != null) {
            return false;
        }
        this.symbolClass = symbolClass;
        this.type = type;
        this.value = value;
        return true;
    }

    void invalidate() {
        valid = false;
    }

    /**
     * Record the value most recently assigned, which must already be of the symbol's type (or
     * {@code null} if not known at translation time).
     *
     * @param value to record
     */
    public void assign(Value value) {
        assert value == null || value.type() == type;
        this.value = value;
    }

    /** @return {@code true} iff the symbol has been given a type */
    public boolean isTyped() {
        return type != null;
    }

    /** @return {@code true} while the scope of the symbol is open */
    public boolean isValid() {
        return valid;
    }

    public SymbolClass getSymbolClass() {
        return symbolClass;
    }

    /** @return declared type or {@code null} if untyped */
    public DataType getType() {
        return type;
    }

    /** @return the current value or {@code null} if never assigned */
    public Value getValue() {
        return value;
    }

    /** @return {@code true} iff an assignment may target the symbol */
    public boolean isAssignable() {
        return symbolClass != SymbolClass.FUNCTION && type != null && type != DataType.VOID;
    }

    @Override
    public String toString() {
        return String.format("%s %s %s@%d=%s%s", symbolClass, type, name, scope, value,
                valid ? "" : " (invalid)");
    }
}
