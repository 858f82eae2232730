package uk.co.farowl.cfront.symbol;

import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.stringtemplate.v4.ST;
import org.stringtemplate.v4.STGroup;
import org.stringtemplate.v4.STGroupFile;
import org.stringtemplate.v4.StringRenderer;

import uk.co.farowl.cfront.types.Value;

/**
 * The end-of-program listing of the symbol table: one row per surviving {@link Symbol}, in order
 * of declaration. The text is produced by the template {@code report} in the group file
 * {@code SymbolReport.stg}, a resource alongside this class.
 */
public class SymbolReport {

    /** Shown where a symbol has no value. */
    public static final String UNSET = "-";

    /** One line of the report, as the template sees it. */
    public static final class Row {

        public final String kind;
        public final String name;
        public final String type;
        public final String scope;
        public final String line;
        public final String value;

        Row(Symbol s) {
            this.kind = s.getSymbolClass().tag;
            this.name = s.name;
            this.type = s.getType().keyword;
            this.scope = Integer.toString(s.scope);
            this.line = Integer.toString(s.line);
            Value v = s.getValue();
            this.value = v == null ? UNSET : v.toString();
        }

        @Override
        public String toString() {
            return String.join(" ", kind, name, type, scope, line, value);
        }
    }

    private final List<Symbol> symbols;
    private final List<Row> rows = new ArrayList<>();

    SymbolReport(List<Symbol> symbols) {
        this.symbols = Collections.unmodifiableList(symbols);
        for (Symbol s : symbols) {
            rows.add(new Row(s));
        }
    }

    /** @return the symbols reported, in order of declaration */
    public List<Symbol> getSymbols() {
        return symbols;
    }

    /** @return the rows of the report, in order of declaration */
    public List<Row> getRows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Return the row for the last symbol reported with the given name (the innermost
     * declaration, where several share it), or {@code null} if there is none.
     *
     * @param name to find
     * @return row or {@code null}
     */
    public Row rowOrNull(String name) {
        Row found = null;
        for (Row r : rows) {
            if (r.name.equals(name)) {
                found = r;
            }
        }
        return found;
    }

    /** @return the report as text, a header line and one line per row */
    public String render() {
        URL url = SymbolReport.class.getResource("SymbolReport.stg");
        if (url == null) {
            throw new IllegalStateException("'SymbolReport.stg' is not on the class path");
        }
        STGroup stg = new STGroupFile(url, "UTF-8", '<', '>');
        stg.registerRenderer(String.class, new StringRenderer());
        ST st = stg.getInstanceOf("report");
        st.add("rows", rows);
        return st.render(Locale.ROOT);
    }

    @Override
    public String toString() {
        return render();
    }
}
