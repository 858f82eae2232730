package uk.co.farowl.cfront.symbol;

/** The role a {@link Symbol} plays, shown as the first column of the symbol table report. */
public enum SymbolClass {

    IDENTIFIER("identifier"), FUNCTION("function"), PARAM("param");

    /** Tag used in the report. */
    public final String tag;

    SymbolClass(String tag) {
        this.tag = tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
