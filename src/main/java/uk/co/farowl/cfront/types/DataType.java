package uk.co.farowl.cfront.types;

/**
 * The declared kinds of data in the toy language. A symbol that has not (yet) been given one of
 * these is <i>untyped</i>, which we represent by {@code null} wherever a {@code DataType} is
 * expected.
 */
public enum DataType {

    INT("int"), FLOAT("float"), CHAR("char"), VOID("void");

    /** The keyword, as written in source and in messages. */
    public final String keyword;

    DataType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Return the {@code DataType} a type specifier keyword names.
     *
     * @param keyword as written in source
     * @return corresponding type
     * @throws IllegalArgumentException if not a type keyword
     */
    public static DataType fromKeyword(String keyword) throws IllegalArgumentException {
        for (DataType t : values()) {
            if (t.keyword.equals(keyword)) {
                return t;
            }
        }
        throw new IllegalArgumentException("not a type specifier: " + keyword);
    }

    /**
     * Whether an implicit conversion from this type to the target loses information in a way we
     * warn about. The hazardous conversions are float to int, char to float and float to char.
     *
     * @param target of the conversion
     * @return {@code true} if the conversion deserves a warning
     */
    public boolean isNarrowingTo(DataType target) {
        switch (this) {
            case FLOAT:
                return target == INT || target == CHAR;
            case CHAR:
                return target == FLOAT;
            default:
                return false;
        }
    }

    /** The type able to hold any value of either argument, where {@code null} means unknown. */
    public static DataType promote(DataType a, DataType b) {
        if (a == null || b == null) {
            return a == null ? b : a;
        } else if (a == FLOAT || b == FLOAT) {
            return FLOAT;
        } else {
            return INT;
        }
    }

    @Override
    public String toString() {
        return keyword;
    }
}
