package uk.co.farowl.cfront.event;

/**
 * The kinds of {@link ReductionEvent}. Each names a grammar rule (or a step within one) whose
 * completion calls for a semantic action.
 */
public enum Construct {
    /** Entry to a block: <code>{</code>. */
    BLOCK_OPEN,
    /** Exit from a block other than a function body. */
    BLOCK_CLOSE,
    /** Two items in sequence, labelled {@code stmt} or {@code ,}. */
    SEQUENCE,
    /** A placeholder where the grammar allows nothing, labelled {@code ;} or <code>{}</code>. */
    EMPTY,
    /** A type keyword, labelled with it. */
    TYPE_SPECIFIER,
    /** The name in a declarator with an initialiser, before the initialiser. */
    DECLARED_NAME,
    /** A declarator with an initialiser, complete. */
    INIT_DECLARATOR,
    /** A declarator without an initialiser. */
    DECLARATOR,
    /** The end of a declaration. */
    DECLARATION,
    /** The name of a function being defined, before its parameters. */
    FUNCTION_NAME,
    /** A parameter of a function being defined. */
    PARAMETER,
    /** A function definition, complete. */
    FUNCTION_DEFINITION,
    /** A call statement: the function then any argument names. */
    CALL,
    /** {@code printf} of a string alone. */
    PRINT,
    /** {@code printf} of a string and one value. */
    PRINT_VALUE,
    RETURN,
    IF,
    IF_ELSE,
    WHILE,
    FOR,
    /** Assignment, labelled with the operator. */
    ASSIGN,
    /** The conditional expression {@code c ? a : b}. */
    CONDITIONAL,
    /** Binary operation, labelled with the operator. */
    BINARY,
    /** Prefix operation, labelled with the operator. */
    UNARY,
    /** Postfix increment or decrement, labelled with the operator. */
    POSTFIX,
    /** An identifier used in an expression. */
    IDENTIFIER,
    /** A literal constant. */
    LITERAL
}
