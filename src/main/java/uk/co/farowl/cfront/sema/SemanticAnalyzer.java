package uk.co.farowl.cfront.sema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.cfront.ast.AstBuilder;
import uk.co.farowl.cfront.ast.AstBuilder.Subtree;
import uk.co.farowl.cfront.ast.AstNode;
import uk.co.farowl.cfront.ast.ConstructionError;
import uk.co.farowl.cfront.diag.ErrorHandler;
import uk.co.farowl.cfront.event.Operand;
import uk.co.farowl.cfront.event.ReductionEvent;
import uk.co.farowl.cfront.event.ReductionSource;
import uk.co.farowl.cfront.symbol.Symbol;
import uk.co.farowl.cfront.symbol.SymbolClass;
import uk.co.farowl.cfront.symbol.SymbolTable;
import uk.co.farowl.cfront.symbol.SymbolTable.Resolution;
import uk.co.farowl.cfront.types.DataType;
import uk.co.farowl.cfront.types.Operators;
import uk.co.farowl.cfront.types.Value;

/**
 * The semantic actions of the front end. The analyser pulls {@link ReductionEvent}s from a
 * {@link ReductionSource} and, for each, updates the symbol table, reports any error or warning,
 * and builds the corresponding part of the tree. Errors in the source never stop the analysis:
 * the construct concerned is left untyped, or replaced by a simpler tree, so that every construct
 * still leaves exactly one entry on the construction stack.
 */
public class SemanticAnalyzer {

    static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    static final String PRINTF = "printf";
    static final String RETURN = "return";
    static final String WHILE = "while";
    /** Prefix of the label of a declarator without initialiser. */
    static final String DECLARATOR_PREFIX = "Dc ";

    private final ErrorHandler errorHandler;
    private ActionContext context;

    /**
     * Create an analyser reporting to the given handler.
     *
     * @param errorHandler to receive diagnostics
     */
    public SemanticAnalyzer(ErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
        this.context = new ActionContext(errorHandler);
    }

    /**
     * Process every event from the source and return the tree built. The symbol table of the
     * analysis remains available from {@link #getSymbolTable()}, even if this method throws.
     *
     * @param source of events
     * @return root of the tree
     * @throws ConstructionError if the events do not describe a well-formed program
     */
    public AstNode analyze(ReductionSource source) throws ConstructionError {
        ActionContext ctx = context = new ActionContext(errorHandler);
        int count = 0;
        ReductionEvent event;
        while ((event = source.nextOrNull()) != null) {
            reduce(ctx, event);
            count++;
        }
        logger.atInfo().setMessage("analysed {} events: {} errors, {} warnings")
                .addArgument(count).addArgument(errorHandler::getNumberOfErrors)
                .addArgument(errorHandler::getNumberOfWarnings).log();
        return ctx.builder.root();
    }

    /** @return the symbol table of the most recent analysis */
    public SymbolTable getSymbolTable() {
        return context.symbols;
    }

    /** @return the handler receiving diagnostics */
    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    /** Carry out the action for one event. */
    private static void reduce(ActionContext ctx, ReductionEvent e) throws ConstructionError {
        logger.atTrace().setMessage("reduce {}").addArgument(e).log();
        ctx.diagnostics.setLine(e.line);
        AstBuilder builder = ctx.builder;

        switch (e.construct) {
            case BLOCK_OPEN -> ctx.symbols.openScope();
            case BLOCK_CLOSE -> closeBlock(ctx);
            case SEQUENCE -> sequence(ctx, e.label);
            case EMPTY -> builder.pushLeaf(e.label);
            case TYPE_SPECIFIER -> ctx.declaredType = DataType.fromKeyword(e.label);
            case DECLARED_NAME -> declaredName(ctx, e);
            case INIT_DECLARATOR -> initDeclarator(ctx, e);
            case DECLARATOR -> declarator(ctx, e);
            case DECLARATION -> ctx.endDeclaration();
            case FUNCTION_NAME -> functionName(ctx, e);
            case PARAMETER -> parameter(ctx, e);
            case FUNCTION_DEFINITION -> functionDefinition(ctx, e);
            case CALL -> call(ctx, e);
            case PRINT -> builder.pushLeaf(PRINTF);
            case PRINT_VALUE -> builder.pushUnary(PRINTF);
            case RETURN -> builder.pushUnary(RETURN);
            case IF -> builder.pushIfThen();
            case IF_ELSE -> builder.pushIfThenElse();
            case WHILE -> builder.pushBinary(WHILE);
            case FOR -> builder.pushFor();
            case ASSIGN -> assign(ctx, e.label);
            case CONDITIONAL -> conditional(ctx);
            case BINARY -> binary(ctx, e.label);
            case UNARY -> unary(ctx, e.label);
            case POSTFIX -> postfix(ctx, e.label);
            case IDENTIFIER -> identifier(ctx, e);
            case LITERAL -> literal(ctx, e.value());
        }
    }

    private static void closeBlock(ActionContext ctx) throws ConstructionError {
        checkNotFileScope(ctx);
        ctx.symbols.closeScope();
    }

    private static void checkNotFileScope(ActionContext ctx) throws ConstructionError {
        if (ctx.symbols.depth() == 0) {
            throw new ConstructionError(ConstructionError.Kind.SCOPE_UNDERFLOW,
                    "block closed at file scope, line " + ctx.diagnostics.getLine());
        }
    }

    /** Two items in sequence. The pair has the type and value of the second. */
    private static void sequence(ActionContext ctx, String label) throws ConstructionError {
        Subtree second = ctx.builder.operand(0);
        ctx.builder.pushBinary(label, second.type, second.value);
    }

    // Declarations ---------------------------------------------------------------------------

    /** The type a declaration gives its declarators. */
    private static DataType declaredType(ActionContext ctx) {
        return ctx.declaredType != null ? ctx.declaredType : DataType.INT;
    }

    /**
     * Find the symbol a declaration should type, reporting if it cannot be declared.
     *
     * @return the symbol or {@code null} if the declaration is in error
     */
    private static Symbol declareOrNull(ActionContext ctx, Symbol found, int line) {
        if (declaredType(ctx) == DataType.VOID) {
            ctx.diagnostics.incompleteType(DataType.VOID);
            return null;
        }
        return ctx.symbols.declareOrNull(found, line);
    }

    /** The name in a declarator, seen before its initialiser. */
    private static void declaredName(ActionContext ctx, ReductionEvent e) {
        Symbol s = ctx.symbols.resolveOrDeclare(e.name(), e.line).symbol;
        ctx.builder.pushLeaf(e.name(), s.getType(), s.getValue(), s);
    }

    /** A declarator with initialiser: the name and the initialiser are on the stack. */
    private static void initDeclarator(ActionContext ctx, ReductionEvent e)
            throws ConstructionError {
        Subtree init = ctx.builder.operand(0);
        Subtree name = ctx.builder.operand(1);
        DataType type = declaredType(ctx);
        Value value = null;
        Symbol target = declareOrNull(ctx, name.symbol, e.line);
        if (target != null) {
            value = convertForStore(ctx, init, type);
            ctx.symbols.typeSymbol(target, SymbolClass.IDENTIFIER, type, value);
        }
        ctx.builder.pushBinary("=", type, value);
    }

    /** A declarator without initialiser. */
    private static void declarator(ActionContext ctx, ReductionEvent e) {
        String name = e.name();
        Symbol found = ctx.symbols.resolveOrDeclare(name, e.line).symbol;
        Symbol target = declareOrNull(ctx, found, e.line);
        if (target != null) {
            ctx.symbols.typeSymbol(target, SymbolClass.IDENTIFIER, declaredType(ctx), null);
        }
        ctx.builder.pushLeaf(DECLARATOR_PREFIX + name);
    }

    /** The name of a function about to be defined. */
    private static void functionName(ActionContext ctx, ReductionEvent e) {
        Symbol s = ctx.symbols.resolveOrDeclare(e.name(), e.line).symbol;
        DataType type = ctx.declaredType;
        ctx.functionTypeDefaulted = type == null;
        ctx.symbols.typeSymbol(s, SymbolClass.FUNCTION, type == null ? DataType.INT : type,
                null);
        ctx.function = s;
        ctx.endDeclaration();
    }

    private static void parameter(ActionContext ctx, ReductionEvent e) {
        Symbol s = ctx.symbols.resolveOrDeclare(e.name(), e.line).symbol;
        ctx.symbols.typeSymbol(s, SymbolClass.PARAM, declaredType(ctx), null);
        ctx.endDeclaration();
    }

    /** A function definition: the body is on the stack and its scope still open. */
    private static void functionDefinition(ActionContext ctx, ReductionEvent e)
            throws ConstructionError {
        ctx.builder.pushUnary(e.name());
        if (ctx.functionTypeDefaulted) {
            ctx.diagnostics.typeSpecifierMissing();
        }
        checkNotFileScope(ctx);
        ctx.symbols.closeFunctionScope();
        ctx.endFunction();
    }

    // Statements -----------------------------------------------------------------------------

    /** A call: the arguments are resolved but not checked, and the call is a leaf. */
    private static void call(ActionContext ctx, ReductionEvent e) {
        Symbol f = null;
        for (Operand op : e.operands) {
            Symbol s = ctx.symbols.resolveOrDeclare(op.getName(), e.line).symbol;
            if (f == null) {
                f = s;
            }
        }
        ctx.builder.pushLeaf(e.name() + "()", f == null ? null : f.getType(), null, null);
    }

    // Expressions ----------------------------------------------------------------------------

    /**
     * An assignment: the target and the value are on the stack. A compound assignment applies the
     * operator to the value the target had. The target must be a variable or parameter, and a
     * target never declared (already reported) is not assigned.
     */
    private static void assign(ActionContext ctx, String op) throws ConstructionError {
        Subtree rhs = ctx.builder.operand(0);
        Subtree lhs = ctx.builder.operand(1);
        Symbol target = lhs.symbol;
        Value stored = null;

        if (target == null || (target.isTyped() && !target.isAssignable())) {
            ctx.diagnostics.notAssignable();

        } else if (target.isTyped()) {
            DataType type = target.getType();
            if (op.equals("=")) {
                stored = convertForStore(ctx, rhs, type);
                target.assign(stored);
            } else {
                String arith = op.substring(0, op.length() - 1);
                Value result;
                if (arith.equals("%") && hasFloat(lhs, rhs)) {
                    ctx.diagnostics.invalidOperands(lhs.type, rhs.type);
                    result = target.getValue();
                } else if (isDivision(arith) && isZero(rhs.value)) {
                    reportZeroDivisor(ctx, arith);
                    result = Value.DIVISION_BY_ZERO;
                } else {
                    checkNarrowing(ctx, rhs.type, type);
                    result = Operators.binary(arith, lhs.value, rhs.value);
                }
                stored = result == null ? null : result.convertTo(type);
                target.assign(stored);
            }
        }

        ctx.builder.pushBinary(op, lhs.type, stored);
    }

    /** The conditional expression: condition, then and else are on the stack. */
    private static void conditional(ActionContext ctx) throws ConstructionError {
        Subtree orElse = ctx.builder.operand(0);
        Subtree then = ctx.builder.operand(1);
        Subtree cond = ctx.builder.operand(2);
        DataType type = DataType.promote(then.type, orElse.type);
        Value value = null;
        if (cond.value != null) {
            value = cond.value.isZero() ? orElse.value : then.value;
            if (value != null && type != null) {
                value = value.convertTo(type);
            }
        }
        ctx.builder.pushIfThenElse(type, value);
    }

    /**
     * A binary operation: both operands are on the stack. A {@code float} operand to {@code %}
     * leaves the left operand standing for the operation. A known zero divisor replaces the whole
     * operation with a leaf bearing the sentinel value.
     */
    private static void binary(ActionContext ctx, String op) throws ConstructionError {
        AstBuilder builder = ctx.builder;
        Subtree right = builder.operand(0);
        Subtree left = builder.operand(1);

        if (op.equals("%") && hasFloat(left, right)) {
            ctx.diagnostics.invalidOperands(left.type, right.type);
            builder.pop();

        } else if (isDivision(op) && isZero(right.value)) {
            reportZeroDivisor(ctx, op);
            builder.pop();
            builder.pop();
            Value v = Value.DIVISION_BY_ZERO;
            builder.pushLeaf(v.toString(), v.type(), v, null);

        } else {
            builder.pushBinary(op, Operators.binaryType(op, left.type, right.type),
                    Operators.binary(op, left.value, right.value));
        }
    }

    /** A prefix operation. Unary plus and minus are labelled to tell them from binary ones. */
    private static void unary(ActionContext ctx, String op) throws ConstructionError {
        Subtree operand = ctx.builder.operand(0);
        String label = op.equals("+") || op.equals("-") ? "'" + op + "'" : op;
        Value value = Operators.unary(op, operand.value);
        if (isStep(op)) {
            value = storeStep(operand, value);
        }
        ctx.builder.pushUnary(label, Operators.unaryType(op, operand.type), value);
    }

    /** A postfix operation, the value of which is that of the operand before the operation. */
    private static void postfix(ActionContext ctx, String op) throws ConstructionError {
        Subtree operand = ctx.builder.operand(0);
        storeStep(operand, Operators.unary(op, operand.value));
        ctx.builder.pushUnary(op, operand.type, operand.value);
    }

    private static boolean isStep(String op) {
        return op.equals("++") || op.equals("--");
    }

    /**
     * Record the result of an increment or decrement in the variable operated on, if the operand
     * is one.
     *
     * @param operand of the increment or decrement
     * @param stepped value of the operand after the operation (or {@code null})
     * @return the value as stored, or {@code stepped} if nothing is stored
     */
    private static Value storeStep(Subtree operand, Value stepped) {
        Symbol target = operand.symbol;
        if (target == null || !target.isTyped() || !target.isAssignable()) {
            return stepped;
        }
        Value stored = stepped == null ? null : stepped.convertTo(target.getType());
        target.assign(stored);
        return stored;
    }

    /** An identifier in an expression, which must have been declared here or in an outer scope. */
    private static void identifier(ActionContext ctx, ReductionEvent e) {
        String name = e.name();
        Resolution r = ctx.symbols.resolveOrDeclare(name, e.line);
        Symbol s = r.symbol;
        if (!s.isTyped() && !r.inherited) {
            ctx.diagnostics.undeclaredIdentifier(name);
        }
        ctx.builder.pushLeaf(name, s.getType(), s.getValue(), s);
    }

    private static void literal(ActionContext ctx, Value v) {
        ctx.builder.pushLeaf(v.toString(), v.type(), v, null);
    }

    // Helpers --------------------------------------------------------------------------------

    /**
     * Return the value of an expression converted for storing in a variable of the target type,
     * warning if the conversion narrows.
     */
    private static Value convertForStore(ActionContext ctx, Subtree source, DataType target) {
        checkNarrowing(ctx, source.type, target);
        return source.value == null ? null : source.value.convertTo(target);
    }

    private static void checkNarrowing(ActionContext ctx, DataType from, DataType to) {
        if (from != null && from.isNarrowingTo(to)) {
            ctx.diagnostics.implicitConversion(from, to);
        }
    }

    private static void reportZeroDivisor(ActionContext ctx, String op) {
        if (op.equals("%")) {
            ctx.diagnostics.remainderByZero();
        } else {
            ctx.diagnostics.divisionByZero();
        }
    }

    private static boolean isDivision(String op) {
        return op.equals("/") || op.equals("%");
    }

    private static boolean isZero(Value v) {
        return v != null && v.isZero();
    }

    private static boolean hasFloat(Subtree a, Subtree b) {
        return a.type == DataType.FLOAT || b.type == DataType.FLOAT;
    }
}
