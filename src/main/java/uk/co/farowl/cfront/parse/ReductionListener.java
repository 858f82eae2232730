package uk.co.farowl.cfront.parse;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.cfront.event.Construct;
import uk.co.farowl.cfront.event.ReductionEvent;
import uk.co.farowl.cfront.parse.CFrontParser.AdditiveExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.AssignmentExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.BlockItemListContext;
import uk.co.farowl.cfront.parse.CFrontParser.CallStatementContext;
import uk.co.farowl.cfront.parse.CFrontParser.CompoundStatementContext;
import uk.co.farowl.cfront.parse.CFrontParser.ConditionalExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.DeclarationContext;
import uk.co.farowl.cfront.parse.CFrontParser.DeclaredNameContext;
import uk.co.farowl.cfront.parse.CFrontParser.EqualityExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.ExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.ExpressionStatementContext;
import uk.co.farowl.cfront.parse.CFrontParser.ForStatementContext;
import uk.co.farowl.cfront.parse.CFrontParser.ForUpdateContext;
import uk.co.farowl.cfront.parse.CFrontParser.FunctionDefinitionContext;
import uk.co.farowl.cfront.parse.CFrontParser.FunctionNameContext;
import uk.co.farowl.cfront.parse.CFrontParser.InitDeclaratorContext;
import uk.co.farowl.cfront.parse.CFrontParser.InitDeclaratorListContext;
import uk.co.farowl.cfront.parse.CFrontParser.LibraryContext;
import uk.co.farowl.cfront.parse.CFrontParser.MultiplicativeExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.ParameterDeclarationContext;
import uk.co.farowl.cfront.parse.CFrontParser.PostfixExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.PrimaryExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.PrintStatementContext;
import uk.co.farowl.cfront.parse.CFrontParser.RelationalExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.ReturnStatementContext;
import uk.co.farowl.cfront.parse.CFrontParser.SelectionStatementContext;
import uk.co.farowl.cfront.parse.CFrontParser.TranslationUnitContext;
import uk.co.farowl.cfront.parse.CFrontParser.TypeSpecifierContext;
import uk.co.farowl.cfront.parse.CFrontParser.UnaryExpressionContext;
import uk.co.farowl.cfront.parse.CFrontParser.WhileStatementContext;
import uk.co.farowl.cfront.types.Value;

/**
 * Listener to the parse tree that turns it into the sequence of {@link ReductionEvent}s the
 * semantic actions consume. The parse tree, and the parser itself, were generated from the grammar
 * {@code CFront.g4} by ANTLR. A walk of the tree calls the {@code exit} method of each rule after
 * those of all the rules within it, which is the order in which a bottom-up parser would reduce
 * them. Where an action must happen part way through a rule, the grammar has a sub-rule whose exit
 * marks the place ({@code declaredName} and {@code functionName}).
 */
public class ReductionListener extends CFrontBaseListener {

    static final Logger logger = LoggerFactory.getLogger(ReductionListener.class);

    /** Label of the node joining statements or external declarations in sequence. */
    public static final String STATEMENTS = "stmt";
    /** Label of the node joining expressions or declarators in sequence. */
    public static final String COMMA = ",";
    /** Label of the leaf standing for an empty statement or expression. */
    public static final String EMPTY_STATEMENT = ";";
    /** Label of the leaf standing for an empty block. */
    public static final String EMPTY_BLOCK = "{}";

    private final Consumer<ReductionEvent> sink;

    /**
     * Create a listener that sends each event to the given consumer.
     *
     * @param sink to receive events
     */
    public ReductionListener(Consumer<ReductionEvent> sink) {
        this.sink = sink;
    }

    @Override
    public void exitLibrary(LibraryContext ctx) {
        logger.atDebug().setMessage("library {}").addArgument(ctx::getText).log();
    }

    @Override
    public void exitTranslationUnit(TranslationUnitContext ctx) {
        if (ctx.translationUnit() != null) {
            emit(Construct.SEQUENCE, ctx, STATEMENTS);
        }
    }

    @Override
    public void exitFunctionName(FunctionNameContext ctx) {
        emitNamed(Construct.FUNCTION_NAME, ctx.IDENTIFIER());
    }

    @Override
    public void exitParameterDeclaration(ParameterDeclarationContext ctx) {
        emitNamed(Construct.PARAMETER, ctx.IDENTIFIER());
    }

    @Override
    public void exitFunctionDefinition(FunctionDefinitionContext ctx) {
        sink.accept(ReductionEvent.named(Construct.FUNCTION_DEFINITION, line(ctx),
                ctx.functionName().getText()));
    }

    @Override
    public void exitTypeSpecifier(TypeSpecifierContext ctx) {
        emit(Construct.TYPE_SPECIFIER, ctx, ctx.getText());
    }

    @Override
    public void exitDeclaration(DeclarationContext ctx) {
        emit(Construct.DECLARATION, ctx, null);
    }

    @Override
    public void exitInitDeclaratorList(InitDeclaratorListContext ctx) {
        if (ctx.initDeclaratorList() != null) {
            emit(Construct.SEQUENCE, ctx, COMMA);
        }
    }

    @Override
    public void exitDeclaredName(DeclaredNameContext ctx) {
        emitNamed(Construct.DECLARED_NAME, ctx.IDENTIFIER());
    }

    @Override
    public void exitInitDeclarator(InitDeclaratorContext ctx) {
        if (ctx.declaredName() != null) {
            sink.accept(ReductionEvent.named(Construct.INIT_DECLARATOR, line(ctx),
                    ctx.declaredName().getText()));
        } else {
            emitNamed(Construct.DECLARATOR, ctx.IDENTIFIER());
        }
    }

    @Override
    public void enterCompoundStatement(CompoundStatementContext ctx) {
        sink.accept(ReductionEvent.of(Construct.BLOCK_OPEN, ctx.getStart().getLine()));
    }

    @Override
    public void exitCompoundStatement(CompoundStatementContext ctx) {
        if (ctx.blockItemList() == null) {
            emit(Construct.EMPTY, ctx, EMPTY_BLOCK);
        }
        // The scope of a function body closes with the function definition.
        if (!(ctx.getParent() instanceof FunctionDefinitionContext)) {
            emit(Construct.BLOCK_CLOSE, ctx, null);
        }
    }

    @Override
    public void exitBlockItemList(BlockItemListContext ctx) {
        if (ctx.blockItemList() != null) {
            emit(Construct.SEQUENCE, ctx, STATEMENTS);
        }
    }

    @Override
    public void exitExpressionStatement(ExpressionStatementContext ctx) {
        if (ctx.expression() == null) {
            emit(Construct.EMPTY, ctx, EMPTY_STATEMENT);
        }
    }

    @Override
    public void exitSelectionStatement(SelectionStatementContext ctx) {
        emit(ctx.statement().size() > 1 ? Construct.IF_ELSE : Construct.IF, ctx, null);
    }

    @Override
    public void exitWhileStatement(WhileStatementContext ctx) {
        emit(Construct.WHILE, ctx, null);
    }

    @Override
    public void exitForUpdate(ForUpdateContext ctx) {
        if (ctx.expression() == null) {
            emit(Construct.EMPTY, ctx, EMPTY_STATEMENT);
        }
    }

    @Override
    public void exitForStatement(ForStatementContext ctx) {
        emit(Construct.FOR, ctx, null);
    }

    @Override
    public void exitReturnStatement(ReturnStatementContext ctx) {
        emit(Construct.RETURN, ctx, null);
    }

    @Override
    public void exitPrintStatement(PrintStatementContext ctx) {
        emit(ctx.assignmentExpression() == null ? Construct.PRINT : Construct.PRINT_VALUE, ctx,
                null);
    }

    @Override
    public void exitCallStatement(CallStatementContext ctx) {
        List<String> names = new ArrayList<>();
        names.add(ctx.IDENTIFIER().getText());
        if (ctx.argumentList() != null) {
            for (TerminalNode arg : ctx.argumentList().IDENTIFIER()) {
                names.add(arg.getText());
            }
        }
        sink.accept(ReductionEvent.named(Construct.CALL, line(ctx), names.toArray(new String[0])));
    }

    @Override
    public void exitExpression(ExpressionContext ctx) {
        if (ctx.expression() != null) {
            emit(Construct.SEQUENCE, ctx, COMMA);
        }
    }

    @Override
    public void exitAssignmentExpression(AssignmentExpressionContext ctx) {
        if (ctx.assignmentOperator() != null) {
            emit(Construct.ASSIGN, ctx, ctx.assignmentOperator().getText());
        }
    }

    @Override
    public void exitConditionalExpression(ConditionalExpressionContext ctx) {
        if (ctx.expression() != null) {
            emit(Construct.CONDITIONAL, ctx, null);
        }
    }

    @Override
    public void exitEqualityExpression(EqualityExpressionContext ctx) {
        emitBinary(ctx, ctx.op);
    }

    @Override
    public void exitRelationalExpression(RelationalExpressionContext ctx) {
        emitBinary(ctx, ctx.op);
    }

    @Override
    public void exitAdditiveExpression(AdditiveExpressionContext ctx) {
        emitBinary(ctx, ctx.op);
    }

    @Override
    public void exitMultiplicativeExpression(MultiplicativeExpressionContext ctx) {
        emitBinary(ctx, ctx.op);
    }

    @Override
    public void exitUnaryExpression(UnaryExpressionContext ctx) {
        if (ctx.unaryOperator() != null) {
            emit(Construct.UNARY, ctx, ctx.unaryOperator().getText());
        }
    }

    @Override
    public void exitPostfixExpression(PostfixExpressionContext ctx) {
        if (ctx.op != null) {
            emit(Construct.POSTFIX, ctx, ctx.op.getText());
        }
    }

    @Override
    public void exitPrimaryExpression(PrimaryExpressionContext ctx) {
        if (ctx.IDENTIFIER() != null) {
            emitNamed(Construct.IDENTIFIER, ctx.IDENTIFIER());
        } else if (ctx.INTEGER_LITERAL() != null) {
            emitLiteral(ctx.INTEGER_LITERAL(), intLiteral(ctx.INTEGER_LITERAL().getText()));
        } else if (ctx.FLOAT_LITERAL() != null) {
            emitLiteral(ctx.FLOAT_LITERAL(), Value.of(Float.parseFloat(ctx.getText())));
        } else if (ctx.CHARACTER_LITERAL() != null) {
            emitLiteral(ctx.CHARACTER_LITERAL(), charLiteral(ctx.getText()));
        }
        // Otherwise a parenthesised expression, already complete.
    }

    /** An integer literal, wrapped to 32 bits as a C compiler would. */
    static Value intLiteral(String text) {
        return Value.of(new BigInteger(text).intValue());
    }

    /**
     * A character literal from its source text, including the quotes.
     *
     * @param text of the literal e.g. {@code 'a'} or {@code '\n'}
     * @return the value
     */
    static Value charLiteral(String text) {
        String body = text.substring(1, text.length() - 1);
        if (body.length() == 2 && body.charAt(0) == '\\') {
            char c = switch (body.charAt(1)) {
                case 'n' -> '\n';
                case 't' -> '\t';
                case 'r' -> '\r';
                case '0' -> '\0';
                case 'a' -> '\u0007';
                case 'b' -> '\b';
                case 'f' -> '\f';
                case 'v' -> '\u000b';
                default -> body.charAt(1);
            };
            return Value.of(c);
        }
        return Value.of(body.charAt(0));
    }

    private void emitBinary(ParserRuleContext ctx, Token op) {
        if (op != null) {
            emit(Construct.BINARY, ctx, op.getText());
        }
    }

    private void emit(Construct construct, ParserRuleContext ctx, String label) {
        sink.accept(ReductionEvent.labelled(construct, line(ctx), label));
    }

    private void emitNamed(Construct construct, TerminalNode name) {
        sink.accept(
                ReductionEvent.named(construct, name.getSymbol().getLine(), name.getText()));
    }

    private void emitLiteral(TerminalNode token, Value value) {
        sink.accept(ReductionEvent.literal(token.getSymbol().getLine(), value));
    }

    /** The line on which a rule ends, which is where a bottom-up parser would reduce it. */
    private static int line(ParserRuleContext ctx) {
        Token t = ctx.getStop() != null ? ctx.getStop() : ctx.getStart();
        return t.getLine();
    }
}
