package uk.co.farowl.cfront.symbol;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.cfront.diag.DefaultErrorHandler;
import uk.co.farowl.cfront.diag.Diagnostics;
import uk.co.farowl.cfront.symbol.SymbolTable.Resolution;
import uk.co.farowl.cfront.types.DataType;
import uk.co.farowl.cfront.types.Value;

/**
 * Test the symbol table directly: look-up, declaration, shadowing and the end-of-program report.
 */
@DisplayName("A SymbolTable")
class SymbolTableTest {

    DefaultErrorHandler handler;
    SymbolTable table;

    @BeforeEach
    void setUp() {
        handler = new DefaultErrorHandler(null);
        table = new SymbolTable(new Diagnostics(handler));
    }

    /** Declare an int variable as a declaration in the source would. */
    Symbol declareInt(String name, int line, Value value) {
        Symbol found = table.resolveOrDeclare(name, line).symbol;
        Symbol s = table.declareOrNull(found, line);
        if (s != null) {
            table.typeSymbol(s, SymbolClass.IDENTIFIER, DataType.INT, value);
        }
        return s;
    }

    @Nested
    @DisplayName("when resolving a name")
    class Resolving {

        @Test
        @DisplayName("creates an untyped symbol if none is visible")
        void createsUntyped() {
            Resolution r = table.resolveOrDeclare("x", 3);
            assertFalse(r.inherited);
            assertFalse(r.symbol.isTyped());
            assertEquals(0, r.symbol.scope);
            assertEquals(3, r.symbol.line);
            assertEquals(1, table.symbols().size());
        }

        @Test
        @DisplayName("finds the same symbol again in the same scope")
        void findsAgain() {
            Symbol s = table.resolveOrDeclare("x", 1).symbol;
            Resolution r = table.resolveOrDeclare("x", 2);
            assertSame(s, r.symbol);
            assertFalse(r.inherited);
        }

        @Test
        @DisplayName("inherits a symbol from an enclosing scope")
        void inherits() {
            Symbol a = declareInt("a", 1, Value.of(5));
            table.openScope();
            table.openScope();
            Resolution r = table.resolveOrDeclare("a", 4);
            assertSame(a, r.symbol);
            assertTrue(r.inherited);
        }

        @Test
        @DisplayName("never finds a symbol of a closed scope")
        void closedScope() {
            table.openScope();
            Symbol inner = declareInt("t", 2, null);
            table.closeScope();
            assertFalse(inner.isValid());
            Resolution r = table.resolveOrDeclare("t", 4);
            assertNotSame(inner, r.symbol);
            assertFalse(r.symbol.isTyped());
            assertNull(table.resolveOrNull("nothing"));
        }
    }

    @Nested
    @DisplayName("when declaring")
    class Declaring {

        @Test
        @DisplayName("an inner declaration shadows the outer one until its scope closes")
        void shadowing() {
            Symbol outer = declareInt("a", 1, Value.of(5));
            table.openScope();
            Symbol inner = declareInt("a", 2, Value.of(6));
            assertNotSame(outer, inner);
            assertEquals(1, inner.scope);
            assertSame(inner, table.resolveOrNull("a"));

            table.closeScope();
            Resolution r = table.resolveOrDeclare("a", 3);
            assertSame(outer, r.symbol);
            assertEquals(Value.of(5), r.symbol.getValue());
            assertEquals(0, handler.getNumberOfErrors());
        }

        @Test
        @DisplayName("twice in one scope is one error and one typed symbol")
        void redefinition() {
            Symbol first = declareInt("a", 1, null);
            assertNull(declareInt("a", 2, null));
            assertEquals(1, handler.getNumberOfErrors());
            assertEquals("redefinition of 'a'", handler.getDiagnostics().get(0).message);
            assertEquals(1, table.symbols().size());
            assertSame(first, table.resolveOrNull("a"));
        }

        @Test
        @DisplayName("the first typing wins")
        void firstTypingWins() {
            Symbol s = table.resolveOrDeclare("p", 1).symbol;
            assertTrue(table.typeSymbol(s, SymbolClass.IDENTIFIER, DataType.FLOAT, null));
            assertFalse(table.typeSymbol(s, SymbolClass.PARAM, DataType.CHAR, null));
            assertEquals(DataType.FLOAT, s.getType());
            assertEquals(SymbolClass.IDENTIFIER, s.getSymbolClass());
        }
    }

    @Nested
    @DisplayName("when closing scopes")
    class Closing {

        @Test
        @DisplayName("keeps invalidated symbols for the report")
        void keepsInvalid() {
            table.openScope();
            declareInt("i", 2, Value.of(0));
            table.closeScope();
            assertEquals(0, table.depth());
            assertEquals(1, table.finish().getRows().size());
        }

        @Test
        @DisplayName("a function scope also ends the parameters")
        void functionScope() {
            Symbol p = table.resolveOrDeclare("n", 1).symbol;
            table.typeSymbol(p, SymbolClass.PARAM, DataType.INT, null);
            table.openScope();
            assertSame(p, table.resolveOrNull("n"));
            table.closeFunctionScope();
            assertFalse(p.isValid());
            assertNull(table.resolveOrNull("n"));
        }

        @Test
        @DisplayName("cannot close the file scope")
        void fileScope() {
            assertThrows(IllegalStateException.class, () -> table.closeScope());
        }
    }

    @Nested
    @DisplayName("at the end of the program")
    class Report {

        @Test
        @DisplayName("drops untyped symbols and main")
        void dropsUntypedAndMain() {
            table.resolveOrDeclare("unknown", 1);
            Symbol main = table.resolveOrDeclare("main", 2).symbol;
            table.typeSymbol(main, SymbolClass.FUNCTION, DataType.INT, null);
            Symbol f = table.resolveOrDeclare("f", 3).symbol;
            table.typeSymbol(f, SymbolClass.FUNCTION, DataType.VOID, null);
            declareInt("x", 4, Value.of(9));

            SymbolReport report = table.finish();
            List<SymbolReport.Row> rows = report.getRows();
            assertEquals(2, rows.size());
            assertEquals("function f void 0 3 -", rows.get(0).toString());
            assertEquals("identifier x int 0 4 9", rows.get(1).toString());
        }

        @Test
        @DisplayName("renders a header and one line per symbol")
        void renders() {
            declareInt("count", 1, null);
            Symbol c = table.resolveOrDeclare("c", 2).symbol;
            table.typeSymbol(c, SymbolClass.IDENTIFIER, DataType.CHAR, Value.of('z'));

            String text = table.finish().render();
            String[] lines = text.split("\\R");
            assertEquals(3, lines.length, text);
            assertThat(lines[0], startsWith("Symbol"));
            assertThat(lines[0], containsString("Line Number"));
            assertThat(lines[1], startsWith("identifier"));
            assertThat(lines[1], containsString("count"));
            assertTrue(lines[1].trim().endsWith("-"), lines[1]);
            assertTrue(lines[2].trim().endsWith("z"), lines[2]);
        }
    }
}
