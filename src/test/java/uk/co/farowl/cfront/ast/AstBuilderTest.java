package uk.co.farowl.cfront.ast;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.cfront.ast.AstBuilder.Subtree;
import uk.co.farowl.cfront.types.DataType;
import uk.co.farowl.cfront.types.Value;

/**
 * Test that the builder takes its operands from the stack in the right order and detects misuse
 * of the stack.
 */
@DisplayName("An AstBuilder")
class AstBuilderTest {

    AstBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new AstBuilder();
    }

    @Nested
    @DisplayName("builds")
    class Building {

        @Test
        @DisplayName("a binary node with the most recent entry on the right")
        void binaryOrder() throws ConstructionError {
            builder.pushLeaf("a");
            builder.pushLeaf("b");
            builder.pushBinary("-");
            AstNode root = builder.root();
            assertEquals("a", root.child(0).label);
            assertEquals("b", root.child(1).label);
            assertNull(root.child(2));
        }

        @Test
        @DisplayName("a unary node with its operand in slot 0")
        void unary() throws ConstructionError {
            builder.pushLeaf("x");
            builder.pushUnary("!");
            AstNode root = builder.root();
            assertEquals(1, root.arity());
            assertEquals("x", root.child(0).label);
        }

        @Test
        @DisplayName("an if without else leaving slot 2 empty")
        void ifThen() throws ConstructionError {
            builder.pushLeaf("c");
            builder.pushLeaf("t");
            builder.pushIfThen();
            AstNode root = builder.root();
            assertEquals("if", root.label);
            assertEquals("c", root.child(0).label);
            assertEquals("t", root.child(1).label);
            assertNull(root.child(2));
        }

        @Test
        @DisplayName("an if with else in slots 0 to 2")
        void ifThenElse() throws ConstructionError {
            builder.pushLeaf("c");
            builder.pushLeaf("t");
            builder.pushLeaf("e");
            builder.pushIfThenElse();
            assertEquals("( if c t e )", Serializer.preorder(builder.root()));
        }

        @Test
        @DisplayName("a for with all four slots in order")
        void forLoop() throws ConstructionError {
            for (String s : new String[] {"init", "cond", "step", "body"}) {
                builder.pushLeaf(s);
            }
            builder.pushFor();
            AstNode root = builder.root();
            assertEquals(4, root.arity());
            assertEquals("init", root.child(0).label);
            assertEquals("cond", root.child(1).label);
            assertEquals("step", root.child(2).label);
            assertEquals("body", root.child(3).label);
        }

        @Test
        @DisplayName("entries carrying type and value")
        void attributes() throws ConstructionError {
            builder.pushLeaf("2", DataType.INT, Value.of(2), null);
            builder.pushLeaf("1.5", DataType.FLOAT, Value.of(1.5f), null);
            Subtree top = builder.operand(0);
            assertEquals(DataType.FLOAT, top.type);
            assertEquals(DataType.INT, builder.operand(1).type);
            Subtree sum = builder.pushBinary("+", DataType.FLOAT, Value.of(3.5f));
            assertSame(sum, builder.operand(0));
            assertEquals(1, builder.size());
        }
    }

    @Nested
    @DisplayName("raises a ConstructionError")
    class Errors {

        @Test
        @DisplayName("on popping an empty stack")
        void underflow() {
            builder.pushLeaf("a");
            ConstructionError e =
                    assertThrows(ConstructionError.class, () -> builder.pushBinary("+"));
            assertEquals(ConstructionError.Kind.UNDERFLOW, e.kind);
        }

        @Test
        @DisplayName("on peeking below the bottom")
        void peekUnderflow() {
            builder.pushLeaf("a");
            assertThrows(ConstructionError.class, () -> builder.operand(1));
        }

        @Test
        @DisplayName("if no node remains at the end")
        void noRoot() {
            ConstructionError e = assertThrows(ConstructionError.class, () -> builder.root());
            assertEquals(ConstructionError.Kind.NOT_SINGLETON, e.kind);
        }

        @Test
        @DisplayName("if more than one node remains at the end")
        void twoRoots() {
            builder.pushLeaf("a");
            builder.pushLeaf("b");
            ConstructionError e = assertThrows(ConstructionError.class, () -> builder.root());
            assertEquals(ConstructionError.Kind.NOT_SINGLETON, e.kind);
        }
    }

    @Nested
    @DisplayName("uses a TreeStack that")
    class Stack {

        @Test
        @DisplayName("is last-in, first-out")
        void lifo() throws ConstructionError {
            TreeStack<String> stack = new TreeStack<>();
            stack.push("1");
            stack.push("2");
            stack.push("3");
            assertEquals("2", stack.peek(1));
            assertEquals("3", stack.pop());
            assertEquals("2", stack.pop());
            assertEquals(1, stack.size());
            assertEquals("1", stack.pop());
            assertTrue(stack.isEmpty());
            assertThrows(ConstructionError.class, () -> stack.pop());
        }
    }
}
