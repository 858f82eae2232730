package uk.co.farowl.cfront.ast;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Test the text forms of a finished tree and the computation of levels.
 */
@DisplayName("The Serializer")
class SerializerTest {

    /** {@code if (a < b) x = 1; else x = 2;} */
    static AstNode ifElse() {
        return new AstNode("if", //
                new AstNode("<", new AstNode("a"), new AstNode("b")),
                new AstNode("=", new AstNode("x"), new AstNode("1")),
                new AstNode("=", new AstNode("x"), new AstNode("2")));
    }

    @Test
    @DisplayName("writes a leaf as its label alone")
    void leaf() {
        assertEquals("42", Serializer.preorder(new AstNode("42")));
    }

    @Test
    @DisplayName("writes a tree in parenthesised preorder")
    void ifElsePreorder() {
        assertEquals("( if ( < a b ) ( = x 1 ) ( = x 2 ) )", Serializer.preorder(ifElse()));
    }

    @Test
    @DisplayName("skips empty slots")
    void emptySlots() {
        AstNode n = new AstNode("for", new AstNode("i"), null, null, new AstNode("body"));
        assertEquals("( for i body )", Serializer.preorder(n));
        assertEquals(2, n.arity());
    }

    @Test
    @DisplayName("gives the same text every time")
    void idempotent() {
        AstNode root = ifElse();
        String first = Serializer.preorder(root);
        Serializer.computeDepth(root, 1);
        assertEquals(first, Serializer.preorder(root));
        assertEquals(first, root.toString());
    }

    @Test
    @DisplayName("assigns levels from the root down")
    void levels() {
        AstNode root = ifElse();
        int max = Serializer.computeDepth(root, 1);
        assertEquals(3, max);
        assertEquals(1, root.getLevel());
        assertEquals(2, root.child(2).getLevel());
        assertEquals(3, root.child(2).child(1).getLevel());

        String listing = Serializer.levels(root);
        String[] lines = listing.split("\n");
        assertEquals(10, lines.length);
        assertEquals("if [1]", lines[0]);
        assertEquals("  < [2]", lines[1]);
        assertEquals("    a [3]", lines[2]);
    }

    @Test
    @DisplayName("refuses a node with more than four children")
    void tooManyChildren() {
        AstNode x = new AstNode("x");
        assertThrows(IllegalArgumentException.class,
                () -> new AstNode("bad", x, x, x, x, x));
    }
}
