package uk.co.farowl.cfront.ast;

import java.util.Objects;

/**
 * A node of the abstract syntax tree. A node has a label (an operator, literal text, an
 * identifier or a construct keyword) and four positional child slots, any of which may be empty.
 * The meaning of each slot depends on the construct:
 * <table>
 * <tr><th>slot</th><th>meaning</th></tr>
 * <tr><td>0</td><td>left operand, sole operand, condition of {@code if}, initialiser of
 * {@code for}</td></tr>
 * <tr><td>1</td><td>right operand, then-branch, condition of {@code for}</td></tr>
 * <tr><td>2</td><td>else-branch, increment of {@code for}</td></tr>
 * <tr><td>3</td><td>body of {@code for}</td></tr>
 * </table>
 * Each node is owned by exactly one parent (or is the root). The level of the node is derived and
 * recomputed by {@link Serializer#computeDepth(AstNode, int)}.
 */
public final class AstNode {

    /** The number of child slots in every node. */
    public static final int SLOTS = 4;

    public final String label;
    private final AstNode[] child = new AstNode[SLOTS];
    int level;

    /**
     * Create a node with children in the given slots, in order from slot 0. An argument may be
     * {@code null} to leave the slot empty.
     *
     * @param label of the node
     * @param children at most {@link #SLOTS} children
     * @throws IllegalArgumentException if there are too many children
     */
    public AstNode(String label, AstNode... children) throws IllegalArgumentException {
        this.label = Objects.requireNonNull(label);
        if (children.length > SLOTS) {
            throw new IllegalArgumentException(
                    String.format("node '%s' given %d children", label, children.length));
        }
        System.arraycopy(children, 0, child, 0, children.length);
    }

    /**
     * Return the child in the given slot.
     *
     * @param slot 0 to 3
     * @return the child or {@code null} if the slot is empty
     */
    public AstNode child(int slot) {
        return child[slot];
    }

    /** @return {@code true} iff any slot is occupied */
    public boolean hasChildren() {
        for (AstNode c : child) {
            if (c != null) {
                return true;
            }
        }
        return false;
    }

    /** @return the number of occupied slots */
    public int arity() {
        int n = 0;
        for (AstNode c : child) {
            if (c != null) {
                n++;
            }
        }
        return n;
    }

    /** @return the level last computed (0 if never computed) */
    public int getLevel() {
        return level;
    }

    @Override
    public String toString() {
        return Serializer.preorder(this);
    }
}
