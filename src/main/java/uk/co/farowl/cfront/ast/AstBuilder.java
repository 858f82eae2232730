package uk.co.farowl.cfront.ast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.cfront.symbol.Symbol;
import uk.co.farowl.cfront.types.DataType;
import uk.co.farowl.cfront.types.Value;

/**
 * Builds the abstract syntax tree bottom-up, in the order a parser reduces grammar rules. Each
 * construction operation pops the operands it needs from a {@link TreeStack}, makes them the
 * children of a new node, and pushes the result. The entries on the stack are {@link Subtree}s,
 * which carry with each node the attributes computed for it: its type, its value if known at
 * translation time, and the symbol it denotes if it is a variable.
 */
public class AstBuilder {

    static final Logger logger = LoggerFactory.getLogger(AstBuilder.class);

    /** Label of {@code if} statements and conditional expressions. */
    public static final String IF = "if";
    /** Label of {@code for} statements. */
    public static final String FOR = "for";

    /** A node on the construction stack together with its attributes. */
    public static final class Subtree {

        public final AstNode node;
        /** Type of the expression or {@code null} (statements, or not known). */
        public final DataType type;
        /** Value of the expression or {@code null} if not known. */
        public final Value value;
        /** The symbol if the node denotes a variable, otherwise {@code null}. */
        public final Symbol symbol;

        Subtree(AstNode node, DataType type, Value value, Symbol symbol) {
            this.node = node;
            this.type = type;
            this.value = value;
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return String.format("%s : %s = %s", node.label, type, value);
        }
    }

    private final TreeStack<Subtree> stack = new TreeStack<>();

    /** Push a node with no children and no attributes. */
    public Subtree pushLeaf(String label) {
        return pushLeaf(label, null, null, null);
    }

    /**
     * Push a node with no children.
     *
     * @param label of the node
     * @param type of the node or {@code null}
     * @param value of the node or {@code null}
     * @param symbol denoted by the node or {@code null}
     * @return the entry pushed
     */
    public Subtree pushLeaf(String label, DataType type, Value value, Symbol symbol) {
        return push(new AstNode(label), type, value, symbol);
    }

    /** Pop one entry, and push a node having it as child 0. */
    public Subtree pushUnary(String label) throws ConstructionError {
        return pushUnary(label, null, null);
    }

    /**
     * Pop one entry, and push a node having it as child 0.
     *
     * @param label of the node
     * @param type of the node or {@code null}
     * @param value of the node or {@code null}
     * @return the entry pushed
     * @throws ConstructionError if the stack is empty
     */
    public Subtree pushUnary(String label, DataType type, Value value) throws ConstructionError {
        AstNode operand = stack.pop().node;
        return push(new AstNode(label, operand), type, value, null);
    }

    /** Pop two entries, and push a node having them as children 0 (left) and 1 (right). */
    public Subtree pushBinary(String label) throws ConstructionError {
        return pushBinary(label, null, null);
    }

    /**
     * Pop two entries, and push a node having them as children. The entry on top of the stack is
     * the right operand (child 1), and the one below it the left operand (child 0).
     *
     * @param label of the node
     * @param type of the node or {@code null}
     * @param value of the node or {@code null}
     * @return the entry pushed
     * @throws ConstructionError if the stack holds fewer than two entries
     */
    public Subtree pushBinary(String label, DataType type, Value value)
            throws ConstructionError {
        AstNode right = stack.pop().node;
        AstNode left = stack.pop().node;
        return push(new AstNode(label, left, right), type, value, null);
    }

    /**
     * Pop a then-branch and a condition, and push an {@code if} node with slot 2 empty.
     *
     * @return the entry pushed
     * @throws ConstructionError if the stack holds fewer than two entries
     */
    public Subtree pushIfThen() throws ConstructionError {
        AstNode then = stack.pop().node;
        AstNode cond = stack.pop().node;
        return push(new AstNode(IF, cond, then), null, null, null);
    }

    /** Pop else, then and condition, and push an {@code if} node. */
    public Subtree pushIfThenElse() throws ConstructionError {
        return pushIfThenElse(null, null);
    }

    /**
     * Pop else, then and condition (in that order), and push an {@code if} node with all three.
     * This serves the conditional expression too, which is why the node may have a type and
     * value.
     *
     * @param type of the node or {@code null}
     * @param value of the node or {@code null}
     * @return the entry pushed
     * @throws ConstructionError if the stack holds fewer than three entries
     */
    public Subtree pushIfThenElse(DataType type, Value value) throws ConstructionError {
        AstNode orElse = stack.pop().node;
        AstNode then = stack.pop().node;
        AstNode cond = stack.pop().node;
        return push(new AstNode(IF, cond, then, orElse), type, value, null);
    }

    /**
     * Pop body, increment, condition and initialiser (in that order), and push a {@code for} node
     * with all four.
     *
     * @return the entry pushed
     * @throws ConstructionError if the stack holds fewer than four entries
     */
    public Subtree pushFor() throws ConstructionError {
        AstNode body = stack.pop().node;
        AstNode step = stack.pop().node;
        AstNode cond = stack.pop().node;
        AstNode init = stack.pop().node;
        return push(new AstNode(FOR, init, cond, step, body), null, null, null);
    }

    /**
     * Look at an entry without removing it.
     *
     * @param k position counting from the top (0 is the top)
     * @return the entry
     * @throws ConstructionError if the stack holds fewer than {@code k+1} entries
     */
    public Subtree operand(int k) throws ConstructionError {
        return stack.peek(k);
    }

    /**
     * Remove the top entry, discarding it from the tree.
     *
     * @return the entry removed
     * @throws ConstructionError if the stack is empty
     */
    public Subtree pop() throws ConstructionError {
        return stack.pop();
    }

    /** @return the number of entries on the stack */
    public int size() {
        return stack.size();
    }

    /**
     * Return the finished tree, which must be the only entry on the stack.
     *
     * @return the root node
     * @throws ConstructionError if the stack does not hold exactly one entry
     */
    public AstNode root() throws ConstructionError {
        if (stack.size() != 1) {
            throw new ConstructionError(ConstructionError.Kind.NOT_SINGLETON,
                    String.format("%d nodes left at end of input", stack.size()));
        }
        return stack.peek(0).node;
    }

    private Subtree push(AstNode node, DataType type, Value value, Symbol symbol) {
        Subtree entry = new Subtree(node, type, value, symbol);
        stack.push(entry);
        logger.atTrace().setMessage("push {} (depth {})").addArgument(entry)
                .addArgument(stack::size).log();
        return entry;
    }
}
