package uk.co.farowl.cfront.ast;

/**
 * Operations on a finished tree: computing the level of every node, and flattening the tree to
 * text. The canonical text form is a fully parenthesised preorder, in which a node without
 * children is just its label, and any other node is {@code ( label child ... )} with the occupied
 * slots in slot order. For example: {@code ( if ( < a b ) ( = x 1 ) ( = x 2 ) )}.
 */
public final class Serializer {

    private Serializer() {} // no instances

    /**
     * Assign the given level to a node and one more to each of its children, recursively.
     *
     * @param node at which to start
     * @param level to assign that node
     * @return the greatest level assigned in the subtree
     */
    public static int computeDepth(AstNode node, int level) {
        node.level = level;
        int max = level;
        for (int i = 0; i < AstNode.SLOTS; i++) {
            AstNode c = node.child(i);
            if (c != null) {
                max = Math.max(max, computeDepth(c, level + 1));
            }
        }
        return max;
    }

    /**
     * Return the preorder text of the tree rooted at a node. The method does not change the tree,
     * so calling it again gives the same result.
     *
     * @param node root of the tree
     * @return the text
     */
    public static String preorder(AstNode node) {
        StringBuilder sb = new StringBuilder();
        preorder(sb, node);
        return sb.toString();
    }

    private static void preorder(StringBuilder sb, AstNode node) {
        if (!node.hasChildren()) {
            sb.append(node.label);
        } else {
            sb.append("( ").append(node.label);
            for (int i = 0; i < AstNode.SLOTS; i++) {
                AstNode c = node.child(i);
                if (c != null) {
                    sb.append(' ');
                    preorder(sb, c);
                }
            }
            sb.append(" )");
        }
    }

    /**
     * Return a listing of the tree with one node per line, indented according to its level as
     * last computed by {@link #computeDepth(AstNode, int)}.
     *
     * @param node root of the tree
     * @return the listing, each line ending in a newline
     */
    public static String levels(AstNode node) {
        StringBuilder sb = new StringBuilder();
        levels(sb, node, node.level);
        return sb.toString();
    }

    private static void levels(StringBuilder sb, AstNode node, int top) {
        for (int i = top; i < node.level; i++) {
            sb.append("  ");
        }
        sb.append(node.label).append(" [").append(node.level).append("]\n");
        for (int i = 0; i < AstNode.SLOTS; i++) {
            AstNode c = node.child(i);
            if (c != null) {
                levels(sb, c, top);
            }
        }
    }
}
