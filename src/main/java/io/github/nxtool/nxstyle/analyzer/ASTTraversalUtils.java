package io.github.nxtool.nxstyle.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSTreeCursor;

/**
 * Utility class for the AST traversal and position helpers shared by the checkers. Statement handlers navigate by field
 * and sibling; the cursor based walk here serves the generic, grammar agnostic passes.
 */
public class ASTTraversalUtils {
    private static final Logger logger = LogManager.getLogger(ASTTraversalUtils.class);

    /** Visitor for {@link #walkTree(TSNode, NodeVisitor)}; {@code depth} is 0 for the start node. */
    @FunctionalInterface
    public interface NodeVisitor {
        /** @return false to skip the children of {@code node} */
        boolean visit(TSNode node, int depth);
    }

    /** True when the node exists; tree-sitter returns null nodes instead of Java nulls for absent fields. */
    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** Depth-first, pre-order walk over every node (named or not) below and including {@code start}. */
    public static void walkTree(TSNode start, NodeVisitor visitor) {
        if (!isPresent(start)) {
            return;
        }

        var cursor = new TSTreeCursor(start);
        int depth = 0;
        boolean visitedChildren = false;

        while (true) {
            if (!visitedChildren) {
                boolean descend = visitor.visit(cursor.currentNode(), depth);
                if (descend && cursor.gotoFirstChild()) {
                    depth++;
                } else {
                    visitedChildren = true;
                }
            } else if (depth > 0 && cursor.gotoNextSibling()) {
                visitedChildren = false;
            } else if (depth > 0 && cursor.gotoParent()) {
                depth--;
            } else {
                break;
            }
        }
    }

    /**
     * Finds the outermost nodes below {@code root} (excluding {@code root} itself) matching the predicate. Matches nested
     * in an earlier match are not reported.
     */
    public static List<TSNode> findOutermostDescendants(TSNode root, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        walkTree(root, (node, depth) -> {
            if (depth > 0 && predicate.test(node)) {
                results.add(node);
                return false;
            }
            return true;
        });
        return results;
    }

    /** Children of {@code node} from index {@code from} (inclusive), counting anonymous tokens. */
    public static List<TSNode> childrenFrom(TSNode node, int from) {
        var children = new ArrayList<TSNode>();
        for (int i = Math.max(0, from); i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    public static List<TSNode> namedChildren(TSNode node) {
        var children = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    /** First direct child with the given type, or null. */
    public static @Nullable TSNode firstChildOfType(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child) && type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** Last direct child with the given type, or null. */
    public static @Nullable TSNode lastChildOfType(TSNode node, String type) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            var child = node.getChild(i);
            if (isPresent(child) && type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** Field child, or null when the grammar position is empty. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** Previous sibling including anonymous tokens, or null. */
    public static @Nullable TSNode previousSibling(TSNode node) {
        var sibling = node.getPrevSibling();
        return isPresent(sibling) ? sibling : null;
    }

    /** Nodes inserted by error recovery occupy no source text and carry no position worth checking. */
    public static boolean isZeroWidth(TSNode node) {
        return node.getStartByte() == node.getEndByte();
    }

    public static int startRow(TSNode node) {
        return node.getStartPoint().getRow();
    }

    public static int startColumn(TSNode node) {
        return node.getStartPoint().getColumn();
    }

    public static int endRow(TSNode node) {
        return node.getEndPoint().getRow();
    }

    public static int endColumn(TSNode node) {
        return node.getEndPoint().getColumn();
    }

    /** Logs tree-sitter error recovery in the subtree; checks still run over the recovered tree. */
    public static void logSyntaxErrors(TSNode root, Object source) {
        if (!root.hasError()) {
            return;
        }
        walkTree(root, (node, depth) -> {
            if ("ERROR".equals(node.getType())) {
                logger.warn(
                        "Syntax error in {} at {}:{}",
                        source,
                        startRow(node) + 1,
                        startColumn(node));
                return false;
            }
            return node.hasError();
        });
    }
}
