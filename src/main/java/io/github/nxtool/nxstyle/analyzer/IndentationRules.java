package io.github.nxtool.nxstyle.analyzer;

import static io.github.nxtool.nxstyle.analyzer.ASTTraversalUtils.*;
import static io.github.nxtool.nxstyle.analyzer.CTreeSitterNodeTypes.*;

import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Vertical layout of C statements: the column each statement starts at and where the braces of its body sit.
 *
 * <p>The expected column is passed down as an argument and derived only from the caller's own expected column. A
 * statement keyword sits at {@code indent}; the braces of its body at {@code indent + 2}; the statements inside the
 * braces at {@code indent + 4}. Nodes that are not statements recurse at {@code indent + 2} without asserting their
 * own column.
 */
public final class IndentationRules {
    private static final Logger logger = LogManager.getLogger(IndentationRules.class);

    /** Offset from a statement keyword to its braces, and from braces to the enclosed statements. */
    static final int STEP = 2;

    private final FindingCollector findings;

    IndentationRules(FindingCollector findings) {
        this.findings = findings;
    }

    /** Checks {@code node} and everything below it, given the column {@code node} must start at. */
    public void checkIndents(int indent, TSNode node) {
        if (!isPresent(node)) {
            return;
        }

        switch (NodeKind.of(node)) {
            case IF -> {
                checkIfStatement(indent, node);
                assertColumn(node, indent);
            }
            case FOR -> {
                checkForStatement(indent, node);
                assertColumn(node, indent);
            }
            case WHILE, DO -> {
                checkWhileStatement(indent, node);
                assertColumn(node, indent);
            }
            case SWITCH -> {
                checkSwitchStatement(indent, node);
                assertColumn(node, indent);
            }
            case RETURN, EXPRESSION, DECLARATION, BREAK -> {
                for (var child : namedChildren(node)) {
                    checkIndents(indent + STEP, child);
                }
                assertColumn(node, indent);
            }
            default -> logger.trace("Skipping {} at {}:{}", node.getType(), startRow(node) + 1, startColumn(node));
        }
    }

    void checkIfStatement(int indent, TSNode node) {
        var consequence = field(node, FIELD_CONSEQUENCE);
        if (consequence != null) {
            checkBody(indent, consequence);
        }

        var alternative = field(node, FIELD_ALTERNATIVE);
        if (alternative == null) {
            return;
        }

        // Newer grammars wrap the else branch in an else_clause; older ones put the statement in the field directly
        @Nullable TSNode elseKeyword;
        @Nullable TSNode elseBody;
        if (ELSE_CLAUSE.equals(alternative.getType())) {
            elseKeyword = firstChildOfType(alternative, ELSE_KEYWORD);
            var named = namedChildren(alternative);
            elseBody = named.isEmpty() ? null : named.get(named.size() - 1);
        } else {
            elseKeyword = previousSibling(alternative);
            elseBody = alternative;
        }

        if (elseKeyword != null && ELSE_KEYWORD.equals(elseKeyword.getType())) {
            assertColumn(elseKeyword, indent);
        }
        if (elseBody == null) {
            return;
        }

        switch (NodeKind.of(elseBody)) {
            // else if: chained, so the nested if keeps our column and sits on the else row
            case IF -> checkIfStatement(indent, elseBody);
            case COMPOUND -> checkBlock(indent, elseBody, child -> checkIndents(indent + 2 * STEP, child));
            default -> checkIndents(indent, elseBody);
        }
    }

    void checkForStatement(int indent, TSNode node) {
        var body = field(node, FIELD_BODY);
        if (body != null) {
            checkBody(indent, body);
        }
    }

    void checkWhileStatement(int indent, TSNode node) {
        var body = field(node, FIELD_BODY);
        if (body != null) {
            checkBody(indent, body);
        }
    }

    void checkSwitchStatement(int indent, TSNode node) {
        var body = field(node, FIELD_BODY);
        if (body == null || NodeKind.of(body) != NodeKind.COMPOUND) {
            return;
        }
        checkBlock(indent, body, child -> {
            if (NodeKind.of(child) == NodeKind.CASE) {
                checkCaseStatement(indent + 2 * STEP, child);
            }
        });
    }

    void checkCaseStatement(int indent, TSNode node) {
        assertColumn(node, indent);
        checkLabelSpacing(node);

        var rest = childrenFrom(node, labelLength(node));
        if (rest.size() == 1 && NodeKind.of(rest.get(0)) == NodeKind.COMPOUND) {
            checkBlock(indent, rest.get(0), child -> checkIndents(indent + 2 * STEP, child));
            return;
        }

        // Without braces the case body is one step deeper than the label
        for (var child : rest) {
            checkIndents(indent + STEP, child);
        }
    }

    /** {@code case value:} has one space after {@code case} and none before the colon; {@code default:} has none. */
    private void checkLabelSpacing(TSNode node) {
        var keyword = node.getChildCount() > 0 ? node.getChild(0) : null;
        var colon = labelColon(node);
        if (!isPresent(keyword) || colon == null || isZeroWidth(colon)) {
            return;
        }

        if (CASE_KEYWORD.equals(keyword.getType())) {
            var value = field(node, FIELD_VALUE);
            if (value == null) {
                return;
            }
            findings.check(!gapIs(keyword, value, 1), StyleRule.CASE_LABEL_SPACE, value.getEndPoint());
            findings.check(!gapIs(value, colon, 0), StyleRule.CASE_LABEL_SPACE, colon.getEndPoint());
        } else {
            findings.check(!gapIs(keyword, colon, 0), StyleRule.CASE_LABEL_SPACE, colon.getEndPoint());
        }
    }

    private static boolean gapIs(TSNode left, TSNode right, int columns) {
        return endRow(left) == startRow(right) && startColumn(right) - endColumn(left) == columns;
    }

    private static @Nullable TSNode labelColon(TSNode caseStatement) {
        for (int i = 0; i < caseStatement.getChildCount(); i++) {
            var child = caseStatement.getChild(i);
            if (isPresent(child) && COLON.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Number of leading children forming the label: {@code case value :} is 3, {@code default :} is 2. The colon is
     * located explicitly so labels with unusual value shapes still split correctly.
     */
    static int labelLength(TSNode caseStatement) {
        for (int i = 0; i < caseStatement.getChildCount(); i++) {
            var child = caseStatement.getChild(i);
            if (isPresent(child) && COLON.equals(child.getType())) {
                return i + 1;
            }
        }
        var first = caseStatement.getChildCount() > 0 ? caseStatement.getChild(0) : null;
        return isPresent(first) && DEFAULT_KEYWORD.equals(first.getType()) ? 2 : 3;
    }

    /** Body of a keyword statement: a braced block, an empty statement, or a single unbraced statement. */
    private void checkBody(int indent, TSNode body) {
        if (NodeKind.of(body) == NodeKind.COMPOUND) {
            checkBlock(indent, body, child -> checkIndents(indent + 2 * STEP, child));
        } else if (NodeKind.of(body) == NodeKind.EXPRESSION && body.getNamedChildCount() == 0) {
            var previous = previousSibling(body);
            findings.check(
                    previous != null && endRow(previous) != startRow(body), StyleRule.EMPTY_BODY, body.getStartPoint());
        } else {
            for (var child : namedChildren(body)) {
                checkIndents(indent + 2 * STEP, child);
            }
        }
    }

    /**
     * Braces on their own rows at {@code indent + 2}, children handed to {@code childCheck}. A brace sharing a row with
     * the preceding token is reported once; its column is not checked on top of that.
     */
    private void checkBlock(int indent, TSNode block, Consumer<TSNode> childCheck) {
        var open = block.getChildCount() > 0 ? block.getChild(0) : null;
        if (isPresent(open) && LEFT_BRACE.equals(open.getType()) && !isZeroWidth(open)) {
            checkBraceRow(indent, open, StyleRule.LEFT_BRACKET, previousSibling(block));
        }

        for (var child : namedChildren(block)) {
            childCheck.accept(child);
        }

        var close = lastChildOfType(block, RIGHT_BRACE);
        if (close != null && !isZeroWidth(close)) {
            checkBraceRow(indent, close, StyleRule.RIGHT_BRACKET, previousSibling(close));
        }
    }

    private void checkBraceRow(int indent, TSNode brace, StyleRule rule, @Nullable TSNode preceding) {
        if (preceding != null && endRow(preceding) == startRow(brace)) {
            findings.add(rule, brace.getStartPoint());
            return;
        }
        assertColumn(brace, indent + STEP);
    }

    private void assertColumn(TSNode node, int expected) {
        findings.check(startColumn(node) != expected, StyleRule.INDENTATION, node.getStartPoint());
    }
}
