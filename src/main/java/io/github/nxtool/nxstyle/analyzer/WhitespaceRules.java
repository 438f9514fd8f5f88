package io.github.nxtool.nxstyle.analyzer;

import static io.github.nxtool.nxstyle.analyzer.ASTTraversalUtils.*;
import static io.github.nxtool.nxstyle.analyzer.CTreeSitterNodeTypes.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

/**
 * Horizontal spacing inside parentheses: controlling expressions of {@code if}, {@code while}, {@code do},
 * {@code switch}, the {@code for} header, and argument lists.
 *
 * <p>Rules run on the raw text of the parenthesized span with literal and comment contents and nested argument lists
 * collapsed, so a comma inside {@code "a,b"}, a comment or an inner call is never attributed to the outer span. Each rule reports at
 * most once per span.
 */
public final class WhitespaceRules {
    private static final Logger logger = LogManager.getLogger(WhitespaceRules.class);

    /** {@code ||}, {@code &&}, {@code <<=}, {@code >>=} and every {@code op=} form; longest alternatives first. */
    static final Pattern OPERATOR = Pattern.compile("\\|\\||&&|<<=|>>=|[-+*/%&|^=!<>]=");

    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "while", "switch", "for");

    private static final Set<String> COLLAPSED_TYPES =
            Set.of(ARGUMENT_LIST, STRING_LITERAL, CHAR_LITERAL, SYSTEM_LIB_STRING, COMMENT);

    private final SyntaxTree tree;
    private final FindingCollector findings;

    WhitespaceRules(SyntaxTree tree, FindingCollector findings) {
        this.tree = tree;
        this.findings = findings;
    }

    /** A parenthesized controlling expression; its keyword is the preceding token. */
    void checkControlExpression(TSNode parenthesized) {
        var open = firstChildOfType(parenthesized, LEFT_PAREN);
        var close = lastChildOfType(parenthesized, RIGHT_PAREN);
        if (open == null || close == null) {
            return;
        }
        checkKeywordGap(previousSibling(parenthesized), open);
        checkSpan(parenthesized, open, close);
    }

    /** The {@code (init; cond; update)} header of a for statement. */
    void checkForHeader(TSNode forStatement) {
        var open = firstChildOfType(forStatement, LEFT_PAREN);
        var close = lastChildOfType(forStatement, RIGHT_PAREN);
        if (open == null || close == null) {
            return;
        }
        checkKeywordGap(previousSibling(open), open);
        checkSpan(forStatement, open, close);
    }

    void checkArgumentList(TSNode arguments) {
        var open = firstChildOfType(arguments, LEFT_PAREN);
        var close = lastChildOfType(arguments, RIGHT_PAREN);
        if (open == null || close == null) {
            return;
        }
        checkSpan(arguments, open, close);
    }

    /** Exactly one column between the keyword and its opening parenthesis, on the same row. */
    private void checkKeywordGap(@Nullable TSNode keyword, TSNode open) {
        if (keyword == null || !CONTROL_KEYWORDS.contains(keyword.getType())) {
            return;
        }
        boolean spaced = endRow(keyword) == startRow(open) && startColumn(open) - endColumn(keyword) == 1;
        findings.check(!spaced, StyleRule.KEYWORD_SPACE, keyword.getEndPoint());
    }

    private void checkSpan(TSNode owner, TSNode open, TSNode close) {
        if (isZeroWidth(open) || isZeroWidth(close)) {
            return;
        }
        var collapsed = findOutermostDescendants(owner, n -> COLLAPSED_TYPES.contains(n.getType()));
        var text = tree.sliceCollapsing(open.getStartByte(), close.getEndByte(), collapsed);
        logger.trace("Checking span {}", text);

        TSPoint at = open.getStartPoint();
        for (var rule : violations(text)) {
            findings.add(rule, at);
        }
    }

    /**
     * Spacing rules violated by a parenthesized span, in rule order. {@code text} starts with {@code (} and ends with
     * {@code )}; literal contents must already be removed.
     */
    static List<StyleRule> violations(String text) {
        var violated = new ArrayList<StyleRule>();
        if (whitespaceAfterOpen(text)) {
            violated.add(StyleRule.LEFT_PAREN_SPACE);
        }
        if (whitespaceBeforeClose(text)) {
            violated.add(StyleRule.RIGHT_PAREN_SPACE);
        }
        if (operatorMissingSpaceBefore(text)) {
            violated.add(StyleRule.OPERATOR_SPACE_BEFORE);
        }
        if (operatorMissingSpaceAfter(text)) {
            violated.add(StyleRule.OPERATOR_SPACE_AFTER);
        }
        if (commaMissingSpaceAfter(text)) {
            violated.add(StyleRule.COMMA_SPACE);
        }
        return violated;
    }

    static boolean whitespaceAfterOpen(String text) {
        return text.length() > 1 && Character.isWhitespace(text.charAt(1));
    }

    static boolean whitespaceBeforeClose(String text) {
        return text.length() > 1 && Character.isWhitespace(text.charAt(text.length() - 2));
    }

    static boolean operatorMissingSpaceBefore(String text) {
        var m = OPERATOR.matcher(text);
        while (m.find()) {
            if (m.start() == 0 || !Character.isWhitespace(text.charAt(m.start() - 1))) {
                return true;
            }
        }
        return false;
    }

    static boolean operatorMissingSpaceAfter(String text) {
        var m = OPERATOR.matcher(text);
        while (m.find()) {
            if (m.end() >= text.length() || !Character.isWhitespace(text.charAt(m.end()))) {
                return true;
            }
        }
        return false;
    }

    static boolean commaMissingSpaceAfter(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ',' && (i + 1 >= text.length() || !Character.isWhitespace(text.charAt(i + 1)))) {
                return true;
            }
        }
        return false;
    }
}
