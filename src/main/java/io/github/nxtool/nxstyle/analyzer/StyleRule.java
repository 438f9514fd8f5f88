package io.github.nxtool.nxstyle.analyzer;

import io.github.nxtool.nxstyle.analyzer.CheckResult.StyleDiagnostic.Severity;

/** Every layout and spacing rule the C checker enforces, with its message and configuration key. */
public enum StyleRule {
    INDENTATION("indentation", "Wrong indentation"),
    LEFT_BRACKET("left-bracket", "Left bracket not on separate line"),
    RIGHT_BRACKET("right-bracket", "Right bracket not on separate line"),
    EMPTY_BODY("empty-body", "Empty body should be inline with last node"),
    KEYWORD_SPACE("keyword-space", "Missing whitespace after keyword"),
    LEFT_PAREN_SPACE("left-paren-space", "Whitespace after left parenthesis"),
    RIGHT_PAREN_SPACE("right-paren-space", "Whitespace before right parenthesis"),
    OPERATOR_SPACE_BEFORE("operator-space-before", "Missing whitespace before operator"),
    OPERATOR_SPACE_AFTER("operator-space-after", "Missing whitespace after operator"),
    COMMA_SPACE("comma-space", "Missing whitespace after comma"),
    CASE_LABEL_SPACE("case-label-space", "Missing whitespace after keyword");

    private final String key;
    private final String message;

    StyleRule(String key, String message) {
        this.key = key;
        this.message = message;
    }

    /** Suffix of the {@code severity.<key>} configuration property. */
    public String key() {
        return key;
    }

    public String message() {
        return message;
    }

    public Severity defaultSeverity() {
        return Severity.ERROR;
    }
}
