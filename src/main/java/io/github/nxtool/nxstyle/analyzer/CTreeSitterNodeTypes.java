package io.github.nxtool.nxstyle.analyzer;

/** Constants for C TreeSitter node type and field names. */
public final class CTreeSitterNodeTypes {

    // ===== STATEMENTS =====
    public static final String IF_STATEMENT = "if_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String CASE_STATEMENT = "case_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String COMPOUND_STATEMENT = "compound_statement";
    public static final String ELSE_CLAUSE = "else_clause";

    // Declarations
    public static final String DECLARATION = "declaration";

    // ===== EXPRESSIONS =====
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String STRING_LITERAL = "string_literal";
    public static final String CHAR_LITERAL = "char_literal";
    public static final String SYSTEM_LIB_STRING = "system_lib_string";
    public static final String COMMENT = "comment";

    // ===== TOKENS =====
    public static final String LEFT_BRACE = "{";
    public static final String RIGHT_BRACE = "}";
    public static final String LEFT_PAREN = "(";
    public static final String RIGHT_PAREN = ")";
    public static final String COLON = ":";
    public static final String CASE_KEYWORD = "case";
    public static final String DEFAULT_KEYWORD = "default";
    public static final String ELSE_KEYWORD = "else";

    // ===== FIELDS =====
    public static final String FIELD_CONSEQUENCE = "consequence";
    public static final String FIELD_ALTERNATIVE = "alternative";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_VALUE = "value";

    private CTreeSitterNodeTypes() {}
}
