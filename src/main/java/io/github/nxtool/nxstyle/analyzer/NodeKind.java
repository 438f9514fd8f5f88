package io.github.nxtool.nxstyle.analyzer;

import static io.github.nxtool.nxstyle.analyzer.CTreeSitterNodeTypes.*;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * The statement kinds the indentation checker distinguishes. The set is fixed by the C grammar; every other node type
 * maps to {@link #OTHER}.
 */
public enum NodeKind {
    IF(IF_STATEMENT),
    FOR(FOR_STATEMENT),
    WHILE(WHILE_STATEMENT),
    DO(DO_STATEMENT),
    SWITCH(SWITCH_STATEMENT),
    CASE(CASE_STATEMENT),
    RETURN(RETURN_STATEMENT),
    EXPRESSION(EXPRESSION_STATEMENT),
    DECLARATION(CTreeSitterNodeTypes.DECLARATION),
    BREAK(BREAK_STATEMENT),
    COMPOUND(COMPOUND_STATEMENT),
    OTHER(null);

    private static final Map<String, NodeKind> BY_TYPE = Arrays.stream(values())
            .filter(kind -> kind.nodeType != null)
            .collect(Collectors.toUnmodifiableMap(kind -> kind.nodeType, Function.identity()));

    private final @Nullable String nodeType;

    NodeKind(@Nullable String nodeType) {
        this.nodeType = nodeType;
    }

    public static NodeKind fromType(@Nullable String nodeType) {
        if (nodeType == null) {
            return OTHER;
        }
        return BY_TYPE.getOrDefault(nodeType, OTHER);
    }

    public static NodeKind of(@Nullable TSNode node) {
        if (!ASTTraversalUtils.isPresent(node)) {
            return OTHER;
        }
        return fromType(node.getType());
    }
}
