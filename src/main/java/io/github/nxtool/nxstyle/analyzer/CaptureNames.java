package io.github.nxtool.nxstyle.analyzer;

/**
 * Constants for TreeSitter query capture names. These capture names are defined in the .scm query files and
 * referenced by the checkers.
 */
public final class CaptureNames {
    // Indentation anchors
    public static final String FUNCTION_BODY = "function.body";

    // Spacing anchors
    public static final String CONDITION = "condition";
    public static final String FOR_HEADER = "for.header";
    public static final String ARGUMENTS = "arguments";

    private CaptureNames() {
        // Utility class, no instantiation
    }
}
