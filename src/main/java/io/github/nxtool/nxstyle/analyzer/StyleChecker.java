package io.github.nxtool.nxstyle.analyzer;

import java.io.PrintWriter;
import java.nio.file.Path;

/**
 * A style checker for one kind of file. An instance covers exactly one file: it is created for that file, checked, and
 * discarded. Implementations share helpers by composition, not by inheriting state.
 */
public interface StyleChecker {

    /** The file this checker was created for. */
    Path file();

    /**
     * Runs every rule over the file. Findings are streamed to the reporter the checker was created with as they are
     * produced, and returned in the same order.
     */
    CheckResult check();

    /** Prints the syntax tree the checker works on, if it has one. */
    default void dumpTree(PrintWriter out) {}
}
