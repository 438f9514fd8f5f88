package io.github.nxtool.nxstyle.analyzer;

import io.github.nxtool.nxstyle.analyzer.CheckResult.StyleDiagnostic;
import io.github.nxtool.nxstyle.analyzer.CheckResult.StyleDiagnostic.Severity;
import java.io.PrintWriter;
import org.jetbrains.annotations.Nullable;

/**
 * Writes diagnostics as soon as they are produced, one formatted line each. Holds no state besides its output, so a
 * failure later in a file never hides earlier findings.
 */
public final class DiagnosticReporter {
    private final @Nullable PrintWriter out;

    public DiagnosticReporter(PrintWriter out) {
        this.out = out;
    }

    private DiagnosticReporter() {
        this.out = null;
    }

    /** A reporter that prints nothing; callers use the returned {@link CheckResult} instead. */
    public static DiagnosticReporter silent() {
        return new DiagnosticReporter();
    }

    /**
     * Prints the diagnostic unless its severity is {@link Severity#OFF}.
     *
     * @return whether the diagnostic was reported
     */
    public boolean report(StyleDiagnostic diagnostic) {
        if (diagnostic.severity() == Severity.OFF) {
            return false;
        }
        if (out != null) {
            out.println(diagnostic.format());
            out.flush();
        }
        return true;
    }
}
