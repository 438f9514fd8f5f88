package io.github.nxtool.nxstyle.analyzer;

import java.nio.file.Path;
import java.util.List;

/** Result of checking one file, containing the style findings in the order they were reported. */
public record CheckResult(List<StyleDiagnostic> diagnostics) {

    public CheckResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static CheckResult empty() {
        return new CheckResult(List.of());
    }

    /** Returns true if there are any ERROR level diagnostics. */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == StyleDiagnostic.Severity.ERROR);
    }

    /** Returns only the ERROR level diagnostics. */
    public List<StyleDiagnostic> getErrors() {
        return diagnostics.stream()
                .filter(d -> d.severity() == StyleDiagnostic.Severity.ERROR)
                .toList();
    }

    /** Returns the diagnostics carrying the given message. */
    public List<StyleDiagnostic> withMessage(String message) {
        return diagnostics.stream().filter(d -> d.message().equals(message)).toList();
    }

    /**
     * A single style finding.
     *
     * @param file resolved absolute path of the checked file
     * @param line 1-based line
     * @param column 0-based column
     */
    public record StyleDiagnostic(Path file, int line, int column, Severity severity, String message) {

        public enum Severity {
            ERROR,
            WARNING,
            INFO,
            /** Suppresses the finding entirely. */
            OFF
        }

        /** Renders {@code <path>:<line>:<column>: [<SEVERITY>] <message>}. */
        public String format() {
            return file + ":" + line + ":" + column + ": [" + severity + "] " + message;
        }

        @Override
        public String toString() {
            return format();
        }
    }
}
