package io.github.nxtool.nxstyle.analyzer;

import io.github.nxtool.nxstyle.StyleConfig;
import io.github.nxtool.nxstyle.analyzer.CheckResult.StyleDiagnostic;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSPoint;

/** Collects the findings of one check run and streams each one to the reporter as it arrives. */
final class FindingCollector {
    private static final Logger logger = LogManager.getLogger(FindingCollector.class);

    private final Path file;
    private final StyleConfig config;
    private final DiagnosticReporter reporter;
    private final List<StyleDiagnostic> diagnostics = new ArrayList<>();

    FindingCollector(Path file, StyleConfig config, DiagnosticReporter reporter) {
        this.file = resolve(file);
        this.config = config;
        this.reporter = reporter;
    }

    void add(StyleRule rule, TSPoint point) {
        var diagnostic = new StyleDiagnostic(
                file, point.getRow() + 1, point.getColumn(), config.severity(rule), rule.message());
        logger.trace("{} -> {}", rule, diagnostic);
        if (reporter.report(diagnostic)) {
            diagnostics.add(diagnostic);
        }
    }

    /** Reports {@code rule} at {@code point} when {@code violated} holds. */
    void check(boolean violated, StyleRule rule, TSPoint point) {
        if (violated) {
            add(rule, point);
        }
    }

    CheckResult result() {
        return new CheckResult(diagnostics);
    }

    /** Absolute, symlink-free path when the file exists; absolute and normalized otherwise. */
    static Path resolve(Path file) {
        var absolute = file.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            return absolute;
        }
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            logger.debug("Cannot resolve real path of {}: {}", absolute, e.getMessage());
            return absolute;
        }
    }
}
