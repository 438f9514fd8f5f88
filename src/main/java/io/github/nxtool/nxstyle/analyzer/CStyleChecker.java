package io.github.nxtool.nxstyle.analyzer;

import static io.github.nxtool.nxstyle.analyzer.CaptureNames.*;

import io.github.nxtool.nxstyle.StyleConfig;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryException;
import org.treesitter.TreeSitterC;

/**
 * Statement level layout checker for C sources.
 *
 * <p>Every statement directly inside a function body is checked for indentation, recursively; every controlling
 * expression, {@code for} header and argument list is checked for spacing. Capture groups are independent of each
 * other and any of them may be empty.
 */
public final class CStyleChecker implements StyleChecker {
    private static final Logger logger = LogManager.getLogger(CStyleChecker.class);

    public static final String LANGUAGE_KEY = "c";

    private final StyleConfig config;
    private final DiagnosticReporter reporter;
    private final SyntaxTree tree;
    private final CaptureSet captures;

    /**
     * Parses {@code contents} and runs the configured query over it.
     *
     * @param file path used in diagnostics; it does not have to exist
     * @throws StyleCheckException if the query resource is missing or does not compile
     */
    public CStyleChecker(Path file, byte[] contents, StyleConfig config, DiagnosticReporter reporter)
            throws StyleCheckException {
        this.config = config;
        this.reporter = reporter;

        TSLanguage language = new TreeSitterC();
        this.tree = SyntaxTree.parse(file, contents, language);

        var queryResource = config.queryResource(LANGUAGE_KEY);
        TSQuery query;
        try {
            query = CaptureSet.compileQuery(language, queryResource);
        } catch (UncheckedIOException e) {
            throw new StyleCheckException(e.getCause().getMessage(), e, file, "query loading");
        } catch (TSQueryException e) {
            throw new StyleCheckException(
                    "Invalid query " + queryResource + ": " + e.getMessage(), e, file, "query compilation");
        }
        this.captures = CaptureSet.collect(query, tree.root());
        logger.debug("Captures for {}: {}", file, captures.names());
    }

    /**
     * Reads {@code file} and creates a checker for it.
     *
     * @throws StyleCheckException if the file cannot be read or the query cannot be loaded
     */
    public static CStyleChecker forFile(Path file, StyleConfig config, DiagnosticReporter reporter)
            throws StyleCheckException {
        byte[] contents;
        try {
            contents = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StyleCheckException("Unable to read file: " + e.getMessage(), e, file, "reading");
        }
        return new CStyleChecker(file, contents, config, reporter);
    }

    @Override
    public Path file() {
        return tree.file();
    }

    public SyntaxTree syntaxTree() {
        return tree;
    }

    public CaptureSet captures() {
        return captures;
    }

    @Override
    public CheckResult check() {
        var findings = new FindingCollector(tree.file(), config, reporter);

        var indentation = new IndentationRules(findings);
        int bodyIndent = config.functionBodyIndent();
        for (TSNode body : captures.get(FUNCTION_BODY)) {
            for (TSNode statement : ASTTraversalUtils.namedChildren(body)) {
                indentation.checkIndents(bodyIndent, statement);
            }
        }

        var whitespace = new WhitespaceRules(tree, findings);
        for (TSNode condition : captures.get(CONDITION)) {
            whitespace.checkControlExpression(condition);
        }
        for (TSNode forStatement : captures.get(FOR_HEADER)) {
            whitespace.checkForHeader(forStatement);
        }
        for (TSNode arguments : captures.get(ARGUMENTS)) {
            whitespace.checkArgumentList(arguments);
        }

        var result = findings.result();
        logger.debug("{}: {} finding(s)", tree.file(), result.diagnostics().size());
        return result;
    }

    @Override
    public void dumpTree(PrintWriter out) {
        tree.dump(out);
    }
}
