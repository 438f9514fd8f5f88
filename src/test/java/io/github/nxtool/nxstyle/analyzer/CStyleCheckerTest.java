package io.github.nxtool.nxstyle.analyzer;

import static io.github.nxtool.nxstyle.analyzer.CheckerTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.nxtool.nxstyle.StyleConfig;
import io.github.nxtool.nxstyle.analyzer.CheckResult.StyleDiagnostic.Severity;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CStyleCheckerTest {

    private static Path fixture(String name) throws URISyntaxException {
        var url = CStyleCheckerTest.class.getClassLoader().getResource("testcode-c/" + name);
        assertNotNull(url, "missing fixture " + name);
        return Path.of(url.toURI());
    }

    private static CheckResult checkFixture(String name, StyleConfig config) throws Exception {
        return CStyleChecker.forFile(fixture(name), config, DiagnosticReporter.silent()).check();
    }

    @Test
    void canonicalFileIsClean() throws Exception {
        var result = checkFixture("canonical.c", StyleConfig.defaults());
        assertEquals(List.of(), result.diagnostics());
        assertFalse(result.hasErrors());
    }

    @Test
    void fileWithoutFunctionBodiesIsClean() throws Exception {
        assertEquals(List.of(), checkFixture("declarations_only.c", StyleConfig.defaults()).diagnostics());
    }

    @Test
    void violationsAreReportedIndentationFirst() throws Exception {
        var result = checkFixture("violations.c", StyleConfig.defaults());
        assertEquals(
                List.of(
                        StyleRule.LEFT_BRACKET.message(),
                        StyleRule.INDENTATION.message(),
                        StyleRule.KEYWORD_SPACE.message(),
                        StyleRule.COMMA_SPACE.message()),
                messages(result));
        assertEquals(List.of("10:12", "14:3", "5:4", "7:9"), positions(result));
        assertTrue(result.hasErrors());
        assertEquals(4, result.getErrors().size());
    }

    @Test
    void reporterPrintsResolvedPath() throws Exception {
        var file = fixture("violations.c");
        var buffer = new StringWriter();
        var checker = CStyleChecker.forFile(
                file, StyleConfig.defaults(), new DiagnosticReporter(new PrintWriter(buffer)));
        checker.check();

        var lines = buffer.toString().lines().toList();
        assertEquals(4, lines.size());
        assertEquals(file.toRealPath() + ":10:12: [ERROR] Left bracket not on separate line", lines.get(0));
        assertEquals(file.toRealPath() + ":7:9: [ERROR] Missing whitespace after comma", lines.get(3));
    }

    @Test
    void checkingTwiceGivesByteIdenticalOutput() throws Exception {
        var buffer = new StringWriter();
        var checker = CStyleChecker.forFile(
                fixture("violations.c"), StyleConfig.defaults(), new DiagnosticReporter(new PrintWriter(buffer)));

        var first = checker.check();
        var firstOutput = buffer.toString();
        buffer.getBuffer().setLength(0);
        var second = checker.check();
        var secondOutput = buffer.toString();

        assertFalse(firstOutput.isEmpty());
        assertEquals(firstOutput, secondOutput);
        assertEquals(first, second);
    }

    @Test
    void configuredSeveritiesApply() throws Exception {
        var overrides = new Properties();
        try (var in = getClass().getClassLoader().getResourceAsStream("severity-off.properties")) {
            assertNotNull(in);
            overrides.load(in);
        }
        var result = checkFixture("violations.c", StyleConfig.withOverrides(overrides));

        assertTrue(result.withMessage(StyleRule.KEYWORD_SPACE.message()).isEmpty());
        var comma = result.withMessage(StyleRule.COMMA_SPACE.message());
        assertEquals(1, comma.size());
        assertEquals(Severity.WARNING, comma.get(0).severity());
        assertEquals(2, result.getErrors().size());
    }

    @Test
    void missingQueryResource() {
        var overrides = new Properties();
        overrides.setProperty("query.c", "queries/does-not-exist.scm");
        var e = assertThrows(
                StyleCheckException.class, () -> check("int x;\n", StyleConfig.withOverrides(overrides)));
        assertEquals("query loading", e.getOperation());
        assertEquals(SAMPLE, e.getFile());
        assertTrue(e.getMessage().contains("queries/does-not-exist.scm"), e.getMessage());
    }

    @Test
    void queryThatDoesNotCompile() {
        var overrides = new Properties();
        overrides.setProperty("query.c", "queries/broken.scm");
        var e = assertThrows(
                StyleCheckException.class, () -> check("int x;\n", StyleConfig.withOverrides(overrides)));
        assertEquals("query compilation", e.getOperation());
    }

    @Test
    void unreadableFile(@TempDir Path tempDir) {
        var missing = tempDir.resolve("missing.c");
        var e = assertThrows(
                StyleCheckException.class,
                () -> CStyleChecker.forFile(missing, StyleConfig.defaults(), DiagnosticReporter.silent()));
        assertEquals("reading", e.getOperation());
        assertEquals(missing, e.getFile());
    }

    @Test
    void emptyFileIsClean(@TempDir Path tempDir) throws Exception {
        var empty = Files.writeString(tempDir.resolve("empty.c"), "");
        var result = CStyleChecker.forFile(empty, StyleConfig.defaults(), DiagnosticReporter.silent())
                .check();
        assertEquals(List.of(), result.diagnostics());
    }

    @Test
    void capturesCoverEveryGroup() throws StyleCheckException {
        var checker = new CStyleChecker(
                SAMPLE,
                inFunction("  for (;;)\n    {\n      foo(1);\n    }\n  if (x)\n    {\n    }\n")
                        .getBytes(java.nio.charset.StandardCharsets.UTF_8),
                StyleConfig.defaults(),
                DiagnosticReporter.silent());
        var captures = checker.captures();
        assertEquals(1, captures.get(CaptureNames.FUNCTION_BODY).size());
        assertEquals(1, captures.get(CaptureNames.FOR_HEADER).size());
        assertEquals(1, captures.get(CaptureNames.CONDITION).size());
        assertEquals(1, captures.get(CaptureNames.ARGUMENTS).size());
    }

    @Test
    void dumpTreeListsNodesWithPositions() throws Exception {
        var checker = new CStyleChecker(
                SAMPLE,
                inFunction("  if (x)\n    {\n    }\n").getBytes(java.nio.charset.StandardCharsets.UTF_8),
                StyleConfig.defaults(),
                DiagnosticReporter.silent());
        var buffer = new StringWriter();
        checker.dumpTree(new PrintWriter(buffer));

        var dump = buffer.toString();
        assertTrue(dump.startsWith("translation_unit [1:0"), dump);
        assertTrue(dump.contains("if_statement [3:2"), dump);
        assertTrue(dump.contains("\"{\""), dump);
    }
}
