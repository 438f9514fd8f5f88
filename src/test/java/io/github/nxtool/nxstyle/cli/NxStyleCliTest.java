package io.github.nxtool.nxstyle.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class NxStyleCliTest {
    private static final String CLEAN = "int main(void)\n{\n  return 0;\n}\n";
    private static final String UNSPACED_CALL = "int main(void)\n{\n  foo(a,b);\n}\n";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        var cmd = new CommandLine(new NxStyleCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void cleanFileExitsZeroSilently() throws Exception {
        var file = Files.writeString(tempDir.resolve("clean.c"), CLEAN);
        assertEquals(NxStyleCli.EXIT_OK, run(file.toString()));
        assertEquals("", out.toString());
    }

    @Test
    void findingsDoNotChangeTheExitCode() throws Exception {
        var file = Files.writeString(tempDir.resolve("call.c"), UNSPACED_CALL);
        assertEquals(NxStyleCli.EXIT_OK, run(file.toString()));
        assertEquals(
                file.toRealPath() + ":3:5: [ERROR] Missing whitespace after comma",
                out.toString().strip());
    }

    @Test
    void missingFile() {
        var missing = tempDir.resolve("missing.c");
        assertEquals(NxStyleCli.EXIT_FAILURE, run(missing.toString()));
        assertTrue(err.toString().contains("Not a valid file path: " + missing), err.toString());
    }

    @Test
    void directoryIsNotAFile() {
        assertEquals(NxStyleCli.EXIT_FAILURE, run(tempDir.toString()));
        assertTrue(err.toString().contains("Not a valid file path"), err.toString());
    }

    @Test
    void unsupportedExtension() throws Exception {
        var file = Files.writeString(tempDir.resolve("notes.txt"), "hello\n");
        assertEquals(NxStyleCli.EXIT_FAILURE, run(file.toString()));
        assertTrue(err.toString().contains("Unsupported file type"), err.toString());
        assertTrue(err.toString().contains(".c, .h"), err.toString());
    }

    @Test
    void headerIsAcceptedWithoutFindings() throws Exception {
        var file = Files.writeString(tempDir.resolve("x.h"), "int  f(int a,int b);\n");
        assertEquals(NxStyleCli.EXIT_OK, run(file.toString()));
        assertEquals("", out.toString());
    }

    @Test
    void missingArgumentIsAUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run());
        assertTrue(err.toString().contains("Missing required parameter"), err.toString());
    }

    @Test
    void configFileAdjustsSeverity() throws Exception {
        var file = Files.writeString(tempDir.resolve("call.c"), UNSPACED_CALL);
        var config = Files.writeString(tempDir.resolve("style.properties"), "severity.comma-space=WARNING\n");
        assertEquals(NxStyleCli.EXIT_OK, run("--config", config.toString(), file.toString()));
        assertTrue(out.toString().contains("[WARNING] Missing whitespace after comma"), out.toString());
    }

    @Test
    void configFileCanSilenceARule() throws Exception {
        var file = Files.writeString(tempDir.resolve("call.c"), UNSPACED_CALL);
        var config = Files.writeString(tempDir.resolve("style.properties"), "severity.comma-space=OFF\n");
        assertEquals(NxStyleCli.EXIT_OK, run("--config", config.toString(), file.toString()));
        assertEquals("", out.toString());
    }

    @Test
    void unreadableConfigFails() throws Exception {
        var file = Files.writeString(tempDir.resolve("clean.c"), CLEAN);
        var config = tempDir.resolve("absent.properties");
        assertEquals(NxStyleCli.EXIT_FAILURE, run("--config", config.toString(), file.toString()));
        assertTrue(err.toString().contains("configuration loading"), err.toString());
    }

    @Test
    void dumpTreePrecedesFindings() throws Exception {
        var file = Files.writeString(tempDir.resolve("call.c"), UNSPACED_CALL);
        assertEquals(NxStyleCli.EXIT_OK, run("--dump-tree", file.toString()));
        var text = out.toString();
        assertTrue(text.startsWith("translation_unit"), text);
        assertTrue(text.indexOf("argument_list") < text.indexOf("Missing whitespace after comma"), text);
    }
}
