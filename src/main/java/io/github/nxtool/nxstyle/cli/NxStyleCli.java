package io.github.nxtool.nxstyle.cli;

import io.github.nxtool.nxstyle.StyleConfig;
import io.github.nxtool.nxstyle.analyzer.DiagnosticReporter;
import io.github.nxtool.nxstyle.analyzer.FileKind;
import io.github.nxtool.nxstyle.analyzer.StyleCheckException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "nxstyle",
        mixinStandardHelpOptions = true,
        version = "nxstyle 0.1.0",
        description = "Checks the statement layout of a C source file. Findings are printed as"
                + " <path>:<line>:<column>: [<SEVERITY>] <message>; they do not change the exit status.")
public final class NxStyleCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(NxStyleCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "File to check.")
    private Path file;

    @CommandLine.Option(
            names = "--config",
            paramLabel = "PROPERTIES",
            description = "Properties file overriding the bundled defaults.")
    @Nullable
    private Path configPath;

    @CommandLine.Option(names = "--dump-tree", description = "Print the syntax tree before checking.")
    private boolean dumpTree = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NxStyleCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            err.println("Not a valid file path: " + file);
            return EXIT_FAILURE;
        }

        var kind = FileKind.fromPath(file);
        if (kind.isEmpty()) {
            err.println("Unsupported file type: " + file + " (supported: " + FileKind.supportedExtensions() + ")");
            return EXIT_FAILURE;
        }

        try {
            var config = StyleConfig.load(configPath);
            var checker = kind.get().createChecker(file, config, new DiagnosticReporter(out));
            if (dumpTree) {
                checker.dumpTree(out);
            }
            var result = checker.check();
            logger.debug("Checked {}: {} finding(s)", file, result.diagnostics().size());
            return EXIT_OK;
        } catch (StyleCheckException e) {
            logger.debug("Check of {} aborted", file, e);
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
