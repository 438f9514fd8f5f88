package io.github.nxtool.nxstyle.analyzer;

import io.github.nxtool.nxstyle.StyleConfig;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** File kinds the checker accepts, chosen by file suffix. */
public enum FileKind {
    C_SOURCE(List.of("c")) {
        @Override
        public StyleChecker createChecker(Path file, StyleConfig config, DiagnosticReporter reporter)
                throws StyleCheckException {
            return CStyleChecker.forFile(file, config, reporter);
        }
    },
    C_HEADER(List.of("h")) {
        @Override
        public StyleChecker createChecker(Path file, StyleConfig config, DiagnosticReporter reporter) {
            return new HeaderStyleChecker(file);
        }
    };

    private final List<String> extensions;

    FileKind(List<String> extensions) {
        this.extensions = extensions;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    /**
     * Creates the checker for one file of this kind.
     *
     * @throws StyleCheckException if the file or the resources the checker needs cannot be loaded
     */
    public abstract StyleChecker createChecker(Path file, StyleConfig config, DiagnosticReporter reporter)
            throws StyleCheckException;

    /** The kind matching the file's extension, if any. Matching is exact: {@code .C} is not {@code .c}. */
    public static Optional<FileKind> fromPath(Path file) {
        var fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        var name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        var extension = name.substring(dot + 1);
        return Arrays.stream(values())
                .filter(kind -> kind.extensions.contains(extension))
                .findFirst();
    }

    public static String supportedExtensions() {
        return String.join(
                ", ",
                Arrays.stream(values())
                        .flatMap(kind -> kind.extensions.stream())
                        .map(ext -> "." + ext)
                        .toList());
    }
}
