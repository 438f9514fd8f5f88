package io.github.nxtool.nxstyle.analyzer;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * Fatal setup failure of a style check: unreadable file, missing or invalid query resource, unusable configuration.
 * Style findings are never reported through this exception.
 */
public class StyleCheckException extends Exception {
    private final @Nullable Path file;
    private final String operation;

    public StyleCheckException(String message, @Nullable Path file, String operation) {
        super(message);
        this.file = file;
        this.operation = operation;
    }

    public StyleCheckException(String message, Throwable cause, @Nullable Path file, String operation) {
        super(message, cause);
        this.file = file;
        this.operation = operation;
    }

    public @Nullable Path getFile() {
        return file;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String getMessage() {
        if (file == null) {
            return String.format("Style check failed during %s: %s", operation, super.getMessage());
        }
        return String.format("Style check failed during %s for file %s: %s", operation, file, super.getMessage());
    }
}
