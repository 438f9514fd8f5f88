package io.github.nxtool.nxstyle.analyzer;

import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** C headers are accepted but carry no layout rules; a check always completes without findings. */
public final class HeaderStyleChecker implements StyleChecker {
    private static final Logger logger = LogManager.getLogger(HeaderStyleChecker.class);

    private final Path file;

    public HeaderStyleChecker(Path file) {
        this.file = file;
    }

    @Override
    public Path file() {
        return file;
    }

    @Override
    public CheckResult check() {
        logger.info("No header rules apply to {}", file);
        return CheckResult.empty();
    }
}
