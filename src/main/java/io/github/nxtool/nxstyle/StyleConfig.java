package io.github.nxtool.nxstyle;

import io.github.nxtool.nxstyle.analyzer.CheckResult.StyleDiagnostic.Severity;
import io.github.nxtool.nxstyle.analyzer.StyleCheckException;
import io.github.nxtool.nxstyle.analyzer.StyleRule;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Checker configuration. Bundled defaults come from {@code nxstyle.properties} on the classpath; a user file given on
 * the command line is layered on top of them.
 *
 * <p>Recognized keys:
 *
 * <ul>
 *   <li>{@code query.<language>}: classpath resource holding the tree-sitter query for that language
 *   <li>{@code severity.<rule>}: one of {@code ERROR}, {@code WARNING}, {@code INFO}, {@code OFF}
 *   <li>{@code indent.function-body}: column of statements directly inside a function body
 * </ul>
 */
public final class StyleConfig {
    private static final Logger logger = LogManager.getLogger(StyleConfig.class);

    public static final String DEFAULTS_RESOURCE = "nxstyle.properties";
    public static final String QUERY_PREFIX = "query.";
    public static final String SEVERITY_PREFIX = "severity.";
    public static final String FUNCTION_BODY_INDENT = "indent.function-body";

    private static final int DEFAULT_FUNCTION_BODY_INDENT = 2;

    private final Properties props;

    private StyleConfig(Properties props) {
        this.props = props;
    }

    /** Bundled defaults only. */
    public static StyleConfig defaults() {
        return new StyleConfig(loadDefaults());
    }

    /** Bundled defaults with the given properties layered on top. */
    public static StyleConfig withOverrides(Properties overrides) {
        var props = loadDefaults();
        props.putAll(overrides);
        return new StyleConfig(props);
    }

    /**
     * Bundled defaults overlaid with the user file, if any.
     *
     * @throws StyleCheckException if the user file cannot be read
     */
    public static StyleConfig load(@Nullable Path userConfig) throws StyleCheckException {
        var props = loadDefaults();
        if (userConfig == null) {
            return new StyleConfig(props);
        }

        var user = new Properties();
        try (var reader = Files.newBufferedReader(userConfig, StandardCharsets.UTF_8)) {
            user.load(reader);
        } catch (IOException e) {
            throw new StyleCheckException(
                    "Unable to read configuration: " + e.getMessage(), e, userConfig, "configuration loading");
        }
        logger.debug("Loaded {} configuration entries from {}", user.size(), userConfig);
        props.putAll(user);
        return new StyleConfig(props);
    }

    private static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = StyleConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new IOException("Resource not found: " + DEFAULTS_RESOURCE);
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return props;
    }

    /** The query resource for a language key such as {@code c}. */
    public String queryResource(String languageKey) {
        var key = QUERY_PREFIX + languageKey;
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return "queries/" + languageKey + ".scm";
        }
        return value.strip();
    }

    /** Configured severity for a rule, falling back to the rule default on absent or unknown values. */
    public Severity severity(StyleRule rule) {
        var raw = props.getProperty(SEVERITY_PREFIX + rule.key());
        if (raw == null || raw.isBlank()) {
            return rule.defaultSeverity();
        }
        try {
            return Severity.valueOf(raw.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown severity '{}' for rule {}, using {}", raw, rule.key(), rule.defaultSeverity());
            return rule.defaultSeverity();
        }
    }

    public int functionBodyIndent() {
        var raw = props.getProperty(FUNCTION_BODY_INDENT);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_FUNCTION_BODY_INDENT;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} '{}', using {}", FUNCTION_BODY_INDENT, raw, DEFAULT_FUNCTION_BODY_INDENT);
            return DEFAULT_FUNCTION_BODY_INDENT;
        }
    }
}
