package org.pragmatica.qmark.lint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads {@link LintConfig} from a properties file.
 * <pre>
 * severity.QMARK-01=ERROR
 * disabled=QMARK-01
 * enabled=QMARK-02
 * </pre>
 */
public final class LintConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(LintConfigLoader.class);

    private static final String SEVERITY_PREFIX = "severity.";
    private static final String DISABLED_KEY = "disabled";
    private static final String ENABLED_KEY = "enabled";

    private LintConfigLoader() {}

    public static LintConfig load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            var properties = new Properties();
            properties.load(reader);
            log.debug("Loaded lint configuration from {}", file);
            return fromProperties(properties);
        }
    }

    /**
     * Load the file if it exists, otherwise return the default configuration.
     */
    public static LintConfig loadOrDefault(Path file) throws IOException {
        if (!Files.exists(file)) {
            log.debug("No lint configuration at {}, using defaults", file);
            return LintConfig.defaultConfig();
        }
        return load(file);
    }

    /**
     * Apply the properties on top of the default configuration.
     *
     * @throws IllegalArgumentException if a severity value is not a known severity
     */
    public static LintConfig fromProperties(Properties properties) {
        var config = LintConfig.defaultConfig();
        for (var key : properties.stringPropertyNames()) {
            if (key.startsWith(SEVERITY_PREFIX)) {
                var ruleId = key.substring(SEVERITY_PREFIX.length());
                config = config.withRuleSeverity(ruleId, parseSeverity(key, properties.getProperty(key)));
            }
        }
        for (var ruleId : ruleList(properties.getProperty(ENABLED_KEY, ""))) {
            config = config.withEnabledRule(ruleId);
        }
        for (var ruleId : ruleList(properties.getProperty(DISABLED_KEY, ""))) {
            config = config.withDisabledRule(ruleId);
        }
        return config;
    }

    private static DiagnosticSeverity parseSeverity(String key, String value) {
        try {
            return DiagnosticSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid severity '" + value + "' for " + key
                                               + ", expected one of " + Arrays.toString(DiagnosticSeverity.values()), e);
        }
    }

    private static String[] ruleList(String value) {
        return Arrays.stream(value.split(","))
                     .map(String::trim)
                     .filter(ruleId -> !ruleId.isEmpty())
                     .toArray(String[]::new);
    }
}
