package org.pragmatica.qmark.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the linter.
 */
public record LintConfig(Map<String, DiagnosticSeverity> ruleSeverities,
                         Set<String> disabledRules) {
    public LintConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        disabledRules = Set.copyOf(disabledRules);
    }

    /**
     * Default lint configuration.
     */
    public static final LintConfig DEFAULT = new LintConfig(
            Map.ofEntries(
                    Map.entry("QMARK-01", DiagnosticSeverity.WARNING),  // Guard could use `?`
                    Map.entry("QMARK-02", DiagnosticSeverity.WARNING)   // `?` is forbidden (restriction)
            ),
            // Restriction lints are opt-in
            Set.of("QMARK-02")
    );

    public static LintConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to set rule severity.
     */
    public LintConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new LintConfig(newSeverities, disabledRules);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public LintConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new LintConfig(ruleSeverities, newDisabled);
    }

    /**
     * Builder-style method to enable a rule that is disabled by default.
     */
    public LintConfig withEnabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.remove(ruleId);
        return new LintConfig(ruleSeverities, newDisabled);
    }

    public boolean isEnabled(String ruleId) {
        return !disabledRules.contains(ruleId);
    }
}
