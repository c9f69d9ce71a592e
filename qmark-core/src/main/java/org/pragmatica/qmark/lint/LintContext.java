package org.pragmatica.qmark.lint;

/// Context for lint analysis providing configuration.
public record LintContext(LintConfig config, String fileName) {
    /// Get the configured severity for a rule.
    public DiagnosticSeverity severityFor(String ruleId) {
        return config.ruleSeverities()
                     .getOrDefault(ruleId, DiagnosticSeverity.WARNING);
    }

    /// Check if a rule is enabled.
    public boolean isRuleEnabled(String ruleId) {
        return config.isEnabled(ruleId);
    }

    /// Factory method with default configuration.
    public static LintContext defaultContext() {
        return new LintContext(LintConfig.defaultConfig(), "Unknown.rs");
    }

    /// Builder-style method to set config.
    public LintContext withConfig(LintConfig config) {
        return new LintContext(config, fileName);
    }

    /// Builder-style method to set file name.
    public LintContext withFileName(String fileName) {
        return new LintContext(config, fileName);
    }
}
