package org.pragmatica.qmark.lint;

import java.util.stream.Stream;

/**
 * Interface for lint rules.
 *
 * Each rule analyzes a source unit and produces zero or more diagnostics.
 */
public interface LintRule {
    /**
     * Get the rule ID (e.g., "QMARK-01").
     */
    String ruleId();

    /**
     * Get a short description of what this rule checks.
     */
    String description();

    /**
     * Analyze a source unit and return any diagnostics.
     *
     * @param unit the source unit to analyze
     * @param ctx  the lint context providing configuration
     * @return stream of diagnostics found
     */
    Stream<Diagnostic> analyze(SourceUnit unit, LintContext ctx);
}
