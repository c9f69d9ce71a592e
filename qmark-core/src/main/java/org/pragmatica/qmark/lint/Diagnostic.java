package org.pragmatica.qmark.lint;

import java.util.Optional;

/**
 * A single lint finding.
 *
 * @param help       one-line hint shown next to the suggestion
 * @param suggestion replacement for the flagged code, if the rule can provide one
 */
public record Diagnostic(String ruleId,
                         DiagnosticSeverity severity,
                         String fileName,
                         int line,
                         int column,
                         String message,
                         String help,
                         Optional<Suggestion> suggestion) {
    public static Diagnostic diagnostic(String ruleId,
                                        DiagnosticSeverity severity,
                                        String fileName,
                                        int line,
                                        int column,
                                        String message,
                                        String help) {
        return new Diagnostic(ruleId, severity, fileName, line, column, message, help, Optional.empty());
    }

    public Diagnostic withSuggestion(Suggestion suggestion) {
        return new Diagnostic(ruleId, severity, fileName, line, column, message, help, Optional.of(suggestion));
    }

    @Override
    public String toString() {
        var base = fileName + ":" + line + ":" + column + ": " + severity + " [" + ruleId + "] " + message;
        return suggestion.map(s -> base + " (" + help + ": `" + s.replacement() + "`, " + s.confidence() + ")")
                         .orElse(base);
    }
}
