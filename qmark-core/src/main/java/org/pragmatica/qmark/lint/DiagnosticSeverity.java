package org.pragmatica.qmark.lint;

public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO
}
