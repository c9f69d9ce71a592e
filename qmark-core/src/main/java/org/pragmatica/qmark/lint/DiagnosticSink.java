package org.pragmatica.qmark.lint;

/// Receives diagnostics as a pass produces them.
@FunctionalInterface
public interface DiagnosticSink {
    void emit(Diagnostic diagnostic);
}
