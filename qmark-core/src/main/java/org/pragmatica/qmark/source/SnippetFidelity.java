package org.pragmatica.qmark.source;

/**
 * How faithfully a snippet reproduces the code at its span.
 */
public enum SnippetFidelity {
    /// Verbatim source text.
    EXACT,
    /// Text exists, but the span comes from a macro expansion.
    APPROXIMATE,
    /// The text could not be recovered; the caller's fallback was substituted.
    PLACEHOLDER
}
