package org.pragmatica.qmark.lint.questionmark;

/// Outcome of following a return chain.
enum Verdict {
    /// The chain ends in the canonical empty marker, or in a failure carrying the proven payload.
    FAILURE_MARKER,
    /// The chain ends in the very local the guard inspected.
    SAME_ORIGIN,
    NEITHER
}
