package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.source.Span;

/**
 * Replacement text for a span of source code.
 */
public record Suggestion(Span span, String replacement, Confidence confidence) {
    public static Suggestion suggestion(Span span, String replacement, Confidence confidence) {
        return new Suggestion(span, replacement, confidence);
    }
}
