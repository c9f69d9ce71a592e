package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.source.SnippetFidelity;

/**
 * How safe a suggestion is to apply without a human looking at it. Declared from most to least safe.
 */
public enum Confidence {
    /// Safe to apply automatically.
    DEFINITE,
    /// Expected to be right, but the replacement text may not match the source exactly.
    LIKELY_CORRECT,
    /// Must be reviewed before applying.
    NEEDS_REVIEW;

    /**
     * Lower the confidence to what the snippet it was built from can support.
     */
    public Confidence degradeTo(SnippetFidelity fidelity) {
        return switch (fidelity) {
            case EXACT -> this;
            case APPROXIMATE -> atMost(LIKELY_CORRECT);
            case PLACEHOLDER -> NEEDS_REVIEW;
        };
    }

    public Confidence atMost(Confidence other) {
        return ordinal() >= other.ordinal()
               ? this
               : other;
    }
}
