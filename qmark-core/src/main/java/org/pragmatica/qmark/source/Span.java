package org.pragmatica.qmark.source;

/**
 * Half-open range {@code [lo, hi)} of character offsets into the source text.
 *
 * @param fromExpansion whether the text was produced by a macro expansion rather than written
 *                      verbatim at this location
 */
public record Span(int lo, int hi, boolean fromExpansion) {
    /// Span of a node that has no source location.
    public static final Span DUMMY = new Span(-1, -1, false);

    public Span {
        if (lo > hi) {
            throw new IllegalArgumentException("Span start " + lo + " is after its end " + hi);
        }
    }

    public static Span span(int lo, int hi) {
        return new Span(lo, hi, false);
    }

    public boolean isDummy() {
        return lo < 0;
    }

    public int length() {
        return hi - lo;
    }

    public Span asExpansion() {
        return new Span(lo, hi, true);
    }
}
