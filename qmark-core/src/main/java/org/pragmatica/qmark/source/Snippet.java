package org.pragmatica.qmark.source;

public record Snippet(String text, SnippetFidelity fidelity) {
    public static Snippet exact(String text) {
        return new Snippet(text, SnippetFidelity.EXACT);
    }

    public static Snippet placeholder(String fallback) {
        return new Snippet(fallback, SnippetFidelity.PLACEHOLDER);
    }
}
