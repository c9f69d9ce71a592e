package org.pragmatica.qmark.source;

import org.pragmatica.qmark.tree.NodeId;

/**
 * Source locations and text for one analyzed file.
 */
public interface SourceMap {
    String fileName();

    /**
     * Span of the node, or {@link Span#DUMMY} when the node has no location.
     */
    Span span(NodeId node);

    /**
     * Source text at the span. When it cannot be reproduced the fallback is returned with
     * {@link SnippetFidelity#PLACEHOLDER}.
     */
    Snippet snippet(Span span, String fallback);

    /**
     * Whether a line or block comment starts anywhere inside the span.
     */
    boolean containsComment(Span span);

    Position position(int offset);
}
