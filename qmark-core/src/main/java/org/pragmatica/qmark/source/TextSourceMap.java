package org.pragmatica.qmark.source;

import org.pragmatica.qmark.tree.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link SourceMap} over an in-memory source text and a span table.
 */
public final class TextSourceMap implements SourceMap {
    private final String fileName;
    private final String text;
    private final Map<NodeId, Span> spans;
    private final int[] lineStarts;

    private TextSourceMap(String fileName, String text, Map<NodeId, Span> spans) {
        this.fileName = fileName;
        this.text = text;
        this.spans = Map.copyOf(spans);
        this.lineStarts = lineStarts(text);
    }

    public static TextSourceMap textSourceMap(String fileName, String text, Map<NodeId, Span> spans) {
        return new TextSourceMap(fileName, text, spans);
    }

    public String text() {
        return text;
    }

    @Override
    public String fileName() {
        return fileName;
    }

    @Override
    public Span span(NodeId node) {
        return spans.getOrDefault(node, Span.DUMMY);
    }

    @Override
    public Snippet snippet(Span span, String fallback) {
        if (!covers(span)) {
            return Snippet.placeholder(fallback);
        }
        var snippet = text.substring(span.lo(), span.hi());
        return span.fromExpansion()
               ? new Snippet(snippet, SnippetFidelity.APPROXIMATE)
               : Snippet.exact(snippet);
    }

    @Override
    public boolean containsComment(Span span) {
        if (!covers(span)) {
            return false;
        }
        var inString = false;
        for (int i = span.lo(); i < span.hi(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '/' && i + 1 < span.hi()) {
                char next = text.charAt(i + 1);
                if (next == '/' || next == '*') {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public Position position(int offset) {
        if (offset < 0) {
            return Position.START;
        }
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return new Position(low + 1, offset - lineStarts[low] + 1);
    }

    private boolean covers(Span span) {
        return !span.isDummy() && span.hi() <= text.length();
    }

    private static int[] lineStarts(String text) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return toArray(starts);
    }

    private static int[] toArray(List<Integer> values) {
        var result = new int[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }
}
