package org.pragmatica.qmark.tree;

/// Identity of a node in the resolved tree. Spans and types are keyed by it.
public record NodeId(int value) {
    public static NodeId nodeId(int value) {
        return new NodeId(value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
