package org.pragmatica.qmark.source;

/// One-based line and column.
public record Position(int line, int column) {
    public static final Position START = new Position(1, 1);
}
