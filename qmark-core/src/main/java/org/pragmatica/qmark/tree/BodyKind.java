package org.pragmatica.qmark.tree;

/// Owner kind of a body.
public enum BodyKind {
    FN,
    CONST_FN,
    CONST,
    STATIC,
    CLOSURE;

    /// Whether the body is evaluated at compile time.
    public boolean isConstContext() {
        return this == CONST_FN || this == CONST || this == STATIC;
    }
}
