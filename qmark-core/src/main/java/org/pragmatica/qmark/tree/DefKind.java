package org.pragmatica.qmark.tree;

public enum DefKind {
    VARIANT_CTOR,
    STRUCT_CTOR,
    FN,
    CONST,
    STATIC,
    OTHER
}
