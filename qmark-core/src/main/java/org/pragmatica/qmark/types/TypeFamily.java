package org.pragmatica.qmark.types;

/// Diagnostic identity of a type as far as the lints are concerned.
public enum TypeFamily {
    OPTION,
    RESULT,
    OTHER
}
