package org.pragmatica.qmark.tree;

/// How a pattern binding captures its value.
public enum BindingMode {
    VALUE,
    REF,
    REF_MUT
}
