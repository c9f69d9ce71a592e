package org.pragmatica.qmark.tree;

/**
 * Language items the analysis recognizes by identity rather than by name.
 */
public enum LangItem {
    OPTION_SOME(true),
    OPTION_NONE(true),
    RESULT_OK(true),
    RESULT_ERR(true),
    /// Wraps the final value of a try block.
    TRY_FROM_OUTPUT(false);

    private final boolean constructor;

    LangItem(boolean constructor) {
        this.constructor = constructor;
    }

    public boolean isConstructor() {
        return constructor;
    }
}
