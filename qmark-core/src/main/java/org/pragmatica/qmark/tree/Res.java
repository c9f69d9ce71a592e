package org.pragmatica.qmark.tree;

/**
 * Result of name resolution for a path.
 */
public sealed interface Res {
    Res UNRESOLVED = new Unresolved();

    /**
     * Local variable; {@code binding} is the id of the {@link Pat.Binding} that introduced it.
     */
    record Local(NodeId binding) implements Res {}

    record Lang(LangItem item) implements Res {}

    record Def(DefKind kind, String path) implements Res {}

    record Unresolved() implements Res {}

    static Res local(NodeId binding) {
        return new Local(binding);
    }

    static Res lang(LangItem item) {
        return new Lang(item);
    }

    static Res def(DefKind kind, String path) {
        return new Def(kind, path);
    }

    /// Whether this resolves to the given language item constructor.
    default boolean isLangCtor(LangItem item) {
        return item.isConstructor() && this instanceof Lang lang && lang.item() == item;
    }
}
