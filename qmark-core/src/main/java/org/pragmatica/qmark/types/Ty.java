package org.pragmatica.qmark.types;

/**
 * Resolved type of an expression, reduced to the facts the lints consume.
 *
 * @param name       display name
 * @param family     diagnostic identity; a reference to an optional is {@link TypeFamily#OTHER}
 * @param copy       whether values are trivially copyable
 * @param propagates whether the type supports the {@code ?} operator
 */
public record Ty(String name, TypeFamily family, boolean copy, boolean propagates) {
    public static final Ty UNKNOWN = new Ty("_", TypeFamily.OTHER, false, false);

    public static Ty option(String inner, boolean copy) {
        return new Ty("Option<" + inner + ">", TypeFamily.OPTION, copy, true);
    }

    public static Ty result(String ok, String err, boolean copy) {
        return new Ty("Result<" + ok + ", " + err + ">", TypeFamily.RESULT, copy, true);
    }

    /// Shared reference to a value of the given type. References are copyable and never propagate.
    public static Ty reference(Ty referent) {
        return new Ty("&" + referent.name(), TypeFamily.OTHER, true, false);
    }

    public static Ty plain(String name, boolean copy) {
        return new Ty(name, TypeFamily.OTHER, copy, false);
    }

    public boolean is(TypeFamily family) {
        return this.family == family;
    }

    @Override
    public String toString() {
        return name;
    }
}
