package org.pragmatica.qmark.types;

import org.pragmatica.qmark.tree.Expr;

/**
 * Decides whether two expressions denote the same value.
 */
@FunctionalInterface
public interface ExprEquality {
    boolean sameValue(Expr left, Expr right);
}
