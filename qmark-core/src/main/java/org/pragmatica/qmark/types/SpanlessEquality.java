package org.pragmatica.qmark.types;

import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.Res;

/**
 * Structural equality that ignores source locations and compares paths by resolution.
 * <p>
 * Calls, method calls and blocks are never equal: evaluating them twice may not produce the
 * same value.
 */
public final class SpanlessEquality implements ExprEquality {
    public static final SpanlessEquality INSTANCE = new SpanlessEquality();

    private SpanlessEquality() {}

    @Override
    public boolean sameValue(Expr left, Expr right) {
        if (left instanceof Expr.Path l && right instanceof Expr.Path r) {
            return l.res().equals(r.res()) && !(l.res() instanceof Res.Unresolved);
        }
        if (left instanceof Expr.Field l && right instanceof Expr.Field r) {
            return l.name().equals(r.name()) && sameValue(l.base(), r.base());
        }
        if (left instanceof Expr.Lit l && right instanceof Expr.Lit r) {
            return l.text().equals(r.text());
        }
        if (left instanceof Expr.Ref l && right instanceof Expr.Ref r) {
            return l.mutable() == r.mutable() && sameValue(l.inner(), r.inner());
        }
        if (left instanceof Expr.Binary l && right instanceof Expr.Binary r) {
            return l.op().equals(r.op()) && sameValue(l.lhs(), r.lhs()) && sameValue(l.rhs(), r.rhs());
        }
        return false;
    }
}
