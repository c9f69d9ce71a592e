package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.questionmark.MatchedGuard.MethodGuard;
import org.pragmatica.qmark.tree.Expr;

import java.util.Optional;

import static org.pragmatica.qmark.tree.TreeNodes.peelBlocks;

/// Matches `if x.is_none() { return None }` and `if r.is_err() { return r }`.
///
/// An else branch is accepted only when it yields the receiver itself, which turns the whole
/// `if` into `Some(x?)`. Any other else branch is left alone.
final class MethodGuardMatcher {
    private MethodGuardMatcher() {}

    static Optional<MethodGuard> match(AnalysisContext cx, Expr expr) {
        if (!(expr instanceof Expr.If ifExpr) || cx.tree().isElseClause(expr)) {
            return Optional.empty();
        }
        if (!(ifExpr.cond() instanceof Expr.MethodCall call) || !call.args().isEmpty()) {
            return Optional.empty();
        }
        var receiver = call.receiver();
        var receiverType = cx.types().exprType(receiver.id());
        return GuardFamily.of(receiverType)
                          .map(family -> new MethodGuard(ifExpr,
                                                         family,
                                                         receiver,
                                                         receiverType,
                                                         call.method(),
                                                         ifExpr.then(),
                                                         ifExpr.orElse()))
                          .filter(MethodGuardMatcher::returnsEarly)
                          .filter(guard -> elseYieldsReceiver(cx, guard));
    }

    private static boolean returnsEarly(MethodGuard guard) {
        var family = guard.family();
        return family.emptinessPredicate().equals(guard.predicate())
               && ReturnChainResolver.resolve(family, guard.then(), guard.receiver(), Optional.empty())
                  == family.earlyReturnVerdict();
    }

    private static boolean elseYieldsReceiver(AnalysisContext cx, MethodGuard guard) {
        return guard.orElse()
                    .map(orElse -> cx.equality().sameValue(guard.receiver(), peelBlocks(orElse)))
                    .orElse(true);
    }
}
