package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.questionmark.MatchedGuard.DestructureGuard;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.LangItem;
import org.pragmatica.qmark.tree.Pat;
import org.pragmatica.qmark.tree.Res;

import java.util.Optional;

import static org.pragmatica.qmark.tree.TreeNodes.pathToLocalId;
import static org.pragmatica.qmark.tree.TreeNodes.peelBlocks;

/// Matches destructuring guards:
///
///   - `if let Some(x) = v { x } else { return None }`
///   - `if let Ok(x) = r { x } else { return r }`
///   - `if let Err(e) = r { return Err(e) }`
///
/// The pattern must be a constructor with exactly one field that is a plain binding.
final class DestructureGuardMatcher {
    private DestructureGuardMatcher() {}

    static Optional<DestructureGuard> match(AnalysisContext cx, Expr expr) {
        if (!(expr instanceof Expr.IfLet ifLet) || cx.tree().isElseClause(expr)) {
            return Optional.empty();
        }
        if (!(ifLet.pat() instanceof Pat.TupleStruct pattern)
            || pattern.fields().size() != 1
            || pattern.dotDotPos().isPresent()
            || !(pattern.res() instanceof Res.Lang constructor)) {
            return Optional.empty();
        }
        if (!(pattern.fields().get(0) instanceof Pat.Binding binding) || binding.sub().isPresent()) {
            return Optional.empty();
        }
        var scrutinee = ifLet.scrutinee();
        var scrutineeType = cx.types().exprType(scrutinee.id());
        return GuardFamily.of(scrutineeType)
                          .map(family -> new DestructureGuard(ifLet,
                                                              family,
                                                              constructor.item(),
                                                              scrutineeType,
                                                              binding,
                                                              scrutinee,
                                                              ifLet.then(),
                                                              ifLet.orElse()))
                          .filter(DestructureGuardMatcher::returnsEarly)
                          .filter(guard -> !elseYieldsScrutinee(cx, guard));
    }

    private static boolean returnsEarly(DestructureGuard guard) {
        return switch (guard.family()) {
            case OPTION -> guard.constructor() == LangItem.OPTION_SOME
                           && elseResolvesTo(guard, Optional.empty(), Verdict.FAILURE_MARKER)
                           && thenYieldsBinding(guard);
            case RESULT -> okWithSameOrigin(guard) || errWithSamePayload(guard);
        };
    }

    private static boolean okWithSameOrigin(DestructureGuard guard) {
        return guard.constructor() == LangItem.RESULT_OK
               && elseResolvesTo(guard, Optional.of(guard.binding().name()), Verdict.SAME_ORIGIN)
               && thenYieldsBinding(guard);
    }

    private static boolean errWithSamePayload(DestructureGuard guard) {
        return guard.constructor() == LangItem.RESULT_ERR
               && guard.orElse().isEmpty()
               && ReturnChainResolver.resolve(guard.family(),
                                              guard.then(),
                                              guard.scrutinee(),
                                              Optional.of(guard.binding().name())) == Verdict.FAILURE_MARKER;
    }

    private static boolean elseResolvesTo(DestructureGuard guard, Optional<String> payload, Verdict expected) {
        return guard.orElse()
                    .map(orElse -> ReturnChainResolver.resolve(guard.family(), orElse, guard.scrutinee(), payload))
                    .filter(expected::equals)
                    .isPresent();
    }

    // The binding must be what the then branch yields, otherwise the rewrite drops its value.
    private static boolean thenYieldsBinding(DestructureGuard guard) {
        return pathToLocalId(peelBlocks(guard.then()), guard.binding().id());
    }

    private static boolean elseYieldsScrutinee(AnalysisContext cx, DestructureGuard guard) {
        return guard.orElse()
                    .map(orElse -> cx.equality().sameValue(guard.scrutinee(), peelBlocks(orElse)))
                    .orElse(false);
    }
}
