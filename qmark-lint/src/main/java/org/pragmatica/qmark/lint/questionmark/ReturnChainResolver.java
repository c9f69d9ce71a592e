package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.LangItem;

import java.util.Optional;

import static org.pragmatica.qmark.tree.TreeNodes.isLangCtor;
import static org.pragmatica.qmark.tree.TreeNodes.pathToLocal;
import static org.pragmatica.qmark.tree.TreeNodes.peelBlocksWithStmt;

/// Follows `return` statements and block tails to the value a branch actually hands back, and
/// classifies it relative to the value the guard inspected.
///
/// Optional values are compared against the nullary empty marker. Result values are compared by
/// binding identity with the inspected local, or, for an explicit `Err(payload)`, by the payload name
/// the destructuring pattern bound.
final class ReturnChainResolver {
    static final int MAX_RETURN_DEPTH = 64;

    private ReturnChainResolver() {}

    static Verdict resolve(GuardFamily family, Expr candidate, Expr origin, Optional<String> failurePayload) {
        var current = peelBlocksWithStmt(candidate);
        var depth = 0;
        while (current instanceof Expr.Ret ret) {
            if (ret.value().isEmpty() || ++depth > MAX_RETURN_DEPTH) {
                return Verdict.NEITHER;
            }
            current = peelBlocksWithStmt(ret.value().get());
        }
        if (current instanceof Expr.Path path) {
            return resolvePath(family, path, origin);
        }
        if (current instanceof Expr.Call call && call.args().size() == 1) {
            return resolveFailureCall(family, call, failurePayload);
        }
        return Verdict.NEITHER;
    }

    private static Verdict resolvePath(GuardFamily family, Expr.Path path, Expr origin) {
        var matches = switch (family) {
            case OPTION -> path.res().isLangCtor(LangItem.OPTION_NONE);
            case RESULT -> pathToLocal(path).isPresent() && pathToLocal(path).equals(pathToLocal(origin));
        };
        if (!matches) {
            return Verdict.NEITHER;
        }
        return family == GuardFamily.OPTION
               ? Verdict.FAILURE_MARKER
               : Verdict.SAME_ORIGIN;
    }

    private static Verdict resolveFailureCall(GuardFamily family, Expr.Call call, Optional<String> failurePayload) {
        if (family != GuardFamily.RESULT || failurePayload.isEmpty() || !isLangCtor(call.callee(), LangItem.RESULT_ERR)) {
            return Verdict.NEITHER;
        }
        var argument = call.args().get(0);
        return argument instanceof Expr.Path path && path.firstSegment().equals(failurePayload.get())
               ? Verdict.FAILURE_MARKER
               : Verdict.NEITHER;
    }
}
