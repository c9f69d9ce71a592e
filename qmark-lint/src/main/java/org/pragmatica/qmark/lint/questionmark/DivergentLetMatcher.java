package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.questionmark.MatchedGuard.DivergentLet;
import org.pragmatica.qmark.source.SnippetFidelity;
import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.LangItem;
import org.pragmatica.qmark.tree.Pat;
import org.pragmatica.qmark.tree.Stmt;

import java.util.Optional;

import static org.pragmatica.qmark.tree.TreeNodes.isLangCtor;
import static org.pragmatica.qmark.tree.TreeNodes.isRefutable;
import static org.pragmatica.qmark.tree.TreeNodes.peelBlocks;

/// Matches `let Some(x) = init else { return None };`.
///
/// The initializer's adjusted type must itself support `?`: a borrowed optional field has type
/// `&Option<T>`, and neither `&init?` nor `(&init)?` would mean the same thing. A comment in the
/// else block blocks the match because the rewrite would drop it. An else block whose text is
/// unavailable counts as commented.
final class DivergentLetMatcher {
    private DivergentLetMatcher() {}

    static Optional<DivergentLet> match(AnalysisContext cx, Stmt stmt) {
        if (!(stmt instanceof Stmt.Let let) || let.init().isEmpty() || let.orElse().isEmpty()) {
            return Optional.empty();
        }
        var init = let.init().get();
        var fallback = let.orElse().get();
        if (!cx.types().adjustedType(init.id()).propagates()) {
            return Optional.empty();
        }
        return fallbackExpression(fallback).flatMap(ret -> bindingCore(let.pat(), ret))
                                           .filter(core -> !containsComment(cx, fallback))
                                           .map(core -> new DivergentLet(let, let.pat(), core, init, fallback));
    }

    /// The single expression the else block reduces to: its tail, or its only statement if that is a `return`.
    static Optional<Expr> fallbackExpression(Block block) {
        if (block.stmts().isEmpty()) {
            return block.expr();
        }
        if (block.stmts().size() == 1
            && block.expr().isEmpty()
            && block.stmts().get(0) instanceof Stmt.Semi semi
            && semi.expr() instanceof Expr.Ret) {
            return Optional.of(semi.expr());
        }
        return Optional.empty();
    }

    /// `Some(inner)` with an irrefutable `inner`, paired with a fallback of `return None`, binds
    /// exactly what `init?` yields.
    static Optional<Pat> bindingCore(Pat pattern, Expr fallback) {
        if (!(pattern instanceof Pat.TupleStruct tupleStruct)
            || tupleStruct.fields().size() != 1
            || tupleStruct.dotDotPos().isPresent()
            || !tupleStruct.res().isLangCtor(LangItem.OPTION_SOME)) {
            return Optional.empty();
        }
        var inner = tupleStruct.fields().get(0);
        if (isRefutable(inner)) {
            return Optional.empty();
        }
        if (peelBlocks(fallback) instanceof Expr.Ret ret
            && ret.value().filter(value -> isLangCtor(value, LangItem.OPTION_NONE)).isPresent()) {
            return Optional.of(inner);
        }
        return Optional.empty();
    }

    private static boolean containsComment(AnalysisContext cx, Block fallback) {
        var sourceMap = cx.sourceMap();
        var span = sourceMap.span(fallback.id());
        if (sourceMap.snippet(span, "").fidelity() == SnippetFidelity.PLACEHOLDER) {
            return true;
        }
        return sourceMap.containsComment(span);
    }
}
