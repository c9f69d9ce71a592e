package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.Confidence;
import org.pragmatica.qmark.lint.Suggestion;
import org.pragmatica.qmark.lint.questionmark.MatchedGuard.DestructureGuard;
import org.pragmatica.qmark.lint.questionmark.MatchedGuard.DivergentLet;
import org.pragmatica.qmark.lint.questionmark.MatchedGuard.MethodGuard;
import org.pragmatica.qmark.source.Snippet;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.Node;

/// Turns a matched guard into replacement text and a confidence tier.
final class SuggestionSynthesizer implements MatchedGuard.Cases<Suggestion> {
    private static final String PLACEHOLDER = "..";

    private final AnalysisContext cx;

    private SuggestionSynthesizer(AnalysisContext cx) {
        this.cx = cx;
    }

    static Suggestion synthesize(AnalysisContext cx, MatchedGuard guard) {
        return guard.fold(new SuggestionSynthesizer(cx));
    }

    /// `recv?;`, `recv.as_ref()?;` or, with an else branch yielding the receiver, `Some(recv?)`.
    @Override
    public Suggestion methodGuard(MethodGuard guard) {
        var receiver = snippet(guard.receiver());
        var byRef = !guard.receiverType().copy() && !isCall(guard.receiver());

        if (guard.orElse().isPresent()) {
            // `?` on a place moves it, while the guard only borrowed it
            var confidence = byRef
                             ? Confidence.NEEDS_REVIEW
                             : Confidence.DEFINITE;
            return suggestion(guard.site(),
                              guard.family().successWrapper() + "(" + receiver.text() + "?)",
                              confidence.degradeTo(receiver.fidelity()));
        }
        var qualifier = byRef
                        ? ".as_ref()"
                        : "";
        return suggestion(guard.site(),
                          receiver.text() + qualifier + "?;",
                          Confidence.DEFINITE.degradeTo(receiver.fidelity()));
    }

    /// `scrutinee?`, with `.as_ref()`/`.as_mut()` for `ref`/`ref mut` bindings and `;` in statement position.
    @Override
    public Suggestion destructureGuard(DestructureGuard guard) {
        var scrutinee = snippet(guard.scrutinee());
        var qualifier = switch (guard.binding().mode()) {
            case VALUE -> "";
            case REF -> ".as_ref()";
            case REF_MUT -> ".as_mut()";
        };
        var terminator = cx.tree().parentIsStatement(guard.site())
                         ? ";"
                         : "";
        return suggestion(guard.site(),
                          scrutinee.text() + qualifier + "?" + terminator,
                          Confidence.DEFINITE.degradeTo(scrutinee.fidelity()));
    }

    /// `let <core> = <init>?;`. The initializer's type is inferred, so this always needs review.
    @Override
    public Suggestion divergentLet(DivergentLet guard) {
        var core = snippet(guard.bindingCore());
        var init = snippet(guard.init());
        var confidence = Confidence.NEEDS_REVIEW.degradeTo(core.fidelity())
                                                .degradeTo(init.fidelity());
        return suggestion(guard.site(), "let " + core.text() + " = " + init.text() + "?;", confidence);
    }

    private static boolean isCall(Expr expr) {
        return expr instanceof Expr.Call || expr instanceof Expr.MethodCall;
    }

    private Snippet snippet(Node node) {
        var sourceMap = cx.sourceMap();
        return sourceMap.snippet(sourceMap.span(node.id()), PLACEHOLDER);
    }

    private Suggestion suggestion(Node site, String replacement, Confidence confidence) {
        return Suggestion.suggestion(cx.sourceMap().span(site.id()), replacement, confidence);
    }
}
