package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.Diagnostic;
import org.pragmatica.qmark.lint.DiagnosticSink;
import org.pragmatica.qmark.lint.LintPass;
import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Body;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.NodeId;
import org.pragmatica.qmark.tree.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.pragmatica.qmark.lint.questionmark.QuestionMarkRule.QUESTION_MARK_USED;
import static org.pragmatica.qmark.lint.questionmark.QuestionMarkRule.RULE_ID;

/// Dispatches tree callbacks to the three matchers.
///
/// Matching is skipped inside try blocks, in compile-time contexts and wherever `?` itself is
/// forbidden by the restriction rule. One instance per analysis: the scope tracker is not shared.
final class QuestionMarkPass implements LintPass {
    private static final Logger log = LoggerFactory.getLogger(QuestionMarkPass.class);

    private static final String BLOCK_MESSAGE = "this block may be rewritten with the `?` operator";
    private static final String LET_ELSE_MESSAGE = "this `let...else` may be rewritten with the `?` operator";
    private static final String HELP = "replace it with";

    private static final MatchedGuard.Cases<String> MESSAGES = new MatchedGuard.Cases<>() {
        @Override
        public String methodGuard(MatchedGuard.MethodGuard guard) {
            return BLOCK_MESSAGE;
        }

        @Override
        public String destructureGuard(MatchedGuard.DestructureGuard guard) {
            return BLOCK_MESSAGE;
        }

        @Override
        public String divergentLet(MatchedGuard.DivergentLet guard) {
            return LET_ELSE_MESSAGE;
        }
    };

    private final ScopeTracker scopes = new ScopeTracker();
    private final DiagnosticSink sink;

    QuestionMarkPass(DiagnosticSink sink) {
        this.sink = sink;
    }

    @Override
    public void checkBody(AnalysisContext cx, Body body) {
        scopes.enterBody();
    }

    @Override
    public void checkBodyPost(AnalysisContext cx, Body body) {
        scopes.exitBody();
    }

    @Override
    public void checkBlock(AnalysisContext cx, Block block) {
        if (scopes.enterBlock(block)) {
            log.trace("Entered try block {} at depth {}", block.id(), scopes.depth());
        }
    }

    @Override
    public void checkBlockPost(AnalysisContext cx, Block block) {
        if (scopes.exitBlock(block)) {
            log.trace("Left try block {}, depth now {}", block.id(), scopes.depth());
        }
    }

    @Override
    public void checkStmt(AnalysisContext cx, Stmt stmt) {
        if (!canSuggest(cx, stmt.id())) {
            return;
        }
        DivergentLetMatcher.match(cx, stmt)
                           .ifPresent(guard -> report(cx, guard));
    }

    @Override
    public void checkExpr(AnalysisContext cx, Expr expr) {
        if (!canSuggest(cx, expr.id())) {
            return;
        }
        MethodGuardMatcher.match(cx, expr)
                          .ifPresent(guard -> report(cx, guard));
        DestructureGuardMatcher.match(cx, expr)
                               .ifPresent(guard -> report(cx, guard));
    }

    private boolean canSuggest(AnalysisContext cx, NodeId node) {
        return !scopes.isSuppressed()
               && !cx.tree().isInConstContext(node)
               && !cx.levels().isEnabled(QUESTION_MARK_USED, node);
    }

    private void report(AnalysisContext cx, MatchedGuard guard) {
        var site = guard.site().id();
        if (!cx.levels().isEnabled(RULE_ID, site)) {
            return;
        }
        var suggestion = SuggestionSynthesizer.synthesize(cx, guard);
        var position = cx.sourceMap().position(suggestion.span().lo());
        var message = guard.fold(MESSAGES);
        log.trace("Suggesting `{}` for {} ({})", suggestion.replacement(), site, suggestion.confidence());
        sink.emit(Diagnostic.diagnostic(RULE_ID,
                                        cx.lint().severityFor(RULE_ID),
                                        cx.lint().fileName(),
                                        position.line(),
                                        position.column(),
                                        message,
                                        HELP)
                            .withSuggestion(suggestion));
    }
}
