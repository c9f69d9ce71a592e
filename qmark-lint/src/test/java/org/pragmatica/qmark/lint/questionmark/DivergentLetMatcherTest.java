package org.pragmatica.qmark.lint.questionmark;

import org.junit.jupiter.api.Test;
import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.Confidence;
import org.pragmatica.qmark.lint.LintContext;
import org.pragmatica.qmark.lint.SourceUnit;
import org.pragmatica.qmark.source.Position;
import org.pragmatica.qmark.source.Snippet;
import org.pragmatica.qmark.source.SourceMap;
import org.pragmatica.qmark.source.Span;
import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Body;
import org.pragmatica.qmark.tree.NodeId;
import org.pragmatica.qmark.tree.Pat;
import org.pragmatica.qmark.tree.Stmt;
import org.pragmatica.qmark.tree.TreeBuilder;
import org.pragmatica.qmark.types.Ty;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.qmark.tree.TreeBuilder.treeBuilder;

class DivergentLetMatcherTest {
    private static final Ty OPTION_I32 = Ty.option("i32", true);
    private static final Ty I32 = Ty.plain("i32", true);

    private final TreeBuilder b = treeBuilder();

    private AnalysisContext context(Body... bodies) {
        return AnalysisContext.analysisContext(b.unit("guard.rs", bodies), LintContext.defaultContext());
    }

    private Body wrap(Stmt.Let let) {
        return b.fn(List.of(), b.block(List.of(let), b.none()));
    }

    private Block returnNone() {
        return b.block(b.semi(b.ret(b.none())));
    }

    /// Delegates to the printed source but reports no location for one node.
    private record UnlocatedNode(SourceMap delegate, NodeId hidden) implements SourceMap {
        @Override
        public String fileName() {
            return delegate.fileName();
        }

        @Override
        public Span span(NodeId node) {
            return node.equals(hidden) ? Span.DUMMY : delegate.span(node);
        }

        @Override
        public Snippet snippet(Span span, String fallback) {
            return delegate.snippet(span, fallback);
        }

        @Override
        public boolean containsComment(Span span) {
            return delegate.containsComment(span);
        }

        @Override
        public Position position(int offset) {
            return delegate.position(offset);
        }
    }

    @Test
    void match_tuplePatternInsideSome_keepsWholeInnerPattern() {
        var v = b.binding("v", Ty.option("(i32, i32)", true));
        var inner = b.tuplePat(b.binding("a", I32), b.binding("b", I32));
        var let = b.letElse(b.somePat(inner), b.local(v), returnNone());
        var cx = context(b.fn(List.of(v), b.block(List.of(let), b.none())));

        var matched = DivergentLetMatcher.match(cx, let);

        assertThat(matched).isPresent();
        assertThat(matched.get().bindingCore()).isSameAs(inner);
        var suggestion = SuggestionSynthesizer.synthesize(cx, matched.get());
        assertThat(suggestion.replacement()).isEqualTo("let (a, b) = v?;");
        assertThat(suggestion.confidence()).isEqualTo(Confidence.NEEDS_REVIEW);
    }

    @Test
    void match_refutableInnerPattern_doesNotMatch() {
        var v = b.binding("v", Ty.option("Option<i32>", true));
        var let = b.letElse(b.somePat(b.somePat(b.binding("x", I32))), b.local(v), returnNone());

        assertThat(DivergentLetMatcher.match(context(wrap(let)), let)).isEmpty();
    }

    @Test
    void match_initializerAdjustedToReference_doesNotMatch() {
        var self = b.binding("self", Ty.plain("&Config", true));
        var field = b.adjusted(b.typed(b.field(b.local(self), "opt"), OPTION_I32), Ty.reference(OPTION_I32));
        var let = b.letElse(b.somePat(b.binding("x", I32)), field, returnNone());
        var cx = context(b.fn(List.of(self), b.block(List.of(let), b.none())));

        assertThat(DivergentLetMatcher.match(cx, let)).isEmpty();
    }

    @Test
    void match_fallbackWithSeveralStatements_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var fallback = b.block(b.semi(b.callFn("log_missing")), b.semi(b.ret(b.none())));
        var let = b.letElse(b.somePat(b.binding("x", I32)), b.local(v), fallback);

        assertThat(DivergentLetMatcher.match(context(wrap(let)), let)).isEmpty();
    }

    @Test
    void match_fallbackThatPanics_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var fallback = b.block(b.semi(b.callFn("panic")));
        var let = b.letElse(b.somePat(b.binding("x", I32)), b.local(v), fallback);

        assertThat(DivergentLetMatcher.match(context(wrap(let)), let)).isEmpty();
    }

    @Test
    void match_okPattern_doesNotMatch() {
        var r = b.binding("r", Ty.result("i32", "i32", true));
        var let = b.letElse(b.okPat(b.binding("x", I32)), b.local(r), b.block(b.semi(b.ret(b.local(r)))));

        assertThat(DivergentLetMatcher.match(context(wrap(let)), let)).isEmpty();
    }

    @Test
    void match_plainLet_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var let = b.let(b.binding("x", OPTION_I32), b.local(v));

        assertThat(DivergentLetMatcher.match(context(wrap(let)), let)).isEmpty();
    }

    @Test
    void match_fallbackWithoutLocation_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var fallback = returnNone();
        var let = b.letElse(b.somePat(b.binding("x", I32)), b.local(v), fallback);
        var printed = b.unit("guard.rs", b.fn(List.of(v), b.block(List.of(let), b.none())));
        var unit = SourceUnit.sourceUnit(printed.fileName(),
                                         printed.bodies(),
                                         new UnlocatedNode(printed.sourceMap(), fallback.id()),
                                         printed.types());

        assertThat(DivergentLetMatcher.match(AnalysisContext.analysisContext(printed, LintContext.defaultContext()), let))
            .isPresent();
        assertThat(DivergentLetMatcher.match(AnalysisContext.analysisContext(unit, LintContext.defaultContext()), let))
            .isEmpty();
        assertThat(QuestionMarkRule.questionMarkRule().analyze(unit, LintContext.defaultContext())).isEmpty();
    }

    @Test
    void fallbackExpression_tailOrSingleReturn() {
        var tail = b.none();
        var ret = b.ret(b.none());

        assertThat(DivergentLetMatcher.fallbackExpression(b.valueBlock(tail))).contains(tail);
        assertThat(DivergentLetMatcher.fallbackExpression(b.block(b.semi(ret)))).contains(ret);
        assertThat(DivergentLetMatcher.fallbackExpression(b.block(b.semi(b.callFn("panic"))))).isEmpty();
    }

    @Test
    void bindingCore_wildcardInner_isIrrefutable() {
        Pat wild = b.wild();

        assertThat(DivergentLetMatcher.bindingCore(b.somePat(wild), b.ret(b.none()))).contains(wild);
        assertThat(DivergentLetMatcher.bindingCore(b.somePat(wild), b.ret())).isEmpty();
    }
}
