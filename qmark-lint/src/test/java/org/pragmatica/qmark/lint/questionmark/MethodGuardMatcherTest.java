package org.pragmatica.qmark.lint.questionmark;

import org.junit.jupiter.api.Test;
import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.Confidence;
import org.pragmatica.qmark.lint.LintContext;
import org.pragmatica.qmark.tree.Body;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.TreeBuilder;
import org.pragmatica.qmark.types.Ty;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.qmark.tree.TreeBuilder.treeBuilder;

class MethodGuardMatcherTest {
    private static final Ty OPTION_I32 = Ty.option("i32", true);
    private static final Ty OPTION_STRING = Ty.option("String", false);

    private final TreeBuilder b = treeBuilder();

    private AnalysisContext context(Body... bodies) {
        return AnalysisContext.analysisContext(b.unit("guard.rs", bodies), LintContext.defaultContext());
    }

    private Body wrap(Expr.If guard, Expr tail) {
        return b.fn(List.of(), b.block(List.of(b.stmt(guard)), tail));
    }

    @Test
    void match_isNoneWithReturnNone_matchesOptionFamily() {
        var v = b.binding("v", OPTION_I32);
        var guard = b.ifThen(b.methodCall(b.local(v), "is_none"), b.block(b.semi(b.ret(b.none()))));
        var cx = context(wrap(guard, b.local(v)));

        var matched = MethodGuardMatcher.match(cx, guard);

        assertThat(matched).isPresent();
        assertThat(matched.get().family()).isEqualTo(GuardFamily.OPTION);
        assertThat(matched.get().receiverType()).isEqualTo(OPTION_I32);
    }

    @Test
    void match_isSomePredicate_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var guard = b.ifThen(b.methodCall(b.local(v), "is_some"), b.block(b.semi(b.ret(b.none()))));
        var cx = context(wrap(guard, b.local(v)));

        assertThat(MethodGuardMatcher.match(cx, guard)).isEmpty();
    }

    @Test
    void match_predicateWithArguments_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var guard = b.ifThen(b.methodCall(b.local(v), "is_none", b.lit("1")), b.block(b.semi(b.ret(b.none()))));
        var cx = context(wrap(guard, b.local(v)));

        assertThat(MethodGuardMatcher.match(cx, guard)).isEmpty();
    }

    @Test
    void match_receiverOfOtherType_doesNotMatch() {
        var v = b.binding("v", Ty.plain("Vec<i32>", false));
        var guard = b.ifThen(b.methodCall(b.local(v), "is_none"), b.block(b.semi(b.ret(b.none()))));
        var cx = context(wrap(guard, b.none()));

        assertThat(MethodGuardMatcher.match(cx, guard)).isEmpty();
    }

    @Test
    void match_returnOfSomeValue_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var guard = b.ifThen(b.methodCall(b.local(v), "is_none"), b.block(b.semi(b.ret(b.some(b.lit("0"))))));
        var cx = context(wrap(guard, b.local(v)));

        assertThat(MethodGuardMatcher.match(cx, guard)).isEmpty();
    }

    @Test
    void match_elseYieldingReceiver_suggestsWrappedForm() {
        var v = b.binding("v", OPTION_I32);
        var guard = b.ifElse(b.methodCall(b.local(v), "is_none"),
                             b.block(b.semi(b.ret(b.none()))),
                             b.blockExpr(b.valueBlock(b.local(v))));
        var cx = context(b.fn(List.of(v), b.valueBlock(guard)));

        var matched = MethodGuardMatcher.match(cx, guard);

        assertThat(matched).isPresent();
        var suggestion = SuggestionSynthesizer.synthesize(cx, matched.get());
        assertThat(suggestion.replacement()).isEqualTo("Some(v?)");
        assertThat(suggestion.confidence()).isEqualTo(Confidence.DEFINITE);
    }

    @Test
    void match_resultElseYieldingReceiver_wrapsWithOk() {
        var r = b.binding("r", Ty.result("i32", "i32", true));
        var guard = b.ifElse(b.methodCall(b.local(r), "is_err"),
                             b.block(b.semi(b.ret(b.local(r)))),
                             b.blockExpr(b.valueBlock(b.local(r))));
        var cx = context(b.fn(List.of(r), b.valueBlock(guard)));

        var matched = MethodGuardMatcher.match(cx, guard);

        assertThat(matched).isPresent();
        assertThat(SuggestionSynthesizer.synthesize(cx, matched.get()).replacement()).isEqualTo("Ok(r?)");
    }

    @Test
    void match_wrappedFormOverNonCopyPlace_needsReview() {
        var v = b.binding("v", OPTION_STRING);
        var guard = b.ifElse(b.methodCall(b.local(v), "is_none"),
                             b.block(b.semi(b.ret(b.none()))),
                             b.blockExpr(b.valueBlock(b.local(v))));
        var cx = context(b.fn(List.of(v), b.valueBlock(guard)));

        var suggestion = SuggestionSynthesizer.synthesize(cx, MethodGuardMatcher.match(cx, guard).orElseThrow());

        assertThat(suggestion.replacement()).isEqualTo("Some(v?)");
        assertThat(suggestion.confidence()).isEqualTo(Confidence.NEEDS_REVIEW);
    }

    @Test
    void match_elseYieldingSomethingElse_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var w = b.binding("w", OPTION_I32);
        var guard = b.ifElse(b.methodCall(b.local(v), "is_none"),
                             b.block(b.semi(b.ret(b.none()))),
                             b.blockExpr(b.valueBlock(b.local(w))));
        var cx = context(b.fn(List.of(v, w), b.valueBlock(guard)));

        assertThat(MethodGuardMatcher.match(cx, guard)).isEmpty();
    }

    @Test
    void match_customEquality_decidesElseBranch() {
        var v = b.binding("v", OPTION_I32);
        var w = b.binding("w", OPTION_I32);
        var guard = b.ifElse(b.methodCall(b.local(v), "is_none"),
                             b.block(b.semi(b.ret(b.none()))),
                             b.blockExpr(b.valueBlock(b.local(w))));
        var cx = context(b.fn(List.of(v, w), b.valueBlock(guard))).withEquality((left, right) -> true);

        assertThat(MethodGuardMatcher.match(cx, guard)).isPresent();
    }

    @Test
    void match_receiverFromMacroExpansion_isLikelyCorrect() {
        var v = b.binding("v", OPTION_I32);
        var receiver = b.expanded(b.local(v));
        var guard = b.ifThen(b.methodCall(receiver, "is_none"), b.block(b.semi(b.ret(b.none()))));
        var cx = context(wrap(guard, b.local(v)));

        var suggestion = SuggestionSynthesizer.synthesize(cx, MethodGuardMatcher.match(cx, guard).orElseThrow());

        assertThat(suggestion.replacement()).isEqualTo("v?;");
        assertThat(suggestion.confidence()).isEqualTo(Confidence.LIKELY_CORRECT);
    }

    @Test
    void match_returnThroughNestedBlocks_matches() {
        var v = b.binding("v", OPTION_I32);
        var nested = b.blockExpr(b.valueBlock(b.blockExpr(b.valueBlock(b.none()))));
        var guard = b.ifThen(b.methodCall(b.local(v), "is_none"), b.block(b.semi(b.ret(nested))));
        var cx = context(wrap(guard, b.local(v)));

        assertThat(MethodGuardMatcher.match(cx, guard)).isPresent();
    }

    @Test
    void match_unsafeBlockAroundReturn_doesNotMatch() {
        var v = b.binding("v", OPTION_I32);
        var guard = b.ifThen(b.methodCall(b.local(v), "is_none"),
                             b.block(b.semi(b.blockExpr(b.unsafeBlock(b.ret(b.none()))))));
        var cx = context(wrap(guard, b.local(v)));

        assertThat(MethodGuardMatcher.match(cx, guard)).isEmpty();
    }
}
