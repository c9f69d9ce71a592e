package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.lint.AnalysisContext;
import org.pragmatica.qmark.lint.Diagnostic;
import org.pragmatica.qmark.lint.DiagnosticSink;
import org.pragmatica.qmark.lint.LintContext;
import org.pragmatica.qmark.lint.LintPass;
import org.pragmatica.qmark.lint.LintRule;
import org.pragmatica.qmark.lint.PassDriver;
import org.pragmatica.qmark.lint.SourceUnit;
import org.pragmatica.qmark.tree.Body;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/// QMARK-01: Early-return guards that could use the `?` operator.
///
/// Detected patterns:
///
///   - `if x.is_none() { return None; }` becomes `x?;`
///   - `if r.is_err() { return r; }` becomes `r?;`
///   - `if let Some(v) = x { v } else { return None }` becomes `x?`
///   - `if let Err(e) = r { return Err(e); }` becomes `r?;`
///   - `let Some(v) = x else { return None };` becomes `let v = x?;`
///
/// Nothing is reported where `?` is forbidden by QMARK-02.
public final class QuestionMarkRule implements LintRule {
    private static final Logger log = LoggerFactory.getLogger(QuestionMarkRule.class);

    public static final String RULE_ID = "QMARK-01";
    /// Restriction rule forbidding the `?` operator; when enabled, no `?` is suggested.
    public static final String QUESTION_MARK_USED = "QMARK-02";

    private QuestionMarkRule() {}

    public static QuestionMarkRule questionMarkRule() {
        return new QuestionMarkRule();
    }

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public String description() {
        return "Early-return guard could be replaced by the `?` operator";
    }

    @Override
    public Stream<Diagnostic> analyze(SourceUnit unit, LintContext ctx) {
        return analyze(AnalysisContext.analysisContext(unit, ctx), unit.bodies());
    }

    /// Analyze bodies with an already built context, e.g. one with a custom value equality.
    public Stream<Diagnostic> analyze(AnalysisContext cx, List<Body> bodies) {
        var diagnostics = new ArrayList<Diagnostic>();
        PassDriver.run(newPass(diagnostics::add), cx, bodies);
        log.debug("Analyzed {} bodies in {}: {} suggestion(s)", bodies.size(), cx.lint().fileName(), diagnostics.size());
        return diagnostics.stream();
    }

    /// Callback set for hosts that drive the traversal themselves. Use one pass per analysis.
    public LintPass newPass(DiagnosticSink sink) {
        return new QuestionMarkPass(sink);
    }
}
