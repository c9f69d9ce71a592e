package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Body;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.Stmt;

/**
 * Callbacks invoked by {@link PassDriver} while it walks a body.
 * <p>
 * Every {@code checkX} hook runs before the children of the node are visited; the {@code Post}
 * hooks run after them. A pass instance holds per-analysis state and must not be shared between
 * concurrent analyses.
 */
public interface LintPass {
    default void checkBody(AnalysisContext cx, Body body) {}

    default void checkBodyPost(AnalysisContext cx, Body body) {}

    default void checkBlock(AnalysisContext cx, Block block) {}

    default void checkBlockPost(AnalysisContext cx, Block block) {}

    default void checkStmt(AnalysisContext cx, Stmt stmt) {}

    default void checkExpr(AnalysisContext cx, Expr expr) {}
}
