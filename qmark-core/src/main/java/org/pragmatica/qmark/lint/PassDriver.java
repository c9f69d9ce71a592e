package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Body;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.Node;
import org.pragmatica.qmark.tree.Stmt;

import java.util.List;

/**
 * Walks bodies once, in source order, calling the hooks of a {@link LintPass}.
 * Closures are walked as nested bodies. Patterns have no hooks and are not descended into.
 */
public final class PassDriver {
    private final LintPass pass;
    private final AnalysisContext cx;

    private PassDriver(LintPass pass, AnalysisContext cx) {
        this.pass = pass;
        this.cx = cx;
    }

    public static void run(LintPass pass, AnalysisContext cx, List<Body> bodies) {
        var driver = new PassDriver(pass, cx);
        bodies.forEach(driver::walkBody);
    }

    private void walkBody(Body body) {
        pass.checkBody(cx, body);
        walkExpr(body.value());
        pass.checkBodyPost(cx, body);
    }

    private void walkBlock(Block block) {
        pass.checkBlock(cx, block);
        walkChildren(block);
        pass.checkBlockPost(cx, block);
    }

    private void walkStmt(Stmt stmt) {
        pass.checkStmt(cx, stmt);
        walkChildren(stmt);
    }

    private void walkExpr(Expr expr) {
        pass.checkExpr(cx, expr);
        walkChildren(expr);
    }

    private void walkChildren(Node node) {
        for (var child : node.children()) {
            if (child instanceof Body body) {
                walkBody(body);
            } else if (child instanceof Block block) {
                walkBlock(block);
            } else if (child instanceof Stmt stmt) {
                walkStmt(stmt);
            } else if (child instanceof Expr expr) {
                walkExpr(expr);
            }
        }
    }
}
