package org.pragmatica.qmark.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Braced block: statements followed by an optional tail expression.
 *
 * @param unsafe   whether the block is an {@code unsafe} block
 * @param comments comment trivia printed at the start of the block; analysis never reads it
 */
public record Block(NodeId id, List<Stmt> stmts, Optional<Expr> expr, boolean unsafe, List<String> comments)
        implements Node {
    public Block {
        stmts = List.copyOf(stmts);
        comments = List.copyOf(comments);
    }

    public boolean isEmpty() {
        return stmts.isEmpty() && expr.isEmpty();
    }

    @Override
    public List<Node> children() {
        var children = new ArrayList<Node>(stmts);
        expr.ifPresent(children::add);
        return children;
    }
}
