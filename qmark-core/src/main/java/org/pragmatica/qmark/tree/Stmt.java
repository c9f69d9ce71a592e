package org.pragmatica.qmark.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statements.
 */
public sealed interface Stmt extends Node {
    /**
     * {@code let pat = init else { ... };}
     */
    record Let(NodeId id, Pat pat, Optional<Expr> init, Optional<Block> orElse) implements Stmt {
        @Override
        public List<Node> children() {
            var children = new ArrayList<Node>();
            children.add(pat);
            init.ifPresent(children::add);
            orElse.ifPresent(children::add);
            return children;
        }
    }

    /**
     * Expression followed by a semicolon.
     */
    record Semi(NodeId id, Expr expr) implements Stmt {
        @Override
        public List<Node> children() {
            return List.of(expr);
        }
    }

    /**
     * Block-like expression in statement position without a semicolon.
     */
    record Expression(NodeId id, Expr expr) implements Stmt {
        @Override
        public List<Node> children() {
            return List.of(expr);
        }
    }

    /// The expression this statement wraps, if it is an expression statement.
    default Optional<Expr> expression() {
        if (this instanceof Semi semi) {
            return Optional.of(semi.expr());
        }
        if (this instanceof Expression expression) {
            return Optional.of(expression.expr());
        }
        return Optional.empty();
    }
}
