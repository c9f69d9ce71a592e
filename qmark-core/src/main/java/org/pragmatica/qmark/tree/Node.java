package org.pragmatica.qmark.tree;

import java.util.List;

/**
 * Common view of every node of the resolved tree.
 * <p>
 * Nodes are immutable and carry no source locations or types: both live in side tables keyed
 * by {@link NodeId}, which lets a host supply them from its own front end.
 */
public sealed interface Node permits Body, Block, Stmt, Expr, Pat {
    NodeId id();

    /**
     * Direct children in source order.
     */
    List<Node> children();
}
