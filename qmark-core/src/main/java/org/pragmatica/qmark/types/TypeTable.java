package org.pragmatica.qmark.types;

import org.pragmatica.qmark.tree.NodeId;

/**
 * Per-expression type information supplied by the host's type checker.
 */
public interface TypeTable {
    /**
     * Type of the expression as written.
     */
    Ty exprType(NodeId expr);

    /**
     * Type of the expression after implicit borrow and deref adjustments.
     */
    default Ty adjustedType(NodeId expr) {
        return exprType(expr);
    }
}
