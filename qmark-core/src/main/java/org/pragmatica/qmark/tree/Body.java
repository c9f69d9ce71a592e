package org.pragmatica.qmark.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Function, closure or constant body: the unit of traversal.
 */
public record Body(NodeId id, BodyKind kind, List<Pat> params, Expr value) implements Node {
    public Body {
        params = List.copyOf(params);
    }

    @Override
    public List<Node> children() {
        var children = new ArrayList<Node>(params);
        children.add(value);
        return children;
    }
}
