package org.pragmatica.qmark.tree;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parent links and compile-time-context membership for a set of bodies, computed in one pass.
 */
public final class TreeIndex {
    private final Map<NodeId, Node> parents;
    private final Set<NodeId> constContext;

    private TreeIndex(Map<NodeId, Node> parents, Set<NodeId> constContext) {
        this.parents = parents;
        this.constContext = constContext;
    }

    public static TreeIndex treeIndex(List<Body> bodies) {
        var parents = new HashMap<NodeId, Node>();
        var constContext = new HashSet<NodeId>();
        var pending = new ArrayDeque<Visit>();

        bodies.forEach(body -> pending.push(new Visit(body, false)));

        while (!pending.isEmpty()) {
            var visit = pending.pop();
            var node = visit.node();
            var inConst = enclosingContext(node, visit.inConst());

            if (inConst) {
                constContext.add(node.id());
            }
            for (var child : node.children()) {
                parents.put(child.id(), node);
                pending.push(new Visit(child, inConst || node instanceof Expr.ConstBlock));
            }
        }
        return new TreeIndex(Map.copyOf(parents), Set.copyOf(constContext));
    }

    private static boolean enclosingContext(Node node, boolean inherited) {
        if (node instanceof Body body) {
            return body.kind().isConstContext();
        }
        return inherited;
    }

    public Optional<Node> parent(NodeId id) {
        return Optional.ofNullable(parents.get(id));
    }

    /**
     * Whether the node is evaluated at compile time: inside a const, static or const fn body,
     * or inside an inline const block.
     */
    public boolean isInConstContext(NodeId id) {
        return constContext.contains(id);
    }

    /**
     * Whether the expression is the else branch of an enclosing {@code if} or {@code if let}.
     */
    public boolean isElseClause(Expr expr) {
        return parent(expr.id()).flatMap(TreeIndex::elseBranch)
                                .filter(orElse -> orElse.id().equals(expr.id()))
                                .isPresent();
    }

    private static Optional<Expr> elseBranch(Node node) {
        if (node instanceof Expr.If ifExpr) {
            return ifExpr.orElse();
        }
        if (node instanceof Expr.IfLet ifLet) {
            return ifLet.orElse();
        }
        return Optional.empty();
    }

    /**
     * Whether the expression is the whole of an expression statement. Initializers of {@code let}
     * statements do not count.
     */
    public boolean parentIsStatement(Expr expr) {
        return parent(expr.id()).filter(parent -> parent instanceof Stmt.Semi || parent instanceof Stmt.Expression)
                                .isPresent();
    }

    private record Visit(Node node, boolean inConst) {}
}
