package org.pragmatica.qmark.tree;

import java.util.Optional;

/**
 * Static helpers for inspecting tree shapes.
 */
public final class TreeNodes {
    private TreeNodes() {}

    /**
     * Strips plain blocks that consist of a tail expression only: {@code { { x } }} becomes {@code x}.
     * Unsafe blocks are kept.
     */
    public static Expr peelBlocks(Expr expr) {
        var current = expr;
        while (current instanceof Expr.BlockExpr blockExpr
               && !blockExpr.block().unsafe()
               && blockExpr.block().stmts().isEmpty()
               && blockExpr.block().expr().isPresent()) {
            current = blockExpr.block().expr().get();
        }
        return current;
    }

    /**
     * Like {@link #peelBlocks(Expr)}, but also strips blocks without a tail that hold exactly one
     * expression statement: {@code { return x; }} becomes {@code return x}.
     */
    public static Expr peelBlocksWithStmt(Expr expr) {
        var current = expr;
        while (current instanceof Expr.BlockExpr blockExpr && !blockExpr.block().unsafe()) {
            var inner = singleExpression(blockExpr.block());
            if (inner.isEmpty()) {
                break;
            }
            current = inner.get();
        }
        return current;
    }

    private static Optional<Expr> singleExpression(Block block) {
        if (block.stmts().isEmpty()) {
            return block.expr();
        }
        if (block.stmts().size() == 1 && block.expr().isEmpty()) {
            return block.stmts().get(0).expression();
        }
        return Optional.empty();
    }

    /// Binding id of the local the expression names, if it is a bare path to a local.
    public static Optional<NodeId> pathToLocal(Expr expr) {
        if (expr instanceof Expr.Path path && path.res() instanceof Res.Local local) {
            return Optional.of(local.binding());
        }
        return Optional.empty();
    }

    public static boolean pathToLocalId(Expr expr, NodeId binding) {
        return pathToLocal(expr).filter(binding::equals).isPresent();
    }

    public static boolean isPathLangItem(Expr expr, LangItem item) {
        return expr instanceof Expr.Path path
               && path.res() instanceof Res.Lang lang
               && lang.item() == item;
    }

    public static boolean isLangCtor(Expr expr, LangItem item) {
        return expr instanceof Expr.Path path && path.res().isLangCtor(item);
    }

    /**
     * Whether the pattern can fail to match. Unresolved paths count as refutable.
     */
    public static boolean isRefutable(Pat pat) {
        if (pat instanceof Pat.Wild) {
            return false;
        }
        if (pat instanceof Pat.Binding binding) {
            return binding.sub().map(TreeNodes::isRefutable).orElse(false);
        }
        if (pat instanceof Pat.Tuple tuple) {
            return tuple.elems().stream().anyMatch(TreeNodes::isRefutable);
        }
        if (pat instanceof Pat.TupleStruct tupleStruct) {
            return isVariantOrUnknown(tupleStruct.res())
                   || tupleStruct.fields().stream().anyMatch(TreeNodes::isRefutable);
        }
        if (pat instanceof Pat.Path path) {
            return !(path.res() instanceof Res.Def def && def.kind() == DefKind.STRUCT_CTOR);
        }
        return true;
    }

    private static boolean isVariantOrUnknown(Res res) {
        if (res instanceof Res.Def def) {
            return def.kind() != DefKind.STRUCT_CTOR;
        }
        return true;
    }
}
