package org.pragmatica.qmark.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expressions of the resolved tree.
 */
public sealed interface Expr extends Node {
    /**
     * Path to a local, a constructor, a function or a constant, already resolved.
     */
    record Path(NodeId id, List<String> segments, Res res) implements Expr {
        public Path {
            if (segments.isEmpty()) {
                throw new IllegalArgumentException("Path " + id + " has no segments");
            }
            segments = List.copyOf(segments);
        }

        public String firstSegment() {
            return segments.get(0);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record Lit(NodeId id, String text) implements Expr {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record Call(NodeId id, Expr callee, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public List<Node> children() {
            var children = new ArrayList<Node>();
            children.add(callee);
            children.addAll(args);
            return children;
        }
    }

    record MethodCall(NodeId id, String method, Expr receiver, List<Expr> args) implements Expr {
        public MethodCall {
            args = List.copyOf(args);
        }

        @Override
        public List<Node> children() {
            var children = new ArrayList<Node>();
            children.add(receiver);
            children.addAll(args);
            return children;
        }
    }

    record Field(NodeId id, Expr base, String name) implements Expr {
        @Override
        public List<Node> children() {
            return List.of(base);
        }
    }

    /**
     * {@code if cond { then } else { orElse }}. The then branch is always a block expression,
     * the else branch is a block expression or another {@code if}.
     */
    record If(NodeId id, Expr cond, Expr then, Optional<Expr> orElse) implements Expr {
        @Override
        public List<Node> children() {
            var children = new ArrayList<Node>();
            children.add(cond);
            children.add(then);
            orElse.ifPresent(children::add);
            return children;
        }
    }

    /**
     * {@code if let pat = scrutinee { then } else { orElse }}.
     */
    record IfLet(NodeId id, Pat pat, Expr scrutinee, Expr then, Optional<Expr> orElse) implements Expr {
        @Override
        public List<Node> children() {
            var children = new ArrayList<Node>();
            children.add(pat);
            children.add(scrutinee);
            children.add(then);
            orElse.ifPresent(children::add);
            return children;
        }
    }

    record Ret(NodeId id, Optional<Expr> value) implements Expr {
        @Override
        public List<Node> children() {
            return value.<List<Node>>map(List::of).orElse(List.of());
        }
    }

    record BlockExpr(NodeId id, Block block) implements Expr {
        @Override
        public List<Node> children() {
            return List.of(block);
        }
    }

    /**
     * The propagation operator, {@code inner?}.
     */
    record Try(NodeId id, Expr inner) implements Expr {
        @Override
        public List<Node> children() {
            return List.of(inner);
        }
    }

    /**
     * Closure; its body is a separate traversal unit.
     */
    record Closure(NodeId id, Body body) implements Expr {
        @Override
        public List<Node> children() {
            return List.of(body);
        }
    }

    /**
     * Inline {@code const { ... }} block, evaluated at compile time.
     */
    record ConstBlock(NodeId id, Block block) implements Expr {
        @Override
        public List<Node> children() {
            return List.of(block);
        }
    }

    record Ref(NodeId id, boolean mutable, Expr inner) implements Expr {
        @Override
        public List<Node> children() {
            return List.of(inner);
        }
    }

    record Binary(NodeId id, String op, Expr lhs, Expr rhs) implements Expr {
        @Override
        public List<Node> children() {
            return List.of(lhs, rhs);
        }
    }
}
