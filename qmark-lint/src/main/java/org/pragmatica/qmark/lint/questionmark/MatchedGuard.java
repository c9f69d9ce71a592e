package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.LangItem;
import org.pragmatica.qmark.tree.Node;
import org.pragmatica.qmark.tree.Pat;
import org.pragmatica.qmark.tree.Stmt;
import org.pragmatica.qmark.types.Ty;

import java.util.Optional;

/// A guard proven equivalent to a `?` rewrite. Views into the tree, never partial: matchers only
/// produce one once every structural and semantic precondition holds.
sealed interface MatchedGuard {
    /// The node the suggestion replaces.
    Node site();

    <R> R fold(Cases<R> cases);

    /// One handler per variant; a new variant does not compile until every consumer handles it.
    interface Cases<R> {
        R methodGuard(MethodGuard guard);

        R destructureGuard(DestructureGuard guard);

        R divergentLet(DivergentLet guard);
    }

    /// `if receiver.is_none() { return None }`
    record MethodGuard(Expr.If site,
                       GuardFamily family,
                       Expr receiver,
                       Ty receiverType,
                       String predicate,
                       Expr then,
                       Optional<Expr> orElse) implements MatchedGuard {
        @Override
        public <R> R fold(Cases<R> cases) {
            return cases.methodGuard(this);
        }
    }

    /// `if let Some(x) = scrutinee { x } else { return None }`
    record DestructureGuard(Expr.IfLet site,
                            GuardFamily family,
                            LangItem constructor,
                            Ty scrutineeType,
                            Pat.Binding binding,
                            Expr scrutinee,
                            Expr then,
                            Optional<Expr> orElse) implements MatchedGuard {
        @Override
        public <R> R fold(Cases<R> cases) {
            return cases.destructureGuard(this);
        }
    }

    /// `let Some(x) = init else { return None };`, with `bindingCore` the `x` part of the pattern.
    record DivergentLet(Stmt.Let site,
                        Pat pattern,
                        Pat bindingCore,
                        Expr init,
                        Block fallback) implements MatchedGuard {
        @Override
        public <R> R fold(Cases<R> cases) {
            return cases.divergentLet(this);
        }
    }
}
