package org.pragmatica.qmark.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Patterns.
 */
public sealed interface Pat extends Node {
    /**
     * Name binding, optionally {@code name @ sub}. Its id is the identity that
     * {@link Res.Local} refers to.
     */
    record Binding(NodeId id, BindingMode mode, String name, Optional<Pat> sub) implements Pat {
        @Override
        public List<Node> children() {
            return sub.<List<Node>>map(List::of).orElse(List.of());
        }
    }

    record Wild(NodeId id) implements Pat {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * {@code Path(fields..)}; {@code dotDotPos} is the index of a {@code ..} rest marker.
     */
    record TupleStruct(NodeId id, List<String> path, Res res, List<Pat> fields, OptionalInt dotDotPos)
            implements Pat {
        public TupleStruct {
            path = List.copyOf(path);
            fields = List.copyOf(fields);
        }

        @Override
        public List<Node> children() {
            return new ArrayList<>(fields);
        }
    }

    record Tuple(NodeId id, List<Pat> elems) implements Pat {
        public Tuple {
            elems = List.copyOf(elems);
        }

        @Override
        public List<Node> children() {
            return new ArrayList<>(elems);
        }
    }

    record Path(NodeId id, List<String> path, Res res) implements Pat {
        public Path {
            path = List.copyOf(path);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record Lit(NodeId id, String text) implements Pat {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }
}
