package org.pragmatica.qmark.types;

import org.pragmatica.qmark.tree.NodeId;

import java.util.HashMap;
import java.util.Map;

/**
 * Immutable map-backed {@link TypeTable}. Expressions without a recorded type are {@link Ty#UNKNOWN}.
 */
public final class MapTypeTable implements TypeTable {
    private final Map<NodeId, Ty> types;
    private final Map<NodeId, Ty> adjusted;

    private MapTypeTable(Map<NodeId, Ty> types, Map<NodeId, Ty> adjusted) {
        this.types = Map.copyOf(types);
        this.adjusted = Map.copyOf(adjusted);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Ty exprType(NodeId expr) {
        return types.getOrDefault(expr, Ty.UNKNOWN);
    }

    @Override
    public Ty adjustedType(NodeId expr) {
        var ty = adjusted.get(expr);
        return ty != null
               ? ty
               : exprType(expr);
    }

    public static final class Builder {
        private final Map<NodeId, Ty> types = new HashMap<>();
        private final Map<NodeId, Ty> adjusted = new HashMap<>();

        private Builder() {}

        public Builder type(NodeId expr, Ty ty) {
            types.put(expr, ty);
            return this;
        }

        public Builder adjusted(NodeId expr, Ty ty) {
            adjusted.put(expr, ty);
            return this;
        }

        public MapTypeTable build() {
            return new MapTypeTable(types, adjusted);
        }
    }
}
