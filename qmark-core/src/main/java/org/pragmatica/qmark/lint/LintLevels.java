package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.tree.NodeId;
import org.pragmatica.qmark.tree.TreeIndex;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers whether a rule is enabled at a given node.
 */
@FunctionalInterface
public interface LintLevels {
    boolean isEnabled(String ruleId, NodeId node);

    /**
     * Levels taken from the configuration alone, identical at every node.
     */
    static LintLevels fromConfig(LintConfig config) {
        return (ruleId, node) -> config.isEnabled(ruleId);
    }

    /**
     * Levels where the innermost enclosing attribute wins over the configuration.
     */
    static LintLevels scoped(LintConfig config, TreeIndex tree, List<LintAttribute> attributes) {
        if (attributes.isEmpty()) {
            return fromConfig(config);
        }
        var byScope = new HashMap<NodeId, Map<String, Boolean>>();
        for (var attribute : attributes) {
            byScope.computeIfAbsent(attribute.scope(), scope -> new HashMap<>())
                   .put(attribute.ruleId(), attribute.enabled());
        }
        return (ruleId, node) -> innermost(byScope, tree, ruleId, node).orElseGet(() -> config.isEnabled(ruleId));
    }

    private static Optional<Boolean> innermost(Map<NodeId, Map<String, Boolean>> byScope,
                                               TreeIndex tree,
                                               String ruleId,
                                               NodeId node) {
        var current = Optional.of(node);
        while (current.isPresent()) {
            var id = current.get();
            var level = Optional.ofNullable(byScope.get(id))
                                .map(levels -> levels.get(ruleId));
            if (level.isPresent()) {
                return level;
            }
            current = tree.parent(id)
                          .map(parent -> parent.id());
        }
        return Optional.empty();
    }
}
