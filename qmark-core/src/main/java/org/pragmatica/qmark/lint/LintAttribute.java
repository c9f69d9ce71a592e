package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.tree.NodeId;

/**
 * Level override for one rule on a subtree, the equivalent of an allow or deny attribute on an item.
 *
 * @param scope   root of the subtree the override applies to
 * @param enabled whether the rule is enabled inside the subtree
 */
public record LintAttribute(NodeId scope, String ruleId, boolean enabled) {
    public static LintAttribute allow(String ruleId, NodeId scope) {
        return new LintAttribute(scope, ruleId, false);
    }

    public static LintAttribute deny(String ruleId, NodeId scope) {
        return new LintAttribute(scope, ruleId, true);
    }
}
