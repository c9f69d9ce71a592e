package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.source.SourceMap;
import org.pragmatica.qmark.tree.TreeIndex;
import org.pragmatica.qmark.types.ExprEquality;
import org.pragmatica.qmark.types.SpanlessEquality;
import org.pragmatica.qmark.types.TypeTable;

/// Everything a pass may query while visiting one source unit.
public record AnalysisContext(LintContext lint,
                              SourceMap sourceMap,
                              TypeTable types,
                              TreeIndex tree,
                              LintLevels levels,
                              ExprEquality equality) {
    public static AnalysisContext analysisContext(SourceUnit unit, LintContext lint) {
        var tree = TreeIndex.treeIndex(unit.bodies());
        return new AnalysisContext(lint.withFileName(unit.fileName()),
                                   unit.sourceMap(),
                                   unit.types(),
                                   tree,
                                   LintLevels.scoped(lint.config(), tree, unit.attributes()),
                                   SpanlessEquality.INSTANCE);
    }

    /// Builder-style method to replace the value-equality predicate.
    public AnalysisContext withEquality(ExprEquality equality) {
        return new AnalysisContext(lint, sourceMap, types, tree, levels, equality);
    }
}
