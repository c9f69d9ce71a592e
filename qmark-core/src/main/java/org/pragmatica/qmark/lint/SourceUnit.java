package org.pragmatica.qmark.lint;

import org.pragmatica.qmark.source.SourceMap;
import org.pragmatica.qmark.tree.Body;
import org.pragmatica.qmark.types.TypeTable;

import java.util.List;

/**
 * One analyzed file: its bodies together with the host-supplied source, type and level information.
 */
public record SourceUnit(String fileName,
                         List<Body> bodies,
                         SourceMap sourceMap,
                         TypeTable types,
                         List<LintAttribute> attributes) {
    public SourceUnit {
        bodies = List.copyOf(bodies);
        attributes = List.copyOf(attributes);
    }

    public static SourceUnit sourceUnit(String fileName, List<Body> bodies, SourceMap sourceMap, TypeTable types) {
        return new SourceUnit(fileName, bodies, sourceMap, types, List.of());
    }

    public SourceUnit withAttributes(List<LintAttribute> attributes) {
        return new SourceUnit(fileName, bodies, sourceMap, types, attributes);
    }
}
