package org.pragmatica.qmark.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.qmark.types.Ty;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.qmark.tree.TreeBuilder.treeBuilder;

class TreeIndexTest {
    private final TreeBuilder b = treeBuilder();

    @Test
    void parent_linksEveryChildToItsNode() {
        var value = b.lit("1");
        var stmt = b.semi(value);
        var block = b.block(stmt);
        var body = b.fn(List.of(), block);

        var index = TreeIndex.treeIndex(List.of(body));

        assertThat(index.parent(value.id())).contains(stmt);
        assertThat(index.parent(stmt.id())).contains(block);
        assertThat(index.parent(body.value().id())).contains(body);
        assertThat(index.parent(body.id())).isEmpty();
    }

    @Test
    void isInConstContext_constFnAndInlineConst_butNotClosureInside() {
        var inConstFn = b.lit("1");
        var constFn = b.body(BodyKind.CONST_FN, List.of(), b.valueBlock(inConstFn));
        var inInlineConst = b.lit("2");
        var inClosure = b.lit("3");
        var closure = b.closure(List.of(), inClosure);
        var inline = b.constBlock(b.block(List.of(b.semi(closure)), inInlineConst));
        var outside = b.lit("4");
        var fn = b.fn(List.of(), b.block(List.of(b.semi(inline)), outside));

        var index = TreeIndex.treeIndex(List.of(constFn, fn));

        assertThat(index.isInConstContext(inConstFn.id())).isTrue();
        assertThat(index.isInConstContext(inInlineConst.id())).isTrue();
        assertThat(index.isInConstContext(inClosure.id())).isFalse();
        assertThat(index.isInConstContext(outside.id())).isFalse();
        assertThat(index.isInConstContext(inline.id())).isFalse();
    }

    @Test
    void isElseClause_onlyForElseBranch() {
        var flag = b.binding("flag", Ty.plain("bool", true));
        var inner = b.ifThen(b.local(flag), b.block());
        var outer = b.ifElse(b.local(flag), b.block(), inner);
        var fn = b.fn(List.of(flag), b.block(b.stmt(outer)));

        var index = TreeIndex.treeIndex(List.of(fn));

        assertThat(index.isElseClause(inner)).isTrue();
        assertThat(index.isElseClause(outer)).isFalse();
        assertThat(index.isElseClause(outer.then())).isFalse();
    }

    @Test
    void parentIsStatement_expressionStatementsOnly() {
        var statement = b.callFn("f");
        var initializer = b.callFn("g");
        var tail = b.callFn("h");
        var fn = b.fn(List.of(),
                      b.block(List.of(b.semi(statement), b.let(b.binding("x", Ty.UNKNOWN), initializer)), tail));

        var index = TreeIndex.treeIndex(List.of(fn));

        assertThat(index.parentIsStatement(statement)).isTrue();
        assertThat(index.parentIsStatement(initializer)).isFalse();
        assertThat(index.parentIsStatement(tail)).isFalse();
    }
}
