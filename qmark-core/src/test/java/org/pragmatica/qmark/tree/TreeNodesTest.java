package org.pragmatica.qmark.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.qmark.types.Ty;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.qmark.tree.TreeBuilder.treeBuilder;

class TreeNodesTest {
    private final TreeBuilder b = treeBuilder();

    @Test
    void peelBlocks_stripsTailOnlyBlocks() {
        var value = b.lit("1");
        var nested = b.blockExpr(b.valueBlock(b.blockExpr(b.valueBlock(value))));

        assertThat(TreeNodes.peelBlocks(nested)).isSameAs(value);
    }

    @Test
    void peelBlocks_keepsUnsafeAndStatementBlocks() {
        var unsafe = b.blockExpr(b.unsafeBlock(b.lit("1")));
        var withStatement = b.blockExpr(b.block(b.semi(b.ret(b.lit("1")))));

        assertThat(TreeNodes.peelBlocks(unsafe)).isSameAs(unsafe);
        assertThat(TreeNodes.peelBlocks(withStatement)).isSameAs(withStatement);
    }

    @Test
    void peelBlocksWithStmt_stripsSingleStatementBlocks() {
        var ret = b.ret(b.none());

        assertThat(TreeNodes.peelBlocksWithStmt(b.blockExpr(b.block(b.semi(ret))))).isSameAs(ret);
    }

    @Test
    void pathToLocal_onlyForLocals() {
        var v = b.binding("v", Ty.UNKNOWN);

        assertThat(TreeNodes.pathToLocal(b.local(v))).contains(v.id());
        assertThat(TreeNodes.pathToLocal(b.none())).isEmpty();
        assertThat(TreeNodes.pathToLocalId(b.local(v), v.id())).isTrue();
    }

    @Test
    void isLangCtor_requiresResolution() {
        assertThat(TreeNodes.isLangCtor(b.none(), LangItem.OPTION_NONE)).isTrue();
        assertThat(TreeNodes.isLangCtor(b.path(Res.UNRESOLVED, "None"), LangItem.OPTION_NONE)).isFalse();
        assertThat(TreeNodes.isPathLangItem(b.path(Res.lang(LangItem.TRY_FROM_OUTPUT), "Try::from_output"),
                                            LangItem.TRY_FROM_OUTPUT)).isTrue();
    }

    @Test
    void isRefutable_bindingsWildcardsAndStructsAreIrrefutable() {
        var pair = b.tupleStruct(Res.def(DefKind.STRUCT_CTOR, "Pair"), "Pair", b.binding("a", Ty.UNKNOWN), b.wild());

        assertThat(TreeNodes.isRefutable(b.binding("x", Ty.UNKNOWN))).isFalse();
        assertThat(TreeNodes.isRefutable(b.tuplePat(b.wild(), b.binding("y", Ty.UNKNOWN)))).isFalse();
        assertThat(TreeNodes.isRefutable(pair)).isFalse();
    }

    @Test
    void isRefutable_variantsAndLiteralsAreRefutable() {
        assertThat(TreeNodes.isRefutable(b.somePat(b.wild()))).isTrue();
        assertThat(TreeNodes.isRefutable(b.nonePat())).isTrue();
        assertThat(TreeNodes.isRefutable(b.tuplePat(b.wild(), new Pat.Lit(NodeId.nodeId(999), "0")))).isTrue();
    }

    @Test
    void path_withoutSegments_isRejected() {
        assertThatThrownBy(() -> new Expr.Path(NodeId.nodeId(7), List.of(), Res.UNRESOLVED))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no segments");
        assertThat(b.path(Res.def(DefKind.CONST, "LIMIT"), "cfg::LIMIT").firstSegment()).isEqualTo("cfg");
    }
}
