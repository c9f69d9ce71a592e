package org.pragmatica.qmark.tree;

import org.pragmatica.qmark.lint.SourceUnit;
import org.pragmatica.qmark.source.TextSourceMap;
import org.pragmatica.qmark.source.TreePrinter;
import org.pragmatica.qmark.types.MapTypeTable;
import org.pragmatica.qmark.types.Ty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Fluent construction of resolved trees.
 * <p>
 * Assigns node ids, resolves paths to locals through the {@link Pat.Binding} they name and
 * records expression types. {@link #unit(String, Body...)} renders the bodies with
 * {@link TreePrinter} so the resulting source unit has real spans and text.
 */
public final class TreeBuilder {
    private final MapTypeTable.Builder types = MapTypeTable.builder();
    private final Map<NodeId, Ty> bindingTypes = new HashMap<>();
    private final Set<NodeId> expanded = new HashSet<>();
    private int nextId;

    private TreeBuilder() {}

    public static TreeBuilder treeBuilder() {
        return new TreeBuilder();
    }

    private NodeId id() {
        return NodeId.nodeId(nextId++);
    }

    // Types and spans

    public <E extends Expr> E typed(E expr, Ty ty) {
        types.type(expr.id(), ty);
        return expr;
    }

    /// Record the type the expression has after implicit borrow/deref adjustments.
    public <E extends Expr> E adjusted(E expr, Ty ty) {
        types.adjusted(expr.id(), ty);
        return expr;
    }

    /// Mark the expression as produced by a macro expansion.
    public <E extends Expr> E expanded(E expr) {
        expanded.add(expr.id());
        return expr;
    }

    // Bodies

    public Body fn(List<? extends Pat> params, Block block) {
        return body(BodyKind.FN, params, block);
    }

    public Body body(BodyKind kind, List<? extends Pat> params, Block block) {
        return new Body(id(), kind, List.copyOf(params), blockExpr(block));
    }

    public Expr.Closure closure(List<? extends Pat> params, Expr value) {
        return new Expr.Closure(id(), new Body(id(), BodyKind.CLOSURE, List.copyOf(params), value));
    }

    public SourceUnit unit(String fileName, Body... bodies) {
        var bodyList = List.of(bodies);
        var printed = TreePrinter.print(bodyList, expanded);
        return SourceUnit.sourceUnit(fileName,
                                     bodyList,
                                     TextSourceMap.textSourceMap(fileName, printed.text(), printed.spans()),
                                     types.build());
    }

    // Blocks and statements

    public Block block(Stmt... stmts) {
        return new Block(id(), List.of(stmts), Optional.empty(), false, List.of());
    }

    public Block block(List<Stmt> stmts, Expr tail) {
        return new Block(id(), stmts, Optional.of(tail), false, List.of());
    }

    public Block valueBlock(Expr tail) {
        return block(List.of(), tail);
    }

    public Block unsafeBlock(Expr tail) {
        return new Block(id(), List.of(), Optional.of(tail), true, List.of());
    }

    /// Same block, with comment trivia added after the opening brace.
    public Block commented(Block block, String comment) {
        var comments = new ArrayList<>(block.comments());
        comments.add(comment);
        return new Block(block.id(), block.stmts(), block.expr(), block.unsafe(), comments);
    }

    public Stmt.Semi semi(Expr expr) {
        return new Stmt.Semi(id(), expr);
    }

    public Stmt.Expression stmt(Expr expr) {
        return new Stmt.Expression(id(), expr);
    }

    public Stmt.Let let(Pat pat, Expr init) {
        return new Stmt.Let(id(), pat, Optional.of(init), Optional.empty());
    }

    public Stmt.Let letElse(Pat pat, Expr init, Block orElse) {
        return new Stmt.Let(id(), pat, Optional.of(init), Optional.of(orElse));
    }

    // Patterns

    public Pat.Binding binding(String name, Ty ty) {
        return binding(name, BindingMode.VALUE, ty);
    }

    public Pat.Binding binding(String name, BindingMode mode, Ty ty) {
        var binding = new Pat.Binding(id(), mode, name, Optional.empty());
        bindingTypes.put(binding.id(), ty);
        return binding;
    }

    public Pat.Wild wild() {
        return new Pat.Wild(id());
    }

    public Pat.Tuple tuplePat(Pat... elems) {
        return new Pat.Tuple(id(), List.of(elems));
    }

    public Pat.TupleStruct tupleStruct(Res res, String path, Pat... fields) {
        return new Pat.TupleStruct(id(), List.of(path.split("::")), res, List.of(fields), OptionalInt.empty());
    }

    /// Same pattern with a `..` rest marker at the given field position.
    public Pat.TupleStruct withRest(Pat.TupleStruct pat, int position) {
        return new Pat.TupleStruct(pat.id(), pat.path(), pat.res(), pat.fields(), OptionalInt.of(position));
    }

    public Pat.TupleStruct somePat(Pat inner) {
        return tupleStruct(Res.lang(LangItem.OPTION_SOME), "Some", inner);
    }

    public Pat.TupleStruct okPat(Pat inner) {
        return tupleStruct(Res.lang(LangItem.RESULT_OK), "Ok", inner);
    }

    public Pat.TupleStruct errPat(Pat inner) {
        return tupleStruct(Res.lang(LangItem.RESULT_ERR), "Err", inner);
    }

    public Pat.Path nonePat() {
        return new Pat.Path(id(), List.of("None"), Res.lang(LangItem.OPTION_NONE));
    }

    // Expressions

    /// Path naming the local introduced by the binding; typed with the binding's type.
    public Expr.Path local(Pat.Binding binding) {
        var path = new Expr.Path(id(), List.of(binding.name()), Res.local(binding.id()));
        var ty = bindingTypes.get(binding.id());
        if (ty != null) {
            types.type(path.id(), ty);
        }
        return path;
    }

    public Expr.Path path(Res res, String path) {
        return new Expr.Path(id(), Arrays.asList(path.split("::")), res);
    }

    public Expr.Path none() {
        return path(Res.lang(LangItem.OPTION_NONE), "None");
    }

    public Expr.Call some(Expr value) {
        return call(path(Res.lang(LangItem.OPTION_SOME), "Some"), value);
    }

    public Expr.Call ok(Expr value) {
        return call(path(Res.lang(LangItem.RESULT_OK), "Ok"), value);
    }

    public Expr.Call err(Expr value) {
        return call(path(Res.lang(LangItem.RESULT_ERR), "Err"), value);
    }

    public Expr.Lit lit(String text) {
        return new Expr.Lit(id(), text);
    }

    public Expr.Call call(Expr callee, Expr... args) {
        return new Expr.Call(id(), callee, List.of(args));
    }

    /// Call to a free function resolved by name.
    public Expr.Call callFn(String name, Expr... args) {
        return call(path(Res.def(DefKind.FN, name), name), args);
    }

    public Expr.MethodCall methodCall(Expr receiver, String method, Expr... args) {
        return new Expr.MethodCall(id(), method, receiver, List.of(args));
    }

    public Expr.Field field(Expr base, String name) {
        return new Expr.Field(id(), base, name);
    }

    public Expr.If ifThen(Expr cond, Block then) {
        return new Expr.If(id(), cond, blockExpr(then), Optional.empty());
    }

    public Expr.If ifElse(Expr cond, Block then, Expr orElse) {
        return new Expr.If(id(), cond, blockExpr(then), Optional.of(orElse));
    }

    public Expr.IfLet ifLet(Pat pat, Expr scrutinee, Block then) {
        return new Expr.IfLet(id(), pat, scrutinee, blockExpr(then), Optional.empty());
    }

    public Expr.IfLet ifLetElse(Pat pat, Expr scrutinee, Block then, Expr orElse) {
        return new Expr.IfLet(id(), pat, scrutinee, blockExpr(then), Optional.of(orElse));
    }

    public Expr.Ret ret(Expr value) {
        return new Expr.Ret(id(), Optional.of(value));
    }

    public Expr.Ret ret() {
        return new Expr.Ret(id(), Optional.empty());
    }

    public Expr.BlockExpr blockExpr(Block block) {
        return new Expr.BlockExpr(id(), block);
    }

    public Expr.Try tryOp(Expr inner) {
        return new Expr.Try(id(), inner);
    }

    /**
     * {@code try { stmts; tail }}: a block whose tail wraps the value as the output of the try scope.
     */
    public Expr.BlockExpr tryBlock(List<Stmt> stmts, Expr tail) {
        var wrapped = call(path(Res.lang(LangItem.TRY_FROM_OUTPUT), "Try::from_output"), tail);
        return blockExpr(block(stmts, wrapped));
    }

    public Expr.ConstBlock constBlock(Block block) {
        return new Expr.ConstBlock(id(), block);
    }

    public Expr.Ref ref(Expr inner) {
        return new Expr.Ref(id(), false, inner);
    }

    public Expr.Ref refMut(Expr inner) {
        return new Expr.Ref(id(), true, inner);
    }

    public Expr.Binary binary(Expr lhs, String op, Expr rhs) {
        return new Expr.Binary(id(), op, lhs, rhs);
    }
}
