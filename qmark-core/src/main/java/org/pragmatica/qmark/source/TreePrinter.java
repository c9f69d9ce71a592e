package org.pragmatica.qmark.source;

import org.pragmatica.qmark.tree.BindingMode;
import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Body;
import org.pragmatica.qmark.tree.BodyKind;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.Node;
import org.pragmatica.qmark.tree.NodeId;
import org.pragmatica.qmark.tree.Pat;
import org.pragmatica.qmark.tree.Stmt;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders bodies as source text and records the span of every node it prints.
 *
 * Output style:
 * - one statement per line
 * - 4 space indentation
 * - block comment trivia printed as line comments right after the opening brace
 */
public final class TreePrinter {
    private static final int INDENT_SIZE = 4;

    private final StringBuilder output = new StringBuilder();
    private final Map<NodeId, Span> spans = new HashMap<>();
    private final Set<NodeId> expanded;
    private int indentLevel;
    private int bodyCounter;

    private TreePrinter(Set<NodeId> expanded) {
        this.expanded = Set.copyOf(expanded);
    }

    /**
     * Print the bodies, one after another, separated by blank lines.
     *
     * @param expanded nodes whose spans are marked as coming from a macro expansion
     */
    public static PrintedSource print(List<Body> bodies, Set<NodeId> expanded) {
        var printer = new TreePrinter(expanded);
        for (var body : bodies) {
            printer.printTopLevel(body);
        }
        return new PrintedSource(printer.output.toString(), Map.copyOf(printer.spans));
    }

    /// Rendered text and the span of every printed node.
    public record PrintedSource(String text, Map<NodeId, Span> spans) {}

    private void printTopLevel(Body body) {
        var start = output.length();
        var name = "body" + bodyCounter++;
        switch (body.kind()) {
            case CONST -> print("const " + name.toUpperCase() + ": _ = ");
            case STATIC -> print("static " + name.toUpperCase() + ": _ = ");
            case CONST_FN -> printSignature("const fn " + name, body);
            default -> printSignature("fn " + name, body);
        }
        printExpr(body.value());
        if (body.kind() == BodyKind.CONST || body.kind() == BodyKind.STATIC) {
            print(";");
        }
        record(body, start);
        println();
        println();
    }

    private void printSignature(String prefix, Body body) {
        print(prefix);
        print("(");
        printPatList(body.params());
        print(") ");
    }

    private void printBlock(Block block) {
        var start = output.length();
        if (block.unsafe()) {
            print("unsafe ");
        }
        print("{");
        indent();
        for (var comment : block.comments()) {
            newLine();
            print("// " + comment);
        }
        for (var stmt : block.stmts()) {
            newLine();
            printStmt(stmt);
        }
        block.expr().ifPresent(expr -> {
            newLine();
            printExpr(expr);
        });
        unindent();
        if (!block.isEmpty() || !block.comments().isEmpty()) {
            newLine();
        }
        print("}");
        record(block, start);
    }

    private void printStmt(Stmt stmt) {
        var start = output.length();
        if (stmt instanceof Stmt.Let let) {
            print("let ");
            printPat(let.pat());
            let.init().ifPresent(init -> {
                print(" = ");
                printExpr(init);
            });
            let.orElse().ifPresent(orElse -> {
                print(" else ");
                printBlock(orElse);
            });
            print(";");
        } else if (stmt instanceof Stmt.Semi semi) {
            printExpr(semi.expr());
            print(";");
        } else if (stmt instanceof Stmt.Expression expression) {
            printExpr(expression.expr());
        }
        record(stmt, start);
    }

    private void printExpr(Expr expr) {
        var start = output.length();
        if (expr instanceof Expr.Path path) {
            print(String.join("::", path.segments()));
        } else if (expr instanceof Expr.Lit lit) {
            print(lit.text());
        } else if (expr instanceof Expr.Call call) {
            printExpr(call.callee());
            printArgs(call.args());
        } else if (expr instanceof Expr.MethodCall methodCall) {
            printExpr(methodCall.receiver());
            print("." + methodCall.method());
            printArgs(methodCall.args());
        } else if (expr instanceof Expr.Field field) {
            printExpr(field.base());
            print("." + field.name());
        } else if (expr instanceof Expr.If ifExpr) {
            print("if ");
            printExpr(ifExpr.cond());
            print(" ");
            printExpr(ifExpr.then());
            ifExpr.orElse().ifPresent(this::printElse);
        } else if (expr instanceof Expr.IfLet ifLet) {
            print("if let ");
            printPat(ifLet.pat());
            print(" = ");
            printExpr(ifLet.scrutinee());
            print(" ");
            printExpr(ifLet.then());
            ifLet.orElse().ifPresent(this::printElse);
        } else if (expr instanceof Expr.Ret ret) {
            print("return");
            ret.value().ifPresent(value -> {
                print(" ");
                printExpr(value);
            });
        } else if (expr instanceof Expr.BlockExpr blockExpr) {
            printBlock(blockExpr.block());
        } else if (expr instanceof Expr.Try tryExpr) {
            printExpr(tryExpr.inner());
            print("?");
        } else if (expr instanceof Expr.Closure closure) {
            printClosure(closure.body());
        } else if (expr instanceof Expr.ConstBlock constBlock) {
            print("const ");
            printBlock(constBlock.block());
        } else if (expr instanceof Expr.Ref ref) {
            print(ref.mutable()
                  ? "&mut "
                  : "&");
            printExpr(ref.inner());
        } else if (expr instanceof Expr.Binary binary) {
            printExpr(binary.lhs());
            print(" " + binary.op() + " ");
            printExpr(binary.rhs());
        }
        record(expr, start);
    }

    private void printElse(Expr orElse) {
        print(" else ");
        printExpr(orElse);
    }

    private void printClosure(Body body) {
        var start = output.length();
        print("|");
        printPatList(body.params());
        print("| ");
        printExpr(body.value());
        record(body, start);
    }

    private void printArgs(List<Expr> args) {
        print("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                print(", ");
            }
            printExpr(args.get(i));
        }
        print(")");
    }

    private void printPatList(List<Pat> pats) {
        for (int i = 0; i < pats.size(); i++) {
            if (i > 0) {
                print(", ");
            }
            printPat(pats.get(i));
        }
    }

    private void printPat(Pat pat) {
        var start = output.length();
        if (pat instanceof Pat.Binding binding) {
            print(bindingPrefix(binding.mode()) + binding.name());
            binding.sub().ifPresent(sub -> {
                print(" @ ");
                printPat(sub);
            });
        } else if (pat instanceof Pat.Wild) {
            print("_");
        } else if (pat instanceof Pat.TupleStruct tupleStruct) {
            print(String.join("::", tupleStruct.path()));
            print("(");
            var fields = tupleStruct.fields();
            var rest = tupleStruct.dotDotPos().orElse(-1);
            for (int i = 0; i <= fields.size(); i++) {
                if (i == rest) {
                    print(i > 0
                          ? ", .."
                          : "..");
                }
                if (i < fields.size()) {
                    if (i > 0 || i == rest) {
                        print(", ");
                    }
                    printPat(fields.get(i));
                }
            }
            print(")");
        } else if (pat instanceof Pat.Tuple tuple) {
            print("(");
            printPatList(tuple.elems());
            print(")");
        } else if (pat instanceof Pat.Path path) {
            print(String.join("::", path.path()));
        } else if (pat instanceof Pat.Lit lit) {
            print(lit.text());
        }
        record(pat, start);
    }

    private static String bindingPrefix(BindingMode mode) {
        return switch (mode) {
            case VALUE -> "";
            case REF -> "ref ";
            case REF_MUT -> "ref mut ";
        };
    }

    private void record(Node node, int start) {
        var span = Span.span(start, output.length());
        spans.put(node.id(),
                  expanded.contains(node.id())
                  ? span.asExpansion()
                  : span);
    }

    private void print(String text) {
        output.append(text);
    }

    private void println() {
        output.append('\n');
    }

    private void newLine() {
        println();
        output.append(" ".repeat(indentLevel * INDENT_SIZE));
    }

    private void indent() {
        indentLevel++;
    }

    private void unindent() {
        indentLevel--;
    }
}
