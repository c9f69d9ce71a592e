package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.tree.Block;
import org.pragmatica.qmark.tree.Expr;
import org.pragmatica.qmark.tree.LangItem;

import java.util.Arrays;

import static org.pragmatica.qmark.tree.TreeNodes.isPathLangItem;

/// Tracks, for every body currently being visited, how many try blocks enclose the current position.
///
/// A try block already provides its own propagation scope, so a `?` suggested inside it would
/// propagate to the block rather than to the function. Keeping one counter per body answers
/// "are we inside a try block" in O(1) without walking ancestors. Closures open a new body and
/// start again at zero.
///
/// Unbalanced calls mean the traversal contract was broken; they throw `IllegalStateException`.
final class ScopeTracker {
    private static final int INITIAL_CAPACITY = 8;

    private int[] depths = new int[INITIAL_CAPACITY];
    private int size;

    void enterBody() {
        if (size == depths.length) {
            depths = Arrays.copyOf(depths, size * 2);
        }
        depths[size++] = 0;
    }

    void exitBody() {
        requireBody("exit body");
        if (depths[size - 1] != 0) {
            throw new IllegalStateException("Body exited while still inside " + depths[size - 1] + " try block(s)");
        }
        size--;
    }

    void enterRegion() {
        requireBody("enter try block");
        depths[size - 1]++;
    }

    void exitRegion() {
        requireBody("exit try block");
        if (depths[size - 1] == 0) {
            throw new IllegalStateException("Try block exited without a matching enter");
        }
        depths[size - 1]--;
    }

    /// Enter the block as a region if it is a try block. Returns whether it was one.
    boolean enterBlock(Block block) {
        if (!isTryBlock(block)) {
            return false;
        }
        enterRegion();
        return true;
    }

    boolean exitBlock(Block block) {
        if (!isTryBlock(block)) {
            return false;
        }
        exitRegion();
        return true;
    }

    boolean isSuppressed() {
        return size > 0 && depths[size - 1] > 0;
    }

    int depth() {
        return size == 0
               ? 0
               : depths[size - 1];
    }

    int openBodies() {
        return size;
    }

    /// A try block ends in `Try::from_output(value)`, wrapping its value as the output of the scope.
    static boolean isTryBlock(Block block) {
        return block.expr()
                    .filter(Expr.Call.class::isInstance)
                    .map(Expr.Call.class::cast)
                    .filter(call -> call.args().size() == 1)
                    .filter(call -> isPathLangItem(call.callee(), LangItem.TRY_FROM_OUTPUT))
                    .isPresent();
    }

    private void requireBody(String operation) {
        if (size == 0) {
            throw new IllegalStateException("Cannot " + operation + ": no body is being visited");
        }
    }
}
