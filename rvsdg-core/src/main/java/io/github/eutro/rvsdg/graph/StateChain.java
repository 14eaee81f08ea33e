package io.github.eutro.rvsdg.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The conventions by which the state is threaded through a function.
 * <p>
 * The state enters a function as {@code Arg(nArgs)}. Every {@link Expr.Call} and {@link Expr.Print}
 * takes the current state as its last argument and produces the next state as its last output.
 * Every {@link RvsdgNode.Branch} and {@link RvsdgNode.Loop} takes the state at input {@link #STATE_SLOT}
 * and produces it at output {@link #STATE_SLOT}, so inside their regions the state enters as
 * {@code Arg(STATE_SLOT)}.
 */
public final class StateChain {
    /**
     * The input and output position of the state in branches and loops.
     */
    public static final int STATE_SLOT = 0;

    private StateChain() {
    }

    /**
     * Check whether an expression takes and produces the state.
     *
     * @param expr The expression.
     * @return Whether it is effectful.
     */
    public static boolean isEffectful(Expr expr) {
        return expr instanceof Expr.Call || expr instanceof Expr.Print;
    }

    /**
     * Get the state produced by an effectful node.
     *
     * @param node The index of the node.
     * @param expr The expression of the node.
     * @return The operand of its state output.
     */
    public static Operand stateOutput(int node, Expr expr) {
        int outputs = expr.outputCount();
        return outputs == 1 ? Operand.id(node) : Operand.project(outputs - 1, node);
    }

    /**
     * Follow the state backwards from {@code state} to the input it came from.
     *
     * @param nodes   The arena.
     * @param state   The final state of the region.
     * @param initial The index of the argument the state enters the region as.
     * @return The indices of the nodes the state passed through, in execution order.
     * @throws IllegalStateException If the operand is not a state threaded from {@code Arg(initial)}.
     */
    public static List<Integer> trace(List<RvsdgNode> nodes, Operand state, int initial) {
        List<Integer> chain = new ArrayList<>();
        Operand cur = state;
        while (true) {
            if (cur instanceof Operand.Arg) {
                if (((Operand.Arg) cur).index != initial) {
                    throw new IllegalStateException("state comes from " + cur + ", not Arg(" + initial + ")");
                }
                break;
            }
            int index;
            int output;
            if (cur instanceof Operand.Id) {
                index = ((Operand.Id) cur).node;
                output = 0;
            } else {
                index = ((Operand.Project) cur).node;
                output = ((Operand.Project) cur).output;
            }
            RvsdgNode node = nodes.get(index);
            if (node instanceof RvsdgNode.BasicOp) {
                Expr expr = ((RvsdgNode.BasicOp) node).expr;
                if (!isEffectful(expr) || output != expr.outputCount() - 1) {
                    throw new IllegalStateException("state comes from a value output: " + cur + " = " + node);
                }
                List<Operand> args = expr.operands();
                cur = args.get(args.size() - 1);
            } else {
                if (output != STATE_SLOT) {
                    throw new IllegalStateException("state comes from a value output: " + cur + " = " + node);
                }
                cur = node instanceof RvsdgNode.Branch
                        ? ((RvsdgNode.Branch) node).inputs.get(STATE_SLOT)
                        : ((RvsdgNode.Loop) node).inputs.get(STATE_SLOT);
            }
            chain.add(index);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Follow the state of a function backwards to its initial state.
     *
     * @param func The function.
     * @return The indices of the top level nodes the state passed through, in execution order.
     * @see #trace(List, Operand, int)
     */
    public static List<Integer> trace(RvsdgFunction func) {
        return trace(func.nodes, func.state, func.nArgs);
    }
}
