package io.github.eutro.rvsdg.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node in the arena of an {@link RvsdgFunction}.
 */
public abstract class RvsdgNode {
    private RvsdgNode() {
    }

    /**
     * Get the number of outputs of this node.
     *
     * @return The number of outputs.
     */
    public abstract int outputCount();

    private static List<Operand> freeze(List<Operand> ops) {
        return Collections.unmodifiableList(new ArrayList<>(ops));
    }

    /**
     * A node computing an {@link Expr}.
     */
    public static final class BasicOp extends RvsdgNode {
        public final Expr expr;

        public BasicOp(Expr expr) {
            this.expr = expr;
        }

        @Override
        public int outputCount() {
            return expr.outputCount();
        }

        @Override
        public String toString() {
            return expr.toString();
        }
    }

    /**
     * A choice between arms by {@link #predicate}: a boolean chooses arm 0 when false and arm 1 when true,
     * an integer chooses the arm at that index.
     * <p>
     * {@link #predicate} and {@link #inputs} are operands of the enclosing region, the arms are
     * operands of a region whose inputs are {@link #inputs}.
     */
    public static final class Branch extends RvsdgNode {
        public final Operand predicate;
        public final List<Operand> inputs;
        public final List<List<Operand>> arms;

        public Branch(Operand predicate, List<Operand> inputs, List<List<Operand>> arms) {
            this.predicate = predicate;
            this.inputs = freeze(inputs);
            List<List<Operand>> frozen = new ArrayList<>();
            for (List<Operand> arm : arms) {
                frozen.add(freeze(arm));
            }
            this.arms = Collections.unmodifiableList(frozen);
        }

        @Override
        public int outputCount() {
            return arms.isEmpty() ? 0 : arms.get(0).size();
        }

        @Override
        public String toString() {
            return "branch " + predicate + " " + inputs + " " + arms;
        }
    }

    /**
     * A tail-controlled loop.
     * <p>
     * {@link #inputs} are operands of the enclosing region, and give the values of the first iteration.
     * {@link #outputs} and {@link #predicate} are operands of a region whose inputs are the values of
     * the current iteration. If the predicate is true, the outputs are the values of the next iteration,
     * otherwise they are the outputs of the node.
     */
    public static final class Loop extends RvsdgNode {
        public final Operand predicate;
        public final List<Operand> inputs;
        public final List<Operand> outputs;

        public Loop(Operand predicate, List<Operand> inputs, List<Operand> outputs) {
            this.predicate = predicate;
            this.inputs = freeze(inputs);
            this.outputs = freeze(outputs);
        }

        @Override
        public int outputCount() {
            return outputs.size();
        }

        @Override
        public String toString() {
            return "loop " + predicate + " " + inputs + " " + outputs;
        }
    }
}
