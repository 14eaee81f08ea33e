package io.github.eutro.rvsdg.graph;

import io.github.eutro.rvsdg.util.Pair;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the invariants of an {@link RvsdgFunction}, throwing an {@link IllegalStateException} if any is broken.
 * <ul>
 *     <li>Operands only refer to earlier nodes, so the arena is acyclic.</li>
 *     <li>Arguments are in range for their region, and projections for their node.</li>
 *     <li>The arms of a branch have the same number of outputs, as do the inputs and outputs of a loop.</li>
 *     <li>The state is threaded through every region, as described in {@link StateChain}.</li>
 * </ul>
 */
public class RvsdgVerifier {
    /**
     * Whether functions should be verified after they are built.
     */
    public static boolean VERIFY = System.getenv("RVSDG_VERIFY") != null;

    private final RvsdgFunction func;
    private final Set<Pair<Integer, Integer>> verified = new HashSet<>();

    private RvsdgVerifier(RvsdgFunction func) {
        this.func = func;
    }

    /**
     * Verify a function.
     *
     * @param func The function.
     * @throws IllegalStateException If the function is ill-formed.
     */
    public static void verify(RvsdgFunction func) {
        RvsdgVerifier verifier = new RvsdgVerifier(func);
        int inputs = func.nArgs + 1;
        int end = func.nodes.size();
        if (func.result != null) verifier.verifyOperand(func.result, inputs, end, -1);
        verifier.verifyOperand(func.state, inputs, end, -1);
        verifier.verifyState(func.state, func.nArgs, -1);
    }

    private void verifyOperand(Operand operand, int regionInputs, int before, int user) {
        if (operand instanceof Operand.Arg) {
            int index = ((Operand.Arg) operand).index;
            if (index < 0 || index >= regionInputs) {
                throw error(user, String.format("%s out of range for a region with %d input(s)", operand, regionInputs));
            }
            return;
        }
        int node = StructuralEquality.nodeOf(operand);
        if (node < 0 || node >= before) {
            throw error(user, "operand does not refer to an earlier node: " + operand);
        }
        if (StructuralEquality.outputOf(operand) >= func.node(node).outputCount()) {
            throw error(user, "operand refers to a missing output: " + operand);
        }
        verifyNode(node, regionInputs);
    }

    private void verifyAll(List<Operand> operands, int regionInputs, int user) {
        for (Operand operand : operands) {
            verifyOperand(operand, regionInputs, user, user);
        }
    }

    private void verifyNode(int index, int regionInputs) {
        if (!verified.add(Pair.of(index, regionInputs))) return;
        RvsdgNode node = func.node(index);
        if (node instanceof RvsdgNode.BasicOp) {
            Expr expr = ((RvsdgNode.BasicOp) node).expr;
            verifyAll(expr.operands(), regionInputs, index);
            if (expr instanceof Expr.Op) {
                Expr.Op op = (Expr.Op) expr;
                if (op.args.size() != op.op.arity) {
                    throw error(index, op.op + " takes " + op.op.arity + " argument(s)");
                }
            } else if (expr instanceof Expr.Call) {
                Expr.Call call = (Expr.Call) expr;
                if (call.outputs != (call.returnType == null ? 1 : 2)) {
                    throw error(index, "call must have a state output, and a value output iff it returns a value");
                }
            }
            if (StateChain.isEffectful(expr) && expr.operands().isEmpty()) {
                throw error(index, "effectful node takes no state");
            }
        } else if (node instanceof RvsdgNode.Branch) {
            RvsdgNode.Branch branch = (RvsdgNode.Branch) node;
            verifyOperand(branch.predicate, regionInputs, index, index);
            verifyAll(branch.inputs, regionInputs, index);
            if (branch.arms.isEmpty() || branch.inputs.isEmpty()) {
                throw error(index, "branch must have arms and a state input");
            }
            int arity = branch.arms.get(0).size();
            for (List<Operand> arm : branch.arms) {
                if (arm.size() != arity || arity == 0) {
                    throw error(index, "arms have different output counts, or no state output");
                }
                verifyAll(arm, branch.inputs.size(), index);
                verifyState(arm.get(StateChain.STATE_SLOT), StateChain.STATE_SLOT, index);
            }
        } else {
            RvsdgNode.Loop loop = (RvsdgNode.Loop) node;
            verifyAll(loop.inputs, regionInputs, index);
            if (loop.inputs.size() != loop.outputs.size() || loop.inputs.isEmpty()) {
                throw error(index, "loop inputs and outputs differ in count, or have no state");
            }
            verifyOperand(loop.predicate, loop.inputs.size(), index, index);
            verifyAll(loop.outputs, loop.inputs.size(), index);
            verifyState(loop.outputs.get(StateChain.STATE_SLOT), StateChain.STATE_SLOT, index);
        }
    }

    private void verifyState(Operand state, int initial, int user) {
        try {
            StateChain.trace(func.nodes, state, initial);
        } catch (IllegalStateException e) {
            IllegalStateException err = error(user, "state is not threaded");
            err.initCause(e);
            throw err;
        }
    }

    private IllegalStateException error(int node, String message) {
        if (node < 0) {
            return new IllegalStateException(String.format("%s\n  in function: %s", message, func));
        }
        return new IllegalStateException(String.format("%s\n  in node: %%%d = %s\n  in function: %s",
                message, node, func.node(node), func));
    }
}
