package io.github.eutro.rvsdg.graph;

import io.github.eutro.rvsdg.util.Pair;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares two functions by what they compute, ignoring the layout of their arenas.
 * <p>
 * Nodes are compared by kind, fields and operands, recursively. Which nodes are shared and the order
 * they were added in do not matter, and {@code Id(n)} is equal to {@code Project(0, n)}.
 */
public class StructuralEquality {
    private final RvsdgFunction f1;
    private final RvsdgFunction f2;
    private final Map<Pair<Integer, Integer>, Boolean> seen = new HashMap<>();

    private StructuralEquality(RvsdgFunction f1, RvsdgFunction f2) {
        this.f1 = f1;
        this.f2 = f2;
    }

    /**
     * Check whether two functions are structurally equal.
     *
     * @param f1 The first function.
     * @param f2 The second function.
     * @return Whether they are equal.
     */
    public static boolean equal(RvsdgFunction f1, RvsdgFunction f2) {
        return new StructuralEquality(f1, f2).functionsEqual();
    }

    private boolean functionsEqual() {
        if (f1.nArgs != f2.nArgs) return false;
        if ((f1.result == null) != (f2.result == null)) return false;
        if (f1.result != null && !operandsEqual(f1.result, f2.result)) return false;
        return operandsEqual(f1.state, f2.state);
    }

    private boolean operandsEqual(Operand o1, Operand o2) {
        if (o1 instanceof Operand.Arg || o2 instanceof Operand.Arg) {
            return o1.equals(o2);
        }
        return outputOf(o1) == outputOf(o2) && nodesEqual(nodeOf(o1), nodeOf(o2));
    }

    private boolean allEqual(List<Operand> l1, List<Operand> l2) {
        if (l1.size() != l2.size()) return false;
        for (int i = 0; i < l1.size(); i++) {
            if (!operandsEqual(l1.get(i), l2.get(i))) return false;
        }
        return true;
    }

    private boolean nodesEqual(int n1, int n2) {
        Pair<Integer, Integer> key = Pair.of(n1, n2);
        Boolean known = seen.get(key);
        if (known != null) return known;
        boolean result = compareNodes(f1.node(n1), f2.node(n2));
        seen.put(key, result);
        return result;
    }

    private boolean compareNodes(RvsdgNode node1, RvsdgNode node2) {
        if (node1 instanceof RvsdgNode.BasicOp && node2 instanceof RvsdgNode.BasicOp) {
            return exprsEqual(((RvsdgNode.BasicOp) node1).expr, ((RvsdgNode.BasicOp) node2).expr);
        }
        if (node1 instanceof RvsdgNode.Branch && node2 instanceof RvsdgNode.Branch) {
            RvsdgNode.Branch b1 = (RvsdgNode.Branch) node1;
            RvsdgNode.Branch b2 = (RvsdgNode.Branch) node2;
            if (b1.arms.size() != b2.arms.size()) return false;
            if (!operandsEqual(b1.predicate, b2.predicate) || !allEqual(b1.inputs, b2.inputs)) return false;
            for (int i = 0; i < b1.arms.size(); i++) {
                if (!allEqual(b1.arms.get(i), b2.arms.get(i))) return false;
            }
            return true;
        }
        if (node1 instanceof RvsdgNode.Loop && node2 instanceof RvsdgNode.Loop) {
            RvsdgNode.Loop l1 = (RvsdgNode.Loop) node1;
            RvsdgNode.Loop l2 = (RvsdgNode.Loop) node2;
            return operandsEqual(l1.predicate, l2.predicate)
                    && allEqual(l1.inputs, l2.inputs)
                    && allEqual(l1.outputs, l2.outputs);
        }
        return false;
    }

    private boolean exprsEqual(Expr e1, Expr e2) {
        if (e1 instanceof Expr.Const && e2 instanceof Expr.Const) {
            return e1.equals(e2);
        }
        if (e1 instanceof Expr.Op && e2 instanceof Expr.Op) {
            Expr.Op op1 = (Expr.Op) e1;
            Expr.Op op2 = (Expr.Op) e2;
            return op1.op == op2.op && op1.type == op2.type && allEqual(op1.args, op2.args);
        }
        if (e1 instanceof Expr.Call && e2 instanceof Expr.Call) {
            Expr.Call c1 = (Expr.Call) e1;
            Expr.Call c2 = (Expr.Call) e2;
            return c1.target.equals(c2.target)
                    && c1.outputs == c2.outputs
                    && c1.returnType == c2.returnType
                    && allEqual(c1.args, c2.args);
        }
        if (e1 instanceof Expr.Print && e2 instanceof Expr.Print) {
            return allEqual(((Expr.Print) e1).args, ((Expr.Print) e2).args);
        }
        return false;
    }

    static int nodeOf(Operand operand) {
        return operand instanceof Operand.Id
                ? ((Operand.Id) operand).node
                : ((Operand.Project) operand).node;
    }

    static int outputOf(Operand operand) {
        return operand instanceof Operand.Id ? 0 : ((Operand.Project) operand).output;
    }
}
